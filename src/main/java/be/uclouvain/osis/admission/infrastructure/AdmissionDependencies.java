/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package be.uclouvain.osis.admission.infrastructure;

import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationRepository;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteRepository;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;
import be.uclouvain.osis.admission.doctorat.preparation.model.DoctoratTranslator;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.domain.digit.DigitRepository;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import be.uclouvain.osis.admission.domain.service.Historique;
import be.uclouvain.osis.admission.domain.service.Notification;
import be.uclouvain.osis.admission.domain.service.ProfilCandidatTranslator;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleRepository;

/** Everything the handlers of the admission tracks depend on. */
public record AdmissionDependencies(
    PropositionRepository propositions,
    EmplacementDocumentRepository emplacementsDocuments,
    JuryRepository jurys,
    GroupeDeSupervisionRepository groupesDeSupervision,
    EpreuveConfirmationRepository epreuvesConfirmation,
    ActiviteRepository activites,
    PropositionGeneraleRepository propositionsGenerales,
    PropositionContinueRepository propositionsContinues,
    DigitRepository digit,
    DoctoratTranslator doctoratTranslator,
    ProfilCandidatTranslator profilCandidatTranslator,
    Historique historique,
    Notification notification) {
  public AdmissionDependencies {
    requireNonNull(propositions, "Proposition repository");
    requireNonNull(emplacementsDocuments, "Document repository");
    requireNonNull(jurys, "Jury repository");
    requireNonNull(groupesDeSupervision, "Supervision group repository");
    requireNonNull(epreuvesConfirmation, "Confirmation repository");
    requireNonNull(activites, "Activity repository");
    requireNonNull(propositionsGenerales, "General proposition repository");
    requireNonNull(propositionsContinues, "Continuing proposition repository");
    requireNonNull(digit, "Digit repository");
    requireNonNull(doctoratTranslator, "Doctorate translator");
    requireNonNull(profilCandidatTranslator, "Profile translator");
    requireNonNull(historique, "Historique");
    requireNonNull(notification, "Notification");
  }

  private static void requireNonNull(final Object dependency, final String name) {
    if (dependency == null) {
      throw new IllegalArgumentException(name + " cannot be null");
    }
  }
}
