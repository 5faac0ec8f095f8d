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

package be.uclouvain.osis.admission.doctorat.preparation.validator;

import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.ConfigurationsChecklistDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.OngletChecklistDoctorale;
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.validator.ShouldStatutChecklistCorrespondre;
import be.uclouvain.osis.admission.domain.validator.ShouldStatutEtreParmi;
import java.util.List;
import java.util.Set;

public final class ApprouverAdmissionParSicValidatorList extends TwoStepsValidatorList {
  private final ChoixStatutPropositionDoctorale statut;
  private final Checklist<OngletChecklistDoctorale> checklist;
  private final Integer nombreAnneesPrevoirProgramme;
  private final List<EmplacementDocument> emplacements;

  public ApprouverAdmissionParSicValidatorList(
      final ChoixStatutPropositionDoctorale statut,
      final Checklist<OngletChecklistDoctorale> checklist,
      final Integer nombreAnneesPrevoirProgramme,
      final List<EmplacementDocument> emplacements) {
    this.statut = statut;
    this.checklist = checklist;
    this.nombreAnneesPrevoirProgramme = nombreAnneesPrevoirProgramme;
    this.emplacements = emplacements;
  }

  @Override
  protected List<InvariantValidator> getInvariantValidators() {
    return List.of(
        new ShouldStatutEtreParmi<>(
            statut,
            Set.of(ChoixStatutPropositionDoctorale.ATTENTE_VALIDATION_DIRECTION),
            SituationPropositionNonSICException::new),
        new ShouldStatutChecklistCorrespondre(
            checklist.get(OngletChecklistDoctorale.PARCOURS_ANTERIEUR),
            List.of(ConfigurationsChecklistDoctorale.PARCOURS_ANTERIEUR_SUFFISANT),
            ParcoursAnterieurNonSuffisantException::new),
        new ShouldStatutChecklistCorrespondre(
            checklist.get(OngletChecklistDoctorale.FINANCABILITE),
            ConfigurationsChecklistDoctorale.FINANCABILITE_VALIDEE,
            FinancabiliteNonValideeException::new),
        new ShouldInformationsAcceptationEtreSpecifiees(nombreAnneesPrevoirProgramme),
        new ShouldAucunDocumentAReclamerImmediatement(emplacements));
  }
}
