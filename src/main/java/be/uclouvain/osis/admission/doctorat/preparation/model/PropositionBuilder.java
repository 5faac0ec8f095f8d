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

package be.uclouvain.osis.admission.doctorat.preparation.model;

import be.uclouvain.osis.admission.doctorat.preparation.validator.InitierPropositionValidatorList;
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/** Creates new doctoral propositions. */
public final class PropositionBuilder {
  private PropositionBuilder() {
    // Cannot be instantiated
  }

  /**
   * @param typeAdmission requested by the candidate
   * @param justification of a pre-admission
   * @param doctorat chosen by the candidate
   * @param matriculeCandidat of the candidate
   * @param nombrePropositionsEnCours of the candidate
   * @param maximumPropositions allowed per candidate
   * @return a draft proposition
   */
  public static Proposition initier(
      final ChoixTypeAdmission typeAdmission,
      final String justification,
      final DoctoratDTO doctorat,
      final String matriculeCandidat,
      final long nombrePropositionsEnCours,
      final int maximumPropositions) {
    new InitierPropositionValidatorList(
            typeAdmission, justification, nombrePropositionsEnCours, maximumPropositions)
        .validate();

    final String uuid = UUID.randomUUID().toString();
    final LocalDateTime maintenant = LocalDateTime.now();
    return new Proposition(
        new PropositionIdentity(uuid),
        typeAdmission,
        justification,
        doctorat.sigle(),
        doctorat.annee(),
        matriculeCandidat,
        reference(doctorat, uuid),
        ChoixStatutPropositionDoctorale.EN_BROUILLON,
        Checklist.initiale(OngletChecklistDoctorale.class, ChoixStatutChecklist.INITIAL_CANDIDAT),
        List.of(),
        List.of(),
        Map.of(),
        null,
        null,
        matriculeCandidat,
        maintenant,
        maintenant);
  }

  private static String reference(final DoctoratDTO doctorat, final String uuid) {
    return "M-%s%02d-%s"
        .formatted(
            doctorat.sigleEntiteGestion(),
            doctorat.annee() % 100,
            uuid.substring(0, 8).toUpperCase(Locale.ROOT));
  }
}
