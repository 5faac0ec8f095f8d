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

import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;
import java.util.List;
import java.util.Map;

public record PropositionDTO(
    String uuid,
    String reference,
    ChoixTypeAdmission typeAdmission,
    String sigleFormation,
    int annee,
    String matriculeCandidat,
    ChoixStatutPropositionDoctorale statut,
    Map<String, StatutChecklist> checklist,
    List<String> motifsRefus,
    List<String> autresMotifsRefus) {
  public static PropositionDTO depuis(final Proposition proposition) {
    return new PropositionDTO(
        proposition.getEntityId().uuid(),
        proposition.getReference(),
        proposition.getTypeAdmission(),
        proposition.getSigleFormation(),
        proposition.getAnnee(),
        proposition.getMatriculeCandidat(),
        proposition.getStatut(),
        proposition.getChecklist().enMap(),
        proposition.getMotifsRefus().stream().map(MotifRefusIdentity::uuid).toList(),
        proposition.getAutresMotifsRefus());
  }
}
