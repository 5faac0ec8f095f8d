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

package be.uclouvain.osis.admission.doctorat.supervision.model;

import java.util.List;

public record GroupeDeSupervisionDTO(
    String uuidProposition,
    ChoixStatutSignatureGroupeDeSupervision statutSignature,
    List<Signataire> promoteurs,
    List<Signataire> membresCA,
    String promoteurReference,
    String institutThese) {
  public GroupeDeSupervisionDTO {
    promoteurs = List.copyOf(promoteurs);
    membresCA = List.copyOf(membresCA);
  }

  public static GroupeDeSupervisionDTO depuis(final GroupeDeSupervision groupe) {
    return new GroupeDeSupervisionDTO(
        groupe.getEntityId().uuid(),
        groupe.getStatutSignature(),
        groupe.getPromoteurs(),
        groupe.getMembresCA(),
        groupe.getPromoteurReference(),
        groupe.getInstitutThese());
  }
}
