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

package be.uclouvain.osis.admission.doctorat.supervision.validator;

import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.doctorat.supervision.model.ChoixStatutSignatureGroupeDeSupervision;

/** Members join or leave the group only before the signatures are requested. */
public record ShouldSignaturesPasEtreEnvoyees(ChoixStatutSignatureGroupeDeSupervision statut)
    implements InvariantValidator {
  @Override
  public void validate() {
    if (statut == ChoixStatutSignatureGroupeDeSupervision.SIGNING_IN_PROGRESS) {
      throw new ProcedureDemandeSignatureLanceeException();
    }
  }
}
