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

package be.uclouvain.osis.admission.domain.document.validator;

import be.uclouvain.osis.admission.ddd.validation.DataContractValidator;
import be.uclouvain.osis.admission.domain.document.StatutReclamationEmplacementDocument;

/**
 * @param statutReclamation chosen by the manager
 */
public record ShouldReclamationEtreSpecifiee(
    StatutReclamationEmplacementDocument statutReclamation) implements DataContractValidator {
  @Override
  public void validate() {
    if (statutReclamation == null) {
      throw new ReclamationNonSpecifieeException();
    }
  }
}
