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

package be.uclouvain.osis.admission.doctorat.jury.validator;

import be.uclouvain.osis.admission.ddd.validation.BusinessException;
import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import java.util.function.Supplier;

/**
 * @param membre being added or modified
 * @param valeur of the field, blank strings count as missing
 * @param exception raised when an external member misses the field
 */
public record ShouldChampMembreExterneEtreRenseigne(
    MembreJury membre, Object valeur, Supplier<? extends BusinessException> exception)
    implements InvariantValidator {
  @Override
  public void validate() {
    if (!membre.estExterne()) {
      return;
    }

    if (valeur == null || (valeur instanceof String texte && texte.isBlank())) {
      throw exception.get();
    }
  }
}
