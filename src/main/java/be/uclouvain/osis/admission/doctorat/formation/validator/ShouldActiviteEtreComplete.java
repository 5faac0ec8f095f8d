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

package be.uclouvain.osis.admission.doctorat.formation.validator;

import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import java.util.Arrays;
import java.util.List;

/**
 * @param champs mandatory values of the activity, blank strings count as missing
 */
public record ShouldActiviteEtreComplete(List<Object> champs) implements InvariantValidator {
  public static ShouldActiviteEtreComplete avecChamps(final Object... champs) {
    return new ShouldActiviteEtreComplete(Arrays.asList(champs));
  }

  @Override
  public void validate() {
    final boolean incomplete =
        champs.stream()
            .anyMatch(
                champ -> champ == null || (champ instanceof String texte && texte.isBlank()));
    if (incomplete) {
      throw new ActiviteNonCompleteException();
    }
  }
}
