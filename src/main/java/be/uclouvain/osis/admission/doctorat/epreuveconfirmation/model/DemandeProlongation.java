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

package be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Request to postpone the deadline of a confirmation paper.
 *
 * @param nouvelleEcheance requested deadline
 * @param justificationSuccincte of the request
 * @param lettreJustification uploaded files
 * @param avisCdd opinion of the doctoral commission, {@code null} while awaited
 */
public record DemandeProlongation(
    LocalDate nouvelleEcheance,
    String justificationSuccincte,
    List<String> lettreJustification,
    String avisCdd) {
  public DemandeProlongation {
    lettreJustification =
        lettreJustification == null ? List.of() : List.copyOf(lettreJustification);
  }

  public boolean estEnAttenteAvis() {
    return avisCdd == null || avisCdd.isBlank();
  }

  public DemandeProlongation avecAvisCdd(final String avis) {
    return new DemandeProlongation(
        nouvelleEcheance, justificationSuccincte, lettreJustification, avis);
  }
}
