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

package be.uclouvain.osis.admission.infrastructure.memory;

import be.uclouvain.osis.admission.doctorat.preparation.model.DoctoratDTO;
import be.uclouvain.osis.admission.doctorat.preparation.model.DoctoratTranslator;
import java.util.List;
import java.util.Optional;

public final class InMemoryDoctoratTranslator implements DoctoratTranslator {
  private static final List<DoctoratDTO> DOCTORATS =
      List.of(
          new DoctoratDTO("SC3DP", 2024, "Doctorat en sciences", "CDSC"),
          new DoctoratDTO(
              "ECGE3DP", 2024, "Doctorat en sciences économiques et de gestion", "CDE"),
          new DoctoratDTO("SC3DP", 2023, "Doctorat en sciences", "CDSC"));

  @Override
  public Optional<DoctoratDTO> get(final String sigle, final int annee) {
    return DOCTORATS.stream()
        .filter(doctorat -> doctorat.sigle().equals(sigle) && doctorat.annee() == annee)
        .findFirst();
  }
}
