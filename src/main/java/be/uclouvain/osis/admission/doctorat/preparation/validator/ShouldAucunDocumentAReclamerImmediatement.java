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
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.StatutEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.StatutReclamationEmplacementDocument;
import java.util.List;
import java.util.Set;

/**
 * @param emplacements of the proposition
 */
public record ShouldAucunDocumentAReclamerImmediatement(List<EmplacementDocument> emplacements)
    implements InvariantValidator {
  private static final Set<StatutEmplacementDocument> EN_ATTENTE =
      Set.of(StatutEmplacementDocument.A_RECLAMER, StatutEmplacementDocument.RECLAME);

  @Override
  public void validate() {
    final boolean documentManquant =
        emplacements.stream()
            .anyMatch(
                emplacement ->
                    emplacement.getStatutReclamation()
                            == StatutReclamationEmplacementDocument.IMMEDIATEMENT
                        && EN_ATTENTE.contains(emplacement.getStatut()));
    if (documentManquant) {
      throw new DocumentAReclamerImmediatException();
    }
  }
}
