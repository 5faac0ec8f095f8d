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

import be.uclouvain.osis.admission.domain.digit.PersonMergeStatus;
import be.uclouvain.osis.admission.domain.service.MergeProposalDTO;
import be.uclouvain.osis.admission.domain.service.ProfilCandidatTranslator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Every candidate has a merged profile unless a test says otherwise. */
public final class InMemoryProfilCandidatTranslator implements ProfilCandidatTranslator {
  private final Map<String, Optional<MergeProposalDTO>> mergeProposals = new HashMap<>();

  @Override
  public synchronized Optional<MergeProposalDTO> getMergeProposal(final String matricule) {
    return mergeProposals.getOrDefault(
        matricule, Optional.of(new MergeProposalDTO(PersonMergeStatus.MERGED, Map.of())));
  }

  /**
   * @param matricule of the candidate
   * @param mergeProposal returned for this candidate, empty when the registry was never queried
   */
  public synchronized void definirMergeProposal(
      final String matricule, final Optional<MergeProposalDTO> mergeProposal) {
    mergeProposals.put(matricule, mergeProposal);
  }

  public synchronized void reset() {
    mergeProposals.clear();
  }
}
