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

package be.uclouvain.osis.admission.domain.service;

import be.uclouvain.osis.admission.domain.digit.PersonMergeStatus;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of the search of the candidate in the person registry.
 *
 * @param status of the merge proposal
 * @param validation report of the registry, {@code valid=false} when data must be fixed
 */
public record MergeProposalDTO(PersonMergeStatus status, Map<String, Object> validation) {
  private static final Set<PersonMergeStatus> STATUTS_QUARANTAINE =
      Set.of(PersonMergeStatus.MATCH_FOUND, PersonMergeStatus.ERROR);

  public MergeProposalDTO {
    validation = validation == null ? Map.of() : Map.copyOf(validation);
  }

  /**
   * @return {@code true} if a manager must solve the merge before the candidate can be enrolled
   */
  public boolean estEnQuarantaine() {
    return STATUTS_QUARANTAINE.contains(status) || Boolean.FALSE.equals(validation.get("valid"));
  }
}
