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

package be.uclouvain.osis.admission.domain.digit;

import java.util.Map;

/**
 * Merge proposal of a candidate, owner of the registration number sent to the registry.
 *
 * @param globalId of the candidate
 * @param status of the merge
 * @param registrationIdSentToDigit allocated NOMA, {@code null} until the first ticket
 * @param validation report of the registry
 */
public record PersonMergeProposal(
    String globalId,
    PersonMergeStatus status,
    String registrationIdSentToDigit,
    Map<String, Object> validation) {
  public PersonMergeProposal {
    validation = validation == null ? Map.of() : Map.copyOf(validation);
  }

  public PersonMergeProposal avecNoma(final String noma) {
    return new PersonMergeProposal(globalId, status, noma, validation);
  }
}
