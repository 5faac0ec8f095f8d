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

import java.util.Optional;

/**
 * Person tickets sent to the registry and the registration numbers (NOMA) they carry.
 *
 * <p>A candidate gets a NOMA at most once: concurrent submissions for the same candidate must all
 * observe the number allocated by the first one.
 */
public interface DigitRepository {
  /**
   * @param valeur of the sequence
   * @return the NOMA, left padded to 8 digits
   */
  static String formaterNoma(final long valeur) {
    return "%08d".formatted(valeur);
  }

  /**
   * Allocates the NOMA of the candidate if needed and records a new ticket.
   *
   * @param globalId of the candidate
   * @return the created ticket
   * @throws PersonMergeProposalNonTrouveeException if the candidate has no merge proposal
   */
  TicketPersonneDTO soumettreTicketPersonne(final String globalId);

  /**
   * @param globalId of the candidate
   * @return the NOMA sent to the registry, if any
   */
  Optional<String> recupererNomaEnvoye(final String globalId);

  /**
   * @param globalId of the candidate
   * @return {@code true} if a ticket is waiting or done
   */
  boolean aDemandeCreationTicketEnCours(final String globalId);
}
