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

import be.uclouvain.osis.admission.domain.digit.DigitRepository;
import be.uclouvain.osis.admission.domain.digit.PersonMergeProposal;
import be.uclouvain.osis.admission.domain.digit.PersonMergeProposalNonTrouveeException;
import be.uclouvain.osis.admission.domain.digit.PersonMergeStatus;
import be.uclouvain.osis.admission.domain.digit.PersonTicketCreationStatus;
import be.uclouvain.osis.admission.domain.digit.TicketPersonneDTO;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Merge proposals and tickets held in memory. Every operation holds the repository monitor, which
 * plays the part of the row locks of the database implementation.
 */
public final class InMemoryDigitRepository implements DigitRepository {
  public static final String GLOBAL_ID = InMemoryPropositionRepository.MATRICULE_CANDIDAT;
  public static final long PREMIER_NOMA = 1;

  private final Map<String, PersonMergeProposal> mergeProposals = new HashMap<>();
  private final List<TicketPersonneDTO> tickets = new ArrayList<>();
  private long prochainNoma;

  public InMemoryDigitRepository() {
    reset();
  }

  public synchronized void reset() {
    mergeProposals.clear();
    tickets.clear();
    prochainNoma = PREMIER_NOMA;
    mergeProposals.put(
        GLOBAL_ID, new PersonMergeProposal(GLOBAL_ID, PersonMergeStatus.NO_MATCH, null, Map.of()));
  }

  @Override
  public synchronized TicketPersonneDTO soumettreTicketPersonne(final String globalId) {
    PersonMergeProposal mergeProposal = mergeProposals.get(globalId);
    if (mergeProposal == null) {
      throw new PersonMergeProposalNonTrouveeException(globalId);
    }

    if (mergeProposal.registrationIdSentToDigit() == null) {
      mergeProposal = mergeProposal.avecNoma(DigitRepository.formaterNoma(prochainNoma++));
      mergeProposals.put(globalId, mergeProposal);
    }

    final TicketPersonneDTO ticket =
        new TicketPersonneDTO(
            UUID.randomUUID().toString(),
            globalId,
            mergeProposal.registrationIdSentToDigit(),
            PersonTicketCreationStatus.CREATED);
    tickets.add(ticket);
    return ticket;
  }

  @Override
  public synchronized Optional<String> recupererNomaEnvoye(final String globalId) {
    return Optional.ofNullable(mergeProposals.get(globalId))
        .map(PersonMergeProposal::registrationIdSentToDigit);
  }

  @Override
  public synchronized boolean aDemandeCreationTicketEnCours(final String globalId) {
    return tickets.stream()
        .anyMatch(
            ticket ->
                ticket.globalId().equals(globalId)
                    && PersonTicketCreationStatus.EN_COURS.contains(ticket.statut()));
  }

  /**
   * @param mergeProposal to add or replace
   */
  public synchronized void save(final PersonMergeProposal mergeProposal) {
    mergeProposals.put(mergeProposal.globalId(), mergeProposal);
  }
}
