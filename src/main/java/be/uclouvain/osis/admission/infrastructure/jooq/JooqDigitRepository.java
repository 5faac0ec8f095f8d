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

package be.uclouvain.osis.admission.infrastructure.jooq;

import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.MERGE_GLOBAL_ID;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.MERGE_REGISTRATION_ID;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.NOMA_SEQUENCE;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.PERSON_MERGE_PROPOSAL;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.PERSON_TICKET_CREATION;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.SEQUENCE_NAME;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.SEQUENCE_NEXT_VALUE;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.TICKET_CREATED_AT;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.TICKET_GLOBAL_ID;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.TICKET_NOMA;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.TICKET_STATUS;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.TICKET_UUID;

import be.uclouvain.osis.admission.domain.digit.DigitRepository;
import be.uclouvain.osis.admission.domain.digit.PersonMergeProposalNonTrouveeException;
import be.uclouvain.osis.admission.domain.digit.PersonTicketCreationStatus;
import be.uclouvain.osis.admission.domain.digit.TicketPersonneDTO;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allocates registration numbers inside one transaction: the merge proposal row is locked first,
 * so a concurrent submission for the same candidate waits and then sees the allocated number.
 */
public final class JooqDigitRepository implements DigitRepository {
  private static final Logger log = LoggerFactory.getLogger(JooqDigitRepository.class);

  private final DSLContext dsl;
  private final String sequence;

  /**
   * @param dsl to run statements with
   * @param sequence name of the {@code noma_sequence} row to allocate from
   */
  public JooqDigitRepository(final DSLContext dsl, final String sequence) {
    if (dsl == null || sequence == null) {
      throw new IllegalArgumentException("Digit repository configuration cannot be null");
    }

    this.dsl = dsl;
    this.sequence = sequence;
  }

  @Override
  public TicketPersonneDTO soumettreTicketPersonne(final String globalId) {
    return dsl.transactionResult(
        (final Configuration trx) -> {
          final DSLContext context = trx.dsl();
          final String nomaExistant =
              context
                  .select(MERGE_REGISTRATION_ID)
                  .from(PERSON_MERGE_PROPOSAL)
                  .where(MERGE_GLOBAL_ID.eq(globalId))
                  .forUpdate()
                  .fetchOptional()
                  .orElseThrow(() -> new PersonMergeProposalNonTrouveeException(globalId))
                  .value1();

          final String noma = nomaExistant != null ? nomaExistant : allouerNoma(context, globalId);
          final String uuid = UUID.randomUUID().toString();
          context
              .insertInto(PERSON_TICKET_CREATION)
              .set(TICKET_UUID, uuid)
              .set(TICKET_GLOBAL_ID, globalId)
              .set(TICKET_STATUS, PersonTicketCreationStatus.CREATED.name())
              .set(TICKET_NOMA, noma)
              .set(TICKET_CREATED_AT, LocalDateTime.now())
              .execute();

          log.debug("Person ticket {} created for {}", uuid, globalId);
          return new TicketPersonneDTO(uuid, globalId, noma, PersonTicketCreationStatus.CREATED);
        });
  }

  @Override
  public Optional<String> recupererNomaEnvoye(final String globalId) {
    return dsl.select(MERGE_REGISTRATION_ID)
        .from(PERSON_MERGE_PROPOSAL)
        .where(MERGE_GLOBAL_ID.eq(globalId))
        .fetchOptional(MERGE_REGISTRATION_ID);
  }

  @Override
  public boolean aDemandeCreationTicketEnCours(final String globalId) {
    return dsl.fetchExists(
        PERSON_TICKET_CREATION,
        TICKET_GLOBAL_ID
            .eq(globalId)
            .and(
                TICKET_STATUS.in(
                    PersonTicketCreationStatus.EN_COURS.stream().map(Enum::name).toList())));
  }

  private String allouerNoma(final DSLContext context, final String globalId) {
    final long valeur =
        context
            .select(SEQUENCE_NEXT_VALUE)
            .from(NOMA_SEQUENCE)
            .where(SEQUENCE_NAME.eq(sequence))
            .forUpdate()
            .fetchOptional(SEQUENCE_NEXT_VALUE)
            .orElseThrow(
                () -> new IllegalStateException("NOMA sequence %s is missing".formatted(sequence)));

    context
        .update(NOMA_SEQUENCE)
        .set(SEQUENCE_NEXT_VALUE, valeur + 1)
        .where(SEQUENCE_NAME.eq(sequence))
        .execute();

    final String noma = DigitRepository.formaterNoma(valeur);
    context
        .update(PERSON_MERGE_PROPOSAL)
        .set(MERGE_REGISTRATION_ID, noma)
        .where(MERGE_GLOBAL_ID.eq(globalId))
        .execute();

    log.info("NOMA {} allocated to {}", noma, globalId);
    return noma;
  }
}
