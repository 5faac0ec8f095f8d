package be.uclouvain.osis.admission.infrastructure.jooq;

import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.MERGE_GLOBAL_ID;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.MERGE_REGISTRATION_ID;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.MERGE_STATUS;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.NOMA_SEQUENCE;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.PERSON_MERGE_PROPOSAL;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.PERSON_TICKET_CREATION;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.SEQUENCE_NAME;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.SEQUENCE_NEXT_VALUE;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.TICKET_GLOBAL_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.domain.digit.PersonMergeProposalNonTrouveeException;
import be.uclouvain.osis.admission.domain.digit.PersonMergeStatus;
import be.uclouvain.osis.admission.domain.digit.TicketPersonneDTO;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.h2.jdbcx.JdbcDataSource;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JooqDigitRepositoryTest {
  static final String SEQUENCE = "noma";
  static final String GLOBAL_ID = "0123456789";
  static final DSLContext DSL_CONTEXT;

  static {
    final var dataSource = new JdbcDataSource();
    dataSource.setURL(
        "jdbc:h2:mem:digit;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;"
            + "DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    DSL_CONTEXT = DSL.using(dataSource, SQLDialect.POSTGRES);
    AdmissionSchema.create(DSL_CONTEXT);
  }

  final JooqDigitRepository repository = new JooqDigitRepository(DSL_CONTEXT, SEQUENCE);

  @BeforeEach
  void setUp() {
    DSL_CONTEXT.truncate(PERSON_TICKET_CREATION).execute();
    DSL_CONTEXT.truncate(PERSON_MERGE_PROPOSAL).execute();
    DSL_CONTEXT.truncate(NOMA_SEQUENCE).execute();

    DSL_CONTEXT
        .insertInto(NOMA_SEQUENCE)
        .set(SEQUENCE_NAME, SEQUENCE)
        .set(SEQUENCE_NEXT_VALUE, 24000001L)
        .execute();
    DSL_CONTEXT
        .insertInto(PERSON_MERGE_PROPOSAL)
        .set(MERGE_GLOBAL_ID, GLOBAL_ID)
        .set(MERGE_STATUS, PersonMergeStatus.NO_MATCH.name())
        .execute();
  }

  static long prochaineValeur() {
    return DSL_CONTEXT
        .select(SEQUENCE_NEXT_VALUE)
        .from(NOMA_SEQUENCE)
        .where(SEQUENCE_NAME.eq(SEQUENCE))
        .fetchOne(SEQUENCE_NEXT_VALUE);
  }

  @Test
  void first_ticket_allocates_the_noma() {
    assertFalse(repository.aDemandeCreationTicketEnCours(GLOBAL_ID));

    final var ticket = repository.soumettreTicketPersonne(GLOBAL_ID);

    assertEquals("24000001", ticket.noma());
    assertEquals(Optional.of("24000001"), repository.recupererNomaEnvoye(GLOBAL_ID));
    assertTrue(repository.aDemandeCreationTicketEnCours(GLOBAL_ID));
    assertEquals(24000002L, prochaineValeur());
  }

  @Test
  void next_tickets_reuse_the_allocated_noma() {
    final var premier = repository.soumettreTicketPersonne(GLOBAL_ID);
    final var second = repository.soumettreTicketPersonne(GLOBAL_ID);

    assertEquals(premier.noma(), second.noma());
    assertEquals(24000002L, prochaineValeur());
    assertEquals(2, DSL_CONTEXT.fetchCount(PERSON_TICKET_CREATION, TICKET_GLOBAL_ID.eq(GLOBAL_ID)));
  }

  @Test
  void candidate_without_merge_proposal_is_refused() {
    assertThrows(
        PersonMergeProposalNonTrouveeException.class,
        () -> repository.soumettreTicketPersonne("0000000000"));
    assertEquals(0, DSL_CONTEXT.fetchCount(PERSON_TICKET_CREATION));
    assertTrue(repository.recupererNomaEnvoye("0000000000").isEmpty());
  }

  @Test
  void should_handle_lock_on_person_merge_proposal_and_not_create_a_new_noma() throws Exception {
    final int candidats = 4;
    final var barrier = new CyclicBarrier(candidats);
    final ExecutorService executor = Executors.newFixedThreadPool(candidats);
    try {
      final List<Future<TicketPersonneDTO>> futures = new ArrayList<>();
      for (int i = 0; i < candidats; i++) {
        futures.add(
            executor.submit(
                () -> {
                  barrier.await(5, TimeUnit.SECONDS);
                  return repository.soumettreTicketPersonne(GLOBAL_ID);
                }));
      }

      final List<String> nomas = new ArrayList<>();
      for (Future<TicketPersonneDTO> future : futures) {
        nomas.add(future.get(30, TimeUnit.SECONDS).noma());
      }

      assertEquals(1, nomas.stream().distinct().count());
      assertEquals(
          Optional.of(nomas.get(0)),
          Optional.ofNullable(
              DSL_CONTEXT
                  .select(MERGE_REGISTRATION_ID)
                  .from(PERSON_MERGE_PROPOSAL)
                  .where(MERGE_GLOBAL_ID.eq(GLOBAL_ID))
                  .fetchOne(MERGE_REGISTRATION_ID)));
      assertEquals(24000002L, prochaineValeur());
      assertEquals(
          candidats,
          DSL_CONTEXT.fetchCount(PERSON_TICKET_CREATION, TICKET_GLOBAL_ID.eq(GLOBAL_ID)));
    } finally {
      executor.shutdownNow();
    }
  }
}
