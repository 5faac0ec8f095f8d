package be.uclouvain.osis.admission.domain.digit;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryDigitRepository.GLOBAL_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DigitHandlersTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  @Test
  void candidate_without_ticket_has_no_noma() {
    assertEquals(Optional.empty(), BUS.invoke(new RecupererNomaEnvoyeADigitQuery(GLOBAL_ID)));
    assertFalse(BUS.invoke(new ADemandeCreationTicketEnCoursQuery(GLOBAL_ID)));
  }

  @Test
  void noma_is_allocated_once_per_candidate() {
    final var premier = BUS.invoke(new SoumettreTicketPersonneCommand(GLOBAL_ID));
    final var second = BUS.invoke(new SoumettreTicketPersonneCommand(GLOBAL_ID));

    assertEquals("00000001", premier.noma());
    assertEquals(premier.noma(), second.noma());
    assertEquals(PersonTicketCreationStatus.CREATED, second.statut());
    assertEquals(
        Optional.of("00000001"), BUS.invoke(new RecupererNomaEnvoyeADigitQuery(GLOBAL_ID)));
    assertTrue(BUS.invoke(new ADemandeCreationTicketEnCoursQuery(GLOBAL_ID)));
  }

  @Test
  void new_candidate_gets_the_next_noma() {
    ADMISSION
        .digit()
        .save(new PersonMergeProposal("0000000001", PersonMergeStatus.NO_MATCH, null, null));

    BUS.invoke(new SoumettreTicketPersonneCommand(GLOBAL_ID));
    final var ticket = BUS.invoke(new SoumettreTicketPersonneCommand("0000000001"));

    assertEquals("00000002", ticket.noma());
  }

  @Test
  void candidate_without_merge_proposal_is_refused() {
    final var command = new SoumettreTicketPersonneCommand("0000000002");

    assertThrows(PersonMergeProposalNonTrouveeException.class, () -> BUS.invoke(command));
  }
}
