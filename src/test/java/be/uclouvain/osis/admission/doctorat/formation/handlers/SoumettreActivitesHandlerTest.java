package be.uclouvain.osis.admission.doctorat.formation.handlers;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository.COMMUNICATION_INCOMPLETE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository.CONFERENCE_AUTRE_DOCTORAT;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository.CONFERENCE_COMPLETE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository.COURS_SOUMIS;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository.DOCTORAT;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository.PUBLICATION_INCOMPLETE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository.SEMINAIRE_COMPLET;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository.SERVICE_DATES_INCOHERENTES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.doctorat.formation.commands.SoumettreActivitesCommand;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteIdentity;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.formation.model.StatutActivite;
import be.uclouvain.osis.admission.doctorat.formation.validator.ActiviteDejaSoumiseException;
import be.uclouvain.osis.admission.doctorat.formation.validator.ActiviteNonCompleteException;
import be.uclouvain.osis.admission.doctorat.formation.validator.DatesActiviteIncoherentesException;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SoumettreActivitesHandlerTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  static StatutActivite statut(final String uuid) {
    return ADMISSION.activites().get(new ActiviteIdentity(uuid)).getStatut();
  }

  @Test
  void complete_activities_are_submitted() {
    final var soumises =
        BUS.invoke(
            new SoumettreActivitesCommand(
                DOCTORAT, List.of(CONFERENCE_COMPLETE, SEMINAIRE_COMPLET)));

    assertEquals(
        List.of(new ActiviteIdentity(CONFERENCE_COMPLETE), new ActiviteIdentity(SEMINAIRE_COMPLET)),
        soumises);
    assertEquals(StatutActivite.SOUMISE, statut(CONFERENCE_COMPLETE));
    assertEquals(StatutActivite.SOUMISE, statut(SEMINAIRE_COMPLET));
  }

  @Test
  void every_incomplete_activity_is_reported_and_none_is_submitted() {
    final var command =
        new SoumettreActivitesCommand(
            DOCTORAT,
            List.of(CONFERENCE_COMPLETE, COMMUNICATION_INCOMPLETE, PUBLICATION_INCOMPLETE));

    final var exception =
        assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));

    assertEquals(2, exception.getExceptions().size());
    assertTrue(
        exception.getExceptions().stream()
            .allMatch(ActiviteNonCompleteException.class::isInstance));
    assertEquals(StatutActivite.NON_SOUMISE, statut(CONFERENCE_COMPLETE));
  }

  @Test
  void end_date_before_start_date_is_refused() {
    final var command =
        new SoumettreActivitesCommand(DOCTORAT, List.of(SERVICE_DATES_INCOHERENTES));

    final var exception =
        assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
    assertTrue(exception.contains(DatesActiviteIncoherentesException.class));
  }

  @Test
  void submitted_activity_cannot_be_submitted_again() {
    final var command = new SoumettreActivitesCommand(DOCTORAT, List.of(COURS_SOUMIS));

    final var exception =
        assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
    assertTrue(exception.contains(ActiviteDejaSoumiseException.class));
  }

  @Test
  void activity_of_another_doctorate_is_not_found() {
    final var command =
        new SoumettreActivitesCommand(
            DOCTORAT, List.of(CONFERENCE_COMPLETE, CONFERENCE_AUTRE_DOCTORAT));

    assertThrows(ActiviteNonTrouveeException.class, () -> BUS.invoke(command));
    assertEquals(StatutActivite.NON_SOUMISE, statut(CONFERENCE_COMPLETE));
  }

  @Test
  void unknown_activity_is_not_found() {
    final var command = new SoumettreActivitesCommand(DOCTORAT, List.of("uuid-inconnu"));

    assertThrows(ActiviteNonTrouveeException.class, () -> BUS.invoke(command));
  }
}
