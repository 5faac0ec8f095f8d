package be.uclouvain.osis.admission.doctorat.epreuveconfirmation.handlers;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEpreuveConfirmationRepository.DATE_LIMITE_EN_COURS;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEpreuveConfirmationRepository.DOCTORAT;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEpreuveConfirmationRepository.DOCTORAT_PROLONGATION;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEpreuveConfirmationRepository.EPREUVE_EN_COURS;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEpreuveConfirmationRepository.EPREUVE_PASSEE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEpreuveConfirmationRepository.EPREUVE_PROLONGATION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.commands.CompleterAvisProlongationParCddCommand;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.commands.ModifierEpreuveConfirmationParCddCommand;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.commands.RecupererDerniereEpreuveConfirmationQuery;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.commands.RecupererEpreuvesConfirmationQuery;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.commands.SoumettreEpreuveConfirmationCommand;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.commands.SoumettreReportDeDateCommand;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.DateEpreuveApresDateLimiteException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.DemandeProlongationIncompleteException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.DemandeProlongationNonDefinieException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.NouvelleEcheanceAnterieureException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.ProlongationDejaEnAttenteException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.RapportRechercheNonFourniException;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EpreuveConfirmationHandlersTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  @Nested
  class Consultation {
    @Test
    void attempts_are_listed_latest_deadline_first() {
      final var epreuves = BUS.invoke(new RecupererEpreuvesConfirmationQuery(DOCTORAT));

      assertEquals(2, epreuves.size());
      assertEquals(EPREUVE_EN_COURS, epreuves.get(0).uuid());
      assertEquals(EPREUVE_PASSEE, epreuves.get(1).uuid());
    }

    @Test
    void active_attempt_has_the_latest_deadline() {
      final var epreuve = BUS.invoke(new RecupererDerniereEpreuveConfirmationQuery(DOCTORAT));

      assertEquals(EPREUVE_EN_COURS, epreuve.uuid());
      assertEquals(DATE_LIMITE_EN_COURS, epreuve.dateLimite());
    }

    @Test
    void doctorate_without_attempt_is_reported() {
      final var query = new RecupererDerniereEpreuveConfirmationQuery("uuid-inconnu");

      assertThrows(EpreuveConfirmationNonTrouveeException.class, () -> BUS.invoke(query));
      assertTrue(BUS.invoke(new RecupererEpreuvesConfirmationQuery("uuid-inconnu")).isEmpty());
    }
  }

  @Nested
  class Soumettre {
    @Test
    void paper_is_submitted_before_the_deadline() {
      BUS.invoke(
          new SoumettreEpreuveConfirmationCommand(
              EPREUVE_EN_COURS,
              DATE_LIMITE_EN_COURS,
              List.of("uuid-rapport-2024"),
              List.of(),
              null));

      final var epreuve = BUS.invoke(new RecupererDerniereEpreuveConfirmationQuery(DOCTORAT));
      assertEquals(DATE_LIMITE_EN_COURS, epreuve.date());
      assertEquals(List.of("uuid-rapport-2024"), epreuve.rapportRecherche());
      assertTrue(epreuve.avisRenouvellementMandatRecherche().isEmpty());
    }

    @Test
    void late_date_and_missing_report_are_both_reported() {
      final var command =
          new SoumettreEpreuveConfirmationCommand(
              EPREUVE_EN_COURS, DATE_LIMITE_EN_COURS.plusDays(1), List.of(), List.of(), List.of());

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));

      assertEquals(2, exception.getExceptions().size());
      assertTrue(exception.contains(DateEpreuveApresDateLimiteException.class));
      assertTrue(exception.contains(RapportRechercheNonFourniException.class));
      assertNull(BUS.invoke(new RecupererDerniereEpreuveConfirmationQuery(DOCTORAT)).date());
    }
  }

  @Nested
  class Prolongation {
    @Test
    void postponement_request_awaits_the_commission() {
      final var echeance = LocalDate.of(2024, 9, 30);

      BUS.invoke(
          new SoumettreReportDeDateCommand(
              EPREUVE_EN_COURS, echeance, "Congé de maladie", List.of("uuid-lettre")));

      final var demande =
          BUS.invoke(new RecupererDerniereEpreuveConfirmationQuery(DOCTORAT))
              .demandeProlongation();
      assertEquals(echeance, demande.nouvelleEcheance());
      assertEquals(List.of("uuid-lettre"), demande.lettreJustification());
      assertTrue(demande.estEnAttenteAvis());
    }

    @Test
    void incomplete_request_is_rejected_alone() {
      final var command =
          new SoumettreReportDeDateCommand(EPREUVE_EN_COURS, null, " ", List.of());

      assertThrows(DemandeProlongationIncompleteException.class, () -> BUS.invoke(command));
    }

    @Test
    void new_deadline_must_follow_the_current_one() {
      final var command =
          new SoumettreReportDeDateCommand(
              EPREUVE_EN_COURS, DATE_LIMITE_EN_COURS, "Congé de maladie", List.of());

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(NouvelleEcheanceAnterieureException.class));
    }

    @Test
    void second_request_waits_for_the_first_opinion() {
      final var command =
          new SoumettreReportDeDateCommand(
              EPREUVE_PROLONGATION, LocalDate.of(2025, 3, 31), "Nouveau retard", List.of());

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(ProlongationDejaEnAttenteException.class));
    }

    @Test
    void commission_opinion_closes_the_request() {
      BUS.invoke(new CompleterAvisProlongationParCddCommand(EPREUVE_PROLONGATION, "Favorable"));

      final var demande =
          BUS.invoke(new RecupererDerniereEpreuveConfirmationQuery(DOCTORAT_PROLONGATION))
              .demandeProlongation();
      assertEquals("Favorable", demande.avisCdd());
      assertEquals(LocalDate.of(2024, 12, 31), demande.nouvelleEcheance());
    }

    @Test
    void opinion_needs_a_request() {
      final var command = new CompleterAvisProlongationParCddCommand(EPREUVE_EN_COURS, "Favorable");

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(DemandeProlongationNonDefinieException.class));
    }
  }

  @Test
  void commission_can_move_the_deadline() {
    final var nouvelleDateLimite = LocalDate.of(2024, 10, 31);

    BUS.invoke(
        new ModifierEpreuveConfirmationParCddCommand(
            EPREUVE_EN_COURS, nouvelleDateLimite, null, List.of(), List.of(), List.of()));

    final var epreuve = BUS.invoke(new RecupererDerniereEpreuveConfirmationQuery(DOCTORAT));
    assertEquals(EPREUVE_EN_COURS, epreuve.uuid());
    assertEquals(nouvelleDateLimite, epreuve.dateLimite());
  }
}
