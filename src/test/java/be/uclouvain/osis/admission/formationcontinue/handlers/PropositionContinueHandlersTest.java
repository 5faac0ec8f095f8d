package be.uclouvain.osis.admission.formationcontinue.handlers;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionContinueRepository.APPROUVEE_PAR_FAC;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionContinueRepository.A_TRAITER;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionContinueRepository.A_VALIDER;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionContinueRepository.CLOTUREE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionContinueRepository.EN_ATTENTE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionContinueRepository.PRISE_EN_CHARGE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionContinueRepository.VALIDEE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.digit.PersonMergeStatus;
import be.uclouvain.osis.admission.domain.service.MergeProposalDTO;
import be.uclouvain.osis.admission.domain.validator.EnQuarantaineException;
import be.uclouvain.osis.admission.formationcontinue.commands.AnnulerPropositionCommand;
import be.uclouvain.osis.admission.formationcontinue.commands.ApprouverParFacCommand;
import be.uclouvain.osis.admission.formationcontinue.commands.CloturerPropositionCommand;
import be.uclouvain.osis.admission.formationcontinue.commands.MettreAValiderCommand;
import be.uclouvain.osis.admission.formationcontinue.commands.MettreEnAttenteCommand;
import be.uclouvain.osis.admission.formationcontinue.commands.PrendreEnChargeCommand;
import be.uclouvain.osis.admission.formationcontinue.commands.RecupererPropositionContinueQuery;
import be.uclouvain.osis.admission.formationcontinue.commands.RefuserPropositionCommand;
import be.uclouvain.osis.admission.formationcontinue.commands.ValiderPropositionCommand;
import be.uclouvain.osis.admission.formationcontinue.model.ChoixStatutPropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.OngletChecklistContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueDTO;
import be.uclouvain.osis.admission.formationcontinue.service.HistoriqueFormationContinue;
import be.uclouvain.osis.admission.formationcontinue.validator.ApprouverPropositionTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.CloturerPropositionTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.MettreAValiderTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.PrendreEnChargeTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.RefuserPropositionTransitionStatutException;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PropositionContinueHandlersTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();
  static final String GESTIONNAIRE = "00321234";

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  static PropositionContinueDTO recuperer(final String uuid) {
    return BUS.invoke(new RecupererPropositionContinueQuery(uuid));
  }

  static StatutChecklist decision(final String uuid) {
    return recuperer(uuid).checklist().get(OngletChecklistContinue.DECISION.name());
  }

  static void mettreEnQuarantaine() {
    ADMISSION
        .profilCandidatTranslator()
        .definirMergeProposal(
            InMemoryPropositionRepository.MATRICULE_CANDIDAT,
            Optional.of(new MergeProposalDTO(PersonMergeStatus.MATCH_FOUND, Map.of())));
  }

  @Nested
  class PriseEnCharge {
    @Test
    void proposition_to_process_is_taken_in_charge_silently() {
      BUS.invoke(new PrendreEnChargeCommand(A_TRAITER, GESTIONNAIRE));

      final var decision = decision(A_TRAITER);
      assertEquals(ChoixStatutChecklist.GEST_EN_COURS, decision.statut());
      assertEquals("taken_in_charge", decision.extra().get("en_cours"));
      assertTrue(ADMISSION.historique().entrees(A_TRAITER).isEmpty());
      assertTrue(ADMISSION.notification().messages(A_TRAITER).isEmpty());
    }

    @Test
    void proposition_already_taken_in_charge_is_refused() {
      final var command = new PrendreEnChargeCommand(PRISE_EN_CHARGE, GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(PrendreEnChargeTransitionStatutException.class));
    }
  }

  @Nested
  class Decisions {
    @Test
    void putting_on_hold_notifies_the_candidate() {
      BUS.invoke(
          new MettreEnAttenteCommand(
              PRISE_EN_CHARGE, GESTIONNAIRE, "Dossier en attente", "Bonjour", "Places", null));

      assertEquals(ChoixStatutPropositionContinue.EN_ATTENTE, recuperer(PRISE_EN_CHARGE).statut());
      assertEquals("on_hold", decision(PRISE_EN_CHARGE).extra().get("en_cours"));

      final var entrees = ADMISSION.historique().entrees(PRISE_EN_CHARGE);
      assertEquals(2, entrees.size());
      assertEquals(HistoriqueFormationContinue.TAGS_STATUT, entrees.get(0).tags());
      assertEquals(HistoriqueFormationContinue.TAGS_MESSAGE, entrees.get(1).tags());

      final var messages = ADMISSION.notification().messages(PRISE_EN_CHARGE);
      assertEquals(1, messages.size());
      assertEquals("Dossier en attente", messages.get(0).objet());
    }

    @Test
    void faculty_approval_without_subject_uses_a_generic_one() {
      BUS.invoke(
          new ApprouverParFacCommand(A_TRAITER, GESTIONNAIRE, " ", "Bonjour", "Réussir le test"));

      assertEquals("Réussir le test", recuperer(A_TRAITER).conditionApprobationFacultaire());
      assertEquals("fac_approval", decision(A_TRAITER).extra().get("en_cours"));
      assertEquals(
          "Votre demande d'inscription à USCC",
          ADMISSION.notification().messages(A_TRAITER).get(0).objet());
    }

    @Test
    void approved_proposition_is_put_to_validation_without_message() {
      BUS.invoke(new MettreAValiderCommand(APPROUVEE_PAR_FAC, GESTIONNAIRE));

      assertEquals("to_validate", decision(APPROUVEE_PAR_FAC).extra().get("en_cours"));
      assertEquals(1, ADMISSION.historique().entrees(APPROUVEE_PAR_FAC).size());
      assertTrue(ADMISSION.notification().messages(APPROUVEE_PAR_FAC).isEmpty());
    }

    @Test
    void only_approved_proposition_can_be_put_to_validation() {
      final var command = new MettreAValiderCommand(A_TRAITER, GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(MettreAValiderTransitionStatutException.class));
    }

    @Test
    void cancellation_keeps_its_reason() {
      BUS.invoke(
          new AnnulerPropositionCommand(EN_ATTENTE, GESTIONNAIRE, "Annulation", "", "Doublon"));

      final var proposition = recuperer(EN_ATTENTE);
      assertEquals(ChoixStatutPropositionContinue.ANNULEE, proposition.statut());
      assertEquals("Doublon", proposition.motifAnnulation());
      assertEquals(ChoixStatutChecklist.GEST_BLOCAGE, decision(EN_ATTENTE).statut());
    }

    @Test
    void final_decision_cannot_be_overturned() {
      final var command =
          new RefuserPropositionCommand(VALIDEE, GESTIONNAIRE, "Refus", "", "Complet", null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(RefuserPropositionTransitionStatutException.class));
      assertEquals(
          ChoixStatutPropositionContinue.INSCRIPTION_AUTORISEE, recuperer(VALIDEE).statut());
    }
  }

  @Nested
  class Validation {
    @Test
    void proposition_to_validate_is_registered() {
      BUS.invoke(new ValiderPropositionCommand(A_VALIDER, GESTIONNAIRE, "Inscription", ""));

      assertEquals(
          ChoixStatutPropositionContinue.INSCRIPTION_AUTORISEE, recuperer(A_VALIDER).statut());
      assertEquals(ChoixStatutChecklist.GEST_REUSSITE, decision(A_VALIDER).statut());
      assertEquals(2, ADMISSION.historique().entrees(A_VALIDER).size());
    }

    @Test
    void faculty_approval_is_enough_to_register() {
      BUS.invoke(new ValiderPropositionCommand(APPROUVEE_PAR_FAC, GESTIONNAIRE, null, null));

      assertEquals(
          ChoixStatutPropositionContinue.INSCRIPTION_AUTORISEE,
          recuperer(APPROUVEE_PAR_FAC).statut());
    }

    @Test
    void candidate_in_quarantine_cannot_be_registered() {
      mettreEnQuarantaine();
      final var command = new ValiderPropositionCommand(A_VALIDER, GESTIONNAIRE, null, null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));

      assertEquals(1, exception.getExceptions().size());
      assertTrue(exception.contains(EnQuarantaineException.class));
      assertTrue(ADMISSION.historique().entrees(A_VALIDER).isEmpty());
    }

    @Test
    void wrong_state_and_quarantine_are_reported_together() {
      mettreEnQuarantaine();
      final var command = new ValiderPropositionCommand(A_TRAITER, GESTIONNAIRE, null, null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));

      assertEquals(2, exception.getExceptions().size());
      assertTrue(exception.contains(ApprouverPropositionTransitionStatutException.class));
      assertTrue(exception.contains(EnQuarantaineException.class));
    }
  }

  @Nested
  class Cloture {
    @Test
    void registered_proposition_is_closed() {
      BUS.invoke(new CloturerPropositionCommand(VALIDEE, GESTIONNAIRE));

      assertEquals(ChoixStatutPropositionContinue.CLOTUREE, recuperer(VALIDEE).statut());
      assertEquals("closed", decision(VALIDEE).extra().get("blocage"));
      assertTrue(ADMISSION.notification().messages(VALIDEE).isEmpty());
    }

    @Test
    void closed_proposition_cannot_be_closed_again() {
      final var command = new CloturerPropositionCommand(CLOTUREE, GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(CloturerPropositionTransitionStatutException.class));
    }
  }
}
