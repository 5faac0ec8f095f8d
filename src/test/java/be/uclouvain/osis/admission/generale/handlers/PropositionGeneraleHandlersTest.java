package be.uclouvain.osis.admission.generale.handlers;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionGeneraleRepository.BROUILLON;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionGeneraleRepository.CONFIRMEE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionGeneraleRepository.RETOUR_DE_FAC;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionGeneraleRepository.TRAITEMENT_FAC;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionGeneraleRepository.TRAITEMENT_FAC_AVEC_MOTIFS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.generale.commands.ApprouverPropositionParFaculteCommand;
import be.uclouvain.osis.admission.generale.commands.EnvoyerPropositionAFacLorsDeLaDecisionFacultaireCommand;
import be.uclouvain.osis.admission.generale.commands.RecupererPropositionGeneraleQuery;
import be.uclouvain.osis.admission.generale.commands.RefuserPropositionParFaculteCommand;
import be.uclouvain.osis.admission.generale.commands.SpecifierMotifsRefusPropositionParFaculteCommand;
import be.uclouvain.osis.admission.generale.commands.SpecifierMotifsRefusPropositionParSicCommand;
import be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale;
import be.uclouvain.osis.admission.generale.model.OngletChecklistGenerale;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleDTO;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleNonTrouveeException;
import be.uclouvain.osis.admission.generale.validator.MotifsRefusNonSpecifiesException;
import be.uclouvain.osis.admission.generale.validator.SituationPropositionNonFACException;
import be.uclouvain.osis.admission.generale.validator.SituationPropositionNonSICException;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PropositionGeneraleHandlersTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();
  static final String GESTIONNAIRE = "00321234";

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  static PropositionGeneraleDTO recuperer(final String uuid) {
    return BUS.invoke(new RecupererPropositionGeneraleQuery(uuid));
  }

  static StatutChecklist onglet(final String uuid, final OngletChecklistGenerale onglet) {
    return recuperer(uuid).checklist().get(onglet.name());
  }

  @Test
  void unknown_proposition_is_reported() {
    final var query = new RecupererPropositionGeneraleQuery("uuid-inconnu");

    assertThrows(PropositionGeneraleNonTrouveeException.class, () -> BUS.invoke(query));
  }

  @Nested
  class EnvoiFaculte {
    @Test
    void confirmed_proposition_is_sent_to_the_faculty() {
      BUS.invoke(
          new EnvoyerPropositionAFacLorsDeLaDecisionFacultaireCommand(CONFIRMEE, GESTIONNAIRE));

      assertEquals(ChoixStatutPropositionGenerale.TRAITEMENT_FAC, recuperer(CONFIRMEE).statut());
      final var decision = onglet(CONFIRMEE, OngletChecklistGenerale.DECISION_FACULTAIRE);
      assertEquals(ChoixStatutChecklist.INITIAL_CANDIDAT, decision.statut());
    }

    @Test
    void draft_cannot_be_sent_to_the_faculty() {
      final var command =
          new EnvoyerPropositionAFacLorsDeLaDecisionFacultaireCommand(BROUILLON, GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(SituationPropositionNonSICException.class));
      assertEquals(ChoixStatutPropositionGenerale.EN_BROUILLON, recuperer(BROUILLON).statut());
    }
  }

  @Nested
  class DecisionFaculte {
    @Test
    void refusal_reasons_block_the_faculty_tab() {
      BUS.invoke(
          new SpecifierMotifsRefusPropositionParFaculteCommand(
              TRAITEMENT_FAC, GESTIONNAIRE, List.of("uuid-motif"), List.of("Dossier incomplet")));

      final var proposition = recuperer(TRAITEMENT_FAC);
      assertEquals(ChoixStatutPropositionGenerale.TRAITEMENT_FAC, proposition.statut());
      assertEquals(List.of("uuid-motif"), proposition.motifsRefus());
      assertEquals(List.of("Dossier incomplet"), proposition.autresMotifsRefus());
      final var decision = onglet(TRAITEMENT_FAC, OngletChecklistGenerale.DECISION_FACULTAIRE);
      assertEquals(ChoixStatutChecklist.GEST_BLOCAGE, decision.statut());
      assertEquals(Map.of("decision", "1"), decision.extra());
    }

    @Test
    void refusal_uses_the_reasons_specified_earlier() {
      BUS.invoke(new RefuserPropositionParFaculteCommand(TRAITEMENT_FAC_AVEC_MOTIFS, GESTIONNAIRE));

      final var proposition = recuperer(TRAITEMENT_FAC_AVEC_MOTIFS);
      assertEquals(ChoixStatutPropositionGenerale.RETOUR_DE_FAC, proposition.statut());
      assertEquals(List.of("uuid-motif-refus"), proposition.motifsRefus());
    }

    @Test
    void refusal_without_reasons_is_refused() {
      final var command = new RefuserPropositionParFaculteCommand(TRAITEMENT_FAC, GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(MotifsRefusNonSpecifiesException.class));
      assertEquals(
          ChoixStatutPropositionGenerale.TRAITEMENT_FAC, recuperer(TRAITEMENT_FAC).statut());
    }

    @Test
    void approval_clears_previous_reasons() {
      BUS.invoke(
          new ApprouverPropositionParFaculteCommand(TRAITEMENT_FAC_AVEC_MOTIFS, GESTIONNAIRE));

      final var proposition = recuperer(TRAITEMENT_FAC_AVEC_MOTIFS);
      assertEquals(ChoixStatutPropositionGenerale.RETOUR_DE_FAC, proposition.statut());
      assertTrue(proposition.motifsRefus().isEmpty());
      assertEquals(
          ChoixStatutChecklist.GEST_REUSSITE,
          onglet(TRAITEMENT_FAC_AVEC_MOTIFS, OngletChecklistGenerale.DECISION_FACULTAIRE)
              .statut());
    }

    @Test
    void faculty_cannot_decide_outside_its_processing() {
      final var command = new ApprouverPropositionParFaculteCommand(CONFIRMEE, GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(SituationPropositionNonFACException.class));
    }
  }

  @Nested
  class DecisionSic {
    @Test
    void refusal_awaits_the_management_validation() {
      BUS.invoke(
          new SpecifierMotifsRefusPropositionParSicCommand(
              RETOUR_DE_FAC, GESTIONNAIRE, List.of("uuid-motif"), null));

      final var proposition = recuperer(RETOUR_DE_FAC);
      assertEquals(
          ChoixStatutPropositionGenerale.ATTENTE_VALIDATION_DIRECTION, proposition.statut());
      assertEquals(List.of("uuid-motif"), proposition.motifsRefus());
      final var decision = onglet(RETOUR_DE_FAC, OngletChecklistGenerale.DECISION_SIC);
      assertEquals(ChoixStatutChecklist.GEST_EN_COURS, decision.statut());
      assertEquals("refusal", decision.extra().get("en_cours"));
    }

    @Test
    void sic_cannot_refuse_while_the_faculty_decides() {
      final var command =
          new SpecifierMotifsRefusPropositionParSicCommand(
              TRAITEMENT_FAC, GESTIONNAIRE, List.of("uuid-motif"), null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(SituationPropositionNonSICException.class));
    }
  }
}
