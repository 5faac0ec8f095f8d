package be.uclouvain.osis.admission.doctorat.preparation.handlers;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.ATTENTE_DIRECTION;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.A_COMPLETER_SIC;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.BROUILLON;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.COMPLETEE_SIC;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.CONFIRMEE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.MATRICULE_CANDIDAT;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.RETOUR_DE_FAC;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.TRAITEMENT_FAC;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.doctorat.preparation.commands.AnnulerReclamationDocumentsAuCandidatCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ApprouverAdmissionParSicCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ApprouverPropositionParCddCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.CompleterEmplacementsDocumentsParCandidatCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.EnvoyerPropositionACddLorsDeLaDecisionCddCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.InitierPropositionCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ListerPropositionsCandidatQuery;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ModifierStatutChecklistExperienceParcoursAnterieurCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ModifierStatutChecklistParcoursAnterieurCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ReclamerDocumentsAuCandidatCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.RecupererPropositionQuery;
import be.uclouvain.osis.admission.doctorat.preparation.commands.RefuserPropositionParCddCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.RefuserPropositionParSicCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.SpecifierMotifsRefusPropositionParCddCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.SpecifierMotifsRefusPropositionParSicCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.SupprimerPropositionCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixTypeAdmission;
import be.uclouvain.osis.admission.doctorat.preparation.model.DoctoratNonTrouveException;
import be.uclouvain.osis.admission.doctorat.preparation.model.OngletChecklistDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionDTO;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.DocumentAReclamerImmediatException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.FinancabiliteNonValideeException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.InformationsAcceptationNonSpecifieesException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.JustificationRequiseException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.MaximumPropositionsAtteintException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.MotifsRefusNonSpecifiesException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.ParcoursAnterieurNonSuffisantException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.PropositionNonACompleterException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.PropositionNonEnBrouillonException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.SituationPropositionNonCddException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.SituationPropositionNonSICException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.StatutChecklistDecisionCddDoitEtreDifferentClotureException;
import be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.digit.RecupererNomaEnvoyeADigitQuery;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentNonTrouveException;
import be.uclouvain.osis.admission.domain.document.StatutEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.StatutReclamationEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.TypeEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.commands.InitialiserEmplacementDocumentAReclamerCommand;
import be.uclouvain.osis.admission.domain.model.TypeGestionnaire;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryEmplacementDocumentRepository;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PropositionDoctoraleHandlersTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();
  static final String SIC = "00987654";
  static final String CDD = "00321234";

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  static PropositionDTO recuperer(final String uuid) {
    return BUS.invoke(new RecupererPropositionQuery(uuid));
  }

  static StatutChecklist onglet(final String uuid, final OngletChecklistDoctorale onglet) {
    return recuperer(uuid).checklist().get(onglet.name());
  }

  static EmplacementDocument emplacement(final String uuid, final String identifiant) {
    return ADMISSION
        .emplacementsDocuments()
        .get(new EmplacementDocumentIdentity(identifiant, uuid));
  }

  @Nested
  class Initier {
    @Test
    void new_proposition_is_a_draft_referenced_after_the_managing_entity() {
      final var id =
          BUS.invoke(
              new InitierPropositionCommand(
                  ChoixTypeAdmission.ADMISSION, null, "SC3DP", 2024, "0000000001"));

      final var proposition = recuperer(id.uuid());
      assertEquals(ChoixStatutPropositionDoctorale.EN_BROUILLON, proposition.statut());
      assertTrue(proposition.reference().startsWith("M-CDSC24-"));
      assertEquals(
          ChoixStatutChecklist.INITIAL_CANDIDAT,
          proposition.checklist().get(OngletChecklistDoctorale.DECISION_SIC.name()).statut());
    }

    @Test
    void unknown_doctorate_is_reported() {
      final var command =
          new InitierPropositionCommand(
              ChoixTypeAdmission.ADMISSION, null, "INCONNU", 2024, "0000000001");

      assertThrows(DoctoratNonTrouveException.class, () -> BUS.invoke(command));
    }

    @Test
    void missing_justification_of_a_pre_admission_is_reported_alone() {
      final var command =
          new InitierPropositionCommand(
              ChoixTypeAdmission.PRE_ADMISSION, " ", "SC3DP", 2024, MATRICULE_CANDIDAT);

      assertThrows(JustificationRequiseException.class, () -> BUS.invoke(command));
    }

    @Test
    void candidate_cannot_exceed_the_maximum_of_propositions() {
      final var command =
          new InitierPropositionCommand(
              ChoixTypeAdmission.ADMISSION, null, "SC3DP", 2024, MATRICULE_CANDIDAT);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(MaximumPropositionsAtteintException.class));
    }
  }

  @Nested
  class DecisionCdd {
    @Test
    void sending_to_cdd_moves_to_faculty_processing() {
      BUS.invoke(new EnvoyerPropositionACddLorsDeLaDecisionCddCommand(CONFIRMEE, SIC));

      assertEquals(ChoixStatutPropositionDoctorale.TRAITEMENT_FAC, recuperer(CONFIRMEE).statut());
      assertEquals(
          ChoixStatutChecklist.INITIAL_CANDIDAT,
          onglet(CONFIRMEE, OngletChecklistDoctorale.DECISION_CDD).statut());
      assertEquals(1, ADMISSION.historique().entrees(CONFIRMEE).size());
    }

    @Test
    void draft_cannot_be_sent_to_cdd() {
      final var command = new EnvoyerPropositionACddLorsDeLaDecisionCddCommand(BROUILLON, SIC);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(SituationPropositionNonSICException.class));
    }

    @Test
    void cdd_refusal_uses_the_reasons_specified_before() {
      BUS.invoke(
          new SpecifierMotifsRefusPropositionParCddCommand(
              TRAITEMENT_FAC, CDD, List.of("uuid-motif-refus"), List.of()));
      BUS.invoke(new RefuserPropositionParCddCommand(TRAITEMENT_FAC, CDD, "Refus", "Désolé"));

      final var proposition = recuperer(TRAITEMENT_FAC);
      assertEquals(ChoixStatutPropositionDoctorale.INSCRIPTION_REFUSEE, proposition.statut());
      assertEquals(List.of("uuid-motif-refus"), proposition.motifsRefus());
      assertEquals(
          Map.of("decision", "EN_DECISION"),
          onglet(TRAITEMENT_FAC, OngletChecklistDoctorale.DECISION_CDD).extra());
      assertEquals(1, ADMISSION.notification().messages(TRAITEMENT_FAC).size());
    }

    @Test
    void cdd_refusal_without_reasons_is_refused() {
      final var command = new RefuserPropositionParCddCommand(TRAITEMENT_FAC, CDD, null, null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(MotifsRefusNonSpecifiesException.class));
      assertEquals(
          ChoixStatutPropositionDoctorale.TRAITEMENT_FAC, recuperer(TRAITEMENT_FAC).statut());
    }

    @Test
    void cdd_approval_returns_the_proposition_to_the_enrolment_office() {
      BUS.invoke(new ApprouverPropositionParCddCommand(TRAITEMENT_FAC, CDD, true, 2));

      assertEquals(
          ChoixStatutPropositionDoctorale.RETOUR_DE_FAC, recuperer(TRAITEMENT_FAC).statut());
      assertEquals(
          ChoixStatutChecklist.GEST_REUSSITE,
          onglet(TRAITEMENT_FAC, OngletChecklistDoctorale.DECISION_CDD).statut());
    }

    @Test
    void closed_cdd_decision_cannot_be_approved() {
      final var proposition = ADMISSION.propositions().get(new PropositionIdentity(TRAITEMENT_FAC));
      proposition
          .getChecklist()
          .modifier(
              OngletChecklistDoctorale.DECISION_CDD,
              ChoixStatutChecklist.GEST_BLOCAGE,
              Map.of("decision", "CLOTURE"));
      ADMISSION.propositions().save(proposition);
      final var command = new ApprouverPropositionParCddCommand(TRAITEMENT_FAC, CDD, false, 1);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(
          exception.contains(StatutChecklistDecisionCddDoitEtreDifferentClotureException.class));
    }
  }

  @Nested
  class DecisionSic {
    @Test
    void refusal_reasons_of_the_enrolment_office_wait_for_direction_validation() {
      BUS.invoke(
          new SpecifierMotifsRefusPropositionParSicCommand(
              RETOUR_DE_FAC, SIC, List.of("uuid-nouveau-motif-refus"), List.of()));

      final var proposition = recuperer(RETOUR_DE_FAC);
      assertEquals(
          ChoixStatutPropositionDoctorale.ATTENTE_VALIDATION_DIRECTION, proposition.statut());
      assertEquals(List.of("uuid-nouveau-motif-refus"), proposition.motifsRefus());

      final var decision = onglet(RETOUR_DE_FAC, OngletChecklistDoctorale.DECISION_SIC);
      assertEquals(ChoixStatutChecklist.GEST_EN_COURS, decision.statut());
      assertEquals(Map.of("en_cours", "refusal"), decision.extra());
    }

    @Test
    void refusal_records_decision_and_message_in_history() {
      BUS.invoke(
          new RefuserPropositionParSicCommand(
              COMPLETEE_SIC,
              List.of("uuid-motif-refus"),
              List.of("Dossier incomplet"),
              SIC,
              "Refus de votre demande",
              "Votre demande a été refusée."));

      final var proposition = recuperer(COMPLETEE_SIC);
      assertEquals(ChoixStatutPropositionDoctorale.INSCRIPTION_REFUSEE, proposition.statut());
      assertEquals(List.of("Dossier incomplet"), proposition.autresMotifsRefus());
      final var decision = onglet(COMPLETEE_SIC, OngletChecklistDoctorale.DECISION_SIC);
      assertEquals(ChoixStatutChecklist.GEST_BLOCAGE, decision.statut());
      assertEquals(Map.of("blocage", "refusal"), decision.extra());
      assertEquals(1, ADMISSION.notification().messages(COMPLETEE_SIC).size());
      assertEquals(2, ADMISSION.historique().entrees(COMPLETEE_SIC).size());
    }

    @Test
    void refusal_is_refused_while_the_proposition_is_back_from_the_faculty() {
      final var command =
          new RefuserPropositionParSicCommand(
              RETOUR_DE_FAC, List.of("uuid-motif-refus"), List.of(), SIC, null, null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(SituationPropositionNonSICException.class));
      assertEquals(
          ChoixStatutPropositionDoctorale.RETOUR_DE_FAC, recuperer(RETOUR_DE_FAC).statut());
      assertTrue(ADMISSION.historique().entrees(RETOUR_DE_FAC).isEmpty());
    }

    @Test
    void refusal_without_any_reason_is_refused() {
      final var command =
          new RefuserPropositionParSicCommand(COMPLETEE_SIC, List.of(), List.of(), SIC, null, null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(MotifsRefusNonSpecifiesException.class));
      assertTrue(ADMISSION.historique().entrees(COMPLETEE_SIC).isEmpty());
    }

    @Test
    void approval_registers_the_candidate_in_the_person_registry() {
      BUS.invoke(new ApprouverAdmissionParSicCommand(ATTENTE_DIRECTION, SIC, null, null));

      assertEquals(
          ChoixStatutPropositionDoctorale.INSCRIPTION_AUTORISEE,
          recuperer(ATTENTE_DIRECTION).statut());
      assertEquals(
          Optional.of("00000001"),
          BUS.invoke(new RecupererNomaEnvoyeADigitQuery(MATRICULE_CANDIDAT)));
      assertTrue(ADMISSION.notification().messages(ATTENTE_DIRECTION).isEmpty());
    }

    @Test
    void approval_reports_every_unmet_condition() {
      final var command = new ApprouverAdmissionParSicCommand(RETOUR_DE_FAC, SIC, null, null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));

      assertEquals(4, exception.getExceptions().size());
      assertTrue(exception.contains(SituationPropositionNonSICException.class));
      assertTrue(exception.contains(ParcoursAnterieurNonSuffisantException.class));
      assertTrue(exception.contains(FinancabiliteNonValideeException.class));
      assertTrue(exception.contains(InformationsAcceptationNonSpecifieesException.class));
    }

    @Test
    void approval_waits_for_documents_requested_immediately() {
      BUS.invoke(
          new InitialiserEmplacementDocumentAReclamerCommand(
              ATTENTE_DIRECTION,
              InMemoryEmplacementDocumentRepository.CARTE_IDENTITE,
              TypeEmplacementDocument.NON_LIBRE,
              "Carte expirée",
              StatutReclamationEmplacementDocument.IMMEDIATEMENT,
              SIC));
      final var command = new ApprouverAdmissionParSicCommand(ATTENTE_DIRECTION, SIC, null, null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));

      assertEquals(1, exception.getExceptions().size());
      assertTrue(exception.contains(DocumentAReclamerImmediatException.class));
      assertEquals(
          Optional.empty(), BUS.invoke(new RecupererNomaEnvoyeADigitQuery(MATRICULE_CANDIDAT)));
    }
  }

  @Nested
  class Documents {
    static final String CURRICULUM = InMemoryEmplacementDocumentRepository.CURRICULUM;
    static final String LIBRE = InMemoryEmplacementDocumentRepository.LIBRE_CANDIDAT;

    @Test
    void requesting_documents_marks_slots_as_requested() {
      final var dateLimite = LocalDate.of(2024, 4, 15);

      BUS.invoke(
          new ReclamerDocumentsAuCandidatCommand(
              CONFIRMEE, List.of(CURRICULUM, LIBRE), TypeGestionnaire.SIC, dateLimite, SIC));

      assertEquals(
          ChoixStatutPropositionDoctorale.A_COMPLETER_POUR_SIC, recuperer(CONFIRMEE).statut());
      assertEquals(
          StatutEmplacementDocument.RECLAME, emplacement(CONFIRMEE, CURRICULUM).getStatut());
      assertEquals(dateLimite, emplacement(CONFIRMEE, LIBRE).getDateLimiteReclamation());
    }

    @Test
    void faculty_cannot_request_documents_outside_faculty_processing() {
      final var command =
          new ReclamerDocumentsAuCandidatCommand(
              CONFIRMEE, List.of(CURRICULUM), TypeGestionnaire.FAC, null, CDD);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(SituationPropositionNonCddException.class));
      assertEquals(
          StatutEmplacementDocument.A_RECLAMER, emplacement(CONFIRMEE, CURRICULUM).getStatut());
    }

    @Test
    void cancelling_the_request_restores_the_previous_state() {
      BUS.invoke(
          new AnnulerReclamationDocumentsAuCandidatCommand(
              A_COMPLETER_SIC, TypeGestionnaire.SIC, SIC));

      assertEquals(ChoixStatutPropositionDoctorale.CONFIRMEE, recuperer(A_COMPLETER_SIC).statut());
      final var curriculum = emplacement(A_COMPLETER_SIC, CURRICULUM);
      assertEquals(StatutEmplacementDocument.A_RECLAMER, curriculum.getStatut());
      assertNull(curriculum.getDateLimiteReclamation());
    }

    @Test
    void candidate_answers_complete_the_requested_slots() {
      BUS.invoke(
          new CompleterEmplacementsDocumentsParCandidatCommand(
              A_COMPLETER_SIC, Map.of(CURRICULUM, List.of("uuid-nouveau-cv"))));

      assertEquals(
          ChoixStatutPropositionDoctorale.COMPLETEE_POUR_SIC, recuperer(A_COMPLETER_SIC).statut());
      final var curriculum = emplacement(A_COMPLETER_SIC, CURRICULUM);
      assertEquals(StatutEmplacementDocument.COMPLETE_APRES_RECLAMATION, curriculum.getStatut());
      assertEquals(List.of("uuid-nouveau-cv"), curriculum.getUuidsDocuments());
    }

    @Test
    void unknown_slot_in_the_answers_leaves_everything_untouched() {
      final var reponses = new LinkedHashMap<String, List<String>>();
      reponses.put(CURRICULUM, List.of("uuid-nouveau-cv"));
      reponses.put("INCONNU", List.of("uuid-autre"));
      final var command =
          new CompleterEmplacementsDocumentsParCandidatCommand(A_COMPLETER_SIC, reponses);

      assertThrows(EmplacementDocumentNonTrouveException.class, () -> BUS.invoke(command));

      assertEquals(
          ChoixStatutPropositionDoctorale.A_COMPLETER_POUR_SIC,
          recuperer(A_COMPLETER_SIC).statut());
      final var curriculum = emplacement(A_COMPLETER_SIC, CURRICULUM);
      assertEquals(StatutEmplacementDocument.RECLAME, curriculum.getStatut());
      assertFalse(curriculum.getUuidsDocuments().contains("uuid-nouveau-cv"));
    }

    @Test
    void candidate_cannot_complete_a_proposition_without_request() {
      final var command = new CompleterEmplacementsDocumentsParCandidatCommand(CONFIRMEE, Map.of());

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(PropositionNonACompleterException.class));
    }
  }

  @Nested
  class Checklist {
    @Test
    void previous_education_status_is_updated() {
      BUS.invoke(
          new ModifierStatutChecklistParcoursAnterieurCommand(
              CONFIRMEE, ChoixStatutChecklist.GEST_REUSSITE, SIC));

      assertEquals(
          ChoixStatutChecklist.GEST_REUSSITE,
          onglet(CONFIRMEE, OngletChecklistDoctorale.PARCOURS_ANTERIEUR).statut());
    }

    @Test
    void experience_status_is_kept_once_per_experience() {
      BUS.invoke(
          new ModifierStatutChecklistExperienceParcoursAnterieurCommand(
              CONFIRMEE, "uuid-experience", ChoixStatutChecklist.GEST_BLOCAGE, SIC));
      BUS.invoke(
          new ModifierStatutChecklistExperienceParcoursAnterieurCommand(
              CONFIRMEE, "uuid-experience", ChoixStatutChecklist.GEST_REUSSITE, SIC));

      final var parcours = onglet(CONFIRMEE, OngletChecklistDoctorale.PARCOURS_ANTERIEUR);
      assertEquals(1, parcours.enfants().size());
      assertEquals(
          ChoixStatutChecklist.GEST_REUSSITE,
          parcours.enfant("uuid-experience").orElseThrow().statut());
      assertEquals(ChoixStatutChecklist.INITIAL_CANDIDAT, parcours.statut());
    }
  }

  @Nested
  class Consultation {
    @Test
    void deleting_a_draft_hides_it_from_the_candidate_list() {
      final int avant = BUS.invoke(new ListerPropositionsCandidatQuery(MATRICULE_CANDIDAT)).size();

      BUS.invoke(new SupprimerPropositionCommand(BROUILLON, MATRICULE_CANDIDAT));

      final var propositions = BUS.invoke(new ListerPropositionsCandidatQuery(MATRICULE_CANDIDAT));
      assertEquals(avant - 1, propositions.size());
      assertFalse(
          propositions.stream().anyMatch(proposition -> proposition.uuid().equals(BROUILLON)));
    }

    @Test
    void only_drafts_can_be_deleted() {
      final var command = new SupprimerPropositionCommand(CONFIRMEE, MATRICULE_CANDIDAT);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(PropositionNonEnBrouillonException.class));
    }

    @Test
    void unknown_proposition_is_reported() {
      assertThrows(
          PropositionNonTrouveeException.class, () -> recuperer("uuid-inconnu"));
    }
  }
}
