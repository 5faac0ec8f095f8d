package be.uclouvain.osis.admission.domain.document.handlers;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEmplacementDocumentRepository.CARTE_IDENTITE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEmplacementDocumentRepository.CURRICULUM;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEmplacementDocumentRepository.LIBRE_CANDIDAT;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEmplacementDocumentRepository.LIBRE_GESTIONNAIRE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryEmplacementDocumentRepository.SYSTEME;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.A_COMPLETER_SIC;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.CONFIRMEE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentNonTrouveException;
import be.uclouvain.osis.admission.domain.document.StatutEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.StatutReclamationEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.TypeEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.commands.AnnulerReclamationEmplacementDocumentCommand;
import be.uclouvain.osis.admission.domain.document.commands.InitialiserEmplacementDocumentAReclamerCommand;
import be.uclouvain.osis.admission.domain.document.commands.InitialiserEmplacementDocumentLibreAReclamerCommand;
import be.uclouvain.osis.admission.domain.document.commands.InitialiserEmplacementDocumentLibreNonReclamableCommand;
import be.uclouvain.osis.admission.domain.document.commands.ModifierReclamationEmplacementDocumentCommand;
import be.uclouvain.osis.admission.domain.document.commands.RemplacerEmplacementDocumentCommand;
import be.uclouvain.osis.admission.domain.document.commands.RemplirEmplacementDocumentParGestionnaireCommand;
import be.uclouvain.osis.admission.domain.document.commands.RetyperDocumentCommand;
import be.uclouvain.osis.admission.domain.document.commands.SupprimerEmplacementDocumentCommand;
import be.uclouvain.osis.admission.domain.document.validator.DocumentNonRetypableException;
import be.uclouvain.osis.admission.domain.document.validator.EmplacementDocumentNonLibreException;
import be.uclouvain.osis.admission.domain.document.validator.EmplacementDocumentNonReclamableException;
import be.uclouvain.osis.admission.domain.document.validator.ReclamationNonSpecifieeException;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EmplacementDocumentHandlersTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();
  static final String GESTIONNAIRE = "00321234";

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  static EmplacementDocument emplacement(final String uuid, final String identifiant) {
    return ADMISSION
        .emplacementsDocuments()
        .get(new EmplacementDocumentIdentity(identifiant, uuid));
  }

  static void assertSupprime(final String uuid, final String identifiant) {
    assertThrows(EmplacementDocumentNonTrouveException.class, () -> emplacement(uuid, identifiant));
  }

  @Nested
  class Initialisation {
    @Test
    void requested_slot_awaits_its_claim() {
      final var identite =
          BUS.invoke(
              new InitialiserEmplacementDocumentAReclamerCommand(
                  CONFIRMEE,
                  "CURRICULUM.DIPLOME",
                  TypeEmplacementDocument.NON_LIBRE,
                  "Diplôme manquant",
                  StatutReclamationEmplacementDocument.ULTERIEUREMENT_BLOQUANT,
                  GESTIONNAIRE));

      final var emplacement = emplacement(CONFIRMEE, identite.identifiant());
      assertEquals(StatutEmplacementDocument.A_RECLAMER, emplacement.getStatut());
      assertEquals("Diplôme manquant", emplacement.getRaison());
      assertEquals(GESTIONNAIRE, emplacement.getDernierActeur());
    }

    @Test
    void missing_claim_status_is_reported_alone() {
      final var command =
          new InitialiserEmplacementDocumentAReclamerCommand(
              CONFIRMEE, "CURRICULUM.DIPLOME", TypeEmplacementDocument.SYSTEME, "", null, null);

      assertThrows(ReclamationNonSpecifieeException.class, () -> BUS.invoke(command));
    }

    @Test
    void system_slot_cannot_be_claimed() {
      final var command =
          new InitialiserEmplacementDocumentAReclamerCommand(
              CONFIRMEE,
              "SYSTEME.AUTRE",
              TypeEmplacementDocument.SYSTEME,
              "",
              StatutReclamationEmplacementDocument.IMMEDIATEMENT,
              GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(EmplacementDocumentNonReclamableException.class));
    }

    @Test
    void free_claimable_slot_gets_a_candidate_identifier() {
      final var identite =
          BUS.invoke(
              new InitialiserEmplacementDocumentLibreAReclamerCommand(
                  CONFIRMEE,
                  TypeEmplacementDocument.LIBRE_RECLAMABLE_FAC,
                  "Lettre de motivation",
                  "À fournir",
                  StatutReclamationEmplacementDocument.IMMEDIATEMENT,
                  GESTIONNAIRE));

      assertTrue(identite.identifiant().startsWith("LIBRE_CANDIDAT."));
      final var emplacement = emplacement(CONFIRMEE, identite.identifiant());
      assertEquals("Lettre de motivation", emplacement.getLibelle());
      assertEquals(StatutEmplacementDocument.A_RECLAMER, emplacement.getStatut());
    }

    @Test
    void free_internal_slot_is_filled_at_once() {
      final var identite =
          BUS.invoke(
              new InitialiserEmplacementDocumentLibreNonReclamableCommand(
                  CONFIRMEE,
                  TypeEmplacementDocument.LIBRE_INTERNE_FAC,
                  "Avis du jury",
                  "uuid-avis",
                  GESTIONNAIRE));

      assertTrue(identite.identifiant().startsWith("LIBRE_GESTIONNAIRE."));
      final var emplacement = emplacement(CONFIRMEE, identite.identifiant());
      assertEquals(StatutEmplacementDocument.VALIDE, emplacement.getStatut());
      assertEquals(List.of("uuid-avis"), emplacement.getUuidsDocuments());
    }

    @Test
    void free_slot_needs_a_free_type() {
      final var command =
          new InitialiserEmplacementDocumentLibreNonReclamableCommand(
              CONFIRMEE, TypeEmplacementDocument.NON_LIBRE, "Avis", "uuid-avis", GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(EmplacementDocumentNonLibreException.class));
    }
  }

  @Nested
  class Reclamation {
    @Test
    void claimed_slot_is_requested_again_with_new_reason() {
      BUS.invoke(
          new ModifierReclamationEmplacementDocumentCommand(
              A_COMPLETER_SIC,
              CURRICULUM,
              "Version signée",
              StatutReclamationEmplacementDocument.ULTERIEUREMENT_BLOQUANT,
              GESTIONNAIRE));

      final var emplacement = emplacement(A_COMPLETER_SIC, CURRICULUM);
      assertEquals(StatutEmplacementDocument.A_RECLAMER, emplacement.getStatut());
      assertEquals(
          StatutReclamationEmplacementDocument.ULTERIEUREMENT_BLOQUANT,
          emplacement.getStatutReclamation());
      assertEquals("Version signée", emplacement.getRaison());
    }

    @Test
    void cancelling_a_fixed_slot_resets_it() {
      BUS.invoke(new AnnulerReclamationEmplacementDocumentCommand(CONFIRMEE, CURRICULUM, null));

      final var emplacement = emplacement(CONFIRMEE, CURRICULUM);
      assertEquals(StatutEmplacementDocument.NON_ANALYSE, emplacement.getStatut());
      assertNull(emplacement.getStatutReclamation());
      assertNull(emplacement.getRaison());
    }

    @Test
    void cancelling_a_free_slot_deletes_it() {
      BUS.invoke(new AnnulerReclamationEmplacementDocumentCommand(CONFIRMEE, LIBRE_CANDIDAT, null));

      assertSupprime(CONFIRMEE, LIBRE_CANDIDAT);
    }
  }

  @Nested
  class Contenu {
    @Test
    void manager_fills_a_slot() {
      BUS.invoke(
          new RemplirEmplacementDocumentParGestionnaireCommand(
              CONFIRMEE, CURRICULUM, List.of("uuid-cv"), "CV reçu par courrier", GESTIONNAIRE));

      final var emplacement = emplacement(CONFIRMEE, CURRICULUM);
      assertEquals(StatutEmplacementDocument.VALIDE, emplacement.getStatut());
      assertEquals(List.of("uuid-cv"), emplacement.getUuidsDocuments());
      assertEquals("CV reçu par courrier", emplacement.getJustificationGestionnaire());
      assertNull(emplacement.getStatutReclamation());
    }

    @Test
    void documents_are_replaced() {
      BUS.invoke(
          new RemplacerEmplacementDocumentCommand(
              CONFIRMEE, CARTE_IDENTITE, List.of("uuid-recto", "uuid-verso"), GESTIONNAIRE));

      assertEquals(
          List.of("uuid-recto", "uuid-verso"),
          emplacement(CONFIRMEE, CARTE_IDENTITE).getUuidsDocuments());
    }

    @Test
    void free_slot_is_deleted() {
      BUS.invoke(new SupprimerEmplacementDocumentCommand(CONFIRMEE, LIBRE_GESTIONNAIRE, null));

      assertSupprime(CONFIRMEE, LIBRE_GESTIONNAIRE);
    }

    @Test
    void fixed_slot_cannot_be_deleted() {
      final var command = new SupprimerEmplacementDocumentCommand(CONFIRMEE, CARTE_IDENTITE, null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(EmplacementDocumentNonLibreException.class));
      assertEquals(
          List.of("uuid-carte-identite"),
          emplacement(CONFIRMEE, CARTE_IDENTITE).getUuidsDocuments());
    }
  }

  @Nested
  class Retypage {
    @Test
    void documents_move_to_the_target_slot() {
      BUS.invoke(
          new RetyperDocumentCommand(CONFIRMEE, CARTE_IDENTITE, LIBRE_CANDIDAT, GESTIONNAIRE));

      final var cible = emplacement(CONFIRMEE, LIBRE_CANDIDAT);
      assertEquals(List.of("uuid-carte-identite"), cible.getUuidsDocuments());
      assertEquals(StatutEmplacementDocument.VALIDE, cible.getStatut());
      final var source = emplacement(CONFIRMEE, CARTE_IDENTITE);
      assertTrue(source.getUuidsDocuments().isEmpty());
      assertEquals(StatutEmplacementDocument.A_RECLAMER, source.getStatut());
    }

    @Test
    void contents_and_justifications_are_swapped() {
      BUS.invoke(
          new RemplirEmplacementDocumentParGestionnaireCommand(
              CONFIRMEE,
              CARTE_IDENTITE,
              List.of("uuid-carte-scannee"),
              "Copie fournie au guichet",
              GESTIONNAIRE));
      BUS.invoke(
          new RemplirEmplacementDocumentParGestionnaireCommand(
              CONFIRMEE,
              LIBRE_CANDIDAT,
              List.of("uuid-annexe"),
              "Annexe reçue par courrier",
              GESTIONNAIRE));

      BUS.invoke(
          new RetyperDocumentCommand(CONFIRMEE, CARTE_IDENTITE, LIBRE_CANDIDAT, GESTIONNAIRE));

      final var cible = emplacement(CONFIRMEE, LIBRE_CANDIDAT);
      assertEquals(List.of("uuid-carte-scannee"), cible.getUuidsDocuments());
      assertEquals("Copie fournie au guichet", cible.getJustificationGestionnaire());
      final var source = emplacement(CONFIRMEE, CARTE_IDENTITE);
      assertEquals(List.of("uuid-annexe"), source.getUuidsDocuments());
      assertEquals("Annexe reçue par courrier", source.getJustificationGestionnaire());
    }

    @Test
    void free_slot_left_empty_is_deleted() {
      BUS.invoke(new RetyperDocumentCommand(CONFIRMEE, LIBRE_CANDIDAT, CURRICULUM, GESTIONNAIRE));

      assertSupprime(CONFIRMEE, LIBRE_CANDIDAT);
      assertEquals(
          StatutEmplacementDocument.A_RECLAMER, emplacement(CONFIRMEE, CURRICULUM).getStatut());
    }

    @Test
    void internal_document_cannot_go_to_the_candidate() {
      final var command =
          new RetyperDocumentCommand(CONFIRMEE, LIBRE_GESTIONNAIRE, CARTE_IDENTITE, GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(DocumentNonRetypableException.class));
    }

    @Test
    void system_document_cannot_be_retyped() {
      final var command =
          new RetyperDocumentCommand(CONFIRMEE, SYSTEME, LIBRE_GESTIONNAIRE, GESTIONNAIRE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(DocumentNonRetypableException.class));
      assertEquals(
          List.of("uuid-recapitulatif"), emplacement(CONFIRMEE, SYSTEME).getUuidsDocuments());
    }
  }
}
