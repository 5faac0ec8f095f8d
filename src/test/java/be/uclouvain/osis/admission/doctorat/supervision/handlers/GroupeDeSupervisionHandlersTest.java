package be.uclouvain.osis.admission.doctorat.supervision.handlers;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.CO_PROMOTEUR;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.CO_PROMOTEUR_INVITE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.MATRICULE_MEMBRE_CA;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.MATRICULE_PROMOTEUR;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.MEMBRE_CA;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.MEMBRE_CA_INVITE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.PROMOTEUR;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.PROMOTEUR_INVITE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.BROUILLON;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.CONFIRMEE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.EN_ATTENTE_SIGNATURE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.MATRICULE_CANDIDAT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.doctorat.preparation.commands.RecupererPropositionQuery;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale;
import be.uclouvain.osis.admission.doctorat.supervision.commands.AjouterMembreCACommand;
import be.uclouvain.osis.admission.doctorat.supervision.commands.AjouterPromoteurCommand;
import be.uclouvain.osis.admission.doctorat.supervision.commands.ApprouverPropositionCommand;
import be.uclouvain.osis.admission.doctorat.supervision.commands.ApprouverPropositionParPdfCommand;
import be.uclouvain.osis.admission.doctorat.supervision.commands.DemanderSignaturesCommand;
import be.uclouvain.osis.admission.doctorat.supervision.commands.DesignerPromoteurReferenceCommand;
import be.uclouvain.osis.admission.doctorat.supervision.commands.RecupererGroupeDeSupervisionQuery;
import be.uclouvain.osis.admission.doctorat.supervision.commands.RefuserPropositionCommand;
import be.uclouvain.osis.admission.doctorat.supervision.commands.SupprimerMembreCACommand;
import be.uclouvain.osis.admission.doctorat.supervision.commands.SupprimerPromoteurCommand;
import be.uclouvain.osis.admission.doctorat.supervision.model.ChoixEtatSignature;
import be.uclouvain.osis.admission.doctorat.supervision.model.ChoixStatutSignatureGroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionDTO;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionNonTrouveException;
import be.uclouvain.osis.admission.doctorat.supervision.model.Signataire;
import be.uclouvain.osis.admission.doctorat.supervision.service.HistoriqueSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.validator.DejaMembreException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.InstitutTheseObligatoireException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.MembreCAManquantException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.ProcedureDemandeSignatureLanceeException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.PromoteurDeReferenceManquantException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.PromoteurNonTrouveException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.SignataireNonTrouveException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.SignatairePasInviteException;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GroupeDeSupervisionHandlersTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();
  static final String INSTITUT = "uuid-institut-cardiologie";

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  static GroupeDeSupervisionDTO groupe(final String uuidProposition) {
    return BUS.invoke(new RecupererGroupeDeSupervisionQuery(uuidProposition));
  }

  static Signataire signataire(final String uuidProposition, final String uuid) {
    final var groupe = groupe(uuidProposition);
    return Stream.concat(groupe.promoteurs().stream(), groupe.membresCA().stream())
        .filter(signataire -> signataire.uuid().equals(uuid))
        .findFirst()
        .orElseThrow();
  }

  static ChoixStatutPropositionDoctorale statut(final String uuidProposition) {
    return BUS.invoke(new RecupererPropositionQuery(uuidProposition)).statut();
  }

  static ApprouverPropositionCommand approbation(final String uuidMembre, final String institut) {
    return new ApprouverPropositionCommand(EN_ATTENTE_SIGNATURE, uuidMembre, null, null, institut);
  }

  @Nested
  class Composition {
    @Test
    void new_promoter_joins_without_invitation() {
      final var uuid = BUS.invoke(new AjouterPromoteurCommand(BROUILLON, "00111111"));

      assertEquals(3, groupe(BROUILLON).promoteurs().size());
      assertEquals(ChoixEtatSignature.NOT_INVITED, signataire(BROUILLON, uuid).etat());
      assertEquals("00111111", signataire(BROUILLON, uuid).matricule());
    }

    @Test
    void same_person_cannot_join_twice() {
      final var command = new AjouterMembreCACommand(BROUILLON, MATRICULE_PROMOTEUR);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(DejaMembreException.class));
      assertEquals(1, groupe(BROUILLON).membresCA().size());
    }

    @Test
    void members_are_locked_once_signatures_are_requested() {
      final var ajout = new AjouterPromoteurCommand(EN_ATTENTE_SIGNATURE, "00111111");
      final var suppression = new SupprimerMembreCACommand(EN_ATTENTE_SIGNATURE, MEMBRE_CA_INVITE);

      assertTrue(
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(ajout))
              .contains(ProcedureDemandeSignatureLanceeException.class));
      assertTrue(
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(suppression))
              .contains(ProcedureDemandeSignatureLanceeException.class));
      assertEquals(1, groupe(EN_ATTENTE_SIGNATURE).membresCA().size());
    }

    @Test
    void removing_the_reference_promoter_clears_the_reference() {
      BUS.invoke(new SupprimerPromoteurCommand(BROUILLON, PROMOTEUR));

      final var groupe = groupe(BROUILLON);
      assertEquals(1, groupe.promoteurs().size());
      assertNull(groupe.promoteurReference());
    }

    @Test
    void co_promoter_becomes_the_reference() {
      BUS.invoke(new DesignerPromoteurReferenceCommand(BROUILLON, CO_PROMOTEUR));

      assertEquals(CO_PROMOTEUR, groupe(BROUILLON).promoteurReference());
    }

    @Test
    void ca_member_cannot_be_the_reference_promoter() {
      final var command = new DesignerPromoteurReferenceCommand(BROUILLON, MEMBRE_CA);

      assertThrows(PromoteurNonTrouveException.class, () -> BUS.invoke(command));
      assertEquals(PROMOTEUR, groupe(BROUILLON).promoteurReference());
    }

    @Test
    void unknown_group_is_reported() {
      final var query = new RecupererGroupeDeSupervisionQuery(CONFIRMEE);

      assertThrows(GroupeDeSupervisionNonTrouveException.class, () -> BUS.invoke(query));
    }
  }

  @Nested
  class DemandeSignatures {
    @Test
    void request_locks_the_draft_and_invites_everyone() {
      BUS.invoke(new DemanderSignaturesCommand(BROUILLON));

      final var groupe = groupe(BROUILLON);
      assertEquals(ChoixStatutPropositionDoctorale.EN_ATTENTE_DE_SIGNATURE, statut(BROUILLON));
      assertEquals(
          ChoixStatutSignatureGroupeDeSupervision.SIGNING_IN_PROGRESS, groupe.statutSignature());
      assertTrue(
          Stream.concat(groupe.promoteurs().stream(), groupe.membresCA().stream())
              .allMatch(signataire -> signataire.etat() == ChoixEtatSignature.INVITED));

      final var entrees = ADMISSION.historique().entrees(BROUILLON);
      assertEquals(1, entrees.size());
      assertEquals("Les demandes de signatures ont été envoyées.", entrees.get(0).message());
      assertEquals(MATRICULE_CANDIDAT, entrees.get(0).auteur());
      assertEquals(HistoriqueSupervision.TAGS_DEMANDE, entrees.get(0).tags());
    }

    @Test
    void missing_ca_member_and_reference_promoter_are_reported_together() {
      BUS.invoke(new SupprimerMembreCACommand(BROUILLON, MEMBRE_CA));
      BUS.invoke(new SupprimerPromoteurCommand(BROUILLON, PROMOTEUR));
      final var command = new DemanderSignaturesCommand(BROUILLON);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertEquals(2, exception.getExceptions().size());
      assertTrue(exception.contains(MembreCAManquantException.class));
      assertTrue(exception.contains(PromoteurDeReferenceManquantException.class));
      assertEquals(ChoixStatutPropositionDoctorale.EN_BROUILLON, statut(BROUILLON));
      assertEquals(
          ChoixStatutSignatureGroupeDeSupervision.IN_PROGRESS,
          groupe(BROUILLON).statutSignature());
    }

    @Test
    void proposition_waiting_for_signatures_cannot_request_them_again() {
      final var command = new DemanderSignaturesCommand(EN_ATTENTE_SIGNATURE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(ProcedureDemandeSignatureLanceeException.class));
      assertTrue(ADMISSION.historique().entrees(EN_ATTENTE_SIGNATURE).isEmpty());
    }
  }

  @Nested
  class Approbation {
    @Test
    void first_promoter_must_give_the_thesis_institute() {
      final var command = approbation(PROMOTEUR_INVITE, " ");

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(InstitutTheseObligatoireException.class));
      assertEquals(
          ChoixEtatSignature.INVITED, signataire(EN_ATTENTE_SIGNATURE, PROMOTEUR_INVITE).etat());
    }

    @Test
    void approval_records_comments_and_institute() {
      BUS.invoke(
          new ApprouverPropositionCommand(
              EN_ATTENTE_SIGNATURE,
              PROMOTEUR_INVITE,
              "Suivi serré",
              "Très bon projet",
              INSTITUT));

      final var promoteur = signataire(EN_ATTENTE_SIGNATURE, PROMOTEUR_INVITE);
      assertEquals(ChoixEtatSignature.APPROVED, promoteur.etat());
      assertEquals("Suivi serré", promoteur.commentaireInterne());
      assertEquals("Très bon projet", promoteur.commentaireExterne());
      assertEquals(INSTITUT, groupe(EN_ATTENTE_SIGNATURE).institutThese());

      final var entree = ADMISSION.historique().entrees(EN_ATTENTE_SIGNATURE).get(0);
      assertEquals(
          MATRICULE_PROMOTEUR
              + " a approuvé la proposition en tant que promoteur"
              + " (commentaire : Très bon projet)",
          entree.message());
      assertEquals(MATRICULE_PROMOTEUR, entree.auteur());
      assertEquals(HistoriqueSupervision.TAGS_AVIS, entree.tags());
    }

    @Test
    void later_promoters_and_ca_members_need_no_institute() {
      BUS.invoke(approbation(MEMBRE_CA_INVITE, null));
      BUS.invoke(approbation(PROMOTEUR_INVITE, INSTITUT));
      BUS.invoke(approbation(CO_PROMOTEUR_INVITE, null));

      final var groupe = groupe(EN_ATTENTE_SIGNATURE);
      assertTrue(groupe.promoteurs().stream().allMatch(Signataire::estApprouve));
      assertTrue(groupe.membresCA().stream().allMatch(Signataire::estApprouve));
      assertEquals(INSTITUT, groupe.institutThese());
    }

    @Test
    void signed_form_is_uploaded_on_behalf_of_the_member() {
      BUS.invoke(
          new ApprouverPropositionParPdfCommand(
              EN_ATTENTE_SIGNATURE, MEMBRE_CA_INVITE, MATRICULE_CANDIDAT, List.of("uuid-pdf")));

      final var membre = signataire(EN_ATTENTE_SIGNATURE, MEMBRE_CA_INVITE);
      assertEquals(ChoixEtatSignature.APPROVED, membre.etat());
      assertEquals(List.of("uuid-pdf"), membre.pdf());

      final var entree = ADMISSION.historique().entrees(EN_ATTENTE_SIGNATURE).get(0);
      assertEquals(
          MATRICULE_MEMBRE_CA
              + " a approuvé la proposition via PDF en tant que membre du comité"
              + " d'accompagnement",
          entree.message());
      assertEquals(MATRICULE_CANDIDAT, entree.auteur());
    }

    @Test
    void member_not_invited_cannot_approve() {
      final var command =
          new ApprouverPropositionCommand(BROUILLON, PROMOTEUR, null, null, INSTITUT);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(SignatairePasInviteException.class));
      assertNull(groupe(BROUILLON).institutThese());
    }

    @Test
    void unknown_member_is_reported() {
      final var command = approbation("uuid-inconnu", INSTITUT);

      assertThrows(SignataireNonTrouveException.class, () -> BUS.invoke(command));
    }
  }

  @Nested
  class Refus {
    RefuserPropositionCommand refus(final String uuidMembre, final String motif) {
      return new RefuserPropositionCommand(EN_ATTENTE_SIGNATURE, uuidMembre, null, null, motif);
    }

    @Test
    void promoter_refusal_sends_the_proposition_back_to_draft() {
      BUS.invoke(approbation(CO_PROMOTEUR_INVITE, INSTITUT));

      BUS.invoke(refus(PROMOTEUR_INVITE, "Projet trop vague"));

      final var groupe = groupe(EN_ATTENTE_SIGNATURE);
      final var promoteur = signataire(EN_ATTENTE_SIGNATURE, PROMOTEUR_INVITE);
      assertEquals(ChoixStatutPropositionDoctorale.EN_BROUILLON, statut(EN_ATTENTE_SIGNATURE));
      assertEquals(ChoixStatutSignatureGroupeDeSupervision.IN_PROGRESS, groupe.statutSignature());
      assertEquals(ChoixEtatSignature.DECLINED, promoteur.etat());
      assertEquals("Projet trop vague", promoteur.motifRefus());
      assertEquals(
          ChoixEtatSignature.NOT_INVITED,
          signataire(EN_ATTENTE_SIGNATURE, CO_PROMOTEUR_INVITE).etat());
      assertEquals(
          ChoixEtatSignature.INVITED, signataire(EN_ATTENTE_SIGNATURE, MEMBRE_CA_INVITE).etat());

      final var entrees = ADMISSION.historique().entrees(EN_ATTENTE_SIGNATURE);
      assertEquals(
          MATRICULE_PROMOTEUR
              + " a refusé la proposition en tant que promoteur (motif : Projet trop vague)",
          entrees.get(entrees.size() - 1).message());
    }

    @Test
    void declined_promoter_is_invited_again() {
      BUS.invoke(refus(PROMOTEUR_INVITE, "Projet trop vague"));

      BUS.invoke(new DemanderSignaturesCommand(EN_ATTENTE_SIGNATURE));

      final var promoteur = signataire(EN_ATTENTE_SIGNATURE, PROMOTEUR_INVITE);
      assertEquals(ChoixEtatSignature.INVITED, promoteur.etat());
      assertNull(promoteur.motifRefus());
      assertEquals(
          ChoixEtatSignature.INVITED,
          signataire(EN_ATTENTE_SIGNATURE, CO_PROMOTEUR_INVITE).etat());
      assertEquals(
          ChoixStatutPropositionDoctorale.EN_ATTENTE_DE_SIGNATURE, statut(EN_ATTENTE_SIGNATURE));
    }

    @Test
    void ca_member_refusing_leaves_the_group() {
      BUS.invoke(refus(MEMBRE_CA_INVITE, "Indisponible"));

      assertTrue(groupe(EN_ATTENTE_SIGNATURE).membresCA().isEmpty());
      assertEquals(
          ChoixStatutPropositionDoctorale.EN_ATTENTE_DE_SIGNATURE, statut(EN_ATTENTE_SIGNATURE));
    }
  }
}
