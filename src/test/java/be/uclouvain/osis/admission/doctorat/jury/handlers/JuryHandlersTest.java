package be.uclouvain.osis.admission.doctorat.jury.handlers;

import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.CO_PROMOTEUR_INVITE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.MEMBRE_CA_INVITE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository.PROMOTEUR_INVITE;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryJuryRepository.JURY;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryJuryRepository.MATRICULE_PROMOTEUR;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryJuryRepository.PRESIDENT;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryJuryRepository.PROMOTEUR;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.BROUILLON;
import static be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository.EN_ATTENTE_SIGNATURE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.doctorat.jury.commands.AjouterMembreCommand;
import be.uclouvain.osis.admission.doctorat.jury.commands.InitialiserJuryCommand;
import be.uclouvain.osis.admission.doctorat.jury.commands.ModifierMembreCommand;
import be.uclouvain.osis.admission.doctorat.jury.commands.ModifierRoleMembreCommand;
import be.uclouvain.osis.admission.doctorat.jury.commands.RecupererJuryQuery;
import be.uclouvain.osis.admission.doctorat.jury.commands.RetirerMembreCommand;
import be.uclouvain.osis.admission.doctorat.jury.model.GenreMembre;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryNonTrouveException;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import be.uclouvain.osis.admission.doctorat.jury.model.RoleJury;
import be.uclouvain.osis.admission.doctorat.jury.model.TitreMembre;
import be.uclouvain.osis.admission.doctorat.jury.validator.JuryDejaInitialiseException;
import be.uclouvain.osis.admission.doctorat.jury.validator.MembreDejaDansJuryException;
import be.uclouvain.osis.admission.doctorat.jury.validator.MembreExterneSansEmailException;
import be.uclouvain.osis.admission.doctorat.jury.validator.MembreExterneSansNomException;
import be.uclouvain.osis.admission.doctorat.jury.validator.MembreExterneSansPrenomException;
import be.uclouvain.osis.admission.doctorat.jury.validator.MembreNonTrouveDansJuryException;
import be.uclouvain.osis.admission.doctorat.jury.validator.NonDocteurSansJustificationException;
import be.uclouvain.osis.admission.doctorat.jury.validator.PromoteurModifieException;
import be.uclouvain.osis.admission.doctorat.jury.validator.PromoteurPresidentException;
import be.uclouvain.osis.admission.doctorat.jury.validator.PromoteurRetireException;
import be.uclouvain.osis.admission.doctorat.supervision.commands.ApprouverPropositionCommand;
import be.uclouvain.osis.admission.doctorat.supervision.validator.ProcedureDemandeSignatureNonLanceeException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.PropositionNonApprouveeParMembresCAException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.PropositionNonApprouveeParPromoteurException;
import be.uclouvain.osis.admission.infrastructure.AdmissionMessageBusFactory;
import be.uclouvain.osis.admission.infrastructure.InMemoryAdmission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JuryHandlersTest {
  static final InMemoryAdmission ADMISSION = AdmissionMessageBusFactory.inMemory();
  static final MessageBus BUS = ADMISSION.messageBus();

  @BeforeEach
  void setUp() {
    ADMISSION.reset();
  }

  static AjouterMembreCommand externe(final String nom, final String prenom, final String email) {
    return new AjouterMembreCommand(
        JURY,
        null,
        null,
        "Université de Namur",
        "BE",
        nom,
        prenom,
        TitreMembre.DOCTEUR,
        null,
        GenreMembre.FEMININ,
        email);
  }

  static AjouterMembreCommand interne(final String matricule, final TitreMembre titre) {
    return new AjouterMembreCommand(
        JURY, matricule, null, null, null, null, null, titre, null, null, null);
  }

  static MembreJury membre(final String uuid) {
    return BUS.invoke(new RecupererJuryQuery(JURY)).membres().stream()
        .filter(membre -> membre.uuid().equals(uuid))
        .findFirst()
        .orElseThrow();
  }

  @Nested
  class Ajouter {
    @Test
    void new_member_joins_the_jury_as_plain_member() {
      final var uuid = BUS.invoke(externe("Dupont", "Marie", "marie.dupont@unamur.be"));

      final var jury = BUS.invoke(new RecupererJuryQuery(JURY));
      assertEquals(3, jury.membres().size());
      assertEquals(RoleJury.MEMBRE, membre(uuid).role());
      assertFalse(membre(uuid).estPromoteur());
    }

    @Test
    void every_missing_field_of_an_external_member_is_reported() {
      final var command = externe(null, " ", null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));

      assertEquals(3, exception.getExceptions().size());
      assertTrue(exception.contains(MembreExterneSansNomException.class));
      assertTrue(exception.contains(MembreExterneSansPrenomException.class));
      assertTrue(exception.contains(MembreExterneSansEmailException.class));
      assertEquals(2, BUS.invoke(new RecupererJuryQuery(JURY)).membres().size());
    }

    @Test
    void internal_member_only_needs_a_registration_number() {
      final var uuid = BUS.invoke(interne("00555555", TitreMembre.PROFESSEUR));

      assertEquals("00555555", membre(uuid).matricule());
    }

    @Test
    void same_internal_member_cannot_join_twice() {
      final var command = interne(MATRICULE_PROMOTEUR, TitreMembre.PROFESSEUR);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(MembreDejaDansJuryException.class));
    }

    @Test
    void non_doctor_member_requires_a_justification() {
      final var command = interne("00555555", TitreMembre.NON_DOCTEUR);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(NonDocteurSansJustificationException.class));
    }

    @Test
    void unknown_jury_is_reported() {
      final var command =
          new AjouterMembreCommand(
              "uuid-inconnu", "00555555", null, null, null, null, null, null, null, null, null);

      assertThrows(JuryNonTrouveException.class, () -> BUS.invoke(command));
    }
  }

  @Nested
  class Modifier {
    @Test
    void member_information_is_replaced_but_role_is_kept() {
      BUS.invoke(
          new ModifierMembreCommand(
              JURY,
              PRESIDENT,
              "00987891",
              null,
              null,
              null,
              null,
              null,
              TitreMembre.DOCTEUR,
              null,
              null,
              null));

      final var president = membre(PRESIDENT);
      assertEquals("00987891", president.matricule());
      assertEquals(TitreMembre.DOCTEUR, president.titre());
      assertEquals(RoleJury.PRESIDENT, president.role());
    }

    @Test
    void promoter_cannot_be_modified() {
      final var command =
          new ModifierMembreCommand(
              JURY,
              PROMOTEUR,
              MATRICULE_PROMOTEUR,
              null,
              null,
              null,
              null,
              null,
              TitreMembre.PROFESSEUR,
              null,
              null,
              null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(PromoteurModifieException.class));
    }

    @Test
    void unknown_member_is_reported() {
      final var command = new ModifierRoleMembreCommand(JURY, "uuid-inconnu", RoleJury.SECRETAIRE);

      assertThrows(MembreNonTrouveDansJuryException.class, () -> BUS.invoke(command));
    }
  }

  @Nested
  class Roles {
    @Test
    void promoter_cannot_preside_the_jury() {
      final var command = new ModifierRoleMembreCommand(JURY, PROMOTEUR, RoleJury.PRESIDENT);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(PromoteurPresidentException.class));
    }

    @Test
    void promoter_can_be_secretary() {
      BUS.invoke(new ModifierRoleMembreCommand(JURY, PROMOTEUR, RoleJury.SECRETAIRE));

      assertEquals(RoleJury.SECRETAIRE, membre(PROMOTEUR).role());
    }

    @Test
    void new_president_demotes_the_previous_one() {
      final var uuid = BUS.invoke(interne("00555555", TitreMembre.PROFESSEUR));

      BUS.invoke(new ModifierRoleMembreCommand(JURY, uuid, RoleJury.PRESIDENT));

      assertEquals(RoleJury.PRESIDENT, membre(uuid).role());
      assertEquals(RoleJury.MEMBRE, membre(PRESIDENT).role());
      assertEquals(3, BUS.invoke(new RecupererJuryQuery(JURY)).membres().size());
    }
  }

  @Nested
  class Retirer {
    @Test
    void member_leaves_the_jury() {
      BUS.invoke(new RetirerMembreCommand(JURY, PRESIDENT));

      final var membres = BUS.invoke(new RecupererJuryQuery(JURY)).membres();
      assertEquals(1, membres.size());
      assertEquals(PROMOTEUR, membres.get(0).uuid());
    }

    @Test
    void promoter_cannot_leave_the_jury() {
      final var command = new RetirerMembreCommand(JURY, PROMOTEUR);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(PromoteurRetireException.class));
    }
  }

  @Nested
  class Initialisation {
    void approuver(final String uuidMembre, final String institut) {
      BUS.invoke(
          new ApprouverPropositionCommand(EN_ATTENTE_SIGNATURE, uuidMembre, null, null, institut));
    }

    @Test
    void approved_promoters_are_seeded_as_promoters() {
      approuver(PROMOTEUR_INVITE, "uuid-institut-cardiologie");
      approuver(CO_PROMOTEUR_INVITE, null);
      approuver(MEMBRE_CA_INVITE, null);

      BUS.invoke(new InitialiserJuryCommand(EN_ATTENTE_SIGNATURE));

      final var membres = BUS.invoke(new RecupererJuryQuery(EN_ATTENTE_SIGNATURE)).membres();
      assertEquals(2, membres.size());
      assertTrue(membres.stream().allMatch(MembreJury::estPromoteur));
      assertTrue(membres.stream().allMatch(membre -> membre.role() == RoleJury.MEMBRE));

      final var command = new RetirerMembreCommand(EN_ATTENTE_SIGNATURE, PROMOTEUR_INVITE);
      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(PromoteurRetireException.class));
    }

    @Test
    void jury_waits_for_every_signature() {
      approuver(PROMOTEUR_INVITE, "uuid-institut-cardiologie");
      final var command = new InitialiserJuryCommand(EN_ATTENTE_SIGNATURE);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertEquals(2, exception.getExceptions().size());
      assertTrue(exception.contains(PropositionNonApprouveeParPromoteurException.class));
      assertTrue(exception.contains(PropositionNonApprouveeParMembresCAException.class));
      assertThrows(
          JuryNonTrouveException.class,
          () -> BUS.invoke(new RecupererJuryQuery(EN_ATTENTE_SIGNATURE)));
    }

    @Test
    void draft_without_signature_request_has_no_jury() {
      final var command = new InitialiserJuryCommand(BROUILLON);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> BUS.invoke(command));
      assertTrue(exception.contains(ProcedureDemandeSignatureNonLanceeException.class));
    }

    @Test
    void jury_is_initialised_once() {
      final var command = new InitialiserJuryCommand(JURY);

      assertThrows(JuryDejaInitialiseException.class, () -> BUS.invoke(command));
      assertEquals(2, BUS.invoke(new RecupererJuryQuery(JURY)).membres().size());
    }
  }
}
