package be.uclouvain.osis.admission.infrastructure.jooq;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.jooq.PayloadMapper;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmation;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryNonTrouveException;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import be.uclouvain.osis.admission.doctorat.jury.model.TitreMembre;
import be.uclouvain.osis.admission.doctorat.supervision.model.ChoixEtatSignature;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionIdentity;
import be.uclouvain.osis.admission.domain.service.EntreeHistorique;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleIdentity;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryEpreuveConfirmationRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryJuryRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionGeneraleRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import java.util.List;
import org.h2.jdbcx.JdbcDataSource;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqRepositoriesTest {
  static final DSLContext DSL_CONTEXT;
  static final ObjectMapper OBJECT_MAPPER = PayloadMapper.create();
  static final List<String> TABLES =
      List.of(
          "doctorat_groupe_supervision",
          "doctorat_jury",
          "epreuve_confirmation",
          "generale_proposition",
          "historique",
          "person_merge_proposal");

  static {
    final var dataSource = new JdbcDataSource();
    dataSource.setURL(
        "jdbc:h2:mem:repositories;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;"
            + "DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1");
    DSL_CONTEXT = DSL.using(dataSource, SQLDialect.POSTGRES);
    AdmissionSchema.create(DSL_CONTEXT);
  }

  @BeforeEach
  void setUp() {
    TABLES.forEach(table -> DSL_CONTEXT.truncate(DSL.table(DSL.name(table))).execute());
  }

  @Nested
  class Jury {
    final JooqJuryRepository repository = new JooqJuryRepository(DSL_CONTEXT, OBJECT_MAPPER);
    final JuryIdentity identite = new JuryIdentity(InMemoryJuryRepository.JURY);

    @Test
    void stored_jury_is_read_back_equal() {
      final var jury = new InMemoryJuryRepository().get(identite);

      repository.save(jury);
      final var relu = repository.get(identite);

      assertNotSame(jury, relu);
      assertEquals(jury.getMembres(), relu.getMembres());
    }

    @Test
    void second_save_updates_the_row() {
      final var jury = new InMemoryJuryRepository().get(identite);
      repository.save(jury);

      jury.ajouterMembre(
          new MembreJury(
              null,
              null,
              false,
              "00555555",
              null,
              null,
              null,
              null,
              null,
              TitreMembre.PROFESSEUR,
              null,
              null,
              null));
      repository.save(jury);

      assertEquals(3, repository.get(identite).getMembres().size());
      assertEquals(1, repository.search(List.of()).size());
    }

    @Test
    void deleted_jury_is_not_found() {
      repository.save(new InMemoryJuryRepository().get(identite));

      repository.delete(identite);

      assertThrows(JuryNonTrouveException.class, () -> repository.get(identite));
    }
  }

  @Test
  void supervision_group_keeps_signatures_and_institute() {
    final var repository = new JooqGroupeDeSupervisionRepository(DSL_CONTEXT, OBJECT_MAPPER);
    final var identite =
        new GroupeDeSupervisionIdentity(InMemoryPropositionRepository.EN_ATTENTE_SIGNATURE);
    final var groupe = new InMemoryGroupeDeSupervisionRepository().get(identite);
    groupe.approuver(
        InMemoryGroupeDeSupervisionRepository.PROMOTEUR_INVITE,
        null,
        "Très bon projet",
        "uuid-institut-cardiologie");

    repository.save(groupe);
    final var relu = repository.get(identite);

    assertNotSame(groupe, relu);
    assertEquals(groupe, relu);
    assertEquals(
        ChoixEtatSignature.APPROVED,
        relu.getSignataire(InMemoryGroupeDeSupervisionRepository.PROMOTEUR_INVITE).etat());
    assertEquals("uuid-institut-cardiologie", relu.getInstitutThese());
  }

  @Test
  void confirmation_attempts_are_searched_by_doctorate_latest_first() {
    final var memoire = new InMemoryEpreuveConfirmationRepository();
    final var repository = new JooqEpreuveConfirmationRepository(DSL_CONTEXT, OBJECT_MAPPER);
    memoire.search(List.of()).forEach(repository::save);

    final var epreuves =
        repository.searchByDoctorat(InMemoryEpreuveConfirmationRepository.DOCTORAT);

    assertEquals(
        List.of(
            new EpreuveConfirmationIdentity(InMemoryEpreuveConfirmationRepository.EPREUVE_EN_COURS),
            new EpreuveConfirmationIdentity(
                InMemoryEpreuveConfirmationRepository.EPREUVE_PASSEE)),
        epreuves.stream().map(EpreuveConfirmation::getEntityId).toList());
    assertEquals(
        memoire.searchByDoctorat(InMemoryEpreuveConfirmationRepository.DOCTORAT), epreuves);
  }

  @Test
  void general_proposition_keeps_checklist_and_refusal_reasons() {
    final var identite =
        new PropositionGeneraleIdentity(
            InMemoryPropositionGeneraleRepository.TRAITEMENT_FAC_AVEC_MOTIFS);
    final var proposition = new InMemoryPropositionGeneraleRepository().get(identite);
    final var repository = new JooqPropositionGeneraleRepository(DSL_CONTEXT, OBJECT_MAPPER);

    repository.save(proposition);

    assertEquals(proposition, repository.get(identite));
  }

  @Test
  void history_entries_are_read_in_creation_order() {
    final var historique = new JooqHistorique(DSL_CONTEXT, OBJECT_MAPPER);
    final var debut = LocalDateTime.of(2024, 5, 2, 9, 30);
    historique.ajouter(
        new EntreeHistorique(
            "uuid-2", "uuid-objet", "00321234", "Second", List.of("b"), debut.plusMinutes(1)));
    historique.ajouter(
        new EntreeHistorique(
            "uuid-1", "uuid-objet", "00321234", "Premier", List.of("a", "status-changed"), debut));
    historique.historiser("uuid-autre", null, "Ailleurs", List.of());

    final var entrees = historique.entrees("uuid-objet");

    assertEquals(
        List.of("Premier", "Second"),
        entrees.stream().map(EntreeHistorique::message).toList());
    assertEquals(List.of("a", "status-changed"), entrees.get(0).tags());
    assertEquals(debut, entrees.get(0).creeLe());
  }

  @Nested
  class ProfilCandidat {
    final JooqProfilCandidatTranslator translator =
        new JooqProfilCandidatTranslator(DSL_CONTEXT, OBJECT_MAPPER);

    void inserer(final String globalId, final String status, final String validation) {
      DSL_CONTEXT
          .insertInto(DigitTables.PERSON_MERGE_PROPOSAL)
          .set(DigitTables.MERGE_GLOBAL_ID, globalId)
          .set(DigitTables.MERGE_STATUS, status)
          .set(DigitTables.MERGE_VALIDATION, validation)
          .execute();
    }

    @Test
    void invalid_registry_report_puts_the_candidate_in_quarantine() {
      inserer("0000000001", "NO_MATCH", "{\"valid\": false}");
      inserer("0000000002", "MERGED", null);

      assertTrue(translator.getMergeProposal("0000000001").orElseThrow().estEnQuarantaine());
      assertFalse(translator.getMergeProposal("0000000002").orElseThrow().estEnQuarantaine());
    }

    @Test
    void candidate_without_proposal_has_none() {
      assertTrue(translator.getMergeProposal("0000000003").isEmpty());
    }
  }
}
