package be.uclouvain.osis.admission.domain.validator;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.validation.BusinessException;
import be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions;
import be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.ConfigurationStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.digit.PersonMergeStatus;
import be.uclouvain.osis.admission.domain.service.MergeProposalDTO;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TransitionStatutValidatorListTest {
  enum Statut {
    BROUILLON,
    CONFIRMEE,
    VALIDEE
  }

  static final class TransitionInterditeException extends BusinessException {
    TransitionInterditeException() {
      super("Transition interdite");
    }
  }

  static final class OngletTermineException extends BusinessException {
    OngletTermineException() {
      super("Onglet termine");
    }
  }

  static final ConfigurationStatutChecklist REFUSE =
      new ConfigurationStatutChecklist(
          "REFUSE", ChoixStatutChecklist.GEST_BLOCAGE, Map.of("blocage", "refusal"));

  @Nested
  class Configurations {
    @Test
    void extra_of_the_configuration_must_be_a_subset_of_the_actual_extra() {
      final var actuel =
          StatutChecklist.of(
              "decision",
              ChoixStatutChecklist.GEST_BLOCAGE,
              Map.of("blocage", "refusal", "motif", "places"));

      assertTrue(REFUSE.matches(actuel));
      assertFalse(REFUSE.matches(actuel.avecExtra("blocage", "closed")));
      assertFalse(REFUSE.matches(actuel.avecStatut(ChoixStatutChecklist.GEST_EN_COURS, Map.of())));
      assertFalse(REFUSE.matches(null));
    }

    @Test
    void tab_without_status_matches_nothing() {
      final var vide = StatutChecklist.of("decision", null);
      final var sansStatut = new ConfigurationStatutChecklist("VIDE", null);

      assertFalse(sansStatut.matches(vide));
      assertFalse(REFUSE.matches(vide));
    }

    @Test
    void children_are_replaced_by_identifier() {
      final var parent = StatutChecklist.of("parcours", ChoixStatutChecklist.INITIAL_CANDIDAT);
      final var enfant =
          StatutChecklist.of(
              "experience",
              ChoixStatutChecklist.GEST_EN_COURS,
              Map.of(StatutChecklist.IDENTIFIANT, "exp-1"));

      final var modifie =
          parent
              .avecEnfant(enfant)
              .avecEnfant(enfant.avecStatut(ChoixStatutChecklist.GEST_REUSSITE, enfant.extra()));

      assertEquals(1, modifie.enfants().size());
      assertEquals(
          ChoixStatutChecklist.GEST_REUSSITE, modifie.enfant("exp-1").orElseThrow().statut());
      assertThrows(
          IllegalArgumentException.class,
          () -> parent.avecEnfant(StatutChecklist.of("experience", null)));
    }
  }

  @Test
  void allowed_transition_is_valid() {
    final var validators =
        new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                Statut.CONFIRMEE, Set.of(Statut.CONFIRMEE), TransitionInterditeException::new),
            new ShouldPasEtreEnQuarantaine(Optional.empty()));

    assertDoesNotThrow(validators::validate);
  }

  @Test
  void every_violation_is_reported_even_when_there_is_only_one() {
    final var validators =
        new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                Statut.BROUILLON, Set.of(Statut.CONFIRMEE), TransitionInterditeException::new));

    final var exception = assertThrows(MultipleBusinessExceptions.class, validators::validate);

    assertEquals(1, exception.getExceptions().size());
    assertTrue(exception.contains(TransitionInterditeException.class));
  }

  @Test
  void violations_are_reported_in_declaration_order() {
    final var decision =
        StatutChecklist.of(
            "decision", ChoixStatutChecklist.GEST_BLOCAGE, Map.of("blocage", "refusal"));
    final var validators =
        new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                Statut.VALIDEE, Set.of(Statut.CONFIRMEE), TransitionInterditeException::new),
            new ShouldStatutChecklistNePasCorrespondre(
                decision, List.of(REFUSE), OngletTermineException::new),
            new ShouldStatutChecklistCorrespondre(
                decision, List.of(REFUSE), TransitionInterditeException::new),
            new ShouldPasEtreEnQuarantaine(
                Optional.of(new MergeProposalDTO(PersonMergeStatus.ERROR, Map.of()))));

    final var exception = assertThrows(MultipleBusinessExceptions.class, validators::validate);

    assertEquals(
        List.of(
            TransitionInterditeException.class,
            OngletTermineException.class,
            EnQuarantaineException.class),
        exception.getExceptions().stream().map(Object::getClass).toList());
  }

  @Test
  void invalid_registry_report_means_quarantine() {
    final var invalide = new MergeProposalDTO(PersonMergeStatus.MERGED, Map.of("valid", false));
    final var valide = new MergeProposalDTO(PersonMergeStatus.NO_MATCH, Map.of("valid", true));

    assertThrows(
        EnQuarantaineException.class,
        () -> new ShouldPasEtreEnQuarantaine(Optional.of(invalide)).validate());
    assertDoesNotThrow(() -> new ShouldPasEtreEnQuarantaine(Optional.of(valide)).validate());
  }
}
