package be.uclouvain.osis.admission.ddd.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TwoStepsValidatorListTest {
  static final class RegleException extends BusinessException {
    RegleException(final String message) {
      super(message);
    }
  }

  static final class Validateurs extends TwoStepsValidatorList {
    private final List<DataContractValidator> contrats;
    private final List<InvariantValidator> invariants;

    Validateurs(
        final List<DataContractValidator> contrats, final List<InvariantValidator> invariants) {
      this.contrats = contrats;
      this.invariants = invariants;
    }

    @Override
    protected List<DataContractValidator> getDataContractValidators() {
      return contrats;
    }

    @Override
    protected List<InvariantValidator> getInvariantValidators() {
      return invariants;
    }
  }

  static DataContractValidator contratEnEchec(final String message) {
    return () -> {
      throw new RegleException(message);
    };
  }

  static InvariantValidator invariantEnEchec(final String message) {
    return () -> {
      throw new RegleException(message);
    };
  }

  @Test
  void no_violation_is_valid() {
    final var result = new Validateurs(List.of(() -> {}), List.of(() -> {})).evaluate();

    assertTrue(result.isValid());
    assertSame(ValidationResult.valid(), result);
  }

  @Test
  void first_data_contract_violation_is_thrown_alone_and_invariants_are_skipped() {
    final List<String> evaluated = new ArrayList<>();
    final var validateurs =
        new Validateurs(
            List.of(contratEnEchec("format"), contratEnEchec("autre format")),
            List.of(() -> evaluated.add("invariant")));

    final var exception = assertThrows(RegleException.class, validateurs::validate);

    assertEquals("format", exception.getMessage());
    assertTrue(evaluated.isEmpty());
  }

  @Test
  void invariant_violations_are_all_collected() {
    final var validateurs =
        new Validateurs(
            List.of(),
            List.of(invariantEnEchec("premier"), () -> {}, invariantEnEchec("second")));

    final var exception = assertThrows(MultipleBusinessExceptions.class, validateurs::validate);

    assertEquals(2, exception.getExceptions().size());
    assertEquals("premier | second", exception.getMessage());
    assertTrue(exception.contains(RegleException.class));
    assertEquals(400, exception.getStatusCode());
  }

  @Test
  void results_are_combined() {
    final var premier = new Validateurs(List.of(), List.of(invariantEnEchec("a"))).evaluate();
    final var second = new Validateurs(List.of(contratEnEchec("b")), List.of()).evaluate();

    final var combined =
        ValidationResult.combine(List.of(premier, ValidationResult.valid(), second));

    assertInstanceOf(ValidationResult.InvariantViolations.class, combined);
    assertEquals(2, combined.errors().size());
  }

  @Test
  void multiple_business_exceptions_require_at_least_one_exception() {
    assertThrows(IllegalArgumentException.class, () -> new MultipleBusinessExceptions(List.of()));
  }
}
