/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package be.uclouvain.osis.admission.ddd.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Outcome of a {@link TwoStepsValidatorList} evaluation.
 *
 * <p>Evaluation itself never throws: the result is turned into an exception only by {@link
 * #throwIfInvalid()}, at the boundary where the aggregate refuses to change.
 */
public sealed interface ValidationResult {
  /**
   * @return the shared successful result
   */
  static ValidationResult valid() {
    return Valid.INSTANCE;
  }

  /**
   * Merges several results into one, keeping every violation. A data contract violation of one
   * result is reported next to the invariant violations of the others.
   *
   * @param results to merge
   * @return {@link #valid()} if every result is valid, otherwise {@link InvariantViolations}
   */
  static ValidationResult combine(final Collection<ValidationResult> results) {
    final List<BusinessException> errors = new ArrayList<>();
    for (ValidationResult result : results) {
      errors.addAll(result.errors());
    }

    return errors.isEmpty() ? valid() : new InvariantViolations(errors);
  }

  /**
   * @return raised exceptions, empty when valid
   */
  List<BusinessException> errors();

  /**
   * @return {@code true} when no validator failed
   */
  default boolean isValid() {
    return errors().isEmpty();
  }

  /**
   * @throws BusinessException for a data contract violation
   * @throws MultipleBusinessExceptions for invariant violations
   */
  void throwIfInvalid();

  /** Every validator passed. */
  final class Valid implements ValidationResult {
    private static final Valid INSTANCE = new Valid();

    private Valid() {
      // Use ValidationResult.valid()
    }

    @Override
    public List<BusinessException> errors() {
      return List.of();
    }

    @Override
    public void throwIfInvalid() {
      // Nothing to report
    }
  }

  /**
   * A structural check failed, invariants were not evaluated.
   *
   * @param cause of the failure
   */
  record DataContractViolation(BusinessException cause) implements ValidationResult {
    @Override
    public List<BusinessException> errors() {
      return List.of(cause);
    }

    @Override
    public void throwIfInvalid() {
      throw cause;
    }
  }

  /**
   * One or more business rules failed.
   *
   * @param exceptions raised by invariants, in declaration order
   */
  record InvariantViolations(List<BusinessException> exceptions) implements ValidationResult {
    public InvariantViolations {
      exceptions = List.copyOf(exceptions);
    }

    @Override
    public List<BusinessException> errors() {
      return exceptions;
    }

    @Override
    public void throwIfInvalid() {
      throw new MultipleBusinessExceptions(exceptions);
    }
  }
}
