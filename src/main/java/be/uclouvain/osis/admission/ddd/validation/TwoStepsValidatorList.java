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
import java.util.List;

/**
 * Ordered aggregation of validators evaluated in two phases:
 *
 * <ol>
 *   <li>{@link DataContractValidator}s - the first failure stops the evaluation and is reported
 *       alone.
 *   <li>{@link InvariantValidator}s - evaluated only if the first phase passed, every failure is
 *       collected.
 * </ol>
 *
 * <p>Aggregate business methods build the list matching the action they perform and call {@link
 * #validate()} before mutating their state.
 */
public abstract class TwoStepsValidatorList {
  /**
   * @return structural checks, none by default
   */
  protected List<DataContractValidator> getDataContractValidators() {
    return List.of();
  }

  /**
   * @return business rule checks
   */
  protected abstract List<InvariantValidator> getInvariantValidators();

  /**
   * Runs both phases without throwing.
   *
   * @return the outcome of the evaluation
   */
  public final ValidationResult evaluate() {
    for (DataContractValidator validator : getDataContractValidators()) {
      try {
        validator.validate();
      } catch (BusinessException e) {
        return new ValidationResult.DataContractViolation(e);
      }
    }

    final List<BusinessException> violations = new ArrayList<>();
    for (InvariantValidator validator : getInvariantValidators()) {
      try {
        validator.validate();
      } catch (BusinessException e) {
        violations.add(e);
      }
    }

    return violations.isEmpty()
        ? ValidationResult.valid()
        : new ValidationResult.InvariantViolations(violations);
  }

  /**
   * @throws BusinessException raised by the first failing data contract validator
   * @throws MultipleBusinessExceptions if one or more invariants failed
   */
  public final void validate() {
    evaluate().throwIfInvalid();
  }
}
