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

import java.io.Serial;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregates every {@link BusinessException} raised by the invariants phase of a {@link
 * TwoStepsValidatorList}, so that all violations can be reported in one round-trip.
 *
 * <p>Callers must inspect {@link #getExceptions()} rather than assume a single cause.
 */
public class MultipleBusinessExceptions extends RuntimeException {
  @Serial private static final long serialVersionUID = 2203620164183934406L;

  @SuppressWarnings("squid:S1948")
  private final List<BusinessException> exceptions;

  /**
   * @param exceptions which were raised, must not be empty
   * @throws IllegalArgumentException if the list is {@code null} or empty
   */
  public MultipleBusinessExceptions(List<BusinessException> exceptions) {
    super(describe(exceptions));
    this.exceptions = List.copyOf(exceptions);
  }

  private static String describe(List<BusinessException> exceptions) {
    if (exceptions == null || exceptions.isEmpty()) {
      throw new IllegalArgumentException("Business exceptions cannot be empty");
    }

    return exceptions.stream().map(Throwable::getMessage).collect(Collectors.joining(" | "));
  }

  /**
   * @return raised exceptions in the order validators were declared
   */
  public List<BusinessException> getExceptions() {
    return exceptions;
  }

  /**
   * @param exceptionClass to look for
   * @return {@code true} if one of the wrapped exceptions is an instance of the given class
   */
  public boolean contains(Class<? extends BusinessException> exceptionClass) {
    return exceptions.stream().anyMatch(exceptionClass::isInstance);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 400;
  }
}
