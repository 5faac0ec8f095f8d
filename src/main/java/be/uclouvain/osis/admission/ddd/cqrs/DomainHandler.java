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

package be.uclouvain.osis.admission.ddd.cqrs;

/**
 * Defines some of the common functionalities defined for handlers.
 *
 * @param <OPERATION> supported by the current handler
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
abstract sealed class DomainHandler<OPERATION extends DomainMessage> extends NullGuards
    permits DomainCommandHandler, DomainQueryHandler {
  private final Class<OPERATION> operationClass;

  /**
   * @param operationClass this handler is intended for
   * @param whatIsHandled is used for error reporting
   * @throws IllegalArgumentException if the operation class is null
   */
  DomainHandler(final Class<OPERATION> operationClass, final String whatIsHandled) {
    this.operationClass = requireArgument(operationClass, whatIsHandled);
  }

  /**
   * @return specific {@link DomainMessage} class handled
   */
  final Class<OPERATION> getOperationClass() {
    return operationClass;
  }
}
