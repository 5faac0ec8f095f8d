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
 * Null checks shared by the {@link MessageBus} and the handlers it routes to.
 *
 * <p>Each check maps a missing value to the exception telling who is at fault: the caller for a
 * {@code null} message, the handler for a {@code null} result, the wiring for a message nobody
 * registered.
 */
abstract sealed class NullGuards permits MessageBus, MessageBus.Builder, DomainHandler {
  /**
   * Guards what a caller hands to the bus or to a handler.
   *
   * @param value which must not be {@code null}
   * @param name of the argument, used in the message
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T requireArgument(final T value, final String name) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(name));
    }

    return value;
  }

  /**
   * Guards what a handler hands back: an identity, a new aggregate, a query answer.
   *
   * @param value which must not be {@code null}
   * @param name of the result, used in the message
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T requireResult(final T value, final String name) {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(name));
    }

    return value;
  }

  /**
   * @param value looked up in the bus registry
   * @param name of the missing registration, used in the message
   * @return value if it was registered
   * @throws UnsupportedOperationException when nothing was registered
   */
  protected final <T> T requireRegistered(final T value, final String name) {
    if (value == null) {
      throw new UnsupportedOperationException(
          "%s is not registered on the bus".formatted(name));
    }

    return value;
  }
}
