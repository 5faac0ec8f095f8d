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
 * Represents an immutable command which must update the underlying model as per CQRS paradigm.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>In terms of 'read-write' {@link DomainCommand} is a 'write' representation, whereas {@link
 * DomainQuery} is its 'read' counterpart.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Refuse proposition' instead of 'Set
 * proposition status to INSCRIPTION_REFUSEE'.
 *
 * <p>Construction of a command never fails: validation happens inside the handler through the
 * validator lists of the aggregate.
 *
 * <p>To bridge the gap in understanding between CRUD and CQRS, we leverage Java {@code sealed}
 * feature, enforcing users to use one of the specific intents rather than defining a command
 * completely on their own.
 *
 * @param <OUTPUT> is the type of the value returned once the command has been handled
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public sealed interface DomainCommand<OUTPUT> extends DomainMessage
permits
  DomainCommand.Create,
  DomainCommand.Update,
  DomainCommand.Delete,
  DomainCommand.Process
{
// @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to create a new
   * aggregate in the system.
   *
   * @param <OUTPUT> is the type of the identity of the created aggregate
   */
  @SuppressWarnings("squid:S119")
  non-sealed interface Create<OUTPUT> extends DomainCommand<OUTPUT> {}

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to change the
   * state of an existing aggregate in the system.
   *
   * @param <OUTPUT> is the type of the identity of the updated aggregate
   */
  @SuppressWarnings("squid:S119")
  non-sealed interface Update<OUTPUT> extends DomainCommand<OUTPUT> {}

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to delete an
   * existing aggregate in the system.
   *
   * @param <OUTPUT> is the type of the identity of the deleted aggregate
   */
  @SuppressWarnings("squid:S119")
  non-sealed interface Delete<OUTPUT> extends DomainCommand<OUTPUT> {}

  /**
   * Marker interface, denoting that the command is supposed to represent a process touching
   * several aggregates at once, or a critical section which must be guarded by the repository
   * itself.
   *
   * @param <OUTPUT> is the type of the process result
   */
  @SuppressWarnings("squid:S119")
  non-sealed interface Process<OUTPUT> extends DomainCommand<OUTPUT> {}
}
