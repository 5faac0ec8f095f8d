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

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.repository.EntityIdentity;
import be.uclouvain.osis.admission.ddd.repository.Repository;
import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import java.util.Optional;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>GIVEN: load the aggregate through its {@link Repository}.
 *   <li>WHEN: call the aggregate business method, which validates and raises on failure.
 *   <li>THEN: save the aggregate.
 *   <li><b>Optional</b>: emit a {@link DomainEvent} once the aggregate has been saved.
 * </ul>
 *
 * <p>Business exceptions are never caught here: they propagate to the {@link MessageBus} caller
 * and the command simply does not apply.
 *
 * <p>Because {@link DomainCommand} leverages Java {@code sealed} feature, for more type safety this
 * class also makes use of the same feature.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever parameters are expected to be provided by consumer
 * must be checked with the help of {@link NullGuards} methods.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <OUTPUT> the output of the given command, typically the identity of the aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<OUTPUT>,
  OUTPUT
>
extends
        DomainHandler<COMMAND>
permits
  DomainCommandHandler.Create,
  DomainCommandHandler.Update,
  DomainCommandHandler.Delete,
  DomainCommandHandler.Process
{
// @formatter:on
  private static final String MISSING_COMMAND_HANDLER_OPTIONAL_SUCCESSFUL_EVENT =
      "Command handler Optional successful event";

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    super(commandClass, "Command class");
  }

  /**
   * Returns the class type of the command being handled by this {@link DomainCommandHandler}.
   *
   * @return the class type of the command
   */
  public final Class<COMMAND> getCommandClass() {
    return getOperationClass();
  }

  /**
   * Executes the core logic of the command.
   *
   * @param command being executed
   * @param domainEventPublisher for publishing events once the state has been saved
   * @return the result of the command execution
   */
  protected abstract OUTPUT internalRunContract(
      final COMMAND command, final DomainEventPublisher domainEventPublisher);

  /**
   * Executes the given command.
   *
   * <p>This method is package-private as it is intended to be invoked by {@link MessageBus} only.
   *
   * @param command to be executed
   * @param domainEventPublisher for publishing events
   * @return the result of the command execution
   * @throws IllegalArgumentException if the command is null
   * @throws IllegalStateException if any internal state is invalid (typically null)
   */
  final OUTPUT runInContext(
      final COMMAND command, final DomainEventPublisher domainEventPublisher) {
    final COMMAND nonNullCommand = requireArgument(command, "Command");
    final DomainEventPublisher nonNullDomainEventPublisher =
        requireResult(domainEventPublisher, "Event publisher");

    return internalRunContract(nonNullCommand, nonNullDomainEventPublisher);
  }

  /**
   * Publishes the event returned by one of the {@code onSuccess} hooks.
   *
   * @param optionalEvent returned by the hook
   * @param domainEventPublisher to publish with
   */
  final void publishIfPresent(
      final Optional<DomainEvent> optionalEvent, final DomainEventPublisher domainEventPublisher) {
    requireResult(optionalEvent, MISSING_COMMAND_HANDLER_OPTIONAL_SUCCESSFUL_EVENT)
        .ifPresent(domainEventPublisher::publish);
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   * @param <ID> the identity of the created aggregate
   * @param <ENTITY> the created aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<ID>,
    ID extends EntityIdentity,
    ENTITY extends RootEntity<ID>
  > extends DomainCommandHandler<CREATE, ID> {
  // @formatter:on
    private final Repository<ID, ENTITY> repository;

    protected Create(final Class<CREATE> commandClass, final Repository<ID, ENTITY> repository) {
      super(commandClass);
      this.repository = requireArgument(repository, "Repository");
    }

    /**
     * Business logic building the new aggregate, validators included.
     *
     * @param command containing the data required to create the aggregate
     * @return the new aggregate, not saved yet
     */
    protected abstract ENTITY create(final CREATE command);

    /**
     * Hook invoked once the aggregate has been saved.
     *
     * @param command which was executed
     * @param entity which was saved
     * @return an {@link Optional} {@link DomainEvent} to publish
     */
    protected Optional<DomainEvent> onSuccess(final CREATE command, final ENTITY entity) {
      return Optional.empty();
    }

    /** {@inheritDoc} */
    @Override
    protected final ID internalRunContract(
        final CREATE command, final DomainEventPublisher domainEventPublisher) {
      final ENTITY entity = requireResult(create(command), "New entity");
      repository.save(entity);
      publishIfPresent(onSuccess(command, entity), domainEventPublisher);
      return entity.getEntityId();
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Update}.
   *
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <ID> the identity of the updated aggregate
   * @param <ENTITY> the updated aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update<ID>,
    ID extends EntityIdentity,
    ENTITY extends RootEntity<ID>
  > extends DomainCommandHandler<UPDATE, ID> {
  // @formatter:on
    private final Repository<ID, ENTITY> repository;

    protected Update(final Class<UPDATE> commandClass, final Repository<ID, ENTITY> repository) {
      super(commandClass);
      this.repository = requireArgument(repository, "Repository");
    }

    /**
     * @param command being executed
     * @return identity of the aggregate to load
     */
    protected abstract ID identify(final UPDATE command);

    /**
     * Business logic changing the aggregate. Validation failures must be raised before any field
     * is modified.
     *
     * @param command containing the data required to update the aggregate
     * @param entity loaded from the repository
     */
    protected abstract void update(final UPDATE command, final ENTITY entity);

    /**
     * Hook invoked once the aggregate has been saved.
     *
     * @param command which was executed
     * @param entity which was saved
     * @return an {@link Optional} {@link DomainEvent} to publish
     */
    protected Optional<DomainEvent> onSuccess(final UPDATE command, final ENTITY entity) {
      return Optional.empty();
    }

    /** {@inheritDoc} */
    @Override
    protected final ID internalRunContract(
        final UPDATE command, final DomainEventPublisher domainEventPublisher) {
      final ID entityId = requireResult(identify(command), "Entity identity");
      final ENTITY entity = repository.get(entityId);
      update(command, entity);
      repository.save(entity);
      publishIfPresent(onSuccess(command, entity), domainEventPublisher);
      return entity.getEntityId();
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Delete}.
   *
   * @param <DELETE> the type of the particular {@link DomainCommand.Delete}
   * @param <ID> the identity of the deleted aggregate
   * @param <ENTITY> the deleted aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Delete<
    DELETE extends DomainCommand.Delete<ID>,
    ID extends EntityIdentity,
    ENTITY extends RootEntity<ID>
  > extends DomainCommandHandler<DELETE, ID> {
  // @formatter:on
    private final Repository<ID, ENTITY> repository;

    protected Delete(final Class<DELETE> commandClass, final Repository<ID, ENTITY> repository) {
      super(commandClass);
      this.repository = requireArgument(repository, "Repository");
    }

    /**
     * @param command being executed
     * @return identity of the aggregate to delete
     */
    protected abstract ID identify(final DELETE command);

    /**
     * Business logic to run before the aggregate is deleted, typically validation.
     *
     * @param command containing the data required to delete the aggregate
     * @param entity to be deleted
     */
    protected void beforeDelete(final DELETE command, final ENTITY entity) {
      // No action by default
    }

    /**
     * Hook invoked once the aggregate has been deleted.
     *
     * @param command which was executed
     * @param entity which was deleted
     * @return an {@link Optional} {@link DomainEvent} to publish
     */
    protected Optional<DomainEvent> onSuccess(final DELETE command, final ENTITY entity) {
      return Optional.empty();
    }

    /** {@inheritDoc} */
    @Override
    protected final ID internalRunContract(
        final DELETE command, final DomainEventPublisher domainEventPublisher) {
      final ID entityId = requireResult(identify(command), "Entity identity");
      final ENTITY entity = repository.get(entityId);
      beforeDelete(command, entity);
      repository.delete(entityId);
      publishIfPresent(onSuccess(command, entity), domainEventPublisher);
      return entityId;
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Process}.
   *
   * <p>Implementations orchestrate several repositories themselves and stay responsible for saving
   * before publishing.
   *
   * @param <PROCESS> the type of the particular {@link DomainCommand.Process}
   * @param <OUTPUT> the result of the process
   */
  // @formatter:off
  public abstract static non-sealed class Process<
    PROCESS extends DomainCommand.Process<OUTPUT>,
    OUTPUT
  > extends DomainCommandHandler<PROCESS, OUTPUT> {
  // @formatter:on
    protected Process(final Class<PROCESS> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic of the process.
     *
     * @param command being executed
     * @param domainEventPublisher to publish events with, after saving
     * @return the result of the process
     */
    protected abstract OUTPUT process(
        final PROCESS command, final DomainEventPublisher domainEventPublisher);

    /** {@inheritDoc} */
    @Override
    protected final OUTPUT internalRunContract(
        final PROCESS command, final DomainEventPublisher domainEventPublisher) {
      return requireResult(process(command, domainEventPublisher), "Process result");
    }
  }
}
