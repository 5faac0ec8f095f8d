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
import be.uclouvain.osis.admission.ddd.async.TaskQueue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable registry of the handlers of a system, performing synchronous dispatch of {@link
 * DomainCommand}s, {@link DomainQuery}s and {@link DomainEvent}s.
 *
 * <p>A bus is built once at process start through {@link #builder()} and passed by reference to
 * whatever needs to invoke commands. Production and tests build their buses the same way, only
 * the repositories bound into the handlers differ.
 *
 * <p>Event handlers registered with {@link ConsumptionMode#ASYNCHRONOUS} are submitted to the
 * {@link TaskQueue}: their outcome is never observed by the publisher.
 */
public final class MessageBus extends NullGuards implements DomainEventPublisher {
  private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

  private final Map<Class<?>, DomainCommandHandler<?, ?>> commandHandlers;
  private final Map<Class<?>, DomainQueryHandler<?, ?>> queryHandlers;
  private final Map<Class<?>, List<EventRegistration<?>>> eventHandlers;
  private final TaskQueue taskQueue;

  private MessageBus(final Builder builder) {
    this.commandHandlers = Map.copyOf(builder.commandHandlers);
    this.queryHandlers = Map.copyOf(builder.queryHandlers);

    final Map<Class<?>, List<EventRegistration<?>>> registrations = new HashMap<>();
    builder.eventHandlers.forEach(
        (eventClass, list) -> registrations.put(eventClass, List.copyOf(list)));
    this.eventHandlers = Map.copyOf(registrations);

    this.taskQueue = builder.taskQueue;
  }

  /**
   * @return a new builder, using {@link TaskQueue#inline()} unless told otherwise
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return {@link DomainCommand} classes which can be invoked
   */
  public Set<Class<?>> getSupportedCommandClasses() {
    return commandHandlers.keySet();
  }

  /**
   * @return {@link DomainQuery} classes which can be invoked
   */
  public Set<Class<?>> getSupportedQueryClasses() {
    return queryHandlers.keySet();
  }

  /**
   * Runs the handler registered for the runtime type of the command.
   *
   * @param command to run
   * @param <OUTPUT> of the command
   * @return the handler result
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the command type
   */
  @SuppressWarnings("unchecked")
  public <OUTPUT> OUTPUT invoke(final DomainCommand<OUTPUT> command) {
    final DomainCommand<OUTPUT> nonNullCommand = requireArgument(command, "Command");
    final Class<?> commandClass = nonNullCommand.getClass();

    final DomainCommandHandler<DomainCommand<OUTPUT>, OUTPUT> handler =
        (DomainCommandHandler<DomainCommand<OUTPUT>, OUTPUT>)
            requireRegistered(
                commandHandlers.get(commandClass),
                "Handler for '%s' command".formatted(commandClass.getSimpleName()));

    log.debug("Invoking {}", commandClass.getSimpleName());
    return handler.runInContext(nonNullCommand, this);
  }

  /**
   * Runs the handler registered for the runtime type of the query.
   *
   * @param query to run
   * @param <OUTPUT> of the query
   * @return the handler answer
   * @throws IllegalArgumentException if the query is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the query type
   */
  @SuppressWarnings("unchecked")
  public <OUTPUT> OUTPUT invoke(final DomainQuery<OUTPUT> query) {
    final DomainQuery<OUTPUT> nonNullQuery = requireArgument(query, "Query");
    final Class<?> queryClass = nonNullQuery.getClass();

    final DomainQueryHandler<DomainQuery<OUTPUT>, OUTPUT> handler =
        (DomainQueryHandler<DomainQuery<OUTPUT>, OUTPUT>)
            requireRegistered(
                queryHandlers.get(queryClass),
                "Handler for '%s' query".formatted(queryClass.getSimpleName()));

    log.debug("Querying {}", queryClass.getSimpleName());
    return handler.runInContext(nonNullQuery);
  }

  /**
   * Delivers the event to every handler registered for its runtime type, in registration order.
   *
   * @param event to publish
   * @throws IllegalArgumentException if the event is {@code null}
   */
  @Override
  public void publish(final DomainEvent event) {
    final DomainEvent nonNullEvent = requireArgument(event, "Event");
    final List<EventRegistration<?>> registrations =
        eventHandlers.getOrDefault(nonNullEvent.getClass(), List.of());

    log.debug(
        "Publishing {} to {} handler(s)",
        nonNullEvent.getClass().getSimpleName(),
        registrations.size());

    for (EventRegistration<?> registration : registrations) {
      if (registration.mode() == ConsumptionMode.ASYNCHRONOUS) {
        taskQueue.submit(() -> handleAsynchronously(registration, nonNullEvent));
      } else {
        registration.handle(nonNullEvent, this);
      }
    }
  }

  private void handleAsynchronously(
      final EventRegistration<?> registration, final DomainEvent event) {
    try {
      registration.handle(event, this);
    } catch (RuntimeException e) {
      log.error(
          "Asynchronous handler of {} failed", event.getClass().getSimpleName(), e);
    }
  }

  /**
   * Event handler bound to its event class.
   *
   * @param eventClass consumed
   * @param mode of consumption
   * @param handler to call
   * @param <E> is the type of the consumed event
   */
  private record EventRegistration<E extends DomainEvent>(
      Class<E> eventClass, ConsumptionMode mode, DomainEventHandler<E> handler) {
    void handle(final DomainEvent event, final MessageBus messageBus) {
      handler.handle(eventClass.cast(event), messageBus);
    }
  }

  /** Collects handlers before the immutable {@link MessageBus} is created. */
  public static final class Builder extends NullGuards {
    private final Map<Class<?>, DomainCommandHandler<?, ?>> commandHandlers = new HashMap<>();
    private final Map<Class<?>, DomainQueryHandler<?, ?>> queryHandlers = new HashMap<>();
    private final Map<Class<?>, List<EventRegistration<?>>> eventHandlers = new LinkedHashMap<>();
    private TaskQueue taskQueue = TaskQueue.inline();

    private Builder() {
      // Use MessageBus.builder()
    }

    /**
     * @param commandHandler to register
     * @return this builder
     * @throws IllegalArgumentException if the handler is {@code null}
     * @throws IllegalStateException if a handler is already registered for the same command
     */
    public Builder addCommandHandler(final DomainCommandHandler<?, ?> commandHandler) {
      final DomainCommandHandler<?, ?> nonNullHandler =
          requireArgument(commandHandler, "Command handler");
      final Class<?> commandClass = nonNullHandler.getCommandClass();

      if (commandHandlers.containsKey(commandClass)) {
        throw new IllegalStateException(
            "Handler for '%s' command is already registered"
                .formatted(commandClass.getSimpleName()));
      }

      commandHandlers.put(commandClass, nonNullHandler);
      return this;
    }

    /**
     * @param queryHandler to register
     * @return this builder
     * @throws IllegalArgumentException if the handler is {@code null}
     * @throws IllegalStateException if a handler is already registered for the same query
     */
    public Builder addQueryHandler(final DomainQueryHandler<?, ?> queryHandler) {
      final DomainQueryHandler<?, ?> nonNullHandler =
          requireArgument(queryHandler, "Query handler");
      final Class<?> queryClass = nonNullHandler.getQueryClass();

      if (queryHandlers.containsKey(queryClass)) {
        throw new IllegalStateException(
            "Handler for '%s' query is already registered".formatted(queryClass.getSimpleName()));
      }

      queryHandlers.put(queryClass, nonNullHandler);
      return this;
    }

    /**
     * @param eventClass to consume
     * @param mode of consumption
     * @param eventHandler to call
     * @param <E> is the type of the consumed event
     * @return this builder
     * @throws IllegalArgumentException if any argument is {@code null}
     */
    public <E extends DomainEvent> Builder addEventHandler(
        final Class<E> eventClass,
        final ConsumptionMode mode,
        final DomainEventHandler<E> eventHandler) {
      final EventRegistration<E> registration =
          new EventRegistration<>(
              requireArgument(eventClass, "Event class"),
              requireArgument(mode, "Consumption mode"),
              requireArgument(eventHandler, "Event handler"));

      eventHandlers.computeIfAbsent(eventClass, ignored -> new ArrayList<>()).add(registration);
      return this;
    }

    /**
     * @param taskQueue receiving asynchronous event handlers
     * @return this builder
     * @throws IllegalArgumentException if the queue is {@code null}
     */
    public Builder taskQueue(final TaskQueue taskQueue) {
      this.taskQueue = requireArgument(taskQueue, "Task queue");
      return this;
    }

    /**
     * @return an immutable bus
     */
    public MessageBus build() {
      return new MessageBus(this);
    }
  }
}
