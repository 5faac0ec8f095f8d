package be.uclouvain.osis.admission.ddd.cqrs;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.async.TaskQueue;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MessageBusTest {
  record Saluer(String nom) implements DomainCommand.Process<String> {}

  record Compter() implements DomainQuery.One<Integer> {}

  record Inconnue() implements DomainCommand.Process<String> {}

  record InconnueQuery() implements DomainQuery.One<String> {}

  record Salue(String nom) implements DomainEvent {}

  static final class SaluerHandler extends DomainCommandHandler.Process<Saluer, String> {
    SaluerHandler() {
      super(Saluer.class);
    }

    @Override
    protected String process(final Saluer command, final DomainEventPublisher publisher) {
      publisher.publish(new Salue(command.nom()));
      return "Bonjour " + command.nom();
    }
  }

  static final class CompterHandler extends DomainQueryHandler.One<Compter, Integer> {
    CompterHandler() {
      super(Compter.class);
    }

    @Override
    protected Integer run(final Compter query) {
      return 42;
    }
  }

  @Mock DomainEventHandler<Salue> eventHandler;

  @Nested
  class Builder {
    @Test
    void null_handlers_are_rejected() {
      final var builder = MessageBus.builder();

      assertThrows(IllegalArgumentException.class, () -> builder.addCommandHandler(null));
      assertThrows(IllegalArgumentException.class, () -> builder.addQueryHandler(null));
      assertThrows(IllegalArgumentException.class, () -> builder.taskQueue(null));
      assertThrows(
          IllegalArgumentException.class,
          () -> builder.addEventHandler(Salue.class, ConsumptionMode.SYNCHRONOUS, null));
    }

    @Test
    void registering_the_same_command_twice_is_refused() {
      final var builder = MessageBus.builder().addCommandHandler(new SaluerHandler());

      assertThrows(
          IllegalStateException.class, () -> builder.addCommandHandler(new SaluerHandler()));
    }

    @Test
    void registering_the_same_query_twice_is_refused() {
      final var builder = MessageBus.builder().addQueryHandler(new CompterHandler());

      assertThrows(
          IllegalStateException.class, () -> builder.addQueryHandler(new CompterHandler()));
    }

    @Test
    void supported_classes_are_exposed() {
      final var bus =
          MessageBus.builder()
              .addCommandHandler(new SaluerHandler())
              .addQueryHandler(new CompterHandler())
              .build();

      assertEquals(Set.of(Saluer.class), bus.getSupportedCommandClasses());
      assertEquals(Set.of(Compter.class), bus.getSupportedQueryClasses());
    }
  }

  @Nested
  class Invoke {
    final MessageBus bus =
        MessageBus.builder()
            .addCommandHandler(new SaluerHandler())
            .addQueryHandler(new CompterHandler())
            .build();

    @Test
    void command_is_routed_to_its_handler() {
      assertEquals("Bonjour Alice", bus.invoke(new Saluer("Alice")));
    }

    @Test
    void query_is_routed_to_its_handler() {
      assertEquals(42, bus.invoke(new Compter()));
    }

    @Test
    void null_messages_are_rejected() {
      assertThrows(IllegalArgumentException.class, () -> bus.invoke((DomainCommand<?>) null));
      assertThrows(IllegalArgumentException.class, () -> bus.invoke((DomainQuery<?>) null));
      assertThrows(IllegalArgumentException.class, () -> bus.publish(null));
    }

    @Test
    void unknown_messages_are_unsupported() {
      final var commande =
          assertThrows(UnsupportedOperationException.class, () -> bus.invoke(new Inconnue()));
      assertEquals(
          "Handler for 'Inconnue' command is not registered on the bus", commande.getMessage());

      final var requete =
          assertThrows(UnsupportedOperationException.class, () -> bus.invoke(new InconnueQuery()));
      assertEquals(
          "Handler for 'InconnueQuery' query is not registered on the bus", requete.getMessage());
    }

    @Test
    void event_without_consumer_is_ignored() {
      assertDoesNotThrow(() -> bus.publish(new Salue("Alice")));
    }
  }

  @Nested
  class Events {
    @Test
    void synchronous_handler_receives_events_published_by_commands() {
      final var bus =
          MessageBus.builder()
              .addCommandHandler(new SaluerHandler())
              .addEventHandler(Salue.class, ConsumptionMode.SYNCHRONOUS, eventHandler)
              .build();

      bus.invoke(new Saluer("Alice"));

      verify(eventHandler).handle(new Salue("Alice"), bus);
    }

    @Test
    void synchronous_handler_failure_reaches_the_publisher() {
      final var bus =
          MessageBus.builder()
              .addEventHandler(Salue.class, ConsumptionMode.SYNCHRONOUS, eventHandler)
              .build();
      doThrow(new IllegalStateException("boom")).when(eventHandler).handle(any(), any());

      assertThrows(IllegalStateException.class, () -> bus.publish(new Salue("Alice")));
    }

    @Test
    void asynchronous_handler_runs_on_the_task_queue_and_its_failure_is_not_propagated() {
      final List<Runnable> tasks = new ArrayList<>();
      final TaskQueue queue = tasks::add;
      final var bus =
          MessageBus.builder()
              .taskQueue(queue)
              .addEventHandler(Salue.class, ConsumptionMode.ASYNCHRONOUS, eventHandler)
              .build();
      doThrow(new IllegalStateException("boom")).when(eventHandler).handle(any(), any());

      assertDoesNotThrow(() -> bus.publish(new Salue("Alice")));
      verify(eventHandler, never()).handle(any(), any());
      assertEquals(1, tasks.size());

      assertDoesNotThrow(() -> tasks.forEach(Runnable::run));
      verify(eventHandler).handle(new Salue("Alice"), bus);
    }

    @Test
    void handlers_of_one_event_are_called_in_registration_order() {
      final List<String> calls = new ArrayList<>();
      final var bus =
          MessageBus.builder()
              .addEventHandler(
                  Salue.class, ConsumptionMode.SYNCHRONOUS, (event, b) -> calls.add("premier"))
              .addEventHandler(
                  Salue.class, ConsumptionMode.SYNCHRONOUS, (event, b) -> calls.add("second"))
              .build();

      bus.publish(new Salue("Alice"));

      assertEquals(List.of("premier", "second"), calls);
      assertTrue(bus.getSupportedCommandClasses().isEmpty());
    }
  }
}
