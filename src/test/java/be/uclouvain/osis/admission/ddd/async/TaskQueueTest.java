package be.uclouvain.osis.admission.ddd.async;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class TaskQueueTest {
  @Test
  void inline_queue_runs_task_in_caller_thread() {
    final var caller = Thread.currentThread();
    final var ranInCaller = new AtomicBoolean();

    TaskQueue.inline().submit(() -> ranInCaller.set(Thread.currentThread() == caller));

    assertTrue(ranInCaller.get());
  }

  @Test
  void executor_queue_delegates_to_executor() {
    final List<Runnable> submitted = new ArrayList<>();
    final Runnable task = () -> {};

    TaskQueue.executor(submitted::add).submit(task);

    assertEquals(List.of(task), submitted);
  }

  @Test
  void executor_queue_requires_executor() {
    assertThrows(IllegalArgumentException.class, () -> TaskQueue.executor(null));
  }

  @Test
  void empty_publisher_accepts_events() {
    DomainEventPublisher.empty().publish(null);
  }
}
