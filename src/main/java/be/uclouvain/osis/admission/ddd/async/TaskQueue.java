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

package be.uclouvain.osis.admission.ddd.async;

import java.util.concurrent.Executor;

/**
 * Background queue receiving the work of asynchronous event handlers.
 *
 * <p>The queue wire format and its workers are not part of this library: production code is
 * expected to adapt its own task runner, tests usually rely on {@link #inline()}.
 */
@FunctionalInterface
public interface TaskQueue {
  /**
   * @return a queue running every task immediately in the caller thread
   */
  static TaskQueue inline() {
    return Inline.INSTANCE;
  }

  /**
   * @param executor to submit tasks to
   * @return a queue delegating to the given {@link Executor}
   * @throws IllegalArgumentException if executor is {@code null}
   */
  static TaskQueue executor(final Executor executor) {
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null");
    }

    return executor::execute;
  }

  /**
   * @param task to run later
   */
  void submit(final Runnable task);

  /** Runs tasks in the caller thread */
  final class Inline implements TaskQueue {
    private static final TaskQueue INSTANCE = new Inline();

    private Inline() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void submit(final Runnable task) {
      task.run();
    }
  }
}
