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

import be.uclouvain.osis.admission.ddd.cqrs.DomainEvent;

/**
 * Abstract contract for an entity which is able to publish {@link DomainEvent}s for consumption.
 *
 * <p>Command handlers receive a publisher when they are run and must only use it once the
 * aggregate they modified has been saved.
 */
@FunctionalInterface
public interface DomainEventPublisher {
  /**
   * @return an instance of publisher which does not perform any operations
   */
  static DomainEventPublisher empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Delivers {@link DomainEvent} to its consumers.
   *
   * @param event to publish
   */
  void publish(final DomainEvent event);

  /** Default implementation of the fake publisher */
  final class NoOp implements DomainEventPublisher {
    private static final DomainEventPublisher INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void publish(final DomainEvent event) {
      // Do nothing
    }
  }
}
