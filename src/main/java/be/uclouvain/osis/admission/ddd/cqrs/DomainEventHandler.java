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
 * Reacts to a published {@link DomainEvent}.
 *
 * @param <E> is the type of the consumed event
 */
@FunctionalInterface
public interface DomainEventHandler<E extends DomainEvent> {
  /**
   * @param event which was published
   * @param messageBus to invoke follow-up commands with
   */
  void handle(final E event, final MessageBus messageBus);
}
