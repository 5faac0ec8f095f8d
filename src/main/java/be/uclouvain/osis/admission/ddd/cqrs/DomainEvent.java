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
 * Represents a notification about a state change which already happened within the system.
 *
 * <p>Events are published by command handlers only after the triggering aggregate has been saved.
 * They must carry enough data (entity identity, actor, message) for consumers to act without
 * querying the system again.
 *
 * <p>Events can be consumed synchronously or deferred to a background {@link
 * be.uclouvain.osis.admission.ddd.async.TaskQueue} - see {@link ConsumptionMode}.
 */
public interface DomainEvent extends DomainMessage {}
