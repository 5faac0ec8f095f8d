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

import java.io.Serializable;

/**
 * Describes general properties of the messages exchanged through the {@link MessageBus}.
 *
 * <p>Messages have no identity beyond their field values: they are created per call and discarded
 * after dispatch. It is highly recommended to implement them as Java {@link Record}s.
 */
public interface DomainMessage extends Serializable {}
