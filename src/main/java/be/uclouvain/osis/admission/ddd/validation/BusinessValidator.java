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

package be.uclouvain.osis.admission.ddd.validation;

/**
 * Single-responsibility guard: holds the data it must check and raises exactly one kind of {@link
 * BusinessException} when its rule is violated.
 *
 * <p>Validators never mutate anything. The phase in which a validator runs is part of its type:
 * see {@link DataContractValidator} and {@link InvariantValidator}.
 */
public sealed interface BusinessValidator permits DataContractValidator, InvariantValidator {
  /**
   * @throws BusinessException if the rule is violated
   */
  void validate();
}
