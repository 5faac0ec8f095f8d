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

package be.uclouvain.osis.admission.domain.validator;

import be.uclouvain.osis.admission.ddd.validation.BusinessException;
import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Guards a status transition: the current status of the proposition must be one of the allowed
 * source statuses.
 *
 * @param statut current status
 * @param autorises allowed source statuses
 * @param exception raised otherwise
 * @param <S> status enumeration of the track
 */
public record ShouldStatutEtreParmi<S extends Enum<S>>(
    S statut, Set<S> autorises, Supplier<? extends BusinessException> exception)
    implements InvariantValidator {
  @Override
  public void validate() {
    if (!autorises.contains(statut)) {
      throw exception.get();
    }
  }
}
