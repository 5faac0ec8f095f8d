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

package be.uclouvain.osis.admission.domain.digit;

import be.uclouvain.osis.admission.ddd.cqrs.DomainQueryHandler;
import java.util.Optional;

public final class RecupererNomaEnvoyeADigitHandler
    extends DomainQueryHandler.One<RecupererNomaEnvoyeADigitQuery, Optional<String>> {
  private final DigitRepository digitRepository;

  public RecupererNomaEnvoyeADigitHandler(final DigitRepository digitRepository) {
    super(RecupererNomaEnvoyeADigitQuery.class);
    this.digitRepository = requireArgument(digitRepository, "Digit repository");
  }

  @Override
  protected Optional<String> run(final RecupererNomaEnvoyeADigitQuery query) {
    return digitRepository.recupererNomaEnvoye(query.globalId());
  }
}
