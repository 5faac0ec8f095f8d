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

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;

/** Submits a person ticket, the critical section is owned by the {@link DigitRepository}. */
public final class SoumettreTicketPersonneHandler
    extends DomainCommandHandler.Process<SoumettreTicketPersonneCommand, TicketPersonneDTO> {
  private final DigitRepository digitRepository;

  public SoumettreTicketPersonneHandler(final DigitRepository digitRepository) {
    super(SoumettreTicketPersonneCommand.class);
    this.digitRepository = requireArgument(digitRepository, "Digit repository");
  }

  @Override
  protected TicketPersonneDTO process(
      final SoumettreTicketPersonneCommand command,
      final DomainEventPublisher domainEventPublisher) {
    return digitRepository.soumettreTicketPersonne(command.globalId());
  }
}
