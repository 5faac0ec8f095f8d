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

package be.uclouvain.osis.admission.infrastructure;

import be.uclouvain.osis.admission.ddd.cqrs.DomainEventHandler;
import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.formationcontinue.events.InscriptionFormationContinueValideeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JournaliserInscriptionValideeHandler
    implements DomainEventHandler<InscriptionFormationContinueValideeEvent> {
  private static final Logger log =
      LoggerFactory.getLogger(JournaliserInscriptionValideeHandler.class);

  @Override
  public void handle(
      final InscriptionFormationContinueValideeEvent event, final MessageBus messageBus) {
    log.info(
        "Registration {} to {} ({}) validated for {}",
        event.uuidProposition(),
        event.sigleFormation(),
        event.annee(),
        event.matricule());
  }
}
