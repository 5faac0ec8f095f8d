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

package be.uclouvain.osis.admission.domain.document.handlers;

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import be.uclouvain.osis.admission.domain.document.commands.AnnulerReclamationEmplacementDocumentCommand;

/** A free slot only exists because of its request: cancelling the request deletes it. */
public final class AnnulerReclamationEmplacementDocumentHandler
    extends DomainCommandHandler.Process<
        AnnulerReclamationEmplacementDocumentCommand, EmplacementDocumentIdentity> {
  private final EmplacementDocumentRepository repository;

  public AnnulerReclamationEmplacementDocumentHandler(
      final EmplacementDocumentRepository repository) {
    super(AnnulerReclamationEmplacementDocumentCommand.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected EmplacementDocumentIdentity process(
      final AnnulerReclamationEmplacementDocumentCommand command,
      final DomainEventPublisher domainEventPublisher) {
    final EmplacementDocumentIdentity entityId =
        new EmplacementDocumentIdentity(
            command.identifiantEmplacement(), command.uuidProposition());
    final EmplacementDocument emplacement = repository.get(entityId);

    if (emplacement.getType().estLibre()) {
      repository.delete(entityId);
    } else {
      emplacement.annulerReclamation(command.auteur());
      repository.save(emplacement);
    }

    return entityId;
  }
}
