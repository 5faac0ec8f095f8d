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
import be.uclouvain.osis.admission.domain.document.commands.RetyperDocumentCommand;

/**
 * Exchanges the content of two slots. A free slot left empty by the exchange is deleted, which is
 * how a document moved out of a temporary free slot leaves no trace behind.
 */
public final class RetyperDocumentHandler
    extends DomainCommandHandler.Process<RetyperDocumentCommand, EmplacementDocumentIdentity> {
  private final EmplacementDocumentRepository repository;

  public RetyperDocumentHandler(final EmplacementDocumentRepository repository) {
    super(RetyperDocumentCommand.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected EmplacementDocumentIdentity process(
      final RetyperDocumentCommand command, final DomainEventPublisher domainEventPublisher) {
    final EmplacementDocument source =
        repository.get(
            new EmplacementDocumentIdentity(
                command.identifiantSource(), command.uuidProposition()));
    final EmplacementDocument cible =
        repository.get(
            new EmplacementDocumentIdentity(command.identifiantCible(), command.uuidProposition()));

    source.echangerContenuAvec(cible, command.auteur());

    enregistrer(source);
    enregistrer(cible);
    return cible.getEntityId();
  }

  private void enregistrer(final EmplacementDocument emplacement) {
    if (emplacement.estLibreEtVide()) {
      repository.delete(emplacement.getEntityId());
    } else {
      repository.save(emplacement);
    }
  }
}
