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

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import be.uclouvain.osis.admission.domain.document.commands.RemplirEmplacementDocumentParGestionnaireCommand;

public final class RemplirEmplacementDocumentParGestionnaireHandler
    extends DomainCommandHandler.Update<
        RemplirEmplacementDocumentParGestionnaireCommand,
        EmplacementDocumentIdentity,
        EmplacementDocument> {
  public RemplirEmplacementDocumentParGestionnaireHandler(
      final EmplacementDocumentRepository repository) {
    super(RemplirEmplacementDocumentParGestionnaireCommand.class, repository);
  }

  @Override
  protected EmplacementDocumentIdentity identify(
      final RemplirEmplacementDocumentParGestionnaireCommand command) {
    return new EmplacementDocumentIdentity(
        command.identifiantEmplacement(), command.uuidProposition());
  }

  @Override
  protected void update(
      final RemplirEmplacementDocumentParGestionnaireCommand command,
      final EmplacementDocument entity) {
    entity.remplirParGestionnaire(
        command.uuidsDocuments(), command.justificationGestionnaire(), command.auteur());
  }
}
