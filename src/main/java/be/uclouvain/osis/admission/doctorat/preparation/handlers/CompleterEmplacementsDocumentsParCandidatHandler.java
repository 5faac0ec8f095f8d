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

package be.uclouvain.osis.admission.doctorat.preparation.handlers;

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.preparation.commands.CompleterEmplacementsDocumentsParCandidatCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Stores the answers of the candidate to the requested documents. */
public final class CompleterEmplacementsDocumentsParCandidatHandler
    extends DomainCommandHandler.Process<
        CompleterEmplacementsDocumentsParCandidatCommand, PropositionIdentity> {
  private final PropositionRepository propositionRepository;
  private final EmplacementDocumentRepository emplacementDocumentRepository;

  public CompleterEmplacementsDocumentsParCandidatHandler(
      final PropositionRepository propositionRepository,
      final EmplacementDocumentRepository emplacementDocumentRepository) {
    super(CompleterEmplacementsDocumentsParCandidatCommand.class);
    this.propositionRepository =
        requireArgument(propositionRepository, "Proposition repository");
    this.emplacementDocumentRepository =
        requireArgument(emplacementDocumentRepository, "Document repository");
  }

  @Override
  protected PropositionIdentity process(
      final CompleterEmplacementsDocumentsParCandidatCommand command,
      final DomainEventPublisher domainEventPublisher) {
    final Proposition proposition =
        propositionRepository.get(new PropositionIdentity(command.uuidProposition()));

    final Map<EmplacementDocument, List<String>> reponses = new LinkedHashMap<>();
    command
        .reponsesDocuments()
        .forEach(
            (identifiant, documents) ->
                reponses.put(
                    emplacementDocumentRepository.get(
                        new EmplacementDocumentIdentity(identifiant, command.uuidProposition())),
                    documents));

    proposition.completerDocumentsParCandidat();
    reponses.forEach(
        (emplacement, documents) ->
            emplacement.completerParCandidat(documents, proposition.getMatriculeCandidat()));

    reponses.keySet().forEach(emplacementDocumentRepository::save);
    propositionRepository.save(proposition);
    return proposition.getEntityId();
  }
}
