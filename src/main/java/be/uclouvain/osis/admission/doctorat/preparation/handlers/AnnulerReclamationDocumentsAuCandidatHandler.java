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
import be.uclouvain.osis.admission.doctorat.preparation.commands.AnnulerReclamationDocumentsAuCandidatCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import be.uclouvain.osis.admission.domain.document.StatutEmplacementDocument;

public final class AnnulerReclamationDocumentsAuCandidatHandler
    extends DomainCommandHandler.Process<
        AnnulerReclamationDocumentsAuCandidatCommand, PropositionIdentity> {
  private final PropositionRepository propositionRepository;
  private final EmplacementDocumentRepository emplacementDocumentRepository;

  public AnnulerReclamationDocumentsAuCandidatHandler(
      final PropositionRepository propositionRepository,
      final EmplacementDocumentRepository emplacementDocumentRepository) {
    super(AnnulerReclamationDocumentsAuCandidatCommand.class);
    this.propositionRepository =
        requireArgument(propositionRepository, "Proposition repository");
    this.emplacementDocumentRepository =
        requireArgument(emplacementDocumentRepository, "Document repository");
  }

  @Override
  protected PropositionIdentity process(
      final AnnulerReclamationDocumentsAuCandidatCommand command,
      final DomainEventPublisher domainEventPublisher) {
    final Proposition proposition =
        propositionRepository.get(new PropositionIdentity(command.uuidProposition()));

    proposition.annulerReclamationDocuments(command.typeGestionnaire(), command.auteur());
    for (final EmplacementDocument emplacement :
        emplacementDocumentRepository.searchByProposition(command.uuidProposition())) {
      if (emplacement.getStatut() == StatutEmplacementDocument.RECLAME) {
        emplacement.annulerReclamationAuCandidat(command.auteur());
        emplacementDocumentRepository.save(emplacement);
      }
    }

    propositionRepository.save(proposition);
    return proposition.getEntityId();
  }
}
