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
import be.uclouvain.osis.admission.doctorat.preparation.commands.ReclamerDocumentsAuCandidatCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.doctorat.preparation.service.HistoriqueDoctorat;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import java.util.List;
import java.util.Optional;

/**
 * Requests the selected document slots from the candidate. The proposition moves to the status
 * where the candidate has to complete it, depending on which manager asked.
 */
public final class ReclamerDocumentsAuCandidatHandler
    extends DomainCommandHandler.Process<ReclamerDocumentsAuCandidatCommand, PropositionIdentity> {
  private final PropositionRepository propositionRepository;
  private final EmplacementDocumentRepository emplacementDocumentRepository;
  private final HistoriqueDoctorat historique;

  public ReclamerDocumentsAuCandidatHandler(
      final PropositionRepository propositionRepository,
      final EmplacementDocumentRepository emplacementDocumentRepository,
      final HistoriqueDoctorat historique) {
    super(ReclamerDocumentsAuCandidatCommand.class);
    this.propositionRepository =
        requireArgument(propositionRepository, "Proposition repository");
    this.emplacementDocumentRepository =
        requireArgument(emplacementDocumentRepository, "Document repository");
    this.historique = requireArgument(historique, "Historique");
  }

  @Override
  protected PropositionIdentity process(
      final ReclamerDocumentsAuCandidatCommand command,
      final DomainEventPublisher domainEventPublisher) {
    final Proposition proposition =
        propositionRepository.get(new PropositionIdentity(command.uuidProposition()));
    final List<EmplacementDocument> emplacements =
        command.identifiantsEmplacements().stream()
            .map(
                identifiant ->
                    emplacementDocumentRepository.get(
                        new EmplacementDocumentIdentity(identifiant, command.uuidProposition())))
            .toList();

    proposition.reclamerDocuments(command.typeGestionnaire(), command.auteur());
    for (final EmplacementDocument emplacement : emplacements) {
      if (emplacement.reclamer(command.dateLimite(), command.auteur())) {
        emplacementDocumentRepository.save(emplacement);
      }
    }

    propositionRepository.save(proposition);
    historique.historiserDecision(
        proposition,
        command.auteur(),
        "Réclamation de documents au candidat par le " + command.typeGestionnaire(),
        Optional.empty());
    return proposition.getEntityId();
  }
}
