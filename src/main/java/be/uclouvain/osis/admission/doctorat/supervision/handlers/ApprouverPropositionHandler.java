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

package be.uclouvain.osis.admission.doctorat.supervision.handlers;

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.supervision.commands.ApprouverPropositionCommand;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionIdentity;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.doctorat.supervision.model.Signataire;
import be.uclouvain.osis.admission.doctorat.supervision.service.HistoriqueSupervision;

public final class ApprouverPropositionHandler
    extends DomainCommandHandler.Process<ApprouverPropositionCommand, GroupeDeSupervisionIdentity> {
  private final GroupeDeSupervisionRepository repository;
  private final HistoriqueSupervision historique;

  public ApprouverPropositionHandler(
      final GroupeDeSupervisionRepository repository, final HistoriqueSupervision historique) {
    super(ApprouverPropositionCommand.class);
    this.repository = requireArgument(repository, "Repository");
    this.historique = requireArgument(historique, "Historique");
  }

  @Override
  protected GroupeDeSupervisionIdentity process(
      final ApprouverPropositionCommand command, final DomainEventPublisher domainEventPublisher) {
    final GroupeDeSupervision groupe =
        repository.get(new GroupeDeSupervisionIdentity(command.uuidProposition()));
    final Signataire avis =
        groupe.approuver(
            command.uuidMembre(),
            command.commentaireInterne(),
            command.commentaireExterne(),
            command.institutThese());

    repository.save(groupe);
    historique.historiserAvis(command.uuidProposition(), avis, avis.matricule());
    return groupe.getEntityId();
  }
}
