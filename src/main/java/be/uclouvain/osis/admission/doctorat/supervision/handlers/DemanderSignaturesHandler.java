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
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.doctorat.supervision.commands.DemanderSignaturesCommand;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionIdentity;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.doctorat.supervision.service.HistoriqueSupervision;

/** Locks the draft and invites every member of the supervision group to sign it. */
public final class DemanderSignaturesHandler
    extends DomainCommandHandler.Process<DemanderSignaturesCommand, PropositionIdentity> {
  private final PropositionRepository propositionRepository;
  private final GroupeDeSupervisionRepository groupeRepository;
  private final HistoriqueSupervision historique;

  public DemanderSignaturesHandler(
      final PropositionRepository propositionRepository,
      final GroupeDeSupervisionRepository groupeRepository,
      final HistoriqueSupervision historique) {
    super(DemanderSignaturesCommand.class);
    this.propositionRepository = requireArgument(propositionRepository, "Proposition repository");
    this.groupeRepository = requireArgument(groupeRepository, "Groupe repository");
    this.historique = requireArgument(historique, "Historique");
  }

  @Override
  protected PropositionIdentity process(
      final DemanderSignaturesCommand command, final DomainEventPublisher domainEventPublisher) {
    final Proposition proposition =
        propositionRepository.get(new PropositionIdentity(command.uuidProposition()));
    final GroupeDeSupervision groupe =
        groupeRepository.get(new GroupeDeSupervisionIdentity(command.uuidProposition()));

    proposition.demanderSignatures();
    groupe.inviterASigner();

    groupeRepository.save(groupe);
    propositionRepository.save(proposition);
    historique.historiserDemandeSignatures(proposition);
    return proposition.getEntityId();
  }
}
