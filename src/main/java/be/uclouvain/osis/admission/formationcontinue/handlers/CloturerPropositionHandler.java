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

package be.uclouvain.osis.admission.formationcontinue.handlers;

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.ddd.cqrs.DomainEvent;
import be.uclouvain.osis.admission.formationcontinue.commands.CloturerPropositionCommand;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueIdentity;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;
import be.uclouvain.osis.admission.formationcontinue.service.HistoriqueFormationContinue;
import java.util.Optional;

/** No message is sent to the candidate, only the status change is recorded. */
public final class CloturerPropositionHandler
    extends DomainCommandHandler.Update<
        CloturerPropositionCommand, PropositionContinueIdentity, PropositionContinue> {
  private final HistoriqueFormationContinue historique;

  public CloturerPropositionHandler(
      final PropositionContinueRepository repository,
      final HistoriqueFormationContinue historique) {
    super(CloturerPropositionCommand.class, repository);
    this.historique = requireArgument(historique, "Historique");
  }

  @Override
  protected PropositionContinueIdentity identify(final CloturerPropositionCommand command) {
    return new PropositionContinueIdentity(command.uuidProposition());
  }

  @Override
  protected void update(
      final CloturerPropositionCommand command, final PropositionContinue entity) {
    entity.cloturer(command.gestionnaire());
  }

  @Override
  protected Optional<DomainEvent> onSuccess(
      final CloturerPropositionCommand command, final PropositionContinue entity) {
    historique.historiserDecision(
        entity, command.gestionnaire(), "Clôture de la demande", Optional.empty());
    return Optional.empty();
  }
}
