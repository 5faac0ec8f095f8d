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
import be.uclouvain.osis.admission.formationcontinue.commands.AnnulerPropositionCommand;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueIdentity;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;
import be.uclouvain.osis.admission.formationcontinue.service.HistoriqueFormationContinue;
import be.uclouvain.osis.admission.formationcontinue.service.NotificationFormationContinue;
import java.util.Optional;

public final class AnnulerPropositionHandler
    extends DomainCommandHandler.Update<
        AnnulerPropositionCommand, PropositionContinueIdentity, PropositionContinue> {
  private final HistoriqueFormationContinue historique;
  private final NotificationFormationContinue notification;

  public AnnulerPropositionHandler(
      final PropositionContinueRepository repository,
      final HistoriqueFormationContinue historique,
      final NotificationFormationContinue notification) {
    super(AnnulerPropositionCommand.class, repository);
    this.historique = requireArgument(historique, "Historique");
    this.notification = requireArgument(notification, "Notification");
  }

  @Override
  protected PropositionContinueIdentity identify(final AnnulerPropositionCommand command) {
    return new PropositionContinueIdentity(command.uuidProposition());
  }

  @Override
  protected void update(final AnnulerPropositionCommand command, final PropositionContinue entity) {
    entity.annuler(command.gestionnaire(), command.motif());
  }

  @Override
  protected Optional<DomainEvent> onSuccess(
      final AnnulerPropositionCommand command, final PropositionContinue entity) {
    historique.historiserDecision(
        entity,
        command.gestionnaire(),
        "Annulation de la demande",
        Optional.of(
            notification.notifierDecision(
                entity, command.objetMessage(), command.corpsMessage())));
    return Optional.empty();
  }
}
