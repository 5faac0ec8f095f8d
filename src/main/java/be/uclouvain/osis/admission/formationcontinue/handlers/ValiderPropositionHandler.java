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
import be.uclouvain.osis.admission.domain.service.ProfilCandidatTranslator;
import be.uclouvain.osis.admission.formationcontinue.commands.ValiderPropositionCommand;
import be.uclouvain.osis.admission.formationcontinue.events.InscriptionFormationContinueValideeEvent;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueIdentity;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;
import be.uclouvain.osis.admission.formationcontinue.service.HistoriqueFormationContinue;
import be.uclouvain.osis.admission.formationcontinue.service.NotificationFormationContinue;
import java.util.Optional;

/** Validates the registration, unless the candidate is in quarantine. */
public final class ValiderPropositionHandler
    extends DomainCommandHandler.Update<
        ValiderPropositionCommand, PropositionContinueIdentity, PropositionContinue> {
  private final ProfilCandidatTranslator profilCandidatTranslator;
  private final HistoriqueFormationContinue historique;
  private final NotificationFormationContinue notification;

  public ValiderPropositionHandler(
      final PropositionContinueRepository repository,
      final ProfilCandidatTranslator profilCandidatTranslator,
      final HistoriqueFormationContinue historique,
      final NotificationFormationContinue notification) {
    super(ValiderPropositionCommand.class, repository);
    this.profilCandidatTranslator =
        requireArgument(profilCandidatTranslator, "Profil candidat translator");
    this.historique = requireArgument(historique, "Historique");
    this.notification = requireArgument(notification, "Notification");
  }

  @Override
  protected PropositionContinueIdentity identify(final ValiderPropositionCommand command) {
    return new PropositionContinueIdentity(command.uuidProposition());
  }

  @Override
  protected void update(final ValiderPropositionCommand command, final PropositionContinue entity) {
    entity.valider(
        command.gestionnaire(),
        profilCandidatTranslator.getMergeProposal(entity.getMatriculeCandidat()));
  }

  @Override
  protected Optional<DomainEvent> onSuccess(
      final ValiderPropositionCommand command, final PropositionContinue entity) {
    historique.historiserDecision(
        entity,
        command.gestionnaire(),
        "Validation de la demande",
        Optional.of(
            notification.notifierDecision(
                entity, command.objetMessage(), command.corpsMessage())));
    return Optional.of(
        new InscriptionFormationContinueValideeEvent(
            entity.getEntityId().uuid(),
            entity.getMatriculeCandidat(),
            entity.getSigleFormation(),
            entity.getAnnee()));
  }
}
