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

package be.uclouvain.osis.admission.infrastructure;

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.formationcontinue.handlers.AnnulerPropositionHandler;
import be.uclouvain.osis.admission.formationcontinue.handlers.ApprouverParFacHandler;
import be.uclouvain.osis.admission.formationcontinue.handlers.CloturerPropositionHandler;
import be.uclouvain.osis.admission.formationcontinue.handlers.MettreAValiderHandler;
import be.uclouvain.osis.admission.formationcontinue.handlers.MettreEnAttenteHandler;
import be.uclouvain.osis.admission.formationcontinue.handlers.PrendreEnChargeHandler;
import be.uclouvain.osis.admission.formationcontinue.handlers.RecupererPropositionContinueHandler;
import be.uclouvain.osis.admission.formationcontinue.handlers.RefuserPropositionHandler;
import be.uclouvain.osis.admission.formationcontinue.handlers.ValiderPropositionHandler;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;
import be.uclouvain.osis.admission.formationcontinue.service.HistoriqueFormationContinue;
import be.uclouvain.osis.admission.formationcontinue.service.NotificationFormationContinue;

final class FormationContinueHandlers {
  private FormationContinueHandlers() {
    // Cannot be instantiated
  }

  static void register(final MessageBus.Builder builder, final AdmissionDependencies dependencies) {
    final PropositionContinueRepository propositions = dependencies.propositionsContinues();
    final HistoriqueFormationContinue historique =
        new HistoriqueFormationContinue(dependencies.historique());
    final NotificationFormationContinue notification =
        new NotificationFormationContinue(dependencies.notification());

    builder
        .addCommandHandler(new PrendreEnChargeHandler(propositions))
        .addCommandHandler(new MettreEnAttenteHandler(propositions, historique, notification))
        .addCommandHandler(new ApprouverParFacHandler(propositions, historique, notification))
        .addCommandHandler(new MettreAValiderHandler(propositions, historique))
        .addCommandHandler(new RefuserPropositionHandler(propositions, historique, notification))
        .addCommandHandler(new AnnulerPropositionHandler(propositions, historique, notification))
        .addCommandHandler(
            new ValiderPropositionHandler(
                propositions, dependencies.profilCandidatTranslator(), historique, notification))
        .addCommandHandler(new CloturerPropositionHandler(propositions, historique))
        .addQueryHandler(new RecupererPropositionContinueHandler(propositions));
  }
}
