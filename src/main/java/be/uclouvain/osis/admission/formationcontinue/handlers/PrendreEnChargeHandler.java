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
import be.uclouvain.osis.admission.formationcontinue.commands.PrendreEnChargeCommand;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueIdentity;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;

public final class PrendreEnChargeHandler
    extends DomainCommandHandler.Update<
        PrendreEnChargeCommand, PropositionContinueIdentity, PropositionContinue> {
  public PrendreEnChargeHandler(final PropositionContinueRepository repository) {
    super(PrendreEnChargeCommand.class, repository);
  }

  @Override
  protected PropositionContinueIdentity identify(final PrendreEnChargeCommand command) {
    return new PropositionContinueIdentity(command.uuidProposition());
  }

  @Override
  protected void update(final PrendreEnChargeCommand command, final PropositionContinue entity) {
    entity.prendreEnCharge(command.gestionnaire());
  }
}
