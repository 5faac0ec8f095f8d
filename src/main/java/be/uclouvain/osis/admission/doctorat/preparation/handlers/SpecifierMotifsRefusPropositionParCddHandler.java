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

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.preparation.commands.SpecifierMotifsRefusPropositionParCddCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;

public final class SpecifierMotifsRefusPropositionParCddHandler
    extends DomainCommandHandler.Update<
        SpecifierMotifsRefusPropositionParCddCommand, PropositionIdentity, Proposition> {
  public SpecifierMotifsRefusPropositionParCddHandler(final PropositionRepository repository) {
    super(SpecifierMotifsRefusPropositionParCddCommand.class, repository);
  }

  @Override
  protected PropositionIdentity identify(
      final SpecifierMotifsRefusPropositionParCddCommand command) {
    return new PropositionIdentity(command.uuidProposition());
  }

  @Override
  protected void update(
      final SpecifierMotifsRefusPropositionParCddCommand command, final Proposition entity) {
    entity.specifierMotifsRefusParCdd(
        command.uuidsMotifs().stream().map(MotifRefusIdentity::new).toList(),
        command.autresMotifs(),
        command.gestionnaire());
  }
}
