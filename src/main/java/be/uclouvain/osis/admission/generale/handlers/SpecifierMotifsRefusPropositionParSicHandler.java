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

package be.uclouvain.osis.admission.generale.handlers;

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;
import be.uclouvain.osis.admission.generale.commands.SpecifierMotifsRefusPropositionParSicCommand;
import be.uclouvain.osis.admission.generale.model.PropositionGenerale;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleIdentity;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleRepository;

public final class SpecifierMotifsRefusPropositionParSicHandler
    extends DomainCommandHandler.Update<
        SpecifierMotifsRefusPropositionParSicCommand,
        PropositionGeneraleIdentity,
        PropositionGenerale> {
  public SpecifierMotifsRefusPropositionParSicHandler(
      final PropositionGeneraleRepository repository) {
    super(SpecifierMotifsRefusPropositionParSicCommand.class, repository);
  }

  @Override
  protected PropositionGeneraleIdentity identify(
      final SpecifierMotifsRefusPropositionParSicCommand command) {
    return new PropositionGeneraleIdentity(command.uuidProposition());
  }

  @Override
  protected void update(
      final SpecifierMotifsRefusPropositionParSicCommand command,
      final PropositionGenerale entity) {
    entity.specifierMotifsRefusParSic(
        command.uuidsMotifs().stream().map(MotifRefusIdentity::new).toList(),
        command.autresMotifs(),
        command.gestionnaire());
  }
}
