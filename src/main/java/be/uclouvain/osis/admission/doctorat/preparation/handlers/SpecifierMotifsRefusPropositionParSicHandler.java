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
import be.uclouvain.osis.admission.ddd.cqrs.DomainEvent;
import be.uclouvain.osis.admission.doctorat.preparation.commands.SpecifierMotifsRefusPropositionParSicCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.doctorat.preparation.service.HistoriqueDoctorat;
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;
import java.util.Optional;

public final class SpecifierMotifsRefusPropositionParSicHandler
    extends DomainCommandHandler.Update<
        SpecifierMotifsRefusPropositionParSicCommand, PropositionIdentity, Proposition> {
  private final HistoriqueDoctorat historique;

  public SpecifierMotifsRefusPropositionParSicHandler(
      final PropositionRepository repository, final HistoriqueDoctorat historique) {
    super(SpecifierMotifsRefusPropositionParSicCommand.class, repository);
    this.historique = requireArgument(historique, "Historique");
  }

  @Override
  protected PropositionIdentity identify(
      final SpecifierMotifsRefusPropositionParSicCommand command) {
    return new PropositionIdentity(command.uuidProposition());
  }

  @Override
  protected void update(
      final SpecifierMotifsRefusPropositionParSicCommand command, final Proposition entity) {
    entity.specifierMotifsRefusParSic(
        command.uuidsMotifs().stream().map(MotifRefusIdentity::new).toList(),
        command.autresMotifs(),
        command.gestionnaire());
  }

  @Override
  protected Optional<DomainEvent> onSuccess(
      final SpecifierMotifsRefusPropositionParSicCommand command, final Proposition entity) {
    historique.historiserDecision(
        entity, command.gestionnaire(), "Refus à valider par la direction", Optional.empty());
    return Optional.empty();
  }
}
