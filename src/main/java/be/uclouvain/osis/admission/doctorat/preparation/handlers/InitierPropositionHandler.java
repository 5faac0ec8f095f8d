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
import be.uclouvain.osis.admission.doctorat.preparation.commands.InitierPropositionCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.DoctoratNonTrouveException;
import be.uclouvain.osis.admission.doctorat.preparation.model.DoctoratTranslator;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionBuilder;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;

/** Creates a draft proposition, within the limit of propositions in progress per candidate. */
public final class InitierPropositionHandler
    extends DomainCommandHandler.Create<
        InitierPropositionCommand, PropositionIdentity, Proposition> {
  private final PropositionRepository repository;
  private final DoctoratTranslator doctoratTranslator;
  private final int maximumPropositions;

  public InitierPropositionHandler(
      final PropositionRepository repository,
      final DoctoratTranslator doctoratTranslator,
      final int maximumPropositions) {
    super(InitierPropositionCommand.class, repository);
    this.repository = repository;
    this.doctoratTranslator = requireArgument(doctoratTranslator, "Doctorat translator");
    this.maximumPropositions = maximumPropositions;
  }

  @Override
  protected Proposition create(final InitierPropositionCommand command) {
    final var doctorat =
        doctoratTranslator
            .get(command.sigleFormation(), command.annee())
            .orElseThrow(DoctoratNonTrouveException::new);
    final long enCours =
        repository.searchByMatricule(command.matriculeCandidat()).stream()
            .filter(Proposition::estEnCours)
            .count();

    return PropositionBuilder.initier(
        command.typeAdmission(),
        command.justification(),
        doctorat,
        command.matriculeCandidat(),
        enCours,
        maximumPropositions);
  }
}
