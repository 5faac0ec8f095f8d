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

import be.uclouvain.osis.admission.ddd.cqrs.DomainQueryHandler;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ListerPropositionsCandidatQuery;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionDTO;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import java.util.List;

/** Lists the propositions of a candidate which are still in progress. */
public final class ListerPropositionsCandidatHandler
    extends DomainQueryHandler.Many<ListerPropositionsCandidatQuery, PropositionDTO> {
  private final PropositionRepository repository;

  public ListerPropositionsCandidatHandler(final PropositionRepository repository) {
    super(ListerPropositionsCandidatQuery.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected List<PropositionDTO> run(final ListerPropositionsCandidatQuery query) {
    return repository.searchByMatricule(query.matriculeCandidat()).stream()
        .filter(Proposition::estEnCours)
        .map(PropositionDTO::depuis)
        .toList();
  }
}
