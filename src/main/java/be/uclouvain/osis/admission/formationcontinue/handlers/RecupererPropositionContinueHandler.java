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

import be.uclouvain.osis.admission.ddd.cqrs.DomainQueryHandler;
import be.uclouvain.osis.admission.formationcontinue.commands.RecupererPropositionContinueQuery;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueDTO;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueIdentity;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;

public final class RecupererPropositionContinueHandler
    extends DomainQueryHandler.One<RecupererPropositionContinueQuery, PropositionContinueDTO> {
  private final PropositionContinueRepository repository;

  public RecupererPropositionContinueHandler(final PropositionContinueRepository repository) {
    super(RecupererPropositionContinueQuery.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected PropositionContinueDTO run(final RecupererPropositionContinueQuery query) {
    return PropositionContinueDTO.depuis(
        repository.get(new PropositionContinueIdentity(query.uuidProposition())));
  }
}
