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

package be.uclouvain.osis.admission.doctorat.jury.handlers;

import be.uclouvain.osis.admission.ddd.cqrs.DomainQueryHandler;
import be.uclouvain.osis.admission.doctorat.jury.commands.RecupererJuryQuery;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryDTO;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;

public final class RecupererJuryHandler
    extends DomainQueryHandler.One<RecupererJuryQuery, JuryDTO> {
  private final JuryRepository repository;

  public RecupererJuryHandler(final JuryRepository repository) {
    super(RecupererJuryQuery.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected JuryDTO run(final RecupererJuryQuery query) {
    return JuryDTO.depuis(repository.get(new JuryIdentity(query.uuidJury())));
  }
}
