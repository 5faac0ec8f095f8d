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

package be.uclouvain.osis.admission.doctorat.epreuveconfirmation.handlers;

import be.uclouvain.osis.admission.ddd.cqrs.DomainQueryHandler;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.commands.RecupererDerniereEpreuveConfirmationQuery;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationDTO;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationRepository;

/** Answers the active attempt, the one with the latest deadline. */
public final class RecupererDerniereEpreuveConfirmationHandler
    extends DomainQueryHandler.One<
        RecupererDerniereEpreuveConfirmationQuery, EpreuveConfirmationDTO> {
  private final EpreuveConfirmationRepository repository;

  public RecupererDerniereEpreuveConfirmationHandler(
      final EpreuveConfirmationRepository repository) {
    super(RecupererDerniereEpreuveConfirmationQuery.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected EpreuveConfirmationDTO run(final RecupererDerniereEpreuveConfirmationQuery query) {
    return repository.searchByDoctorat(query.doctoratUuid()).stream()
        .findFirst()
        .map(EpreuveConfirmationDTO::depuis)
        .orElseThrow(EpreuveConfirmationNonTrouveeException::new);
  }
}
