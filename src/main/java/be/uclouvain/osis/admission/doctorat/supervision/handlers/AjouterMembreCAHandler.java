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

package be.uclouvain.osis.admission.doctorat.supervision.handlers;

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.supervision.commands.AjouterMembreCACommand;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionIdentity;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;

public final class AjouterMembreCAHandler
    extends DomainCommandHandler.Process<AjouterMembreCACommand, String> {
  private final GroupeDeSupervisionRepository repository;

  public AjouterMembreCAHandler(final GroupeDeSupervisionRepository repository) {
    super(AjouterMembreCACommand.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected String process(
      final AjouterMembreCACommand command, final DomainEventPublisher domainEventPublisher) {
    final GroupeDeSupervision groupe =
        repository.get(new GroupeDeSupervisionIdentity(command.uuidProposition()));
    final String uuid = groupe.ajouterMembreCA(command.matricule());
    repository.save(groupe);
    return uuid;
  }
}
