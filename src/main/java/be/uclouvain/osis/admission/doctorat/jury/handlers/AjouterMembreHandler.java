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

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.jury.commands.AjouterMembreCommand;
import be.uclouvain.osis.admission.doctorat.jury.model.Jury;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;

public final class AjouterMembreHandler
    extends DomainCommandHandler.Process<AjouterMembreCommand, String> {
  private final JuryRepository repository;

  public AjouterMembreHandler(final JuryRepository repository) {
    super(AjouterMembreCommand.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected String process(
      final AjouterMembreCommand command, final DomainEventPublisher domainEventPublisher) {
    final Jury jury = repository.get(new JuryIdentity(command.uuidJury()));
    final String uuidMembre = jury.ajouterMembre(command.informations());
    repository.save(jury);
    return uuidMembre;
  }
}
