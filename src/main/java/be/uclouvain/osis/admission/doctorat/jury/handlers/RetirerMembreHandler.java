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

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.jury.commands.RetirerMembreCommand;
import be.uclouvain.osis.admission.doctorat.jury.model.Jury;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;

public final class RetirerMembreHandler
    extends DomainCommandHandler.Update<RetirerMembreCommand, JuryIdentity, Jury> {
  public RetirerMembreHandler(final JuryRepository repository) {
    super(RetirerMembreCommand.class, repository);
  }

  @Override
  protected JuryIdentity identify(final RetirerMembreCommand command) {
    return new JuryIdentity(command.uuidJury());
  }

  @Override
  protected void update(final RetirerMembreCommand command, final Jury entity) {
    entity.retirerMembre(command.uuidMembre());
  }
}
