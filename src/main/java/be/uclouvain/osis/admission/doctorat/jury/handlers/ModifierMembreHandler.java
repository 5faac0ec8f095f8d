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
import be.uclouvain.osis.admission.doctorat.jury.commands.ModifierMembreCommand;
import be.uclouvain.osis.admission.doctorat.jury.model.Jury;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;

public final class ModifierMembreHandler
    extends DomainCommandHandler.Update<ModifierMembreCommand, JuryIdentity, Jury> {
  public ModifierMembreHandler(final JuryRepository repository) {
    super(ModifierMembreCommand.class, repository);
  }

  @Override
  protected JuryIdentity identify(final ModifierMembreCommand command) {
    return new JuryIdentity(command.uuidJury());
  }

  @Override
  protected void update(final ModifierMembreCommand command, final Jury entity) {
    entity.modifierMembre(command.uuidMembre(), command.informations());
  }
}
