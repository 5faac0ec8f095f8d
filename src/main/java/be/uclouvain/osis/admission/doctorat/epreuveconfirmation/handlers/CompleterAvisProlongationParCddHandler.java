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

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.commands.CompleterAvisProlongationParCddCommand;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmation;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationIdentity;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationRepository;

public final class CompleterAvisProlongationParCddHandler
    extends DomainCommandHandler.Update<
        CompleterAvisProlongationParCddCommand, EpreuveConfirmationIdentity, EpreuveConfirmation> {
  public CompleterAvisProlongationParCddHandler(final EpreuveConfirmationRepository repository) {
    super(CompleterAvisProlongationParCddCommand.class, repository);
  }

  @Override
  protected EpreuveConfirmationIdentity identify(
      final CompleterAvisProlongationParCddCommand command) {
    return new EpreuveConfirmationIdentity(command.uuid());
  }

  @Override
  protected void update(
      final CompleterAvisProlongationParCddCommand command, final EpreuveConfirmation entity) {
    entity.completerAvisProlongationParCdd(command.avisCdd());
  }
}
