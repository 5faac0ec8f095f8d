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

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.supervision.commands.SupprimerPromoteurCommand;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionIdentity;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;

public final class SupprimerPromoteurHandler
    extends DomainCommandHandler.Update<
        SupprimerPromoteurCommand, GroupeDeSupervisionIdentity, GroupeDeSupervision> {
  public SupprimerPromoteurHandler(final GroupeDeSupervisionRepository repository) {
    super(SupprimerPromoteurCommand.class, repository);
  }

  @Override
  protected GroupeDeSupervisionIdentity identify(final SupprimerPromoteurCommand command) {
    return new GroupeDeSupervisionIdentity(command.uuidProposition());
  }

  @Override
  protected void update(final SupprimerPromoteurCommand command, final GroupeDeSupervision entity) {
    entity.supprimerPromoteur(command.uuidPromoteur());
  }
}
