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

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ModifierStatutChecklistParcoursAnterieurCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;

public final class ModifierStatutChecklistParcoursAnterieurHandler
    extends DomainCommandHandler.Update<
        ModifierStatutChecklistParcoursAnterieurCommand, PropositionIdentity, Proposition> {
  public ModifierStatutChecklistParcoursAnterieurHandler(final PropositionRepository repository) {
    super(ModifierStatutChecklistParcoursAnterieurCommand.class, repository);
  }

  @Override
  protected PropositionIdentity identify(
      final ModifierStatutChecklistParcoursAnterieurCommand command) {
    return new PropositionIdentity(command.uuidProposition());
  }

  @Override
  protected void update(
      final ModifierStatutChecklistParcoursAnterieurCommand command, final Proposition entity) {
    entity.modifierStatutChecklistParcoursAnterieur(command.statut(), command.gestionnaire());
  }
}
