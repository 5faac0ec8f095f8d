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
import be.uclouvain.osis.admission.doctorat.jury.commands.InitialiserJuryCommand;
import be.uclouvain.osis.admission.doctorat.jury.model.Jury;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import be.uclouvain.osis.admission.doctorat.jury.validator.JuryDejaInitialiseException;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionIdentity;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;
import java.util.List;

/**
 * Seeds the jury with the promoters of the supervision group, once every member of the group
 * approved the proposition.
 */
public final class InitialiserJuryHandler
    extends DomainCommandHandler.Create<InitialiserJuryCommand, JuryIdentity, Jury> {
  private final JuryRepository repository;
  private final GroupeDeSupervisionRepository groupes;

  public InitialiserJuryHandler(
      final JuryRepository repository, final GroupeDeSupervisionRepository groupes) {
    super(InitialiserJuryCommand.class, repository);
    this.repository = repository;
    this.groupes = requireArgument(groupes, "Groupe de supervision repository");
  }

  @Override
  protected Jury create(final InitialiserJuryCommand command) {
    final JuryIdentity entityId = new JuryIdentity(command.uuidDoctorat());
    if (!repository.search(List.of(entityId)).isEmpty()) {
      throw new JuryDejaInitialiseException();
    }

    final GroupeDeSupervision groupe =
        groupes.get(new GroupeDeSupervisionIdentity(command.uuidDoctorat()));
    groupe.verifierToutLeMondeAApprouve();

    return new Jury(
        entityId,
        groupe.getPromoteurs().stream()
            .map(promoteur -> MembreJury.promoteur(promoteur.uuid(), promoteur.matricule()))
            .toList());
  }
}
