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

package be.uclouvain.osis.admission.doctorat.formation.handlers;

import be.uclouvain.osis.admission.ddd.async.DomainEventPublisher;
import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.ddd.validation.ValidationResult;
import be.uclouvain.osis.admission.doctorat.formation.commands.SoumettreActivitesCommand;
import be.uclouvain.osis.admission.doctorat.formation.model.Activite;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteIdentity;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteRepository;
import be.uclouvain.osis.admission.doctorat.formation.validator.ActiviteValidatorListFactory;
import java.util.List;

/**
 * Every activity is validated before any is submitted, the violations of all activities are
 * reported together.
 */
public final class SoumettreActivitesHandler
    extends DomainCommandHandler.Process<SoumettreActivitesCommand, List<ActiviteIdentity>> {
  private final ActiviteRepository repository;

  public SoumettreActivitesHandler(final ActiviteRepository repository) {
    super(SoumettreActivitesCommand.class);
    this.repository = requireArgument(repository, "Repository");
  }

  @Override
  protected List<ActiviteIdentity> process(
      final SoumettreActivitesCommand command, final DomainEventPublisher domainEventPublisher) {
    final List<Activite> activites =
        command.activiteUuids().stream()
            .map(uuid -> repository.get(new ActiviteIdentity(uuid)))
            .toList();
    if (activites.stream()
        .anyMatch(activite -> !activite.getDoctoratUuid().equals(command.doctoratUuid()))) {
      throw new ActiviteNonTrouveeException();
    }

    ValidationResult.combine(
            activites.stream()
                .map(activite -> ActiviteValidatorListFactory.pour(activite).evaluate())
                .toList())
        .throwIfInvalid();

    activites.forEach(
        activite -> {
          activite.soumettre();
          repository.save(activite);
        });
    return activites.stream().map(Activite::getEntityId).toList();
  }
}
