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

package be.uclouvain.osis.admission.doctorat.formation.validator;

import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.doctorat.formation.model.Activite;
import be.uclouvain.osis.admission.doctorat.formation.model.DetailsActivite.Cours;
import java.util.List;

public final class CoursValidatorList extends ActiviteValidatorList<Cours> {
  public CoursValidatorList(final Activite activite) {
    super(activite, Cours.class);
  }

  @Override
  protected List<InvariantValidator> getDetailsValidators(final Cours details) {
    return List.of(
        ShouldActiviteEtreComplete.avecChamps(details.intitule(), details.dateDebut()),
        new ShouldDatesActiviteEtreCoherentes(details.dateDebut(), details.dateFin()));
  }
}
