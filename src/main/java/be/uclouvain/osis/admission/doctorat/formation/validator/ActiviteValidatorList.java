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
import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.formation.model.Activite;
import be.uclouvain.osis.admission.doctorat.formation.model.DetailsActivite;
import java.util.ArrayList;
import java.util.List;

/**
 * Validation of an activity before its submission.
 *
 * @param <D> details of the category handled by the list
 */
public abstract class ActiviteValidatorList<D extends DetailsActivite>
    extends TwoStepsValidatorList {
  private final Activite activite;
  private final D details;

  protected ActiviteValidatorList(final Activite activite, final Class<D> typeDetails) {
    this.activite = activite;
    this.details = typeDetails.cast(activite.getDetails());
  }

  protected abstract List<InvariantValidator> getDetailsValidators(final D details);

  @Override
  protected final List<InvariantValidator> getInvariantValidators() {
    final List<InvariantValidator> validators = new ArrayList<>();
    validators.add(new ShouldActiviteEtreNonSoumise(activite));
    validators.addAll(getDetailsValidators(details));
    return validators;
  }
}
