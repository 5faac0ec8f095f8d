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

package be.uclouvain.osis.admission.doctorat.preparation.validator;

import be.uclouvain.osis.admission.ddd.validation.DataContractValidator;
import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixTypeAdmission;
import java.util.List;

public final class InitierPropositionValidatorList extends TwoStepsValidatorList {
  private final ChoixTypeAdmission typeAdmission;
  private final String justification;
  private final long nombrePropositionsEnCours;
  private final int maximumPropositions;

  public InitierPropositionValidatorList(
      final ChoixTypeAdmission typeAdmission,
      final String justification,
      final long nombrePropositionsEnCours,
      final int maximumPropositions) {
    this.typeAdmission = typeAdmission;
    this.justification = justification;
    this.nombrePropositionsEnCours = nombrePropositionsEnCours;
    this.maximumPropositions = maximumPropositions;
  }

  @Override
  protected List<DataContractValidator> getDataContractValidators() {
    return List.of(new ShouldJustificationDonneeSiPreadmission(typeAdmission, justification));
  }

  @Override
  protected List<InvariantValidator> getInvariantValidators() {
    return List.of(
        new ShouldMaximumPropositionsNonAtteint(nombrePropositionsEnCours, maximumPropositions));
  }
}
