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

package be.uclouvain.osis.admission.doctorat.supervision.validator;

import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.supervision.model.Signataire;
import java.util.List;

public final class ApprobationPromoteurValidatorList extends TwoStepsValidatorList {
  private final List<Signataire> signataires;
  private final Signataire signataire;
  private final String institutGroupe;
  private final String institut;

  public ApprobationPromoteurValidatorList(
      final List<Signataire> signataires,
      final Signataire signataire,
      final String institutGroupe,
      final String institut) {
    this.signataires = List.copyOf(signataires);
    this.signataire = signataire;
    this.institutGroupe = institutGroupe;
    this.institut = institut;
  }

  @Override
  protected List<InvariantValidator> getInvariantValidators() {
    return List.of(
        new ShouldPremierPromoteurRenseignerInstitutThese(
            signataires, signataire, institutGroupe, institut));
  }
}
