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
import be.uclouvain.osis.admission.doctorat.supervision.model.TypeSignataire;
import java.util.List;

/** Composition required before the signatures can be requested. */
public final class SignatairesValidatorList extends TwoStepsValidatorList {
  private final List<Signataire> signataires;
  private final String promoteurReference;

  public SignatairesValidatorList(
      final List<Signataire> signataires, final String promoteurReference) {
    this.signataires = List.copyOf(signataires);
    this.promoteurReference = promoteurReference;
  }

  @Override
  protected List<InvariantValidator> getInvariantValidators() {
    return List.of(
        new ShouldGroupeAvoirSignataire(
            signataires, TypeSignataire.PROMOTEUR, PromoteurManquantException::new),
        new ShouldGroupeAvoirSignataire(
            signataires, TypeSignataire.MEMBRE_CA, MembreCAManquantException::new),
        new ShouldGroupeAvoirUnPromoteurDeReference(signataires, promoteurReference));
  }
}
