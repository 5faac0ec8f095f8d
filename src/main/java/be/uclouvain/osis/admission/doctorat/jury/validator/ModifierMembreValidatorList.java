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

package be.uclouvain.osis.admission.doctorat.jury.validator;

import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import java.util.ArrayList;
import java.util.List;

public final class ModifierMembreValidatorList extends TwoStepsValidatorList {
  private final List<MembreJury> membres;
  private final MembreJury membre;
  private final MembreJury informations;

  public ModifierMembreValidatorList(
      final List<MembreJury> membres, final MembreJury membre, final MembreJury informations) {
    this.membres = List.copyOf(membres);
    this.membre = membre;
    this.informations = informations;
  }

  @Override
  protected List<InvariantValidator> getInvariantValidators() {
    final List<InvariantValidator> validators = new ArrayList<>();
    validators.add(new ShouldMembreNePasEtrePromoteur(membre, PromoteurModifieException::new));
    validators.addAll(
        AjouterMembreValidatorList.informationsMembre(membres, informations, membre.uuid()));
    return validators;
  }
}
