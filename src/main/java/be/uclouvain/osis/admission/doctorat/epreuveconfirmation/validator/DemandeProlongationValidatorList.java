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

package be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator;

import be.uclouvain.osis.admission.ddd.validation.DataContractValidator;
import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.DemandeProlongation;
import java.time.LocalDate;
import java.util.List;

/** Incomplete requests are rejected before the deadline rules are looked at. */
public final class DemandeProlongationValidatorList extends TwoStepsValidatorList {
  private final LocalDate nouvelleEcheance;
  private final String justificationSuccincte;
  private final LocalDate dateLimite;
  private final DemandeProlongation demandeActuelle;

  public DemandeProlongationValidatorList(
      final LocalDate nouvelleEcheance,
      final String justificationSuccincte,
      final LocalDate dateLimite,
      final DemandeProlongation demandeActuelle) {
    this.nouvelleEcheance = nouvelleEcheance;
    this.justificationSuccincte = justificationSuccincte;
    this.dateLimite = dateLimite;
    this.demandeActuelle = demandeActuelle;
  }

  @Override
  protected List<DataContractValidator> getDataContractValidators() {
    return List.of(
        new ShouldDemandeProlongationEtreComplete(nouvelleEcheance, justificationSuccincte));
  }

  @Override
  protected List<InvariantValidator> getInvariantValidators() {
    return List.of(
        new ShouldNouvelleEcheanceEtreApresDateLimite(nouvelleEcheance, dateLimite),
        new ShouldAucuneProlongationEtreEnAttente(demandeActuelle));
  }
}
