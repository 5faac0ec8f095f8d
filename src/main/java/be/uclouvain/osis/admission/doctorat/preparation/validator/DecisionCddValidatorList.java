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

import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.ConfigurationsChecklistDoctorale.DecisionCdd;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.validator.ShouldStatutChecklistNePasCorrespondre;
import be.uclouvain.osis.admission.domain.validator.ShouldStatutEtreParmi;
import java.util.List;
import java.util.Set;

/** Decision of the doctoral commission, while its tab is not closed. */
public final class DecisionCddValidatorList extends TwoStepsValidatorList {
  private final ChoixStatutPropositionDoctorale statut;
  private final Set<ChoixStatutPropositionDoctorale> statutsAutorises;
  private final StatutChecklist decisionCdd;

  public DecisionCddValidatorList(
      final ChoixStatutPropositionDoctorale statut,
      final Set<ChoixStatutPropositionDoctorale> statutsAutorises,
      final StatutChecklist decisionCdd) {
    this.statut = statut;
    this.statutsAutorises = statutsAutorises;
    this.decisionCdd = decisionCdd;
  }

  @Override
  protected List<InvariantValidator> getInvariantValidators() {
    return List.of(
        new ShouldStatutEtreParmi<>(
            statut, statutsAutorises, SituationPropositionNonCddException::new),
        new ShouldStatutChecklistNePasCorrespondre(
            decisionCdd,
            List.of(DecisionCdd.CLOTURE),
            StatutChecklistDecisionCddDoitEtreDifferentClotureException::new));
  }
}
