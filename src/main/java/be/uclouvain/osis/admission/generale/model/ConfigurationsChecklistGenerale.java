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

package be.uclouvain.osis.admission.generale.model;

import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_BLOCAGE;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_EN_COURS;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_REUSSITE;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.INITIAL_CANDIDAT;

import be.uclouvain.osis.admission.domain.checklist.ConfigurationStatutChecklist;
import java.util.Map;

public final class ConfigurationsChecklistGenerale {
  private ConfigurationsChecklistGenerale() {
    // Constants holder
  }

  /** {@link OngletChecklistGenerale#DECISION_FACULTAIRE} */
  public static final class DecisionFacultaire {
    public static final ConfigurationStatutChecklist A_TRAITER =
        new ConfigurationStatutChecklist("A_TRAITER", INITIAL_CANDIDAT);
    public static final ConfigurationStatutChecklist REFUS =
        new ConfigurationStatutChecklist("REFUS", GEST_BLOCAGE, Map.of("decision", "1"));
    public static final ConfigurationStatutChecklist APPROUVE =
        new ConfigurationStatutChecklist("APPROUVE", GEST_REUSSITE);

    private DecisionFacultaire() {}
  }

  /** {@link OngletChecklistGenerale#DECISION_SIC} */
  public static final class DecisionSic {
    public static final ConfigurationStatutChecklist REFUS_A_VALIDER =
        new ConfigurationStatutChecklist(
            "REFUS_A_VALIDER", GEST_EN_COURS, Map.of("en_cours", "refusal"));

    private DecisionSic() {}
  }
}
