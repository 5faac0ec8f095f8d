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

package be.uclouvain.osis.admission.doctorat.preparation.model;

import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_BLOCAGE;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_EN_COURS;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_REUSSITE;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.INITIAL_CANDIDAT;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.INITIAL_NON_CONCERNE;

import be.uclouvain.osis.admission.domain.checklist.ConfigurationStatutChecklist;
import java.util.List;
import java.util.Map;

/** Named states of the decision tabs of a doctoral proposition. */
public final class ConfigurationsChecklistDoctorale {
  private ConfigurationsChecklistDoctorale() {
    // Constants holder
  }

  /** {@link OngletChecklistDoctorale#DECISION_SIC} */
  public static final class DecisionSic {
    public static final ConfigurationStatutChecklist A_TRAITER =
        new ConfigurationStatutChecklist("A_TRAITER", INITIAL_CANDIDAT);
    public static final ConfigurationStatutChecklist A_COMPLETER =
        new ConfigurationStatutChecklist(
            "A_COMPLETER", GEST_BLOCAGE, Map.of("blocage", "to_be_completed"));
    public static final ConfigurationStatutChecklist BESOIN_DEROGATION =
        new ConfigurationStatutChecklist(
            "BESOIN_DEROGATION", GEST_EN_COURS, Map.of("en_cours", "derogation"));
    public static final ConfigurationStatutChecklist REFUS_A_VALIDER =
        new ConfigurationStatutChecklist(
            "REFUS_A_VALIDER", GEST_EN_COURS, Map.of("en_cours", "refusal"));
    public static final ConfigurationStatutChecklist AUTORISATION_A_VALIDER =
        new ConfigurationStatutChecklist(
            "AUTORISATION_A_VALIDER", GEST_EN_COURS, Map.of("en_cours", "approval"));
    public static final ConfigurationStatutChecklist CLOTURE =
        new ConfigurationStatutChecklist("CLOTURE", GEST_BLOCAGE, Map.of("blocage", "closed"));
    public static final ConfigurationStatutChecklist REFUSE =
        new ConfigurationStatutChecklist("REFUSE", GEST_BLOCAGE, Map.of("blocage", "refusal"));
    public static final ConfigurationStatutChecklist AUTORISE =
        new ConfigurationStatutChecklist("AUTORISE", GEST_REUSSITE);

    private DecisionSic() {}
  }

  /** {@link OngletChecklistDoctorale#DECISION_CDD} */
  public static final class DecisionCdd {
    public static final ConfigurationStatutChecklist A_TRAITER =
        new ConfigurationStatutChecklist("A_TRAITER", INITIAL_CANDIDAT);
    public static final ConfigurationStatutChecklist PRIS_EN_CHARGE =
        new ConfigurationStatutChecklist("PRIS_EN_CHARGE", GEST_EN_COURS);
    public static final ConfigurationStatutChecklist A_COMPLETER_PAR_SIC =
        new ConfigurationStatutChecklist(
            "A_COMPLETER_PAR_SIC", GEST_BLOCAGE, Map.of("decision", "HORS_DECISION"));
    public static final ConfigurationStatutChecklist CLOTURE =
        new ConfigurationStatutChecklist("CLOTURE", GEST_BLOCAGE, Map.of("decision", "CLOTURE"));
    public static final ConfigurationStatutChecklist REFUS =
        new ConfigurationStatutChecklist("REFUS", GEST_BLOCAGE, Map.of("decision", "EN_DECISION"));
    public static final ConfigurationStatutChecklist ACCORD =
        new ConfigurationStatutChecklist("ACCORD", GEST_REUSSITE);

    public static final List<ConfigurationStatutChecklist> TOUTES =
        List.of(A_TRAITER, PRIS_EN_CHARGE, A_COMPLETER_PAR_SIC, CLOTURE, REFUS, ACCORD);

    private DecisionCdd() {}
  }

  /** {@link OngletChecklistDoctorale#FINANCABILITE} states accepted by the SIC approval. */
  public static final List<ConfigurationStatutChecklist> FINANCABILITE_VALIDEE =
      List.of(
          new ConfigurationStatutChecklist("NON_CONCERNE", INITIAL_NON_CONCERNE),
          new ConfigurationStatutChecklist("FINANCABLE", GEST_REUSSITE));

  /** {@link OngletChecklistDoctorale#PARCOURS_ANTERIEUR} state accepted by the SIC approval. */
  public static final ConfigurationStatutChecklist PARCOURS_ANTERIEUR_SUFFISANT =
      new ConfigurationStatutChecklist("SUFFISANT", GEST_REUSSITE);
}
