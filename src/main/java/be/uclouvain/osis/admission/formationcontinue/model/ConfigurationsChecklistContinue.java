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

package be.uclouvain.osis.admission.formationcontinue.model;

import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_BLOCAGE;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_EN_COURS;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.GEST_REUSSITE;
import static be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist.INITIAL_CANDIDAT;

import be.uclouvain.osis.admission.domain.checklist.ConfigurationStatutChecklist;
import java.util.List;
import java.util.Map;

/** Named states of {@link OngletChecklistContinue#DECISION}. */
public final class ConfigurationsChecklistContinue {
  public static final ConfigurationStatutChecklist A_TRAITER =
      new ConfigurationStatutChecklist("A_TRAITER", INITIAL_CANDIDAT);
  public static final ConfigurationStatutChecklist PRISE_EN_CHARGE =
      new ConfigurationStatutChecklist(
          "PRISE_EN_CHARGE", GEST_EN_COURS, Map.of("en_cours", "taken_in_charge"));
  public static final ConfigurationStatutChecklist EN_ATTENTE =
      new ConfigurationStatutChecklist("EN_ATTENTE", GEST_EN_COURS, Map.of("en_cours", "on_hold"));
  public static final ConfigurationStatutChecklist APPROUVEE_PAR_FAC =
      new ConfigurationStatutChecklist(
          "APPROUVEE_PAR_FAC", GEST_EN_COURS, Map.of("en_cours", "fac_approval"));
  public static final ConfigurationStatutChecklist A_VALIDER =
      new ConfigurationStatutChecklist(
          "A_VALIDER", GEST_EN_COURS, Map.of("en_cours", "to_validate"));
  public static final ConfigurationStatutChecklist REFUSEE =
      new ConfigurationStatutChecklist("REFUSEE", GEST_BLOCAGE, Map.of("blocage", "denied"));
  public static final ConfigurationStatutChecklist ANNULEE =
      new ConfigurationStatutChecklist("ANNULEE", GEST_BLOCAGE, Map.of("blocage", "canceled"));
  public static final ConfigurationStatutChecklist CLOTUREE =
      new ConfigurationStatutChecklist("CLOTUREE", GEST_BLOCAGE, Map.of("blocage", "closed"));
  public static final ConfigurationStatutChecklist VALIDEE =
      new ConfigurationStatutChecklist("VALIDEE", GEST_REUSSITE);

  /** States from which no decision can be taken anymore, except closing. */
  public static final List<ConfigurationStatutChecklist> FINALES =
      List.of(CLOTUREE, REFUSEE, ANNULEE, VALIDEE);

  private ConfigurationsChecklistContinue() {
    // Constants holder
  }
}
