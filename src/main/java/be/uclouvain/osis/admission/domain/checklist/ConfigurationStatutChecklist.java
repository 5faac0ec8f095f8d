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

package be.uclouvain.osis.admission.domain.checklist;

import java.util.Map;

/**
 * Named state of a checklist tab, e.g. {@code REFUSE} is {@code GEST_BLOCAGE} with {@code
 * {blocage=refusal}}.
 *
 * @param identifiant of the configuration
 * @param statut expected status
 * @param extra entries which must be present with the same values
 */
public record ConfigurationStatutChecklist(
    String identifiant, ChoixStatutChecklist statut, Map<String, String> extra) {
  public ConfigurationStatutChecklist {
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  public ConfigurationStatutChecklist(final String identifiant, final ChoixStatutChecklist statut) {
    this(identifiant, statut, Map.of());
  }

  /**
   * @param actuel status to check
   * @return {@code true} if the status is the same and {@link #extra()} is a subset of the actual
   *     extra
   */
  public boolean matches(final StatutChecklist actuel) {
    return actuel != null
        && statut != null
        && statut == actuel.statut()
        && actuel.extra().entrySet().containsAll(extra.entrySet());
  }

  /**
   * @param libelle of the tab
   * @return a tab state matching this configuration
   */
  public StatutChecklist enStatut(final String libelle) {
    return StatutChecklist.of(libelle, statut, extra);
  }
}
