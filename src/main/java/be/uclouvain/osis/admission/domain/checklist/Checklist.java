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

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Checklist of a proposition: one {@link StatutChecklist} per tab of the track.
 *
 * @param <O> the tab enumeration of the track
 */
public final class Checklist<O extends Enum<O>> {
  private final Class<O> onglets;
  private final EnumMap<O, StatutChecklist> statuts;

  private Checklist(final Class<O> onglets, final EnumMap<O, StatutChecklist> statuts) {
    this.onglets = onglets;
    this.statuts = statuts;
  }

  /**
   * @param onglets tab enumeration
   * @param initial status given to every tab
   * @return a checklist where each tab is in the initial status
   */
  public static <O extends Enum<O>> Checklist<O> initiale(
      final Class<O> onglets, final ChoixStatutChecklist initial) {
    final EnumMap<O, StatutChecklist> statuts = new EnumMap<>(onglets);
    for (O onglet : onglets.getEnumConstants()) {
      statuts.put(onglet, StatutChecklist.of(onglet.name(), initial));
    }

    return new Checklist<>(onglets, statuts);
  }

  /**
   * Rebuilds a checklist from its stored form. Unknown keys are ignored, missing tabs get an empty
   * status.
   *
   * @param onglets tab enumeration
   * @param stockee statuses keyed by tab name
   * @return the checklist
   */
  public static <O extends Enum<O>> Checklist<O> depuis(
      final Class<O> onglets, final Map<String, StatutChecklist> stockee) {
    final EnumMap<O, StatutChecklist> statuts = new EnumMap<>(onglets);
    for (O onglet : onglets.getEnumConstants()) {
      final StatutChecklist statut = stockee == null ? null : stockee.get(onglet.name());
      statuts.put(onglet, statut == null ? StatutChecklist.of(onglet.name(), null) : statut);
    }

    return new Checklist<>(onglets, statuts);
  }

  public StatutChecklist get(final O onglet) {
    return statuts.get(onglet);
  }

  /**
   * @param onglet to change
   * @param statut new status of the tab
   * @param extra new sub-state of the tab
   */
  public void modifier(
      final O onglet, final ChoixStatutChecklist statut, final Map<String, String> extra) {
    statuts.computeIfPresent(onglet, (cle, actuel) -> actuel.avecStatut(statut, extra));
  }

  /**
   * @param onglet to change
   * @param modification applied to the current status
   */
  public void remplacer(final O onglet, final UnaryOperator<StatutChecklist> modification) {
    statuts.put(onglet, modification.apply(statuts.get(onglet)));
  }

  public Checklist<O> copie() {
    return new Checklist<>(onglets, new EnumMap<>(statuts));
  }

  /**
   * @return statuses keyed by tab name, in tab order
   */
  public Map<String, StatutChecklist> enMap() {
    final Map<String, StatutChecklist> map = new LinkedHashMap<>();
    statuts.forEach((onglet, statut) -> map.put(onglet.name(), statut));
    return map;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Checklist<?> checklist = (Checklist<?>) o;
    return onglets.equals(checklist.onglets) && statuts.equals(checklist.statuts);
  }

  @Override
  public int hashCode() {
    return statuts.hashCode();
  }

  @Override
  public String toString() {
    return "Checklist" + statuts;
  }
}
