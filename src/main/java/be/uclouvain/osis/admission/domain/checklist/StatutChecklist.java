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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one checklist tab.
 *
 * <p>{@code extra} carries the sub-state of the tab, e.g. {@code {en_cours=refusal}}. Children are
 * used by the previous experience tab, one per experience, identified by {@code
 * extra[identifiant]}.
 *
 * @param libelle of the tab
 * @param statut current status, may be {@code null} for a tab which was never initialised
 * @param extra sub-state
 * @param enfants child statuses
 */
public record StatutChecklist(
    String libelle,
    ChoixStatutChecklist statut,
    Map<String, String> extra,
    List<StatutChecklist> enfants) {
  public static final String IDENTIFIANT = "identifiant";

  public StatutChecklist {
    libelle = libelle == null ? "" : libelle;
    extra = extra == null ? Map.of() : Map.copyOf(extra);
    enfants = enfants == null ? List.of() : List.copyOf(enfants);
  }

  public static StatutChecklist of(final String libelle, final ChoixStatutChecklist statut) {
    return new StatutChecklist(libelle, statut, Map.of(), List.of());
  }

  public static StatutChecklist of(
      final String libelle, final ChoixStatutChecklist statut, final Map<String, String> extra) {
    return new StatutChecklist(libelle, statut, extra, List.of());
  }

  /**
   * @param nouveauStatut of the tab
   * @param nouvelExtra replacing the current one
   * @return a copy with the given status, children are kept
   */
  public StatutChecklist avecStatut(
      final ChoixStatutChecklist nouveauStatut, final Map<String, String> nouvelExtra) {
    return new StatutChecklist(libelle, nouveauStatut, nouvelExtra, enfants);
  }

  /**
   * @param cle of the extra entry
   * @param valeur of the extra entry
   * @return a copy with the extra entry added or replaced
   */
  public StatutChecklist avecExtra(final String cle, final String valeur) {
    final Map<String, String> copie = new HashMap<>(extra);
    copie.put(cle, valeur);
    return new StatutChecklist(libelle, statut, copie, enfants);
  }

  public Optional<StatutChecklist> enfant(final String identifiant) {
    return enfants.stream()
        .filter(enfant -> Objects.equals(enfant.extra().get(IDENTIFIANT), identifiant))
        .findFirst();
  }

  /**
   * @param enfant to add, or to replace if a child with the same identifier exists
   * @return a copy with the given child
   * @throws IllegalArgumentException if the child has no identifier
   */
  public StatutChecklist avecEnfant(final StatutChecklist enfant) {
    final String identifiant = enfant.extra().get(IDENTIFIANT);
    if (identifiant == null) {
      throw new IllegalArgumentException("Child status must define extra[identifiant]");
    }

    final List<StatutChecklist> nouveauxEnfants = new ArrayList<>(enfants);
    nouveauxEnfants.removeIf(existant -> identifiant.equals(existant.extra().get(IDENTIFIANT)));
    nouveauxEnfants.add(enfant);
    return new StatutChecklist(libelle, statut, extra, nouveauxEnfants);
  }
}
