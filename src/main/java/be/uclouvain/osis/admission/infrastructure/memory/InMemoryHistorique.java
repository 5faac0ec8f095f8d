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

package be.uclouvain.osis.admission.infrastructure.memory;

import be.uclouvain.osis.admission.domain.service.EntreeHistorique;
import be.uclouvain.osis.admission.domain.service.Historique;
import java.util.ArrayList;
import java.util.List;

public final class InMemoryHistorique implements Historique {
  private final List<EntreeHistorique> entrees = new ArrayList<>();

  @Override
  public synchronized void ajouter(final EntreeHistorique entree) {
    entrees.add(entree);
  }

  @Override
  public synchronized List<EntreeHistorique> entrees(final String uuidObjet) {
    return entrees.stream().filter(entree -> entree.uuidObjet().equals(uuidObjet)).toList();
  }

  public synchronized void reset() {
    entrees.clear();
  }
}
