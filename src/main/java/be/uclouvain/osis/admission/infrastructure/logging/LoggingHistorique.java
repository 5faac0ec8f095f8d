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

package be.uclouvain.osis.admission.infrastructure.logging;

import be.uclouvain.osis.admission.domain.service.EntreeHistorique;
import be.uclouvain.osis.admission.domain.service.Historique;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes the audit trail to the application log only, nothing can be read back. */
public final class LoggingHistorique implements Historique {
  private static final Logger log = LoggerFactory.getLogger(LoggingHistorique.class);

  @Override
  public void ajouter(final EntreeHistorique entree) {
    log.info(
        "[{}] {} by {}: {} {}",
        entree.uuidObjet(),
        entree.creeLe(),
        entree.auteur(),
        entree.message(),
        entree.tags());
  }

  @Override
  public List<EntreeHistorique> entrees(final String uuidObjet) {
    return List.of();
  }
}
