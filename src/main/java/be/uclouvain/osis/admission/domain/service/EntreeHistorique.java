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

package be.uclouvain.osis.admission.domain.service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One line of the audit trail of an object.
 *
 * @param uuid of the entry
 * @param uuidObjet the entry is about, usually a proposition
 * @param auteur of the action
 * @param message describing the action
 * @param tags to filter entries with, e.g. {@code [proposition, decision, status-changed]}
 * @param creeLe time of the action
 */
public record EntreeHistorique(
    String uuid,
    String uuidObjet,
    String auteur,
    String message,
    List<String> tags,
    LocalDateTime creeLe) {
  public EntreeHistorique {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static EntreeHistorique nouvelle(
      final String uuidObjet, final String auteur, final String message, final List<String> tags) {
    return new EntreeHistorique(
        UUID.randomUUID().toString(), uuidObjet, auteur, message, tags, LocalDateTime.now());
  }
}
