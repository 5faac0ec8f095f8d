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

package be.uclouvain.osis.admission.domain.document;

import be.uclouvain.osis.admission.domain.model.TypeGestionnaire;

/** Kind of document slot. Free slots are created on demand by managers. */
public enum TypeEmplacementDocument {
  NON_LIBRE(false, true, null),
  LIBRE_RECLAMABLE_SIC(true, true, TypeGestionnaire.SIC),
  LIBRE_RECLAMABLE_FAC(true, true, TypeGestionnaire.FAC),
  LIBRE_INTERNE_SIC(true, false, TypeGestionnaire.SIC),
  LIBRE_INTERNE_FAC(true, false, TypeGestionnaire.FAC),
  SYSTEME(false, false, null);

  private final boolean libre;
  private final boolean reclamable;
  private final TypeGestionnaire gestionnaire;

  TypeEmplacementDocument(
      final boolean libre, final boolean reclamable, final TypeGestionnaire gestionnaire) {
    this.libre = libre;
    this.reclamable = reclamable;
    this.gestionnaire = gestionnaire;
  }

  public boolean estLibre() {
    return libre;
  }

  /**
   * @return {@code true} if the slot can be requested from the candidate
   */
  public boolean estReclamable() {
    return reclamable;
  }

  /**
   * @return {@code true} if only managers see the slot
   */
  public boolean estInterne() {
    return !reclamable;
  }

  /**
   * @return the body owning a free slot, {@code null} otherwise
   */
  public TypeGestionnaire getGestionnaire() {
    return gestionnaire;
  }

  /**
   * @return prefix of the identifier of a free slot
   * @throws IllegalStateException if the slot is not free
   */
  public String prefixeIdentifiantLibre() {
    if (!libre) {
      throw new IllegalStateException("%s slots have fixed identifiers".formatted(name()));
    }

    return reclamable ? "LIBRE_CANDIDAT" : "LIBRE_GESTIONNAIRE";
  }
}
