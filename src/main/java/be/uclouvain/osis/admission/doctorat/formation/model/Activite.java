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

package be.uclouvain.osis.admission.doctorat.formation.model;

import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import java.util.Objects;

/** A training activity of a doctorate, submitted to the doctoral commission once complete. */
public final class Activite implements RootEntity<ActiviteIdentity> {
  private final ActiviteIdentity entityId;
  private final String doctoratUuid;
  private final DetailsActivite details;
  private StatutActivite statut;

  public Activite(
      final ActiviteIdentity entityId,
      final String doctoratUuid,
      final StatutActivite statut,
      final DetailsActivite details) {
    this.entityId = entityId;
    this.doctoratUuid = doctoratUuid;
    this.statut = statut;
    this.details = details;
  }

  /** Must only be called once the activity has been validated. */
  public void soumettre() {
    statut = StatutActivite.SOUMISE;
  }

  public CategorieActivite getCategorie() {
    return details.categorie();
  }

  @Override
  public ActiviteIdentity getEntityId() {
    return entityId;
  }

  public String getDoctoratUuid() {
    return doctoratUuid;
  }

  public StatutActivite getStatut() {
    return statut;
  }

  public DetailsActivite getDetails() {
    return details;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Activite activite = (Activite) o;
    return Objects.equals(entityId, activite.entityId)
        && Objects.equals(doctoratUuid, activite.doctoratUuid)
        && Objects.equals(details, activite.details)
        && statut == activite.statut;
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityId, doctoratUuid, details, statut);
  }

  @Override
  public String toString() {
    return "Activite{entityId="
        + entityId
        + ", doctoratUuid="
        + doctoratUuid
        + ", statut="
        + statut
        + ", details="
        + details
        + '}';
  }
}
