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

import be.uclouvain.osis.admission.ddd.repository.EntityNotFoundException;
import be.uclouvain.osis.admission.ddd.repository.InMemoryRepository;
import be.uclouvain.osis.admission.doctorat.formation.model.Activite;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteIdentity;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteRepository;
import be.uclouvain.osis.admission.doctorat.formation.model.DetailsActivite;
import be.uclouvain.osis.admission.doctorat.formation.model.StatutActivite;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public final class InMemoryActiviteRepository extends InMemoryRepository<ActiviteIdentity, Activite>
    implements ActiviteRepository {
  public static final String DOCTORAT = InMemoryEpreuveConfirmationRepository.DOCTORAT;
  public static final String AUTRE_DOCTORAT =
      InMemoryEpreuveConfirmationRepository.DOCTORAT_PROLONGATION;

  public static final String CONFERENCE_COMPLETE = "uuid-conference-complete";
  public static final String SEMINAIRE_COMPLET = "uuid-seminaire-complet";
  public static final String COMMUNICATION_INCOMPLETE = "uuid-communication-incomplete";
  public static final String PUBLICATION_INCOMPLETE = "uuid-publication-incomplete";
  public static final String SERVICE_DATES_INCOHERENTES = "uuid-service-dates-incoherentes";
  public static final String COURS_SOUMIS = "uuid-cours-soumis";
  public static final String CONFERENCE_AUTRE_DOCTORAT = "uuid-conference-autre-doctorat";

  @Override
  protected List<Activite> fixtures() {
    final LocalDate debut = LocalDate.of(2024, 3, 4);
    final LocalDate fin = LocalDate.of(2024, 3, 6);
    return List.of(
        activite(
            CONFERENCE_COMPLETE,
            DOCTORAT,
            StatutActivite.NON_SOUMISE,
            new DetailsActivite.Conference(
                "Colloque", "Journées de chimie", debut, fin, "BE", "Namur", BigDecimal.ONE)),
        activite(
            SEMINAIRE_COMPLET,
            DOCTORAT,
            StatutActivite.NON_SOUMISE,
            new DetailsActivite.Seminaire("Atelier", "Méthodes numériques", debut, fin, 12)),
        activite(
            COMMUNICATION_INCOMPLETE,
            DOCTORAT,
            StatutActivite.NON_SOUMISE,
            new DetailsActivite.Communication("Poster", null, debut, BigDecimal.ONE)),
        activite(
            PUBLICATION_INCOMPLETE,
            DOCTORAT,
            StatutActivite.NON_SOUMISE,
            new DetailsActivite.Publication("Article", "Catalyse", null, null, BigDecimal.TEN)),
        activite(
            SERVICE_DATES_INCOHERENTES,
            DOCTORAT,
            StatutActivite.NON_SOUMISE,
            new DetailsActivite.Service("Encadrement", "Travaux pratiques", fin, debut, 30)),
        activite(
            COURS_SOUMIS,
            DOCTORAT,
            StatutActivite.SOUMISE,
            new DetailsActivite.Cours("LCHM2131", debut, fin, new BigDecimal("5"))),
        activite(
            CONFERENCE_AUTRE_DOCTORAT,
            AUTRE_DOCTORAT,
            StatutActivite.NON_SOUMISE,
            new DetailsActivite.Conference(
                "Colloque", "Economics days", debut, fin, "FR", "Lille", BigDecimal.ONE)));
  }

  @Override
  protected EntityNotFoundException notFound(final ActiviteIdentity entityId) {
    return new ActiviteNonTrouveeException();
  }

  @Override
  protected Activite copy(final Activite entity) {
    return new Activite(
        entity.getEntityId(), entity.getDoctoratUuid(), entity.getStatut(), entity.getDetails());
  }

  private static Activite activite(
      final String uuid,
      final String doctoratUuid,
      final StatutActivite statut,
      final DetailsActivite details) {
    return new Activite(new ActiviteIdentity(uuid), doctoratUuid, statut, details);
  }
}
