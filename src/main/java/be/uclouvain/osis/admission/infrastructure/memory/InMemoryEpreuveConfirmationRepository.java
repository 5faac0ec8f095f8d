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
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.DemandeProlongation;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmation;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationIdentity;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationRepository;
import java.time.LocalDate;
import java.util.List;

/**
 * {@value #DOCTORAT} has a past attempt and an active one, {@value #DOCTORAT_PROLONGATION} has an
 * extension request waiting for the opinion of the doctoral commission.
 */
public final class InMemoryEpreuveConfirmationRepository
    extends InMemoryRepository<EpreuveConfirmationIdentity, EpreuveConfirmation>
    implements EpreuveConfirmationRepository {
  public static final String DOCTORAT = "uuid-doctorat-SC3DP";
  public static final String DOCTORAT_PROLONGATION = "uuid-doctorat-ECGE3DP";
  public static final String EPREUVE_PASSEE = "uuid-epreuve-passee";
  public static final String EPREUVE_EN_COURS = "uuid-epreuve-en-cours";
  public static final String EPREUVE_PROLONGATION = "uuid-epreuve-prolongation";
  public static final LocalDate DATE_LIMITE_EN_COURS = LocalDate.of(2024, 6, 30);

  @Override
  protected List<EpreuveConfirmation> fixtures() {
    return List.of(
        new EpreuveConfirmation(
            new EpreuveConfirmationIdentity(EPREUVE_PASSEE),
            DOCTORAT,
            LocalDate.of(2023, 6, 30),
            LocalDate.of(2023, 6, 15),
            List.of("uuid-rapport-2023"),
            List.of("uuid-proces-verbal-2023"),
            List.of(),
            null),
        new EpreuveConfirmation(
            new EpreuveConfirmationIdentity(EPREUVE_EN_COURS),
            DOCTORAT,
            DATE_LIMITE_EN_COURS,
            null,
            List.of(),
            List.of(),
            List.of(),
            null),
        new EpreuveConfirmation(
            new EpreuveConfirmationIdentity(EPREUVE_PROLONGATION),
            DOCTORAT_PROLONGATION,
            DATE_LIMITE_EN_COURS,
            null,
            List.of(),
            List.of(),
            List.of(),
            new DemandeProlongation(
                LocalDate.of(2024, 12, 31), "Retard de publication", List.of(), null)));
  }

  @Override
  protected EntityNotFoundException notFound(final EpreuveConfirmationIdentity entityId) {
    return new EpreuveConfirmationNonTrouveeException();
  }

  @Override
  protected EpreuveConfirmation copy(final EpreuveConfirmation entity) {
    return new EpreuveConfirmation(
        entity.getEntityId(),
        entity.getDoctoratUuid(),
        entity.getDateLimite(),
        entity.getDate(),
        entity.getRapportRecherche(),
        entity.getProcesVerbalCa(),
        entity.getAvisRenouvellementMandatRecherche(),
        entity.getDemandeProlongation());
  }

  @Override
  public List<EpreuveConfirmation> searchByDoctorat(final String doctoratUuid) {
    return filter(epreuve -> epreuve.getDoctoratUuid().equals(doctoratUuid)).stream()
        .sorted(EpreuveConfirmation.PLUS_RECENTE_D_ABORD)
        .toList();
  }
}
