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

package be.uclouvain.osis.admission.infrastructure.jooq;

import be.uclouvain.osis.admission.ddd.jooq.JooqRepository;
import be.uclouvain.osis.admission.ddd.repository.EntityNotFoundException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.DemandeProlongation;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmation;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationIdentity;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

public final class JooqEpreuveConfirmationRepository
    extends JooqRepository<
        EpreuveConfirmationIdentity,
        EpreuveConfirmation,
        JooqEpreuveConfirmationRepository.EpreuveConfirmationRow>
    implements EpreuveConfirmationRepository {
  static final String TABLE = "epreuve_confirmation";
  static final Field<String> DOCTORAT_UUID =
      DSL.field(DSL.name("doctorat_uuid"), SQLDataType.VARCHAR);

  public JooqEpreuveConfirmationRepository(final DSLContext dsl, final ObjectMapper objectMapper) {
    super(dsl, objectMapper, TABLE, "uuid", EpreuveConfirmationRow.class);
  }

  @Override
  public List<EpreuveConfirmation> searchByDoctorat(final String doctoratUuid) {
    return searchWhere(DOCTORAT_UUID.eq(doctoratUuid)).stream()
        .sorted(EpreuveConfirmation.PLUS_RECENTE_D_ABORD)
        .toList();
  }

  @Override
  protected String key(final EpreuveConfirmationIdentity entityId) {
    return entityId.uuid();
  }

  @Override
  protected Map<Field<?>, Object> indexedColumns(final EpreuveConfirmation entity) {
    return Map.of(DOCTORAT_UUID, entity.getDoctoratUuid());
  }

  @Override
  protected EpreuveConfirmationRow toRow(final EpreuveConfirmation entity) {
    return new EpreuveConfirmationRow(
        entity.getEntityId().uuid(),
        entity.getDoctoratUuid(),
        entity.getDateLimite(),
        entity.getDate(),
        entity.getRapportRecherche(),
        entity.getProcesVerbalCa(),
        entity.getAvisRenouvellementMandatRecherche(),
        entity.getDemandeProlongation());
  }

  @Override
  protected EpreuveConfirmation fromRow(final EpreuveConfirmationRow row) {
    return new EpreuveConfirmation(
        new EpreuveConfirmationIdentity(row.uuid()),
        row.doctoratUuid(),
        row.dateLimite(),
        row.date(),
        row.rapportRecherche(),
        row.procesVerbalCa(),
        row.avisRenouvellementMandatRecherche(),
        row.demandeProlongation());
  }

  @Override
  protected EntityNotFoundException notFound(final EpreuveConfirmationIdentity entityId) {
    return new EpreuveConfirmationNonTrouveeException();
  }

  public record EpreuveConfirmationRow(
      String uuid,
      String doctoratUuid,
      LocalDate dateLimite,
      LocalDate date,
      List<String> rapportRecherche,
      List<String> procesVerbalCa,
      List<String> avisRenouvellementMandatRecherche,
      DemandeProlongation demandeProlongation) {}
}
