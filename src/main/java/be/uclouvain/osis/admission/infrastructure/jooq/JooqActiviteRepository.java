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
import be.uclouvain.osis.admission.doctorat.formation.model.Activite;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteIdentity;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.formation.model.ActiviteRepository;
import be.uclouvain.osis.admission.doctorat.formation.model.CategorieActivite;
import be.uclouvain.osis.admission.doctorat.formation.model.DetailsActivite;
import be.uclouvain.osis.admission.doctorat.formation.model.StatutActivite;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.EnumMap;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/** Activities store their category next to the details, which are read back with its class. */
public final class JooqActiviteRepository
    extends JooqRepository<ActiviteIdentity, Activite, JooqActiviteRepository.ActiviteRow>
    implements ActiviteRepository {
  static final String TABLE = "doctorat_activite";
  static final Field<String> DOCTORAT_UUID =
      DSL.field(DSL.name("doctorat_uuid"), SQLDataType.VARCHAR);

  private static final Map<CategorieActivite, Class<? extends DetailsActivite>> DETAILS =
      new EnumMap<>(CategorieActivite.class);

  static {
    DETAILS.put(CategorieActivite.CONFERENCE, DetailsActivite.Conference.class);
    DETAILS.put(CategorieActivite.COMMUNICATION, DetailsActivite.Communication.class);
    DETAILS.put(CategorieActivite.PUBLICATION, DetailsActivite.Publication.class);
    DETAILS.put(CategorieActivite.SEMINAIRE, DetailsActivite.Seminaire.class);
    DETAILS.put(CategorieActivite.SERVICE, DetailsActivite.Service.class);
    DETAILS.put(CategorieActivite.COURS, DetailsActivite.Cours.class);
  }

  private final ObjectMapper objectMapper;

  public JooqActiviteRepository(final DSLContext dsl, final ObjectMapper objectMapper) {
    super(dsl, objectMapper, TABLE, "uuid", ActiviteRow.class);
    this.objectMapper = objectMapper;
  }

  @Override
  protected String key(final ActiviteIdentity entityId) {
    return entityId.uuid();
  }

  @Override
  protected Map<Field<?>, Object> indexedColumns(final Activite entity) {
    return Map.of(DOCTORAT_UUID, entity.getDoctoratUuid());
  }

  @Override
  protected ActiviteRow toRow(final Activite entity) {
    return new ActiviteRow(
        entity.getEntityId().uuid(),
        entity.getDoctoratUuid(),
        entity.getStatut(),
        entity.getCategorie(),
        objectMapper.valueToTree(entity.getDetails()));
  }

  @Override
  protected Activite fromRow(final ActiviteRow row) {
    try {
      return new Activite(
          new ActiviteIdentity(row.uuid()),
          row.doctoratUuid(),
          row.statut(),
          objectMapper.treeToValue(row.details(), DETAILS.get(row.categorie())));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Cannot read %s details of activity %s".formatted(row.categorie(), row.uuid()), e);
    }
  }

  @Override
  protected EntityNotFoundException notFound(final ActiviteIdentity entityId) {
    return new ActiviteNonTrouveeException();
  }

  public record ActiviteRow(
      String uuid,
      String doctoratUuid,
      StatutActivite statut,
      CategorieActivite categorie,
      JsonNode details) {}
}
