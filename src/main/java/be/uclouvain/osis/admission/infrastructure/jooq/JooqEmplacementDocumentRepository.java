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
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentNonTrouveException;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import be.uclouvain.osis.admission.domain.document.StatutEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.StatutReclamationEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.TypeEmplacementDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/** Document slots keyed by {@code <proposition uuid>/<slot identifier>}. */
public final class JooqEmplacementDocumentRepository
    extends JooqRepository<
        EmplacementDocumentIdentity,
        EmplacementDocument,
        JooqEmplacementDocumentRepository.EmplacementDocumentRow>
    implements EmplacementDocumentRepository {
  static final String TABLE = "emplacement_document";
  static final Field<String> PROPOSITION_UUID =
      DSL.field(DSL.name("proposition_uuid"), SQLDataType.VARCHAR);

  public JooqEmplacementDocumentRepository(final DSLContext dsl, final ObjectMapper objectMapper) {
    super(dsl, objectMapper, TABLE, "id", EmplacementDocumentRow.class);
  }

  @Override
  public List<EmplacementDocument> searchByProposition(final String propositionUuid) {
    return searchWhere(PROPOSITION_UUID.eq(propositionUuid));
  }

  @Override
  protected String key(final EmplacementDocumentIdentity entityId) {
    return entityId.toString();
  }

  @Override
  protected Map<Field<?>, Object> indexedColumns(final EmplacementDocument entity) {
    return Map.of(PROPOSITION_UUID, entity.getEntityId().propositionUuid());
  }

  @Override
  protected EmplacementDocumentRow toRow(final EmplacementDocument entity) {
    return new EmplacementDocumentRow(
        entity.getEntityId().identifiant(),
        entity.getEntityId().propositionUuid(),
        entity.getType(),
        entity.getLibelle(),
        entity.getStatut(),
        entity.getStatutReclamation(),
        entity.getRaison(),
        entity.getUuidsDocuments(),
        entity.getJustificationGestionnaire(),
        entity.getDateLimiteReclamation(),
        entity.getReclameLe(),
        entity.getDernierActeur(),
        entity.getDerniereActionLe());
  }

  @Override
  protected EmplacementDocument fromRow(final EmplacementDocumentRow row) {
    return new EmplacementDocument(
        new EmplacementDocumentIdentity(row.identifiant(), row.propositionUuid()),
        row.type(),
        row.libelle(),
        row.statut(),
        row.statutReclamation(),
        row.raison(),
        row.uuidsDocuments(),
        row.justificationGestionnaire(),
        row.dateLimiteReclamation(),
        row.reclameLe(),
        row.dernierActeur(),
        row.derniereActionLe());
  }

  @Override
  protected EntityNotFoundException notFound(final EmplacementDocumentIdentity entityId) {
    return new EmplacementDocumentNonTrouveException(entityId);
  }

  public record EmplacementDocumentRow(
      String identifiant,
      String propositionUuid,
      TypeEmplacementDocument type,
      String libelle,
      StatutEmplacementDocument statut,
      StatutReclamationEmplacementDocument statutReclamation,
      String raison,
      List<String> uuidsDocuments,
      String justificationGestionnaire,
      LocalDate dateLimiteReclamation,
      LocalDateTime reclameLe,
      String dernierActeur,
      LocalDateTime derniereActionLe) {}
}
