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
import be.uclouvain.osis.admission.doctorat.supervision.model.ChoixStatutSignatureGroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionIdentity;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionNonTrouveException;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.doctorat.supervision.model.Signataire;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.jooq.DSLContext;

public final class JooqGroupeDeSupervisionRepository
    extends JooqRepository<
        GroupeDeSupervisionIdentity,
        GroupeDeSupervision,
        JooqGroupeDeSupervisionRepository.GroupeRow>
    implements GroupeDeSupervisionRepository {
  static final String TABLE = "doctorat_groupe_supervision";

  public JooqGroupeDeSupervisionRepository(
      final DSLContext dsl, final ObjectMapper objectMapper) {
    super(dsl, objectMapper, TABLE, "uuid", GroupeRow.class);
  }

  @Override
  protected String key(final GroupeDeSupervisionIdentity entityId) {
    return entityId.uuid();
  }

  @Override
  protected GroupeRow toRow(final GroupeDeSupervision entity) {
    return new GroupeRow(
        entity.getEntityId().uuid(),
        entity.getStatutSignature(),
        entity.getSignataires(),
        entity.getPromoteurReference(),
        entity.getInstitutThese());
  }

  @Override
  protected GroupeDeSupervision fromRow(final GroupeRow row) {
    return new GroupeDeSupervision(
        new GroupeDeSupervisionIdentity(row.uuid()),
        row.statutSignature(),
        row.signataires(),
        row.promoteurReference(),
        row.institutThese());
  }

  @Override
  protected EntityNotFoundException notFound(final GroupeDeSupervisionIdentity entityId) {
    return new GroupeDeSupervisionNonTrouveException();
  }

  public record GroupeRow(
      String uuid,
      ChoixStatutSignatureGroupeDeSupervision statutSignature,
      List<Signataire> signataires,
      String promoteurReference,
      String institutThese) {
    public GroupeRow {
      signataires = signataires == null ? List.of() : signataires;
    }
  }
}
