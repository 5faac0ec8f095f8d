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
import be.uclouvain.osis.admission.doctorat.jury.model.Jury;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryNonTrouveException;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.jooq.DSLContext;

public final class JooqJuryRepository
    extends JooqRepository<JuryIdentity, Jury, JooqJuryRepository.JuryRow>
    implements JuryRepository {
  static final String TABLE = "doctorat_jury";

  public JooqJuryRepository(final DSLContext dsl, final ObjectMapper objectMapper) {
    super(dsl, objectMapper, TABLE, "uuid", JuryRow.class);
  }

  @Override
  protected String key(final JuryIdentity entityId) {
    return entityId.uuid();
  }

  @Override
  protected JuryRow toRow(final Jury entity) {
    return new JuryRow(entity.getEntityId().uuid(), entity.getMembres());
  }

  @Override
  protected Jury fromRow(final JuryRow row) {
    return new Jury(new JuryIdentity(row.uuid()), row.membres());
  }

  @Override
  protected EntityNotFoundException notFound(final JuryIdentity entityId) {
    return new JuryNonTrouveException();
  }

  public record JuryRow(String uuid, List<MembreJury> membres) {
    public JuryRow {
      membres = membres == null ? List.of() : membres;
    }
  }
}
