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
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;
import be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale;
import be.uclouvain.osis.admission.generale.model.OngletChecklistGenerale;
import be.uclouvain.osis.admission.generale.model.PropositionGenerale;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleIdentity;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleNonTrouveeException;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

public final class JooqPropositionGeneraleRepository
    extends JooqRepository<
        PropositionGeneraleIdentity,
        PropositionGenerale,
        JooqPropositionGeneraleRepository.PropositionGeneraleRow>
    implements PropositionGeneraleRepository {
  static final String TABLE = "generale_proposition";
  static final Field<String> MATRICULE_CANDIDAT =
      DSL.field(DSL.name("matricule_candidat"), SQLDataType.VARCHAR);

  public JooqPropositionGeneraleRepository(final DSLContext dsl, final ObjectMapper objectMapper) {
    super(dsl, objectMapper, TABLE, "uuid", PropositionGeneraleRow.class);
  }

  @Override
  protected String key(final PropositionGeneraleIdentity entityId) {
    return entityId.uuid();
  }

  @Override
  protected Map<Field<?>, Object> indexedColumns(final PropositionGenerale entity) {
    return Map.of(MATRICULE_CANDIDAT, entity.getMatriculeCandidat());
  }

  @Override
  protected PropositionGeneraleRow toRow(final PropositionGenerale entity) {
    return new PropositionGeneraleRow(
        entity.getEntityId().uuid(),
        entity.getMatriculeCandidat(),
        entity.getSigleFormation(),
        entity.getAnnee(),
        entity.getStatut(),
        entity.getChecklist().enMap(),
        entity.getMotifsRefus().stream().map(MotifRefusIdentity::uuid).toList(),
        entity.getAutresMotifsRefus(),
        entity.getAuteurDerniereModification());
  }

  @Override
  protected PropositionGenerale fromRow(final PropositionGeneraleRow row) {
    return new PropositionGenerale(
        new PropositionGeneraleIdentity(row.uuid()),
        row.matriculeCandidat(),
        row.sigleFormation(),
        row.annee(),
        row.statut(),
        Checklist.depuis(OngletChecklistGenerale.class, row.checklist()),
        row.motifsRefus().stream().map(MotifRefusIdentity::new).toList(),
        row.autresMotifsRefus(),
        row.auteurDerniereModification());
  }

  @Override
  protected EntityNotFoundException notFound(final PropositionGeneraleIdentity entityId) {
    return new PropositionGeneraleNonTrouveeException();
  }

  public record PropositionGeneraleRow(
      String uuid,
      String matriculeCandidat,
      String sigleFormation,
      int annee,
      ChoixStatutPropositionGenerale statut,
      Map<String, StatutChecklist> checklist,
      List<String> motifsRefus,
      List<String> autresMotifsRefus,
      String auteurDerniereModification) {
    public PropositionGeneraleRow {
      motifsRefus = motifsRefus == null ? List.of() : motifsRefus;
    }
  }
}
