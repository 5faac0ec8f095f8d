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
import be.uclouvain.osis.admission.formationcontinue.model.ChoixStatutPropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.OngletChecklistContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueIdentity;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueNonTrouveeException;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

public final class JooqPropositionContinueRepository
    extends JooqRepository<
        PropositionContinueIdentity,
        PropositionContinue,
        JooqPropositionContinueRepository.PropositionContinueRow>
    implements PropositionContinueRepository {
  static final String TABLE = "continue_proposition";
  static final Field<String> MATRICULE_CANDIDAT =
      DSL.field(DSL.name("matricule_candidat"), SQLDataType.VARCHAR);

  public JooqPropositionContinueRepository(final DSLContext dsl, final ObjectMapper objectMapper) {
    super(dsl, objectMapper, TABLE, "uuid", PropositionContinueRow.class);
  }

  @Override
  protected String key(final PropositionContinueIdentity entityId) {
    return entityId.uuid();
  }

  @Override
  protected Map<Field<?>, Object> indexedColumns(final PropositionContinue entity) {
    return Map.of(MATRICULE_CANDIDAT, entity.getMatriculeCandidat());
  }

  @Override
  protected PropositionContinueRow toRow(final PropositionContinue entity) {
    return new PropositionContinueRow(
        entity.getEntityId().uuid(),
        entity.getMatriculeCandidat(),
        entity.getSigleFormation(),
        entity.getAnnee(),
        entity.getStatut(),
        entity.getChecklist().enMap(),
        entity.getConditionApprobationFacultaire(),
        entity.getMotifMiseEnAttente(),
        entity.getAutreMotifMiseEnAttente(),
        entity.getMotifRefus(),
        entity.getAutreMotifRefus(),
        entity.getMotifAnnulation(),
        entity.getAuteurDerniereModification());
  }

  @Override
  protected PropositionContinue fromRow(final PropositionContinueRow row) {
    return new PropositionContinue(
        new PropositionContinueIdentity(row.uuid()),
        row.matriculeCandidat(),
        row.sigleFormation(),
        row.annee(),
        row.statut(),
        Checklist.depuis(OngletChecklistContinue.class, row.checklist()),
        row.conditionApprobationFacultaire(),
        row.motifMiseEnAttente(),
        row.autreMotifMiseEnAttente(),
        row.motifRefus(),
        row.autreMotifRefus(),
        row.motifAnnulation(),
        row.auteurDerniereModification());
  }

  @Override
  protected EntityNotFoundException notFound(final PropositionContinueIdentity entityId) {
    return new PropositionContinueNonTrouveeException();
  }

  public record PropositionContinueRow(
      String uuid,
      String matriculeCandidat,
      String sigleFormation,
      int annee,
      ChoixStatutPropositionContinue statut,
      Map<String, StatutChecklist> checklist,
      String conditionApprobationFacultaire,
      String motifMiseEnAttente,
      String autreMotifMiseEnAttente,
      String motifRefus,
      String autreMotifRefus,
      String motifAnnulation,
      String auteurDerniereModification) {}
}
