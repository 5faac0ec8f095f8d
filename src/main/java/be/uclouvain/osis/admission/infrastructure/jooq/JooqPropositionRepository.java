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
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixTypeAdmission;
import be.uclouvain.osis.admission.doctorat.preparation.model.OngletChecklistDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

public final class JooqPropositionRepository
    extends JooqRepository<
        PropositionIdentity, Proposition, JooqPropositionRepository.PropositionRow>
    implements PropositionRepository {
  static final String TABLE = "doctorat_proposition";
  static final Field<String> MATRICULE_CANDIDAT =
      DSL.field(DSL.name("matricule_candidat"), SQLDataType.VARCHAR);
  static final Field<String> STATUT = DSL.field(DSL.name("statut"), SQLDataType.VARCHAR);

  public JooqPropositionRepository(final DSLContext dsl, final ObjectMapper objectMapper) {
    super(dsl, objectMapper, TABLE, "uuid", PropositionRow.class);
  }

  @Override
  public List<Proposition> searchByMatricule(final String matriculeCandidat) {
    return searchWhere(MATRICULE_CANDIDAT.eq(matriculeCandidat));
  }

  @Override
  protected String key(final PropositionIdentity entityId) {
    return entityId.uuid();
  }

  @Override
  protected Map<Field<?>, Object> indexedColumns(final Proposition entity) {
    return Map.of(
        MATRICULE_CANDIDAT, entity.getMatriculeCandidat(), STATUT, entity.getStatut().name());
  }

  @Override
  protected PropositionRow toRow(final Proposition entity) {
    return new PropositionRow(
        entity.getEntityId().uuid(),
        entity.getTypeAdmission(),
        entity.getJustification(),
        entity.getSigleFormation(),
        entity.getAnnee(),
        entity.getMatriculeCandidat(),
        entity.getReference(),
        entity.getStatut(),
        entity.getChecklist().enMap(),
        entity.getMotifsRefus().stream().map(MotifRefusIdentity::uuid).toList(),
        entity.getAutresMotifsRefus(),
        entity.getReponsesQuestionsSpecifiques(),
        entity.getComplementsFormation(),
        entity.getNombreAnneesPrevoirProgramme(),
        entity.getAuteurDerniereModification(),
        entity.getCreeLe(),
        entity.getModifieeLe());
  }

  @Override
  protected Proposition fromRow(final PropositionRow row) {
    return new Proposition(
        new PropositionIdentity(row.uuid()),
        row.typeAdmission(),
        row.justification(),
        row.sigleFormation(),
        row.annee(),
        row.matriculeCandidat(),
        row.reference(),
        row.statut(),
        Checklist.depuis(OngletChecklistDoctorale.class, row.checklist()),
        row.motifsRefus().stream().map(MotifRefusIdentity::new).toList(),
        row.autresMotifsRefus(),
        row.reponsesQuestionsSpecifiques(),
        row.complementsFormation(),
        row.nombreAnneesPrevoirProgramme(),
        row.auteurDerniereModification(),
        row.creeLe(),
        row.modifieeLe());
  }

  @Override
  protected EntityNotFoundException notFound(final PropositionIdentity entityId) {
    return new PropositionNonTrouveeException();
  }

  /** Stored form of a {@link Proposition}. */
  public record PropositionRow(
      String uuid,
      ChoixTypeAdmission typeAdmission,
      String justification,
      String sigleFormation,
      int annee,
      String matriculeCandidat,
      String reference,
      ChoixStatutPropositionDoctorale statut,
      Map<String, StatutChecklist> checklist,
      List<String> motifsRefus,
      List<String> autresMotifsRefus,
      Map<String, String> reponsesQuestionsSpecifiques,
      Boolean complementsFormation,
      Integer nombreAnneesPrevoirProgramme,
      String auteurDerniereModification,
      LocalDateTime creeLe,
      LocalDateTime modifieeLe) {
    public PropositionRow {
      motifsRefus = motifsRefus == null ? List.of() : motifsRefus;
    }
  }
}
