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

import be.uclouvain.osis.admission.doctorat.preparation.model.DoctoratDTO;
import be.uclouvain.osis.admission.doctorat.preparation.model.DoctoratTranslator;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/** Reads the doctoral trainings from the {@code doctorat_formation} catalogue table. */
public final class JooqDoctoratTranslator implements DoctoratTranslator {
  private static final Table<Record> DOCTORAT_FORMATION = DSL.table(DSL.name("doctorat_formation"));
  private static final Field<String> SIGLE = DSL.field(DSL.name("sigle"), SQLDataType.VARCHAR);
  private static final Field<Integer> ANNEE = DSL.field(DSL.name("annee"), SQLDataType.INTEGER);
  private static final Field<String> INTITULE =
      DSL.field(DSL.name("intitule"), SQLDataType.VARCHAR);
  private static final Field<String> SIGLE_ENTITE_GESTION =
      DSL.field(DSL.name("sigle_entite_gestion"), SQLDataType.VARCHAR);

  private final DSLContext dsl;

  public JooqDoctoratTranslator(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext cannot be null");
    }

    this.dsl = dsl;
  }

  @Override
  public Optional<DoctoratDTO> get(final String sigle, final int annee) {
    return dsl.select(SIGLE, ANNEE, INTITULE, SIGLE_ENTITE_GESTION)
        .from(DOCTORAT_FORMATION)
        .where(SIGLE.eq(sigle).and(ANNEE.eq(annee)))
        .fetchOptional(
            record ->
                new DoctoratDTO(
                    record.value1(), record.value2(), record.value3(), record.value4()));
  }
}
