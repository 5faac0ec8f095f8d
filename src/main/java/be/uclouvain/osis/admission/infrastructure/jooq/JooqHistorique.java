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

import be.uclouvain.osis.admission.domain.service.EntreeHistorique;
import be.uclouvain.osis.admission.domain.service.Historique;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import java.util.List;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/** Audit trail stored in the {@code historique} table, tags are kept as a JSON array. */
public final class JooqHistorique implements Historique {
  private static final Table<Record> HISTORIQUE = DSL.table(DSL.name("historique"));
  private static final Field<String> UUID = DSL.field(DSL.name("uuid"), SQLDataType.VARCHAR);
  private static final Field<String> UUID_OBJET =
      DSL.field(DSL.name("uuid_objet"), SQLDataType.VARCHAR);
  private static final Field<String> AUTEUR = DSL.field(DSL.name("auteur"), SQLDataType.VARCHAR);
  private static final Field<String> MESSAGE = DSL.field(DSL.name("message"), SQLDataType.VARCHAR);
  private static final Field<String> TAGS = DSL.field(DSL.name("tags"), SQLDataType.VARCHAR);
  private static final Field<LocalDateTime> CREE_LE =
      DSL.field(DSL.name("cree_le"), SQLDataType.LOCALDATETIME);
  private static final TypeReference<List<String>> LISTE_TAGS = new TypeReference<>() {};

  private final DSLContext dsl;
  private final ObjectMapper objectMapper;

  public JooqHistorique(final DSLContext dsl, final ObjectMapper objectMapper) {
    if (dsl == null || objectMapper == null) {
      throw new IllegalArgumentException("Historique configuration cannot be null");
    }

    this.dsl = dsl;
    this.objectMapper = objectMapper;
  }

  @Override
  public void ajouter(final EntreeHistorique entree) {
    dsl.insertInto(HISTORIQUE)
        .set(UUID, entree.uuid())
        .set(UUID_OBJET, entree.uuidObjet())
        .set(AUTEUR, entree.auteur())
        .set(MESSAGE, entree.message())
        .set(TAGS, write(entree.tags()))
        .set(CREE_LE, entree.creeLe())
        .execute();
  }

  @Override
  public List<EntreeHistorique> entrees(final String uuidObjet) {
    return dsl.select(UUID, UUID_OBJET, AUTEUR, MESSAGE, TAGS, CREE_LE)
        .from(HISTORIQUE)
        .where(UUID_OBJET.eq(uuidObjet))
        .orderBy(CREE_LE, UUID)
        .fetch(
            record ->
                new EntreeHistorique(
                    record.value1(),
                    record.value2(),
                    record.value3(),
                    record.value4(),
                    read(record.value5()),
                    record.value6()));
  }

  private String write(final List<String> tags) {
    try {
      return objectMapper.writeValueAsString(tags);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot write history tags", e);
    }
  }

  private List<String> read(final String tags) {
    try {
      return objectMapper.readValue(tags, LISTE_TAGS);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot read history tags", e);
    }
  }
}
