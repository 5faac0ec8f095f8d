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

package be.uclouvain.osis.admission.ddd.jooq;

import be.uclouvain.osis.admission.ddd.repository.EntityIdentity;
import be.uclouvain.osis.admission.ddd.repository.EntityNotFoundException;
import be.uclouvain.osis.admission.ddd.repository.Repository;
import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * {@link Repository} storing each aggregate as one row: its identity, a few indexed columns used by
 * searches, and a JSON payload holding the whole state.
 *
 * <p>Subclasses map the aggregate to a serializable {@code ROW} record and back.
 *
 * @param <ID> is the type of the aggregate identity
 * @param <E> is the type of the aggregate
 * @param <ROW> is the type of the stored payload
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract class JooqRepository<
  ID extends EntityIdentity,
  E extends RootEntity<ID>,
  ROW
> implements Repository<ID, E> {
// @formatter:on
  protected static final Field<String> PAYLOAD =
      DSL.field(DSL.name("payload"), SQLDataType.VARCHAR);

  private final DSLContext dsl;
  private final ObjectMapper objectMapper;
  private final Table<Record> table;
  private final Field<String> idField;
  private final Class<ROW> rowClass;

  /**
   * @param dsl to run statements with
   * @param objectMapper to (de)serialize payloads
   * @param tableName storing the aggregates
   * @param idColumn holding {@link #key(EntityIdentity)}
   * @param rowClass of the payload
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  protected JooqRepository(
      final DSLContext dsl,
      final ObjectMapper objectMapper,
      final String tableName,
      final String idColumn,
      final Class<ROW> rowClass) {
    if (dsl == null || objectMapper == null || tableName == null || idColumn == null) {
      throw new IllegalArgumentException("Repository configuration cannot be null");
    }

    if (rowClass == null) {
      throw new IllegalArgumentException("Row class cannot be null");
    }

    this.dsl = dsl;
    this.objectMapper = objectMapper;
    this.table = DSL.table(DSL.name(tableName));
    this.idField = DSL.field(DSL.name(idColumn), SQLDataType.VARCHAR);
    this.rowClass = rowClass;
  }

  /**
   * @param entityId to convert
   * @return value of the identity column
   */
  protected abstract String key(final ID entityId);

  /**
   * @param entity to store
   * @return its payload
   */
  protected abstract ROW toRow(final E entity);

  /**
   * @param row which was stored
   * @return the rebuilt aggregate
   */
  protected abstract E fromRow(final ROW row);

  /**
   * @param entityId which was not found
   * @return the exception matching the aggregate type
   */
  protected abstract EntityNotFoundException notFound(final ID entityId);

  /**
   * @param entity being saved
   * @return indexed columns to write next to the payload, none by default
   */
  protected Map<Field<?>, Object> indexedColumns(final E entity) {
    return Map.of();
  }

  @Override
  public E get(final ID entityId) {
    return dsl.select(PAYLOAD)
        .from(table)
        .where(idField.eq(key(entityId)))
        .fetchOptional(PAYLOAD)
        .map(this::read)
        .orElseThrow(() -> notFound(entityId));
  }

  @Override
  public List<E> search(final Collection<ID> entityIds) {
    if (entityIds == null || entityIds.isEmpty()) {
      return searchWhere(DSL.noCondition());
    }

    return searchWhere(idField.in(entityIds.stream().map(this::key).toList()));
  }

  @Override
  public void save(final E entity) {
    if (entity == null) {
      throw new IllegalArgumentException("Entity cannot be null");
    }

    final String key = key(entity.getEntityId());
    final Map<Field<?>, Object> values = new LinkedHashMap<>(indexedColumns(entity));
    values.put(PAYLOAD, write(toRow(entity)));

    dsl.transaction(
        (final Configuration trx) -> {
          final int updated = trx.dsl().update(table).set(values).where(idField.eq(key)).execute();
          if (updated == 0) {
            values.put(idField, key);
            trx.dsl().insertInto(table).set(values).execute();
          }
        });
  }

  @Override
  public void delete(final ID entityId) {
    dsl.deleteFrom(table).where(idField.eq(key(entityId))).execute();
  }

  /**
   * @param condition on the indexed columns
   * @return matching aggregates ordered by identity
   */
  protected final List<E> searchWhere(final Condition condition) {
    return dsl.select(PAYLOAD).from(table).where(condition).orderBy(idField).fetch(PAYLOAD).stream()
        .map(this::read)
        .toList();
  }

  /**
   * @return the context, for repository specific statements
   */
  protected final DSLContext dsl() {
    return dsl;
  }

  private E read(final String payload) {
    try {
      return fromRow(objectMapper.readValue(payload, rowClass));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Cannot read %s payload".formatted(rowClass.getSimpleName()), e);
    }
  }

  private String write(final ROW row) {
    try {
      return objectMapper.writeValueAsString(row);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Cannot write %s payload".formatted(rowClass.getSimpleName()), e);
    }
  }
}
