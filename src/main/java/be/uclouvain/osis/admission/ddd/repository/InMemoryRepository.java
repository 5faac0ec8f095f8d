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

package be.uclouvain.osis.admission.ddd.repository;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * {@link Repository} holding its aggregates in an owned map.
 *
 * <p>Each instance owns its storage: two instances never share state. {@link #reset()} drops
 * everything and seeds the canned {@link #fixtures()} again, which is what tests call between
 * cases.
 *
 * <p>Aggregates are copied in and out through {@link #copy(RootEntity)}, so a change only becomes
 * visible once it is saved, as with a database-backed repository.
 *
 * @param <ID> is the type of the aggregate identity
 * @param <E> is the type of the aggregate
 */
public abstract class InMemoryRepository<ID extends EntityIdentity, E extends RootEntity<ID>>
    implements Repository<ID, E> {
  private final Map<ID, E> entities = new LinkedHashMap<>();

  protected InMemoryRepository() {
    reset();
  }

  /**
   * @return fresh instances of the aggregates available after {@link #reset()}
   */
  protected abstract List<E> fixtures();

  /**
   * @param entityId which was not found
   * @return the exception matching the aggregate type
   */
  protected abstract EntityNotFoundException notFound(final ID entityId);

  /**
   * @param entity to copy
   * @return an instance sharing no mutable state with the given aggregate
   */
  protected abstract E copy(final E entity);

  /** Restores the canned fixture data. */
  public final synchronized void reset() {
    entities.clear();
    for (E fixture : fixtures()) {
      entities.put(fixture.getEntityId(), fixture);
    }
  }

  @Override
  public synchronized E get(final ID entityId) {
    final E entity = entities.get(entityId);
    if (entity == null) {
      throw notFound(entityId);
    }

    return copy(entity);
  }

  @Override
  public synchronized List<E> search(final Collection<ID> entityIds) {
    if (entityIds == null || entityIds.isEmpty()) {
      return entities.values().stream().map(this::copy).collect(Collectors.toList());
    }

    return filter(entity -> entityIds.contains(entity.getEntityId()));
  }

  @Override
  public synchronized void save(final E entity) {
    if (entity == null) {
      throw new IllegalArgumentException("Entity cannot be null");
    }

    entities.put(entity.getEntityId(), copy(entity));
  }

  @Override
  public synchronized void delete(final ID entityId) {
    entities.remove(entityId);
  }

  /**
   * @param predicate to match aggregates against
   * @return copies of the matching aggregates in insertion order
   */
  protected final synchronized List<E> filter(final Predicate<E> predicate) {
    return entities.values().stream().filter(predicate).map(this::copy).toList();
  }
}
