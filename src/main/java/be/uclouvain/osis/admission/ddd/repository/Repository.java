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
import java.util.List;

/**
 * Persistence abstraction shared by ORM-backed and in-memory implementations.
 *
 * <p>Every implementation must raise the same {@link EntityNotFoundException} subtype for the same
 * aggregate type.
 *
 * @param <ID> is the type of the aggregate identity
 * @param <E> is the type of the aggregate
 */
public interface Repository<ID extends EntityIdentity, E extends RootEntity<ID>> {
  /**
   * @param entityId to look for
   * @return the aggregate
   * @throws EntityNotFoundException if nothing was saved with this identity
   */
  E get(final ID entityId);

  /**
   * @param entityIds to look for, {@code null} or empty to return every aggregate
   * @return found aggregates, absent identities are ignored
   */
  List<E> search(final Collection<ID> entityIds);

  /**
   * Inserts or replaces the aggregate.
   *
   * @param entity to save
   */
  void save(final E entity);

  /**
   * @param entityId of the aggregate to delete, nothing happens if it is absent
   */
  void delete(final ID entityId);
}
