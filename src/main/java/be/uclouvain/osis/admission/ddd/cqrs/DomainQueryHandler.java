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

package be.uclouvain.osis.admission.ddd.cqrs;

import java.util.List;

/**
 * Class to accept and process the work associated to a specific {@link DomainQuery}: read the
 * repositories or translators and answer without any side effect.
 *
 * <p>Because {@link DomainQuery} leverages Java {@code sealed} feature, for more type safety this
 * class also makes use of the same feature.
 *
 * @param <QUERY> the type of the particular {@link DomainQuery}
 * @param <OUTPUT> the expected output type of the given query
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainQueryHandler<
  QUERY extends DomainQuery<OUTPUT>,
  OUTPUT
>
extends
        DomainHandler<QUERY>
permits
  DomainQueryHandler.One,
  DomainQueryHandler.Many
{
// @formatter:on

  /**
   * Default constructor.
   *
   * @param queryClass this handler is intended for
   * @throws IllegalArgumentException if the query class is null
   */
  protected DomainQueryHandler(final Class<QUERY> queryClass) {
    super(queryClass, "Query class");
  }

  /**
   * @return specific {@link DomainQuery} class
   */
  public final Class<QUERY> getQueryClass() {
    return getOperationClass();
  }

  /**
   * Defines business logic of this particular {@link DomainQueryHandler}.
   *
   * @param query being invoked
   * @return the answer
   */
  protected abstract OUTPUT run(final QUERY query);

  /**
   * General business logic invocation to be used and exposed via {@link MessageBus}.
   *
   * <p>This method is package-private as it is intended to be invoked by {@link MessageBus} only.
   *
   * @param query being invoked
   * @return a result of query invocation
   * @throws IllegalArgumentException if the query is null
   * @throws IllegalStateException if the handler answered null
   */
  final OUTPUT runInContext(final QUERY query) {
    final QUERY nonNullQuery = requireArgument(query, "Query");
    return requireResult(run(nonNullQuery), "Query handler result");
  }

  /**
   * A variant of the {@link DomainQueryHandler} for {@link DomainQuery.One}.
   *
   * @param <ONE> the type of the particular {@link DomainQuery.One}
   * @param <OUTPUT> the type of the model
   */
  // @formatter:off
  public abstract static non-sealed class One<
    ONE extends DomainQuery.One<OUTPUT>,
    OUTPUT
  > extends DomainQueryHandler<ONE, OUTPUT> {
  // @formatter:on
    protected One(final Class<ONE> queryClass) {
      super(queryClass);
    }
  }

  /**
   * A variant of the {@link DomainQueryHandler} for {@link DomainQuery.Many}.
   *
   * @param <MANY> the type of the particular {@link DomainQuery.Many}
   * @param <OUTPUT> the type of each model
   */
  // @formatter:off
  public abstract static non-sealed class Many<
    MANY extends DomainQuery.Many<OUTPUT>,
    OUTPUT
  > extends DomainQueryHandler<MANY, List<OUTPUT>> {
  // @formatter:on
    protected Many(final Class<MANY> queryClass) {
      super(queryClass);
    }
  }
}
