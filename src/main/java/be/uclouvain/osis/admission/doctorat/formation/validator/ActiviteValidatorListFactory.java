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

package be.uclouvain.osis.admission.doctorat.formation.validator;

import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.formation.model.Activite;
import be.uclouvain.osis.admission.doctorat.formation.model.CategorieActivite;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/** Resolves the validator list of an activity from its category. */
public final class ActiviteValidatorListFactory {
  private static final Map<CategorieActivite, Function<Activite, TwoStepsValidatorList>>
      VALIDATOR_LISTS = validatorLists();

  private ActiviteValidatorListFactory() {
    // Cannot be instantiated
  }

  private static Map<CategorieActivite, Function<Activite, TwoStepsValidatorList>>
      validatorLists() {
    final Map<CategorieActivite, Function<Activite, TwoStepsValidatorList>> lists =
        new EnumMap<>(CategorieActivite.class);
    lists.put(CategorieActivite.CONFERENCE, ConferenceValidatorList::new);
    lists.put(CategorieActivite.COMMUNICATION, CommunicationValidatorList::new);
    lists.put(CategorieActivite.PUBLICATION, PublicationValidatorList::new);
    lists.put(CategorieActivite.SEMINAIRE, SeminaireValidatorList::new);
    lists.put(CategorieActivite.SERVICE, ServiceValidatorList::new);
    lists.put(CategorieActivite.COURS, CoursValidatorList::new);
    return Collections.unmodifiableMap(lists);
  }

  public static TwoStepsValidatorList pour(final Activite activite) {
    return VALIDATOR_LISTS.get(activite.getCategorie()).apply(activite);
  }
}
