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

package be.uclouvain.osis.admission.domain.digit;

import java.util.EnumSet;
import java.util.Set;

/** Progress of a person creation ticket sent to the registry. */
public enum PersonTicketCreationStatus {
  CREATED,
  ERROR,
  DONE,
  DONE_WITH_WARNINGS,
  IN_PROGRESS;

  /** Tickets in these statuses block the submission of a new one. */
  public static final Set<PersonTicketCreationStatus> EN_COURS =
      EnumSet.of(CREATED, DONE, DONE_WITH_WARNINGS, IN_PROGRESS);
}
