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

package be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model;

import java.time.LocalDate;
import java.util.List;

public record EpreuveConfirmationDTO(
    String uuid,
    String doctoratUuid,
    LocalDate dateLimite,
    LocalDate date,
    List<String> rapportRecherche,
    List<String> procesVerbalCa,
    List<String> avisRenouvellementMandatRecherche,
    DemandeProlongation demandeProlongation) {
  public static EpreuveConfirmationDTO depuis(final EpreuveConfirmation epreuve) {
    return new EpreuveConfirmationDTO(
        epreuve.getEntityId().uuid(),
        epreuve.getDoctoratUuid(),
        epreuve.getDateLimite(),
        epreuve.getDate(),
        epreuve.getRapportRecherche(),
        epreuve.getProcesVerbalCa(),
        epreuve.getAvisRenouvellementMandatRecherche(),
        epreuve.getDemandeProlongation());
  }
}
