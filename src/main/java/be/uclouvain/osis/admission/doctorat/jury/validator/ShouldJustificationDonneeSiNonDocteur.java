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

package be.uclouvain.osis.admission.doctorat.jury.validator;

import be.uclouvain.osis.admission.ddd.validation.InvariantValidator;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import be.uclouvain.osis.admission.doctorat.jury.model.TitreMembre;

public record ShouldJustificationDonneeSiNonDocteur(MembreJury membre)
    implements InvariantValidator {
  @Override
  public void validate() {
    if (membre.titre() == TitreMembre.NON_DOCTEUR
        && (membre.justificationNonDocteur() == null
            || membre.justificationNonDocteur().isBlank())) {
      throw new NonDocteurSansJustificationException();
    }
  }
}
