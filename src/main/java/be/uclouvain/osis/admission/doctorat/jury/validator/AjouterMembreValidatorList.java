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
import be.uclouvain.osis.admission.ddd.validation.TwoStepsValidatorList;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import java.util.List;

/** Every missing detail of an external member is reported, not only the first one. */
public final class AjouterMembreValidatorList extends TwoStepsValidatorList {
  private final List<MembreJury> membres;
  private final MembreJury informations;

  public AjouterMembreValidatorList(final List<MembreJury> membres, final MembreJury informations) {
    this.membres = List.copyOf(membres);
    this.informations = informations;
  }

  @Override
  protected List<InvariantValidator> getInvariantValidators() {
    return informationsMembre(membres, informations, null);
  }

  static List<InvariantValidator> informationsMembre(
      final List<MembreJury> membres, final MembreJury informations, final String uuidIgnore) {
    return List.of(
        new ShouldChampMembreExterneEtreRenseigne(
            informations, informations.institution(), MembreExterneSansInstitutionException::new),
        new ShouldChampMembreExterneEtreRenseigne(
            informations, informations.pays(), MembreExterneSansPaysException::new),
        new ShouldChampMembreExterneEtreRenseigne(
            informations, informations.nom(), MembreExterneSansNomException::new),
        new ShouldChampMembreExterneEtreRenseigne(
            informations, informations.prenom(), MembreExterneSansPrenomException::new),
        new ShouldChampMembreExterneEtreRenseigne(
            informations, informations.email(), MembreExterneSansEmailException::new),
        new ShouldChampMembreExterneEtreRenseigne(
            informations, informations.genre(), MembreExterneSansGenreException::new),
        new ShouldChampMembreExterneEtreRenseigne(
            informations, informations.titre(), MembreExterneSansTitreException::new),
        new ShouldJustificationDonneeSiNonDocteur(informations),
        new ShouldMembreNePasEtreDejaDansJury(membres, informations, uuidIgnore));
  }
}
