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

package be.uclouvain.osis.admission.doctorat.jury.commands;

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommand;
import be.uclouvain.osis.admission.doctorat.jury.model.GenreMembre;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import be.uclouvain.osis.admission.doctorat.jury.model.TitreMembre;

/** Adds a plain member to the jury, answers the uuid of the new member. */
public record AjouterMembreCommand(
    String uuidJury,
    String matricule,
    String institution,
    String autreInstitution,
    String pays,
    String nom,
    String prenom,
    TitreMembre titre,
    String justificationNonDocteur,
    GenreMembre genre,
    String email)
    implements DomainCommand.Process<String> {
  public MembreJury informations() {
    return new MembreJury(
        null,
        null,
        false,
        matricule,
        institution,
        autreInstitution,
        pays,
        nom,
        prenom,
        titre,
        justificationNonDocteur,
        genre,
        email);
  }
}
