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

package be.uclouvain.osis.admission.doctorat.jury.model;

/**
 * A member of a doctoral jury. Internal members are known by their matricule, external members
 * are described by their institution and contact details.
 *
 * @param uuid of the member
 * @param role in the jury
 * @param estPromoteur whether the member is one of the promoters of the doctorate
 * @param matricule of an internal member, {@code null} for an external one
 * @param institution of an external member
 * @param autreInstitution free text when the institution is not listed
 * @param pays of the institution
 * @param nom of an external member
 * @param prenom of an external member
 * @param titre of an external member
 * @param justificationNonDocteur required when the member is not a doctor
 * @param genre of an external member
 * @param email of an external member
 */
public record MembreJury(
    String uuid,
    RoleJury role,
    boolean estPromoteur,
    String matricule,
    String institution,
    String autreInstitution,
    String pays,
    String nom,
    String prenom,
    TitreMembre titre,
    String justificationNonDocteur,
    GenreMembre genre,
    String email) {
  /** Internal member seeded from the supervision group. */
  public static MembreJury promoteur(final String uuid, final String matricule) {
    return new MembreJury(
        uuid,
        RoleJury.MEMBRE,
        true,
        matricule,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null);
  }

  public boolean estExterne() {
    return matricule == null || matricule.isBlank();
  }

  /**
   * @param nouvelUuid of the member joining the jury
   * @return a plain member, not a promoter, with the details of this one
   */
  public MembreJury nouveau(final String nouvelUuid) {
    return new MembreJury(
        nouvelUuid,
        RoleJury.MEMBRE,
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

  public MembreJury avecRole(final RoleJury nouveauRole) {
    return new MembreJury(
        uuid,
        nouveauRole,
        estPromoteur,
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

  /**
   * @param informations new details, its uuid, role and promoter flag are ignored
   * @return this member with the given details
   */
  public MembreJury avecInformations(final MembreJury informations) {
    return new MembreJury(
        uuid,
        role,
        estPromoteur,
        informations.matricule(),
        informations.institution(),
        informations.autreInstitution(),
        informations.pays(),
        informations.nom(),
        informations.prenom(),
        informations.titre(),
        informations.justificationNonDocteur(),
        informations.genre(),
        informations.email());
  }
}
