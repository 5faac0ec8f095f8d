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

import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import be.uclouvain.osis.admission.doctorat.jury.validator.AjouterMembreValidatorList;
import be.uclouvain.osis.admission.doctorat.jury.validator.MembreNonTrouveDansJuryException;
import be.uclouvain.osis.admission.doctorat.jury.validator.ModifierMembreValidatorList;
import be.uclouvain.osis.admission.doctorat.jury.validator.ModifierRoleMembreValidatorList;
import be.uclouvain.osis.admission.doctorat.jury.validator.RetirerMembreValidatorList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Jury of a doctorate, the promoters are members from the start. */
public final class Jury implements RootEntity<JuryIdentity> {
  private final JuryIdentity entityId;
  private final List<MembreJury> membres;

  public Jury(final JuryIdentity entityId, final List<MembreJury> membres) {
    this.entityId = entityId;
    this.membres = new ArrayList<>(membres);
  }

  /**
   * @param informations of the new member, uuid and role are assigned here
   * @return uuid of the new member
   */
  public String ajouterMembre(final MembreJury informations) {
    new AjouterMembreValidatorList(membres, informations).validate();

    final String uuid = UUID.randomUUID().toString();
    membres.add(informations.nouveau(uuid));
    return uuid;
  }

  public void modifierMembre(final String uuidMembre, final MembreJury informations) {
    final MembreJury membre = getMembre(uuidMembre);
    new ModifierMembreValidatorList(membres, membre, informations).validate();

    remplacer(membre, membre.avecInformations(informations));
  }

  /** PRESIDENT and SECRETAIRE are held by one member at a time, the previous holder is demoted. */
  public void modifierRoleMembre(final String uuidMembre, final RoleJury role) {
    final MembreJury membre = getMembre(uuidMembre);
    new ModifierRoleMembreValidatorList(membre, role).validate();

    if (role != RoleJury.MEMBRE) {
      List.copyOf(membres).stream()
          .filter(autre -> autre.role() == role && !autre.uuid().equals(uuidMembre))
          .forEach(autre -> remplacer(autre, autre.avecRole(RoleJury.MEMBRE)));
    }
    remplacer(membre, membre.avecRole(role));
  }

  public void retirerMembre(final String uuidMembre) {
    final MembreJury membre = getMembre(uuidMembre);
    new RetirerMembreValidatorList(membre).validate();

    membres.remove(membre);
  }

  public MembreJury getMembre(final String uuidMembre) {
    return membres.stream()
        .filter(membre -> membre.uuid().equals(uuidMembre))
        .findFirst()
        .orElseThrow(MembreNonTrouveDansJuryException::new);
  }

  private void remplacer(final MembreJury ancien, final MembreJury nouveau) {
    membres.set(membres.indexOf(ancien), nouveau);
  }

  @Override
  public JuryIdentity getEntityId() {
    return entityId;
  }

  public List<MembreJury> getMembres() {
    return List.copyOf(membres);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Jury jury = (Jury) o;
    return Objects.equals(entityId, jury.entityId) && Objects.equals(membres, jury.membres);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityId, membres);
  }

  @Override
  public String toString() {
    return "Jury{entityId=" + entityId + ", membres=" + membres + '}';
  }
}
