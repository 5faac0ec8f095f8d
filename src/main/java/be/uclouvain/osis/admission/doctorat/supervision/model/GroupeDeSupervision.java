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

package be.uclouvain.osis.admission.doctorat.supervision.model;

import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import be.uclouvain.osis.admission.doctorat.supervision.validator.AjouterSignataireValidatorList;
import be.uclouvain.osis.admission.doctorat.supervision.validator.ApprobationPromoteurValidatorList;
import be.uclouvain.osis.admission.doctorat.supervision.validator.ApprobationValidatorList;
import be.uclouvain.osis.admission.doctorat.supervision.validator.ApprouverValidatorList;
import be.uclouvain.osis.admission.doctorat.supervision.validator.MembreCANonTrouveException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.PromoteurNonTrouveException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.SignataireNonTrouveException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.SignatairesValidatorList;
import be.uclouvain.osis.admission.doctorat.supervision.validator.SupprimerSignataireValidatorList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Promoters and members of the supervisory panel (CA) who sign a doctoral proposition.
 *
 * <p>Members join or leave the group only while no signature is requested. A promoter declining
 * the proposition unlocks the group, the other promoters then have to be invited again.
 */
public final class GroupeDeSupervision implements RootEntity<GroupeDeSupervisionIdentity> {
  private final GroupeDeSupervisionIdentity entityId;
  private final List<Signataire> signataires;
  private ChoixStatutSignatureGroupeDeSupervision statutSignature;
  private String promoteurReference;
  private String institutThese;

  public GroupeDeSupervision(
      final GroupeDeSupervisionIdentity entityId,
      final ChoixStatutSignatureGroupeDeSupervision statutSignature,
      final List<Signataire> signataires,
      final String promoteurReference,
      final String institutThese) {
    this.entityId = Objects.requireNonNull(entityId, "Entity identity cannot be null");
    this.statutSignature =
        statutSignature == null
            ? ChoixStatutSignatureGroupeDeSupervision.IN_PROGRESS
            : statutSignature;
    this.signataires = new ArrayList<>(signataires);
    this.promoteurReference = promoteurReference;
    this.institutThese = institutThese;
  }

  /**
   * @param matricule of the new promoter
   * @return uuid of the promoter in the group
   */
  public String ajouterPromoteur(final String matricule) {
    return ajouter(TypeSignataire.PROMOTEUR, matricule);
  }

  /**
   * @param matricule of the new CA member
   * @return uuid of the member in the group
   */
  public String ajouterMembreCA(final String matricule) {
    return ajouter(TypeSignataire.MEMBRE_CA, matricule);
  }

  /** Removing the reference promoter leaves the group without one. */
  public void supprimerPromoteur(final String uuidPromoteur) {
    final Signataire promoteur = getPromoteur(uuidPromoteur);
    new SupprimerSignataireValidatorList(statutSignature).validate();

    signataires.remove(promoteur);
    if (promoteur.uuid().equals(promoteurReference)) {
      promoteurReference = null;
    }
  }

  public void supprimerMembreCA(final String uuidMembreCA) {
    final Signataire membre = getMembreCA(uuidMembreCA);
    new SupprimerSignataireValidatorList(statutSignature).validate();

    signataires.remove(membre);
  }

  public void designerPromoteurReference(final String uuidPromoteur) {
    promoteurReference = getPromoteur(uuidPromoteur).uuid();
  }

  /** Invites every signatory not invited yet or who declined, and locks the group. */
  public void inviterASigner() {
    new SignatairesValidatorList(signataires, promoteurReference).validate();

    List.copyOf(signataires).stream()
        .filter(
            signataire ->
                signataire.etat() == ChoixEtatSignature.NOT_INVITED
                    || signataire.etat() == ChoixEtatSignature.DECLINED)
        .forEach(
            signataire -> remplacer(signataire, signataire.avecEtat(ChoixEtatSignature.INVITED)));
    statutSignature = ChoixStatutSignatureGroupeDeSupervision.SIGNING_IN_PROGRESS;
  }

  /**
   * @param institut thesis institute, required from the first promoter approving while the group
   *     has none
   * @return the approval as recorded
   */
  public Signataire approuver(
      final String uuidSignataire,
      final String commentaireInterne,
      final String commentaireExterne,
      final String institut) {
    final Signataire signataire = getSignataire(uuidSignataire);
    new ApprobationPromoteurValidatorList(signataires, signataire, institutThese, institut)
        .validate();
    new ApprouverValidatorList(signataire).validate();

    final Signataire approbation = signataire.approuve(commentaireInterne, commentaireExterne);
    remplacer(signataire, approbation);
    if (signataire.estPromoteur() && institut != null && !institut.isBlank()) {
      institutThese = institut;
    }

    return approbation;
  }

  /**
   * @param pdf uuids of the signed form
   * @return the approval as recorded
   */
  public Signataire approuverParPdf(final String uuidSignataire, final List<String> pdf) {
    final Signataire signataire = getSignataire(uuidSignataire);
    new ApprouverValidatorList(signataire).validate();

    final Signataire approbation = signataire.approuveParPdf(pdf);
    remplacer(signataire, approbation);
    return approbation;
  }

  /**
   * A declining promoter resets the other promoters and unlocks the group. A declining CA member
   * leaves the group.
   *
   * @return the refusal as recorded
   */
  public Signataire refuser(
      final String uuidSignataire,
      final String commentaireInterne,
      final String commentaireExterne,
      final String motifRefus) {
    final Signataire signataire = getSignataire(uuidSignataire);
    new ApprouverValidatorList(signataire).validate();

    final Signataire refus =
        signataire.refuse(commentaireInterne, commentaireExterne, motifRefus);
    if (!signataire.estPromoteur()) {
      signataires.remove(signataire);
      return refus;
    }

    for (final Signataire promoteur : getPromoteurs()) {
      remplacer(
          promoteur,
          promoteur.equals(signataire)
              ? refus
              : promoteur.avecEtat(ChoixEtatSignature.NOT_INVITED));
    }
    statutSignature = ChoixStatutSignatureGroupeDeSupervision.IN_PROGRESS;
    return refus;
  }

  /**
   * @throws be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions unless every
   *     signatory approved the requested signatures
   */
  public void verifierToutLeMondeAApprouve() {
    new ApprobationValidatorList(statutSignature, signataires).validate();
  }

  public Signataire getSignataire(final String uuidSignataire) {
    return signataires.stream()
        .filter(signataire -> signataire.uuid().equals(uuidSignataire))
        .findFirst()
        .orElseThrow(SignataireNonTrouveException::new);
  }

  private Signataire getPromoteur(final String uuidPromoteur) {
    return getPromoteurs().stream()
        .filter(promoteur -> promoteur.uuid().equals(uuidPromoteur))
        .findFirst()
        .orElseThrow(PromoteurNonTrouveException::new);
  }

  private Signataire getMembreCA(final String uuidMembreCA) {
    return getMembresCA().stream()
        .filter(membre -> membre.uuid().equals(uuidMembreCA))
        .findFirst()
        .orElseThrow(MembreCANonTrouveException::new);
  }

  private String ajouter(final TypeSignataire type, final String matricule) {
    new AjouterSignataireValidatorList(statutSignature, signataires, matricule).validate();

    final String uuid = UUID.randomUUID().toString();
    signataires.add(Signataire.nonInvite(uuid, type, matricule));
    return uuid;
  }

  private void remplacer(final Signataire ancien, final Signataire nouveau) {
    signataires.set(signataires.indexOf(ancien), nouveau);
  }

  @Override
  public GroupeDeSupervisionIdentity getEntityId() {
    return entityId;
  }

  public ChoixStatutSignatureGroupeDeSupervision getStatutSignature() {
    return statutSignature;
  }

  public List<Signataire> getSignataires() {
    return List.copyOf(signataires);
  }

  public List<Signataire> getPromoteurs() {
    return signataires.stream().filter(Signataire::estPromoteur).toList();
  }

  public List<Signataire> getMembresCA() {
    return signataires.stream().filter(signataire -> !signataire.estPromoteur()).toList();
  }

  public String getPromoteurReference() {
    return promoteurReference;
  }

  public String getInstitutThese() {
    return institutThese;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final GroupeDeSupervision groupe = (GroupeDeSupervision) o;
    return entityId.equals(groupe.entityId)
        && statutSignature == groupe.statutSignature
        && signataires.equals(groupe.signataires)
        && Objects.equals(promoteurReference, groupe.promoteurReference)
        && Objects.equals(institutThese, groupe.institutThese);
  }

  @Override
  public int hashCode() {
    return entityId.hashCode();
  }

  @Override
  public String toString() {
    return "GroupeDeSupervision{entityId="
        + entityId
        + ", statutSignature="
        + statutSignature
        + ", signataires="
        + signataires
        + ", promoteurReference="
        + promoteurReference
        + '}';
  }
}
