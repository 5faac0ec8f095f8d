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

package be.uclouvain.osis.admission.domain.document;

import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import be.uclouvain.osis.admission.domain.document.validator.ReclamationEmplacementDocumentValidatorList;
import be.uclouvain.osis.admission.domain.document.validator.RetypageDocumentValidatorList;
import be.uclouvain.osis.admission.domain.document.validator.SuppressionEmplacementDocumentValidatorList;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Slot of a document attached to a proposition, requested from the candidate or uploaded by a
 * manager.
 *
 * <p>A free slot left without any file is deleted rather than kept empty.
 */
public final class EmplacementDocument implements RootEntity<EmplacementDocumentIdentity> {
  private final EmplacementDocumentIdentity entityId;
  private final TypeEmplacementDocument type;
  private String libelle;
  private StatutEmplacementDocument statut;
  private StatutReclamationEmplacementDocument statutReclamation;
  private String raison;
  private List<String> uuidsDocuments;
  private String justificationGestionnaire;
  private LocalDate dateLimiteReclamation;
  private LocalDateTime reclameLe;
  private String dernierActeur;
  private LocalDateTime derniereActionLe;

  @SuppressWarnings("squid:S107")
  public EmplacementDocument(
      final EmplacementDocumentIdentity entityId,
      final TypeEmplacementDocument type,
      final String libelle,
      final StatutEmplacementDocument statut,
      final StatutReclamationEmplacementDocument statutReclamation,
      final String raison,
      final List<String> uuidsDocuments,
      final String justificationGestionnaire,
      final LocalDate dateLimiteReclamation,
      final LocalDateTime reclameLe,
      final String dernierActeur,
      final LocalDateTime derniereActionLe) {
    this.entityId = Objects.requireNonNull(entityId, "Entity identity cannot be null");
    this.type = Objects.requireNonNull(type, "Type cannot be null");
    this.libelle = libelle;
    this.statut = statut;
    this.statutReclamation = statutReclamation;
    this.raison = raison;
    this.uuidsDocuments = uuidsDocuments == null ? List.of() : List.copyOf(uuidsDocuments);
    this.justificationGestionnaire = justificationGestionnaire;
    this.dateLimiteReclamation = dateLimiteReclamation;
    this.reclameLe = reclameLe;
    this.dernierActeur = dernierActeur;
    this.derniereActionLe = derniereActionLe;
  }

  /**
   * Creates a free slot to request from the candidate.
   *
   * @throws be.uclouvain.osis.admission.ddd.validation.BusinessException if the request moment is
   *     missing
   * @throws be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions if the type
   *     cannot be requested
   */
  public static EmplacementDocument libreAReclamer(
      final String propositionUuid,
      final TypeEmplacementDocument type,
      final String libelle,
      final String raison,
      final StatutReclamationEmplacementDocument statutReclamation,
      final String auteur) {
    new ReclamationEmplacementDocumentValidatorList(type, statutReclamation).validate();
    new SuppressionEmplacementDocumentValidatorList(type).validate();
    return new EmplacementDocument(
        identiteLibre(propositionUuid, type),
        type,
        libelle,
        StatutEmplacementDocument.A_RECLAMER,
        statutReclamation,
        raison,
        List.of(),
        null,
        null,
        null,
        auteur,
        LocalDateTime.now());
  }

  /** Creates a free internal slot holding a document uploaded by a manager. */
  public static EmplacementDocument libreNonReclamable(
      final String propositionUuid,
      final TypeEmplacementDocument type,
      final String libelle,
      final String uuidDocument,
      final String auteur) {
    new SuppressionEmplacementDocumentValidatorList(type).validate();
    return new EmplacementDocument(
        identiteLibre(propositionUuid, type),
        type,
        libelle,
        StatutEmplacementDocument.VALIDE,
        null,
        null,
        List.of(uuidDocument),
        null,
        null,
        null,
        auteur,
        LocalDateTime.now());
  }

  /** Marks a fixed slot of the proposition as to be requested. */
  public static EmplacementDocument aReclamer(
      final EmplacementDocumentIdentity entityId,
      final TypeEmplacementDocument type,
      final String raison,
      final StatutReclamationEmplacementDocument statutReclamation,
      final String auteur) {
    new ReclamationEmplacementDocumentValidatorList(type, statutReclamation).validate();
    return new EmplacementDocument(
        entityId,
        type,
        null,
        StatutEmplacementDocument.A_RECLAMER,
        statutReclamation,
        raison,
        List.of(),
        null,
        null,
        null,
        auteur,
        LocalDateTime.now());
  }

  private static EmplacementDocumentIdentity identiteLibre(
      final String propositionUuid, final TypeEmplacementDocument type) {
    return new EmplacementDocumentIdentity(
        type.prefixeIdentifiantLibre() + "." + UUID.randomUUID(), propositionUuid);
  }

  public void modifierReclamation(
      final String nouvelleRaison,
      final StatutReclamationEmplacementDocument nouveauStatutReclamation,
      final String auteur) {
    new ReclamationEmplacementDocumentValidatorList(type, nouveauStatutReclamation).validate();
    this.raison = nouvelleRaison;
    this.statutReclamation = nouveauStatutReclamation;
    this.statut = StatutEmplacementDocument.A_RECLAMER;
    tracer(auteur);
  }

  /** Withdraws the request of a fixed slot. Free slots are deleted instead. */
  public void annulerReclamation(final String auteur) {
    this.statut = StatutEmplacementDocument.NON_ANALYSE;
    this.statutReclamation = null;
    this.raison = null;
    this.dateLimiteReclamation = null;
    this.reclameLe = null;
    tracer(auteur);
  }

  /**
   * @param justification shown to the other managers, follows the files when they are retyped
   */
  public void remplirParGestionnaire(
      final List<String> documents, final String justification, final String auteur) {
    this.uuidsDocuments = List.copyOf(documents);
    this.justificationGestionnaire = justification;
    this.statut = StatutEmplacementDocument.VALIDE;
    this.statutReclamation = null;
    this.dateLimiteReclamation = null;
    tracer(auteur);
  }

  public void remplacer(final List<String> documents, final String auteur) {
    this.uuidsDocuments = List.copyOf(documents);
    this.statut = StatutEmplacementDocument.VALIDE;
    tracer(auteur);
  }

  /**
   * @throws be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions if the slot is
   *     not free
   */
  public void verifierSuppression() {
    new SuppressionEmplacementDocumentValidatorList(type).validate();
  }

  /**
   * Sends the request to the candidate. Only slots waiting to be requested are affected.
   *
   * @return {@code true} if the slot was requested
   */
  public boolean reclamer(final LocalDate dateLimite, final String auteur) {
    if (statut != StatutEmplacementDocument.A_RECLAMER) {
      return false;
    }

    this.statut = StatutEmplacementDocument.RECLAME;
    this.dateLimiteReclamation = dateLimite;
    this.reclameLe = LocalDateTime.now();
    tracer(auteur);
    return true;
  }

  public void annulerReclamationAuCandidat(final String auteur) {
    if (statut == StatutEmplacementDocument.RECLAME) {
      this.statut = StatutEmplacementDocument.A_RECLAMER;
      this.dateLimiteReclamation = null;
      this.reclameLe = null;
      tracer(auteur);
    }
  }

  public void completerParCandidat(final List<String> documents, final String auteur) {
    if (statut == StatutEmplacementDocument.RECLAME) {
      this.uuidsDocuments = List.copyOf(documents);
      this.statut = StatutEmplacementDocument.COMPLETE_APRES_RECLAMATION;
      tracer(auteur);
    }
  }

  /**
   * Moves the content of this slot to the target slot and the content of the target here.
   *
   * @param cible slot receiving the files of this one
   * @param auteur of the change
   * @throws be.uclouvain.osis.admission.ddd.validation.MultipleBusinessExceptions if the slots are
   *     not compatible
   */
  public void echangerContenuAvec(final EmplacementDocument cible, final String auteur) {
    new RetypageDocumentValidatorList(type, cible.type).validate();

    final List<String> documentsCible = cible.uuidsDocuments;
    final String justificationCible = cible.justificationGestionnaire;
    final StatutEmplacementDocument statutCible = cible.statut;

    cible.uuidsDocuments = this.uuidsDocuments;
    cible.justificationGestionnaire = this.justificationGestionnaire;
    cible.statut = this.statut;
    cible.tracer(auteur);

    this.uuidsDocuments = documentsCible;
    this.justificationGestionnaire = justificationCible;
    this.statut = statutCible;
    tracer(auteur);
  }

  /**
   * @return {@code true} if the slot is free and holds no file, it must then be deleted
   */
  public boolean estLibreEtVide() {
    return type.estLibre() && uuidsDocuments.isEmpty();
  }

  private void tracer(final String auteur) {
    this.dernierActeur = auteur;
    this.derniereActionLe = LocalDateTime.now();
  }

  @Override
  public EmplacementDocumentIdentity getEntityId() {
    return entityId;
  }

  public TypeEmplacementDocument getType() {
    return type;
  }

  public String getLibelle() {
    return libelle;
  }

  public StatutEmplacementDocument getStatut() {
    return statut;
  }

  public StatutReclamationEmplacementDocument getStatutReclamation() {
    return statutReclamation;
  }

  public String getRaison() {
    return raison;
  }

  public List<String> getUuidsDocuments() {
    return uuidsDocuments;
  }

  public String getJustificationGestionnaire() {
    return justificationGestionnaire;
  }

  public LocalDate getDateLimiteReclamation() {
    return dateLimiteReclamation;
  }

  public LocalDateTime getReclameLe() {
    return reclameLe;
  }

  public String getDernierActeur() {
    return dernierActeur;
  }

  public LocalDateTime getDerniereActionLe() {
    return derniereActionLe;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final EmplacementDocument that = (EmplacementDocument) o;
    return entityId.equals(that.entityId)
        && type == that.type
        && statut == that.statut
        && statutReclamation == that.statutReclamation
        && Objects.equals(raison, that.raison)
        && uuidsDocuments.equals(that.uuidsDocuments)
        && Objects.equals(justificationGestionnaire, that.justificationGestionnaire)
        && Objects.equals(dateLimiteReclamation, that.dateLimiteReclamation);
  }

  @Override
  public int hashCode() {
    return entityId.hashCode();
  }

  @Override
  public String toString() {
    return "EmplacementDocument{"
        + "entityId="
        + entityId
        + ", type="
        + type
        + ", statut="
        + statut
        + ", uuidsDocuments="
        + uuidsDocuments
        + '}';
  }
}
