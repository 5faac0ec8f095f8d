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

import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.AvisProlongationValidatorList;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.DemandeProlongationValidatorList;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator.SoumettreEpreuveConfirmationValidatorList;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One attempt of the confirmation paper of a doctorate. Only the attempt with the latest deadline
 * is active.
 */
public final class EpreuveConfirmation implements RootEntity<EpreuveConfirmationIdentity> {
  /** Orders the attempts of a doctorate, latest deadline first. */
  public static final Comparator<EpreuveConfirmation> PLUS_RECENTE_D_ABORD =
      Comparator.comparing(
              EpreuveConfirmation::getDateLimite, Comparator.nullsLast(Comparator.naturalOrder()))
          .reversed();

  private final EpreuveConfirmationIdentity entityId;
  private final String doctoratUuid;
  private LocalDate dateLimite;
  private LocalDate date;
  private List<String> rapportRecherche;
  private List<String> procesVerbalCa;
  private List<String> avisRenouvellementMandatRecherche;
  private DemandeProlongation demandeProlongation;

  @SuppressWarnings("squid:S107")
  public EpreuveConfirmation(
      final EpreuveConfirmationIdentity entityId,
      final String doctoratUuid,
      final LocalDate dateLimite,
      final LocalDate date,
      final List<String> rapportRecherche,
      final List<String> procesVerbalCa,
      final List<String> avisRenouvellementMandatRecherche,
      final DemandeProlongation demandeProlongation) {
    this.entityId = entityId;
    this.doctoratUuid = doctoratUuid;
    this.dateLimite = dateLimite;
    this.date = date;
    this.rapportRecherche = copie(rapportRecherche);
    this.procesVerbalCa = copie(procesVerbalCa);
    this.avisRenouvellementMandatRecherche = copie(avisRenouvellementMandatRecherche);
    this.demandeProlongation = demandeProlongation;
  }

  public void soumettre(
      final LocalDate dateEpreuve,
      final List<String> rapport,
      final List<String> procesVerbal,
      final List<String> avisRenouvellement) {
    new SoumettreEpreuveConfirmationValidatorList(dateEpreuve, dateLimite, rapport).validate();

    date = dateEpreuve;
    rapportRecherche = copie(rapport);
    procesVerbalCa = copie(procesVerbal);
    avisRenouvellementMandatRecherche = copie(avisRenouvellement);
  }

  public void soumettreReportDeDate(
      final LocalDate nouvelleEcheance,
      final String justificationSuccincte,
      final List<String> lettreJustification) {
    new DemandeProlongationValidatorList(
            nouvelleEcheance, justificationSuccincte, dateLimite, demandeProlongation)
        .validate();

    demandeProlongation =
        new DemandeProlongation(
            nouvelleEcheance, justificationSuccincte, lettreJustification, null);
  }

  public void completerAvisProlongationParCdd(final String avisCdd) {
    new AvisProlongationValidatorList(demandeProlongation).validate();

    demandeProlongation = demandeProlongation.avecAvisCdd(avisCdd);
  }

  /** The doctoral commission may correct every information, deadline included. */
  public void modifierParCdd(
      final LocalDate nouvelleDateLimite,
      final LocalDate dateEpreuve,
      final List<String> rapport,
      final List<String> procesVerbal,
      final List<String> avisRenouvellement) {
    dateLimite = nouvelleDateLimite;
    date = dateEpreuve;
    rapportRecherche = copie(rapport);
    procesVerbalCa = copie(procesVerbal);
    avisRenouvellementMandatRecherche = copie(avisRenouvellement);
  }

  private static List<String> copie(final List<String> fichiers) {
    return fichiers == null ? List.of() : List.copyOf(fichiers);
  }

  @Override
  public EpreuveConfirmationIdentity getEntityId() {
    return entityId;
  }

  public String getDoctoratUuid() {
    return doctoratUuid;
  }

  public LocalDate getDateLimite() {
    return dateLimite;
  }

  public LocalDate getDate() {
    return date;
  }

  public List<String> getRapportRecherche() {
    return rapportRecherche;
  }

  public List<String> getProcesVerbalCa() {
    return procesVerbalCa;
  }

  public List<String> getAvisRenouvellementMandatRecherche() {
    return avisRenouvellementMandatRecherche;
  }

  public DemandeProlongation getDemandeProlongation() {
    return demandeProlongation;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final EpreuveConfirmation that = (EpreuveConfirmation) o;
    return Objects.equals(entityId, that.entityId)
        && Objects.equals(doctoratUuid, that.doctoratUuid)
        && Objects.equals(dateLimite, that.dateLimite)
        && Objects.equals(date, that.date)
        && Objects.equals(rapportRecherche, that.rapportRecherche)
        && Objects.equals(procesVerbalCa, that.procesVerbalCa)
        && Objects.equals(avisRenouvellementMandatRecherche, that.avisRenouvellementMandatRecherche)
        && Objects.equals(demandeProlongation, that.demandeProlongation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityId, doctoratUuid, dateLimite, date);
  }

  @Override
  public String toString() {
    return "EpreuveConfirmation{entityId="
        + entityId
        + ", doctoratUuid="
        + doctoratUuid
        + ", dateLimite="
        + dateLimite
        + ", date="
        + date
        + ", demandeProlongation="
        + demandeProlongation
        + '}';
  }
}
