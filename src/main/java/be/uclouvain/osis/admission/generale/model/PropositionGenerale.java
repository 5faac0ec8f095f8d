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

package be.uclouvain.osis.admission.generale.model;

import static be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale.ATTENTE_VALIDATION_DIRECTION;
import static be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale.COMPLETEE_POUR_FAC;
import static be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale.COMPLETEE_POUR_SIC;
import static be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale.CONFIRMEE;
import static be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale.RETOUR_DE_FAC;
import static be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale.TRAITEMENT_FAC;

import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.checklist.ConfigurationStatutChecklist;
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;
import be.uclouvain.osis.admission.domain.validator.ShouldStatutEtreParmi;
import be.uclouvain.osis.admission.domain.validator.TransitionStatutValidatorList;
import be.uclouvain.osis.admission.generale.model.ConfigurationsChecklistGenerale.DecisionFacultaire;
import be.uclouvain.osis.admission.generale.model.ConfigurationsChecklistGenerale.DecisionSic;
import be.uclouvain.osis.admission.generale.validator.ShouldMotifsRefusEtreSpecifies;
import be.uclouvain.osis.admission.generale.validator.SituationPropositionNonFACException;
import be.uclouvain.osis.admission.generale.validator.SituationPropositionNonSICException;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Admission proposition to a bachelor or master training. */
public final class PropositionGenerale implements RootEntity<PropositionGeneraleIdentity> {
  private static final Set<ChoixStatutPropositionGenerale> SOURCES_ENVOI_FAC =
      EnumSet.of(CONFIRMEE, COMPLETEE_POUR_SIC, RETOUR_DE_FAC);
  private static final Set<ChoixStatutPropositionGenerale> SOURCES_DECISION_FAC =
      EnumSet.of(TRAITEMENT_FAC, COMPLETEE_POUR_FAC);

  private final PropositionGeneraleIdentity entityId;
  private final String matriculeCandidat;
  private final String sigleFormation;
  private final int annee;
  private ChoixStatutPropositionGenerale statut;
  private Checklist<OngletChecklistGenerale> checklist;
  private List<MotifRefusIdentity> motifsRefus;
  private List<String> autresMotifsRefus;
  private String auteurDerniereModification;

  @SuppressWarnings("squid:S107")
  public PropositionGenerale(
      final PropositionGeneraleIdentity entityId,
      final String matriculeCandidat,
      final String sigleFormation,
      final int annee,
      final ChoixStatutPropositionGenerale statut,
      final Checklist<OngletChecklistGenerale> checklist,
      final List<MotifRefusIdentity> motifsRefus,
      final List<String> autresMotifsRefus,
      final String auteurDerniereModification) {
    this.entityId = entityId;
    this.matriculeCandidat = matriculeCandidat;
    this.sigleFormation = sigleFormation;
    this.annee = annee;
    this.statut = statut;
    this.checklist = checklist.copie();
    this.motifsRefus = motifsRefus == null ? List.of() : List.copyOf(motifsRefus);
    this.autresMotifsRefus = autresMotifsRefus == null ? List.of() : List.copyOf(autresMotifsRefus);
    this.auteurDerniereModification = auteurDerniereModification;
  }

  public void soumettreAFacLorsDeLaDecisionFacultaire(final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, SOURCES_ENVOI_FAC, SituationPropositionNonSICException::new))
        .validate();

    statut = TRAITEMENT_FAC;
    modifierOnglet(OngletChecklistGenerale.DECISION_FACULTAIRE, DecisionFacultaire.A_TRAITER);
    auteurDerniereModification = auteur;
  }

  public void specifierMotifsRefusParFaculte(
      final List<MotifRefusIdentity> motifs, final List<String> autresMotifs, final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, SOURCES_DECISION_FAC, SituationPropositionNonFACException::new))
        .validate();

    motifsRefus = List.copyOf(motifs);
    autresMotifsRefus = List.copyOf(autresMotifs);
    modifierOnglet(OngletChecklistGenerale.DECISION_FACULTAIRE, DecisionFacultaire.REFUS);
    auteurDerniereModification = auteur;
  }

  /** Refuses with the reasons previously specified by the faculty. */
  public void refuserParFaculte(final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, SOURCES_DECISION_FAC, SituationPropositionNonFACException::new),
            new ShouldMotifsRefusEtreSpecifies(motifsRefus, autresMotifsRefus))
        .validate();

    statut = RETOUR_DE_FAC;
    modifierOnglet(OngletChecklistGenerale.DECISION_FACULTAIRE, DecisionFacultaire.REFUS);
    auteurDerniereModification = auteur;
  }

  public void approuverParFaculte(final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, SOURCES_DECISION_FAC, SituationPropositionNonFACException::new))
        .validate();

    statut = RETOUR_DE_FAC;
    motifsRefus = List.of();
    autresMotifsRefus = List.of();
    modifierOnglet(OngletChecklistGenerale.DECISION_FACULTAIRE, DecisionFacultaire.APPROUVE);
    auteurDerniereModification = auteur;
  }

  public void specifierMotifsRefusParSic(
      final List<MotifRefusIdentity> motifs, final List<String> autresMotifs, final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, EnumSet.of(RETOUR_DE_FAC), SituationPropositionNonSICException::new))
        .validate();

    statut = ATTENTE_VALIDATION_DIRECTION;
    motifsRefus = List.copyOf(motifs);
    autresMotifsRefus = List.copyOf(autresMotifs);
    modifierOnglet(OngletChecklistGenerale.DECISION_SIC, DecisionSic.REFUS_A_VALIDER);
    auteurDerniereModification = auteur;
  }

  private void modifierOnglet(
      final OngletChecklistGenerale onglet, final ConfigurationStatutChecklist configuration) {
    checklist.modifier(onglet, configuration.statut(), configuration.extra());
  }

  @Override
  public PropositionGeneraleIdentity getEntityId() {
    return entityId;
  }

  public String getMatriculeCandidat() {
    return matriculeCandidat;
  }

  public String getSigleFormation() {
    return sigleFormation;
  }

  public int getAnnee() {
    return annee;
  }

  public ChoixStatutPropositionGenerale getStatut() {
    return statut;
  }

  public Checklist<OngletChecklistGenerale> getChecklist() {
    return checklist;
  }

  public List<MotifRefusIdentity> getMotifsRefus() {
    return motifsRefus;
  }

  public List<String> getAutresMotifsRefus() {
    return autresMotifsRefus;
  }

  public String getAuteurDerniereModification() {
    return auteurDerniereModification;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final PropositionGenerale that = (PropositionGenerale) o;
    return annee == that.annee
        && Objects.equals(entityId, that.entityId)
        && Objects.equals(matriculeCandidat, that.matriculeCandidat)
        && Objects.equals(sigleFormation, that.sigleFormation)
        && statut == that.statut
        && Objects.equals(checklist, that.checklist)
        && Objects.equals(motifsRefus, that.motifsRefus)
        && Objects.equals(autresMotifsRefus, that.autresMotifsRefus);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityId, matriculeCandidat, sigleFormation, annee, statut);
  }

  @Override
  public String toString() {
    return "PropositionGenerale{entityId=" + entityId + ", statut=" + statut + '}';
  }
}
