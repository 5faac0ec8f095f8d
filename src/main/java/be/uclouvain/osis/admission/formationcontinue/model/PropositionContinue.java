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

package be.uclouvain.osis.admission.formationcontinue.model;

import static be.uclouvain.osis.admission.formationcontinue.model.ConfigurationsChecklistContinue.A_TRAITER;
import static be.uclouvain.osis.admission.formationcontinue.model.ConfigurationsChecklistContinue.A_VALIDER;
import static be.uclouvain.osis.admission.formationcontinue.model.ConfigurationsChecklistContinue.APPROUVEE_PAR_FAC;
import static be.uclouvain.osis.admission.formationcontinue.model.ConfigurationsChecklistContinue.CLOTUREE;
import static be.uclouvain.osis.admission.formationcontinue.model.ConfigurationsChecklistContinue.FINALES;

import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import be.uclouvain.osis.admission.ddd.validation.BusinessException;
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.checklist.ConfigurationStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.service.MergeProposalDTO;
import be.uclouvain.osis.admission.domain.validator.ShouldPasEtreEnQuarantaine;
import be.uclouvain.osis.admission.domain.validator.ShouldStatutChecklistCorrespondre;
import be.uclouvain.osis.admission.domain.validator.ShouldStatutChecklistNePasCorrespondre;
import be.uclouvain.osis.admission.domain.validator.TransitionStatutValidatorList;
import be.uclouvain.osis.admission.formationcontinue.validator.AnnulerPropositionTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.ApprouverParFacTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.ApprouverPropositionTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.CloturerPropositionTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.MettreAValiderTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.MettreEnAttenteTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.PrendreEnChargeTransitionStatutException;
import be.uclouvain.osis.admission.formationcontinue.validator.RefuserPropositionTransitionStatutException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Admission proposition to a continuing education training. Decisions are driven by the state of
 * the {@link OngletChecklistContinue#DECISION} tab.
 */
public final class PropositionContinue implements RootEntity<PropositionContinueIdentity> {
  private final PropositionContinueIdentity entityId;
  private final String matriculeCandidat;
  private final String sigleFormation;
  private final int annee;
  private ChoixStatutPropositionContinue statut;
  private Checklist<OngletChecklistContinue> checklist;
  private String conditionApprobationFacultaire;
  private String motifMiseEnAttente;
  private String autreMotifMiseEnAttente;
  private String motifRefus;
  private String autreMotifRefus;
  private String motifAnnulation;
  private String auteurDerniereModification;

  @SuppressWarnings("squid:S107")
  public PropositionContinue(
      final PropositionContinueIdentity entityId,
      final String matriculeCandidat,
      final String sigleFormation,
      final int annee,
      final ChoixStatutPropositionContinue statut,
      final Checklist<OngletChecklistContinue> checklist,
      final String conditionApprobationFacultaire,
      final String motifMiseEnAttente,
      final String autreMotifMiseEnAttente,
      final String motifRefus,
      final String autreMotifRefus,
      final String motifAnnulation,
      final String auteurDerniereModification) {
    this.entityId = entityId;
    this.matriculeCandidat = matriculeCandidat;
    this.sigleFormation = sigleFormation;
    this.annee = annee;
    this.statut = statut;
    this.checklist = checklist.copie();
    this.conditionApprobationFacultaire = conditionApprobationFacultaire;
    this.motifMiseEnAttente = motifMiseEnAttente;
    this.autreMotifMiseEnAttente = autreMotifMiseEnAttente;
    this.motifRefus = motifRefus;
    this.autreMotifRefus = autreMotifRefus;
    this.motifAnnulation = motifAnnulation;
    this.auteurDerniereModification = auteurDerniereModification;
  }

  public void prendreEnCharge(final String gestionnaire) {
    doitEtreDans(List.of(A_TRAITER), PrendreEnChargeTransitionStatutException::new);

    modifierDecision(ConfigurationsChecklistContinue.PRISE_EN_CHARGE, gestionnaire);
  }

  public void mettreEnAttente(
      final String gestionnaire, final String motif, final String autreMotif) {
    nePasEtreDans(FINALES, MettreEnAttenteTransitionStatutException::new);

    statut = ChoixStatutPropositionContinue.EN_ATTENTE;
    motifMiseEnAttente = motif;
    autreMotifMiseEnAttente = autreMotif;
    modifierDecision(ConfigurationsChecklistContinue.EN_ATTENTE, gestionnaire);
  }

  public void approuverParFac(final String gestionnaire, final String condition) {
    nePasEtreDans(FINALES, ApprouverParFacTransitionStatutException::new);

    conditionApprobationFacultaire = condition;
    modifierDecision(APPROUVEE_PAR_FAC, gestionnaire);
  }

  public void mettreAValider(final String gestionnaire) {
    doitEtreDans(List.of(APPROUVEE_PAR_FAC), MettreAValiderTransitionStatutException::new);

    modifierDecision(A_VALIDER, gestionnaire);
  }

  public void refuser(final String gestionnaire, final String motif, final String autreMotif) {
    nePasEtreDans(FINALES, RefuserPropositionTransitionStatutException::new);

    statut = ChoixStatutPropositionContinue.INSCRIPTION_REFUSEE;
    motifRefus = motif;
    autreMotifRefus = autreMotif;
    modifierDecision(ConfigurationsChecklistContinue.REFUSEE, gestionnaire);
  }

  public void annuler(final String gestionnaire, final String motif) {
    nePasEtreDans(FINALES, AnnulerPropositionTransitionStatutException::new);

    statut = ChoixStatutPropositionContinue.ANNULEE;
    motifAnnulation = motif;
    modifierDecision(ConfigurationsChecklistContinue.ANNULEE, gestionnaire);
  }

  /**
   * @param gestionnaire validating the registration
   * @param mergeProposal of the candidate, a candidate in quarantine cannot be registered
   */
  public void valider(final String gestionnaire, final Optional<MergeProposalDTO> mergeProposal) {
    new TransitionStatutValidatorList(
            new ShouldStatutChecklistCorrespondre(
                decision(),
                List.of(APPROUVEE_PAR_FAC, A_VALIDER),
                ApprouverPropositionTransitionStatutException::new),
            new ShouldPasEtreEnQuarantaine(mergeProposal))
        .validate();

    statut = ChoixStatutPropositionContinue.INSCRIPTION_AUTORISEE;
    modifierDecision(ConfigurationsChecklistContinue.VALIDEE, gestionnaire);
  }

  public void cloturer(final String gestionnaire) {
    nePasEtreDans(List.of(CLOTUREE), CloturerPropositionTransitionStatutException::new);

    statut = ChoixStatutPropositionContinue.CLOTUREE;
    modifierDecision(CLOTUREE, gestionnaire);
  }

  private StatutChecklist decision() {
    return checklist.get(OngletChecklistContinue.DECISION);
  }

  private void doitEtreDans(
      final List<ConfigurationStatutChecklist> autorisees,
      final Supplier<? extends BusinessException> exception) {
    new TransitionStatutValidatorList(
            new ShouldStatutChecklistCorrespondre(decision(), autorisees, exception))
        .validate();
  }

  private void nePasEtreDans(
      final List<ConfigurationStatutChecklist> interdites,
      final Supplier<? extends BusinessException> exception) {
    new TransitionStatutValidatorList(
            new ShouldStatutChecklistNePasCorrespondre(decision(), interdites, exception))
        .validate();
  }

  private void modifierDecision(
      final ConfigurationStatutChecklist configuration, final String gestionnaire) {
    checklist.modifier(
        OngletChecklistContinue.DECISION, configuration.statut(), configuration.extra());
    auteurDerniereModification = gestionnaire;
  }

  @Override
  public PropositionContinueIdentity getEntityId() {
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

  public ChoixStatutPropositionContinue getStatut() {
    return statut;
  }

  public Checklist<OngletChecklistContinue> getChecklist() {
    return checklist;
  }

  public String getConditionApprobationFacultaire() {
    return conditionApprobationFacultaire;
  }

  public String getMotifMiseEnAttente() {
    return motifMiseEnAttente;
  }

  public String getAutreMotifMiseEnAttente() {
    return autreMotifMiseEnAttente;
  }

  public String getMotifRefus() {
    return motifRefus;
  }

  public String getAutreMotifRefus() {
    return autreMotifRefus;
  }

  public String getMotifAnnulation() {
    return motifAnnulation;
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

    final PropositionContinue that = (PropositionContinue) o;
    return annee == that.annee
        && Objects.equals(entityId, that.entityId)
        && Objects.equals(matriculeCandidat, that.matriculeCandidat)
        && Objects.equals(sigleFormation, that.sigleFormation)
        && statut == that.statut
        && Objects.equals(checklist, that.checklist)
        && Objects.equals(conditionApprobationFacultaire, that.conditionApprobationFacultaire)
        && Objects.equals(motifMiseEnAttente, that.motifMiseEnAttente)
        && Objects.equals(autreMotifMiseEnAttente, that.autreMotifMiseEnAttente)
        && Objects.equals(motifRefus, that.motifRefus)
        && Objects.equals(autreMotifRefus, that.autreMotifRefus)
        && Objects.equals(motifAnnulation, that.motifAnnulation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityId, matriculeCandidat, sigleFormation, annee, statut);
  }

  @Override
  public String toString() {
    return "PropositionContinue{entityId="
        + entityId
        + ", statut="
        + statut
        + ", decision="
        + checklist.get(OngletChecklistContinue.DECISION)
        + '}';
  }
}
