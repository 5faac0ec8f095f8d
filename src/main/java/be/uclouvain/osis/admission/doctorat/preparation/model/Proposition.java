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

package be.uclouvain.osis.admission.doctorat.preparation.model;

import static be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale.A_COMPLETER_POUR_FAC;
import static be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale.A_COMPLETER_POUR_SIC;
import static be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale.COMPLETEE_POUR_FAC;
import static be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale.COMPLETEE_POUR_SIC;
import static be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale.CONFIRMEE;
import static be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale.RETOUR_DE_FAC;
import static be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale.TRAITEMENT_FAC;

import be.uclouvain.osis.admission.ddd.repository.RootEntity;
import be.uclouvain.osis.admission.doctorat.preparation.model.ConfigurationsChecklistDoctorale.DecisionCdd;
import be.uclouvain.osis.admission.doctorat.preparation.model.ConfigurationsChecklistDoctorale.DecisionSic;
import be.uclouvain.osis.admission.doctorat.preparation.validator.ApprouverAdmissionParSicValidatorList;
import be.uclouvain.osis.admission.doctorat.preparation.validator.DecisionCddValidatorList;
import be.uclouvain.osis.admission.doctorat.preparation.validator.PropositionNonACompleterException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.PropositionNonEnBrouillonException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.ShouldMotifsRefusEtreSpecifies;
import be.uclouvain.osis.admission.doctorat.preparation.validator.SituationPropositionNonCddException;
import be.uclouvain.osis.admission.doctorat.preparation.validator.SituationPropositionNonSICException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.ProcedureDemandeSignatureLanceeException;
import be.uclouvain.osis.admission.doctorat.supervision.validator.ProcedureDemandeSignatureNonLanceeException;
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.ConfigurationStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.StatutChecklist;
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;
import be.uclouvain.osis.admission.domain.model.TypeGestionnaire;
import be.uclouvain.osis.admission.domain.validator.ShouldStatutEtreParmi;
import be.uclouvain.osis.admission.domain.validator.TransitionStatutValidatorList;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Doctoral admission proposition of a candidate.
 *
 * <p>Every business method validates first and mutates only once validation passed: a refused
 * transition leaves the proposition untouched.
 */
public final class Proposition implements RootEntity<PropositionIdentity> {
  static final Set<ChoixStatutPropositionDoctorale> SOURCES_ENVOI_CDD =
      EnumSet.of(CONFIRMEE, COMPLETEE_POUR_SIC, RETOUR_DE_FAC);
  static final Set<ChoixStatutPropositionDoctorale> SOURCES_REFUS_SIC =
      EnumSet.of(COMPLETEE_POUR_SIC, TRAITEMENT_FAC);
  static final Set<ChoixStatutPropositionDoctorale> SOURCES_MOTIFS_REFUS_CDD =
      EnumSet.of(TRAITEMENT_FAC, COMPLETEE_POUR_FAC, A_COMPLETER_POUR_FAC);
  static final Set<ChoixStatutPropositionDoctorale> SOURCES_DECISION_CDD =
      EnumSet.of(TRAITEMENT_FAC, COMPLETEE_POUR_FAC);
  static final Set<ChoixStatutPropositionDoctorale> SOURCES_RECLAMATION_SIC =
      EnumSet.of(CONFIRMEE, COMPLETEE_POUR_SIC, RETOUR_DE_FAC, A_COMPLETER_POUR_SIC);
  static final Set<ChoixStatutPropositionDoctorale> SOURCES_RECLAMATION_FAC =
      EnumSet.of(TRAITEMENT_FAC, COMPLETEE_POUR_FAC, A_COMPLETER_POUR_FAC);

  private final PropositionIdentity entityId;
  private final ChoixTypeAdmission typeAdmission;
  private final String justification;
  private final String sigleFormation;
  private final int annee;
  private final String matriculeCandidat;
  private final String reference;
  private final LocalDateTime creeLe;
  private ChoixStatutPropositionDoctorale statut;
  private Checklist<OngletChecklistDoctorale> checklist;
  private List<MotifRefusIdentity> motifsRefus;
  private List<String> autresMotifsRefus;
  private Map<String, String> reponsesQuestionsSpecifiques;
  private Boolean complementsFormation;
  private Integer nombreAnneesPrevoirProgramme;
  private String auteurDerniereModification;
  private LocalDateTime modifieeLe;

  @SuppressWarnings("squid:S107")
  public Proposition(
      final PropositionIdentity entityId,
      final ChoixTypeAdmission typeAdmission,
      final String justification,
      final String sigleFormation,
      final int annee,
      final String matriculeCandidat,
      final String reference,
      final ChoixStatutPropositionDoctorale statut,
      final Checklist<OngletChecklistDoctorale> checklist,
      final List<MotifRefusIdentity> motifsRefus,
      final List<String> autresMotifsRefus,
      final Map<String, String> reponsesQuestionsSpecifiques,
      final Boolean complementsFormation,
      final Integer nombreAnneesPrevoirProgramme,
      final String auteurDerniereModification,
      final LocalDateTime creeLe,
      final LocalDateTime modifieeLe) {
    this.entityId = Objects.requireNonNull(entityId, "Entity identity cannot be null");
    this.typeAdmission = typeAdmission;
    this.justification = justification;
    this.sigleFormation = sigleFormation;
    this.annee = annee;
    this.matriculeCandidat = matriculeCandidat;
    this.reference = reference;
    this.statut = Objects.requireNonNull(statut, "Status cannot be null");
    this.checklist =
        checklist == null
            ? Checklist.initiale(
                OngletChecklistDoctorale.class, ChoixStatutChecklist.INITIAL_CANDIDAT)
            : checklist;
    this.motifsRefus = motifsRefus == null ? List.of() : List.copyOf(motifsRefus);
    this.autresMotifsRefus = autresMotifsRefus == null ? List.of() : List.copyOf(autresMotifsRefus);
    this.reponsesQuestionsSpecifiques =
        reponsesQuestionsSpecifiques == null ? Map.of() : Map.copyOf(reponsesQuestionsSpecifiques);
    this.complementsFormation = complementsFormation;
    this.nombreAnneesPrevoirProgramme = nombreAnneesPrevoirProgramme;
    this.auteurDerniereModification = auteurDerniereModification;
    this.creeLe = creeLe;
    this.modifieeLe = modifieeLe;
  }

  /** Sends the proposition to the doctoral commission for its decision. */
  public void envoyerACddLorsDeLaDecisionCdd(final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, SOURCES_ENVOI_CDD, SituationPropositionNonSICException::new))
        .validate();

    statut = TRAITEMENT_FAC;
    modifierOnglet(OngletChecklistDoctorale.DECISION_CDD, DecisionCdd.A_TRAITER);
    modifiee(auteur);
  }

  /**
   * Refuses the proposition. The given reasons replace the current ones, the current ones are kept
   * when none is given.
   */
  public void refuserParSic(
      final List<MotifRefusIdentity> motifs, final List<String> autresMotifs, final String auteur) {
    final List<MotifRefusIdentity> nouveauxMotifs =
        motifs.isEmpty() && autresMotifs.isEmpty() ? motifsRefus : motifs;
    final List<String> nouveauxAutresMotifs =
        motifs.isEmpty() && autresMotifs.isEmpty() ? autresMotifsRefus : autresMotifs;

    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, SOURCES_REFUS_SIC, SituationPropositionNonSICException::new),
            new ShouldMotifsRefusEtreSpecifies(nouveauxMotifs, nouveauxAutresMotifs))
        .validate();

    statut = ChoixStatutPropositionDoctorale.INSCRIPTION_REFUSEE;
    motifsRefus = List.copyOf(nouveauxMotifs);
    autresMotifsRefus = List.copyOf(nouveauxAutresMotifs);
    modifierOnglet(OngletChecklistDoctorale.DECISION_SIC, DecisionSic.REFUSE);
    modifiee(auteur);
  }

  /** Records the refusal reasons, the refusal then waits for the approval of the direction. */
  public void specifierMotifsRefusParSic(
      final List<MotifRefusIdentity> motifs, final List<String> autresMotifs, final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, EnumSet.of(RETOUR_DE_FAC), SituationPropositionNonSICException::new))
        .validate();

    statut = ChoixStatutPropositionDoctorale.ATTENTE_VALIDATION_DIRECTION;
    motifsRefus = List.copyOf(motifs);
    autresMotifsRefus = List.copyOf(autresMotifs);
    modifierOnglet(OngletChecklistDoctorale.DECISION_SIC, DecisionSic.REFUS_A_VALIDER);
    modifiee(auteur);
  }

  public void specifierMotifsRefusParCdd(
      final List<MotifRefusIdentity> motifs, final List<String> autresMotifs, final String auteur) {
    new DecisionCddValidatorList(
            statut, SOURCES_MOTIFS_REFUS_CDD, checklist.get(OngletChecklistDoctorale.DECISION_CDD))
        .validate();

    motifsRefus = List.copyOf(motifs);
    autresMotifsRefus = List.copyOf(autresMotifs);
    modifierOnglet(OngletChecklistDoctorale.DECISION_CDD, DecisionCdd.REFUS);
    modifiee(auteur);
  }

  /** Refuses with the reasons previously specified by the doctoral commission. */
  public void refuserParCdd(final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut, SOURCES_DECISION_CDD, SituationPropositionNonCddException::new),
            new ShouldMotifsRefusEtreSpecifies(motifsRefus, autresMotifsRefus))
        .validate();

    statut = ChoixStatutPropositionDoctorale.INSCRIPTION_REFUSEE;
    modifierOnglet(OngletChecklistDoctorale.DECISION_CDD, DecisionCdd.REFUS);
    modifiee(auteur);
  }

  public void approuverParCdd(
      final Boolean avecComplementsFormation,
      final Integer nombreAnnees,
      final String auteur) {
    new DecisionCddValidatorList(
            statut, SOURCES_DECISION_CDD, checklist.get(OngletChecklistDoctorale.DECISION_CDD))
        .validate();

    statut = RETOUR_DE_FAC;
    complementsFormation = avecComplementsFormation;
    nombreAnneesPrevoirProgramme = nombreAnnees;
    motifsRefus = List.of();
    autresMotifsRefus = List.of();
    modifierOnglet(OngletChecklistDoctorale.DECISION_CDD, DecisionCdd.ACCORD);
    modifiee(auteur);
  }

  /**
   * @param emplacements document slots of the proposition
   * @param auteur of the decision
   */
  public void approuverAdmissionParSic(
      final List<EmplacementDocument> emplacements, final String auteur) {
    new ApprouverAdmissionParSicValidatorList(
            statut, checklist, nombreAnneesPrevoirProgramme, emplacements)
        .validate();

    statut = ChoixStatutPropositionDoctorale.INSCRIPTION_AUTORISEE;
    modifierOnglet(OngletChecklistDoctorale.DECISION_SIC, DecisionSic.AUTORISE);
    modifiee(auteur);
  }

  public void reclamerDocuments(final TypeGestionnaire typeGestionnaire, final String auteur) {
    if (typeGestionnaire == TypeGestionnaire.FAC) {
      new TransitionStatutValidatorList(
              new ShouldStatutEtreParmi<>(
                  statut, SOURCES_RECLAMATION_FAC, SituationPropositionNonCddException::new))
          .validate();
      statut = A_COMPLETER_POUR_FAC;
    } else {
      new TransitionStatutValidatorList(
              new ShouldStatutEtreParmi<>(
                  statut, SOURCES_RECLAMATION_SIC, SituationPropositionNonSICException::new))
          .validate();
      statut = A_COMPLETER_POUR_SIC;
    }

    modifiee(auteur);
  }

  public void annulerReclamationDocuments(
      final TypeGestionnaire typeGestionnaire, final String auteur) {
    if (typeGestionnaire == TypeGestionnaire.FAC) {
      new TransitionStatutValidatorList(
              new ShouldStatutEtreParmi<>(
                  statut,
                  EnumSet.of(A_COMPLETER_POUR_FAC),
                  SituationPropositionNonCddException::new))
          .validate();
      statut = TRAITEMENT_FAC;
    } else {
      new TransitionStatutValidatorList(
              new ShouldStatutEtreParmi<>(
                  statut,
                  EnumSet.of(A_COMPLETER_POUR_SIC),
                  SituationPropositionNonSICException::new))
          .validate();
      statut = CONFIRMEE;
    }

    modifiee(auteur);
  }

  public void completerDocumentsParCandidat() {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut,
                EnumSet.of(A_COMPLETER_POUR_SIC, A_COMPLETER_POUR_FAC),
                PropositionNonACompleterException::new))
        .validate();

    statut = statut == A_COMPLETER_POUR_FAC ? COMPLETEE_POUR_FAC : COMPLETEE_POUR_SIC;
    modifiee(matriculeCandidat);
  }

  public void modifierStatutChecklistParcoursAnterieur(
      final ChoixStatutChecklist nouveauStatut, final String auteur) {
    checklist.modifier(OngletChecklistDoctorale.PARCOURS_ANTERIEUR, nouveauStatut, Map.of());
    modifiee(auteur);
  }

  /**
   * @param uuidExperience child of the previous experience tab, created if missing
   * @param nouveauStatut of the experience
   * @param auteur of the change
   */
  public void modifierStatutChecklistExperienceParcoursAnterieur(
      final String uuidExperience, final ChoixStatutChecklist nouveauStatut, final String auteur) {
    checklist.remplacer(
        OngletChecklistDoctorale.PARCOURS_ANTERIEUR,
        onglet -> {
          final StatutChecklist enfant =
              onglet
                  .enfant(uuidExperience)
                  .map(existant -> existant.avecStatut(nouveauStatut, existant.extra()))
                  .orElseGet(
                      () ->
                          StatutChecklist.of(
                              uuidExperience,
                              nouveauStatut,
                              Map.of(StatutChecklist.IDENTIFIANT, uuidExperience)));
          return onglet.avecEnfant(enfant);
        });
    modifiee(auteur);
  }

  /** Cancels a draft, propositions are never physically deleted. */
  public void supprimer(final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut,
                EnumSet.of(ChoixStatutPropositionDoctorale.EN_BROUILLON),
                PropositionNonEnBrouillonException::new))
        .validate();

    statut = ChoixStatutPropositionDoctorale.ANNULEE;
    modifiee(auteur);
  }

  /** Locks the draft while the supervision group signs it. */
  public void demanderSignatures() {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut,
                EnumSet.of(ChoixStatutPropositionDoctorale.EN_BROUILLON),
                ProcedureDemandeSignatureLanceeException::new))
        .validate();

    statut = ChoixStatutPropositionDoctorale.EN_ATTENTE_DE_SIGNATURE;
    modifiee(matriculeCandidat);
  }

  /**
   * @param auteur promoter who declined the proposition
   */
  public void deverrouillerApresRefusPromoteur(final String auteur) {
    new TransitionStatutValidatorList(
            new ShouldStatutEtreParmi<>(
                statut,
                EnumSet.of(ChoixStatutPropositionDoctorale.EN_ATTENTE_DE_SIGNATURE),
                ProcedureDemandeSignatureNonLanceeException::new))
        .validate();

    statut = ChoixStatutPropositionDoctorale.EN_BROUILLON;
    modifiee(auteur);
  }

  public boolean estEnCours() {
    return statut != ChoixStatutPropositionDoctorale.ANNULEE;
  }

  private void modifierOnglet(
      final OngletChecklistDoctorale onglet, final ConfigurationStatutChecklist configuration) {
    checklist.modifier(onglet, configuration.statut(), configuration.extra());
  }

  private void modifiee(final String auteur) {
    auteurDerniereModification = auteur;
    modifieeLe = LocalDateTime.now();
  }

  @Override
  public PropositionIdentity getEntityId() {
    return entityId;
  }

  public ChoixTypeAdmission getTypeAdmission() {
    return typeAdmission;
  }

  public String getJustification() {
    return justification;
  }

  public String getSigleFormation() {
    return sigleFormation;
  }

  public int getAnnee() {
    return annee;
  }

  public String getMatriculeCandidat() {
    return matriculeCandidat;
  }

  public String getReference() {
    return reference;
  }

  public ChoixStatutPropositionDoctorale getStatut() {
    return statut;
  }

  public Checklist<OngletChecklistDoctorale> getChecklist() {
    return checklist;
  }

  public List<MotifRefusIdentity> getMotifsRefus() {
    return motifsRefus;
  }

  public List<String> getAutresMotifsRefus() {
    return autresMotifsRefus;
  }

  public Map<String, String> getReponsesQuestionsSpecifiques() {
    return reponsesQuestionsSpecifiques;
  }

  public Boolean getComplementsFormation() {
    return complementsFormation;
  }

  public Integer getNombreAnneesPrevoirProgramme() {
    return nombreAnneesPrevoirProgramme;
  }

  public String getAuteurDerniereModification() {
    return auteurDerniereModification;
  }

  public LocalDateTime getCreeLe() {
    return creeLe;
  }

  public LocalDateTime getModifieeLe() {
    return modifieeLe;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Proposition that = (Proposition) o;
    return annee == that.annee
        && entityId.equals(that.entityId)
        && typeAdmission == that.typeAdmission
        && Objects.equals(justification, that.justification)
        && Objects.equals(sigleFormation, that.sigleFormation)
        && Objects.equals(matriculeCandidat, that.matriculeCandidat)
        && Objects.equals(reference, that.reference)
        && statut == that.statut
        && checklist.equals(that.checklist)
        && motifsRefus.equals(that.motifsRefus)
        && autresMotifsRefus.equals(that.autresMotifsRefus)
        && reponsesQuestionsSpecifiques.equals(that.reponsesQuestionsSpecifiques)
        && Objects.equals(complementsFormation, that.complementsFormation)
        && Objects.equals(nombreAnneesPrevoirProgramme, that.nombreAnneesPrevoirProgramme);
  }

  @Override
  public int hashCode() {
    return entityId.hashCode();
  }

  @Override
  public String toString() {
    return "Proposition{" + "entityId=" + entityId + ", statut=" + statut + '}';
  }
}
