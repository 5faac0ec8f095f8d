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

package be.uclouvain.osis.admission.infrastructure.memory;

import be.uclouvain.osis.admission.ddd.repository.EntityNotFoundException;
import be.uclouvain.osis.admission.ddd.repository.InMemoryRepository;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixStatutPropositionDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.ChoixTypeAdmission;
import be.uclouvain.osis.admission.doctorat.preparation.model.OngletChecklistDoctorale;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionNonTrouveeException;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Doctoral propositions of the candidate {@value #MATRICULE_CANDIDAT}, one per lifecycle step. */
public final class InMemoryPropositionRepository
    extends InMemoryRepository<PropositionIdentity, Proposition>
    implements PropositionRepository {
  public static final String MATRICULE_CANDIDAT = "0123456789";
  public static final String SIGLE_FORMATION = "SC3DP";
  public static final int ANNEE = 2024;

  public static final String CONFIRMEE = "uuid-SC3DP-confirmee";
  public static final String TRAITEMENT_FAC = "uuid-SC3DP-traitement-fac";
  public static final String COMPLETEE_SIC = "uuid-SC3DP-completee-sic";
  public static final String RETOUR_DE_FAC = "uuid-SC3DP-retour-de-fac";
  public static final String ATTENTE_DIRECTION = "uuid-SC3DP-attente-direction";
  public static final String BROUILLON = "uuid-SC3DP-brouillon";
  public static final String A_COMPLETER_SIC = "uuid-SC3DP-a-completer-sic";
  public static final String EN_ATTENTE_SIGNATURE = "uuid-SC3DP-en-attente-signature";

  @Override
  protected List<Proposition> fixtures() {
    final Checklist<OngletChecklistDoctorale> attenteDirection = checklistInitiale();
    attenteDirection.modifier(
        OngletChecklistDoctorale.PARCOURS_ANTERIEUR, ChoixStatutChecklist.GEST_REUSSITE, Map.of());
    attenteDirection.modifier(
        OngletChecklistDoctorale.FINANCABILITE, ChoixStatutChecklist.GEST_REUSSITE, Map.of());

    return List.of(
        proposition(
            CONFIRMEE, ChoixStatutPropositionDoctorale.CONFIRMEE, checklistInitiale(), null),
        proposition(
            TRAITEMENT_FAC,
            ChoixStatutPropositionDoctorale.TRAITEMENT_FAC,
            checklistInitiale(),
            null),
        proposition(
            COMPLETEE_SIC,
            ChoixStatutPropositionDoctorale.COMPLETEE_POUR_SIC,
            checklistInitiale(),
            null),
        proposition(
            RETOUR_DE_FAC,
            ChoixStatutPropositionDoctorale.RETOUR_DE_FAC,
            checklistInitiale(),
            null),
        proposition(
            ATTENTE_DIRECTION,
            ChoixStatutPropositionDoctorale.ATTENTE_VALIDATION_DIRECTION,
            attenteDirection,
            1),
        proposition(
            BROUILLON, ChoixStatutPropositionDoctorale.EN_BROUILLON, checklistInitiale(), null),
        proposition(
            A_COMPLETER_SIC,
            ChoixStatutPropositionDoctorale.A_COMPLETER_POUR_SIC,
            checklistInitiale(),
            null),
        proposition(
            EN_ATTENTE_SIGNATURE,
            ChoixStatutPropositionDoctorale.EN_ATTENTE_DE_SIGNATURE,
            checklistInitiale(),
            null));
  }

  @Override
  protected EntityNotFoundException notFound(final PropositionIdentity entityId) {
    return new PropositionNonTrouveeException();
  }

  @Override
  protected Proposition copy(final Proposition entity) {
    return new Proposition(
        entity.getEntityId(),
        entity.getTypeAdmission(),
        entity.getJustification(),
        entity.getSigleFormation(),
        entity.getAnnee(),
        entity.getMatriculeCandidat(),
        entity.getReference(),
        entity.getStatut(),
        entity.getChecklist().copie(),
        entity.getMotifsRefus(),
        entity.getAutresMotifsRefus(),
        entity.getReponsesQuestionsSpecifiques(),
        entity.getComplementsFormation(),
        entity.getNombreAnneesPrevoirProgramme(),
        entity.getAuteurDerniereModification(),
        entity.getCreeLe(),
        entity.getModifieeLe());
  }

  @Override
  public List<Proposition> searchByMatricule(final String matriculeCandidat) {
    return filter(proposition -> proposition.getMatriculeCandidat().equals(matriculeCandidat));
  }

  private static Checklist<OngletChecklistDoctorale> checklistInitiale() {
    return Checklist.initiale(
        OngletChecklistDoctorale.class, ChoixStatutChecklist.INITIAL_CANDIDAT);
  }

  private static Proposition proposition(
      final String uuid,
      final ChoixStatutPropositionDoctorale statut,
      final Checklist<OngletChecklistDoctorale> checklist,
      final Integer nombreAnneesPrevoirProgramme) {
    final LocalDateTime creeLe = LocalDateTime.of(ANNEE, 1, 15, 10, 0);
    return new Proposition(
        new PropositionIdentity(uuid),
        ChoixTypeAdmission.ADMISSION,
        null,
        SIGLE_FORMATION,
        ANNEE,
        MATRICULE_CANDIDAT,
        "M-CDSC24-" + uuid.substring(uuid.length() - 8).toUpperCase(Locale.ROOT),
        statut,
        checklist,
        List.of(),
        List.of(),
        Map.of(),
        null,
        nombreAnneesPrevoirProgramme,
        MATRICULE_CANDIDAT,
        creeLe,
        creeLe);
  }
}
