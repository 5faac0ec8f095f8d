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
import be.uclouvain.osis.admission.domain.checklist.Checklist;
import be.uclouvain.osis.admission.domain.checklist.ChoixStatutChecklist;
import be.uclouvain.osis.admission.domain.checklist.ConfigurationStatutChecklist;
import be.uclouvain.osis.admission.formationcontinue.model.ChoixStatutPropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.ConfigurationsChecklistContinue;
import be.uclouvain.osis.admission.formationcontinue.model.OngletChecklistContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinue;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueIdentity;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueNonTrouveeException;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinueRepository;
import java.util.List;

/** Continuing-education propositions, one per state of the decision tab. */
public final class InMemoryPropositionContinueRepository
    extends InMemoryRepository<PropositionContinueIdentity, PropositionContinue>
    implements PropositionContinueRepository {
  public static final String A_TRAITER = "uuid-USCC1";
  public static final String PRISE_EN_CHARGE = "uuid-USCC2";
  public static final String APPROUVEE_PAR_FAC = "uuid-USCC22";
  public static final String A_VALIDER = "uuid-USCC23";
  public static final String EN_ATTENTE = "uuid-USCC3";
  public static final String REFUSEE = "uuid-USCC4";
  public static final String ANNULEE = "uuid-USCC5";
  public static final String VALIDEE = "uuid-USCC6";
  public static final String CLOTUREE = "uuid-USCC7";

  @Override
  protected List<PropositionContinue> fixtures() {
    return List.of(
        proposition(
            A_TRAITER,
            ChoixStatutPropositionContinue.CONFIRMEE,
            ConfigurationsChecklistContinue.A_TRAITER),
        proposition(
            PRISE_EN_CHARGE,
            ChoixStatutPropositionContinue.CONFIRMEE,
            ConfigurationsChecklistContinue.PRISE_EN_CHARGE),
        proposition(
            APPROUVEE_PAR_FAC,
            ChoixStatutPropositionContinue.CONFIRMEE,
            ConfigurationsChecklistContinue.APPROUVEE_PAR_FAC),
        proposition(
            A_VALIDER,
            ChoixStatutPropositionContinue.CONFIRMEE,
            ConfigurationsChecklistContinue.A_VALIDER),
        proposition(
            EN_ATTENTE,
            ChoixStatutPropositionContinue.EN_ATTENTE,
            ConfigurationsChecklistContinue.EN_ATTENTE),
        proposition(
            REFUSEE,
            ChoixStatutPropositionContinue.INSCRIPTION_REFUSEE,
            ConfigurationsChecklistContinue.REFUSEE),
        proposition(
            ANNULEE,
            ChoixStatutPropositionContinue.ANNULEE,
            ConfigurationsChecklistContinue.ANNULEE),
        proposition(
            VALIDEE,
            ChoixStatutPropositionContinue.INSCRIPTION_AUTORISEE,
            ConfigurationsChecklistContinue.VALIDEE),
        proposition(
            CLOTUREE,
            ChoixStatutPropositionContinue.CLOTUREE,
            ConfigurationsChecklistContinue.CLOTUREE));
  }

  @Override
  protected EntityNotFoundException notFound(final PropositionContinueIdentity entityId) {
    return new PropositionContinueNonTrouveeException();
  }

  @Override
  protected PropositionContinue copy(final PropositionContinue entity) {
    return new PropositionContinue(
        entity.getEntityId(),
        entity.getMatriculeCandidat(),
        entity.getSigleFormation(),
        entity.getAnnee(),
        entity.getStatut(),
        entity.getChecklist(),
        entity.getConditionApprobationFacultaire(),
        entity.getMotifMiseEnAttente(),
        entity.getAutreMotifMiseEnAttente(),
        entity.getMotifRefus(),
        entity.getAutreMotifRefus(),
        entity.getMotifAnnulation(),
        entity.getAuteurDerniereModification());
  }

  private static PropositionContinue proposition(
      final String uuid,
      final ChoixStatutPropositionContinue statut,
      final ConfigurationStatutChecklist decision) {
    final Checklist<OngletChecklistContinue> checklist =
        Checklist.initiale(OngletChecklistContinue.class, ChoixStatutChecklist.INITIAL_CANDIDAT);
    checklist.modifier(OngletChecklistContinue.DECISION, decision.statut(), decision.extra());

    return new PropositionContinue(
        new PropositionContinueIdentity(uuid),
        InMemoryPropositionRepository.MATRICULE_CANDIDAT,
        "USCC",
        2024,
        statut,
        checklist,
        null,
        null,
        null,
        null,
        null,
        null,
        InMemoryPropositionRepository.MATRICULE_CANDIDAT);
  }
}
