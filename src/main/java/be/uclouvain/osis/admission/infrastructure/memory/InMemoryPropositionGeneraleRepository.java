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
import be.uclouvain.osis.admission.domain.model.MotifRefusIdentity;
import be.uclouvain.osis.admission.generale.model.ChoixStatutPropositionGenerale;
import be.uclouvain.osis.admission.generale.model.OngletChecklistGenerale;
import be.uclouvain.osis.admission.generale.model.PropositionGenerale;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleIdentity;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleNonTrouveeException;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleRepository;
import java.util.List;

public final class InMemoryPropositionGeneraleRepository
    extends InMemoryRepository<PropositionGeneraleIdentity, PropositionGenerale>
    implements PropositionGeneraleRepository {
  public static final String CONFIRMEE = "uuid-MASTER-SCI-confirmee";
  public static final String TRAITEMENT_FAC = "uuid-MASTER-SCI-traitement-fac";
  public static final String TRAITEMENT_FAC_AVEC_MOTIFS = "uuid-MASTER-SCI-traitement-fac-motifs";
  public static final String RETOUR_DE_FAC = "uuid-MASTER-SCI-retour-de-fac";
  public static final String BROUILLON = "uuid-MASTER-SCI-brouillon";

  @Override
  protected List<PropositionGenerale> fixtures() {
    return List.of(
        proposition(CONFIRMEE, ChoixStatutPropositionGenerale.CONFIRMEE, List.of()),
        proposition(TRAITEMENT_FAC, ChoixStatutPropositionGenerale.TRAITEMENT_FAC, List.of()),
        proposition(
            TRAITEMENT_FAC_AVEC_MOTIFS,
            ChoixStatutPropositionGenerale.TRAITEMENT_FAC,
            List.of(new MotifRefusIdentity("uuid-motif-refus"))),
        proposition(RETOUR_DE_FAC, ChoixStatutPropositionGenerale.RETOUR_DE_FAC, List.of()),
        proposition(BROUILLON, ChoixStatutPropositionGenerale.EN_BROUILLON, List.of()));
  }

  @Override
  protected EntityNotFoundException notFound(final PropositionGeneraleIdentity entityId) {
    return new PropositionGeneraleNonTrouveeException();
  }

  @Override
  protected PropositionGenerale copy(final PropositionGenerale entity) {
    return new PropositionGenerale(
        entity.getEntityId(),
        entity.getMatriculeCandidat(),
        entity.getSigleFormation(),
        entity.getAnnee(),
        entity.getStatut(),
        entity.getChecklist(),
        entity.getMotifsRefus(),
        entity.getAutresMotifsRefus(),
        entity.getAuteurDerniereModification());
  }

  private static PropositionGenerale proposition(
      final String uuid,
      final ChoixStatutPropositionGenerale statut,
      final List<MotifRefusIdentity> motifsRefus) {
    return new PropositionGenerale(
        new PropositionGeneraleIdentity(uuid),
        InMemoryPropositionRepository.MATRICULE_CANDIDAT,
        "SINF2M",
        2024,
        statut,
        Checklist.initiale(OngletChecklistGenerale.class, ChoixStatutChecklist.INITIAL_CANDIDAT),
        motifsRefus,
        List.of(),
        InMemoryPropositionRepository.MATRICULE_CANDIDAT);
  }
}
