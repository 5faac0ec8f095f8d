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
import be.uclouvain.osis.admission.doctorat.supervision.model.ChoixEtatSignature;
import be.uclouvain.osis.admission.doctorat.supervision.model.ChoixStatutSignatureGroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervision;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionIdentity;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionNonTrouveException;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.doctorat.supervision.model.Signataire;
import be.uclouvain.osis.admission.doctorat.supervision.model.TypeSignataire;
import java.util.List;

/**
 * Groups of the draft {@link InMemoryPropositionRepository#BROUILLON} and of the proposition
 * waiting for signatures {@link InMemoryPropositionRepository#EN_ATTENTE_SIGNATURE}.
 */
public final class InMemoryGroupeDeSupervisionRepository
    extends InMemoryRepository<GroupeDeSupervisionIdentity, GroupeDeSupervision>
    implements GroupeDeSupervisionRepository {
  public static final String PROMOTEUR = "uuid-promoteur-brouillon";
  public static final String CO_PROMOTEUR = "uuid-co-promoteur-brouillon";
  public static final String MEMBRE_CA = "uuid-membre-ca-brouillon";
  public static final String PROMOTEUR_INVITE = "uuid-promoteur-invite";
  public static final String CO_PROMOTEUR_INVITE = "uuid-co-promoteur-invite";
  public static final String MEMBRE_CA_INVITE = "uuid-membre-ca-invite";

  public static final String MATRICULE_PROMOTEUR = "00321234";
  public static final String MATRICULE_CO_PROMOTEUR = "00321235";
  public static final String MATRICULE_MEMBRE_CA = "00654321";

  @Override
  protected List<GroupeDeSupervision> fixtures() {
    return List.of(
        new GroupeDeSupervision(
            new GroupeDeSupervisionIdentity(InMemoryPropositionRepository.BROUILLON),
            ChoixStatutSignatureGroupeDeSupervision.IN_PROGRESS,
            List.of(
                Signataire.nonInvite(PROMOTEUR, TypeSignataire.PROMOTEUR, MATRICULE_PROMOTEUR),
                Signataire.nonInvite(
                    CO_PROMOTEUR, TypeSignataire.PROMOTEUR, MATRICULE_CO_PROMOTEUR),
                Signataire.nonInvite(MEMBRE_CA, TypeSignataire.MEMBRE_CA, MATRICULE_MEMBRE_CA)),
            PROMOTEUR,
            null),
        new GroupeDeSupervision(
            new GroupeDeSupervisionIdentity(InMemoryPropositionRepository.EN_ATTENTE_SIGNATURE),
            ChoixStatutSignatureGroupeDeSupervision.SIGNING_IN_PROGRESS,
            List.of(
                invite(PROMOTEUR_INVITE, TypeSignataire.PROMOTEUR, MATRICULE_PROMOTEUR),
                invite(CO_PROMOTEUR_INVITE, TypeSignataire.PROMOTEUR, MATRICULE_CO_PROMOTEUR),
                invite(MEMBRE_CA_INVITE, TypeSignataire.MEMBRE_CA, MATRICULE_MEMBRE_CA)),
            PROMOTEUR_INVITE,
            null));
  }

  @Override
  protected EntityNotFoundException notFound(final GroupeDeSupervisionIdentity entityId) {
    return new GroupeDeSupervisionNonTrouveException();
  }

  @Override
  protected GroupeDeSupervision copy(final GroupeDeSupervision entity) {
    return new GroupeDeSupervision(
        entity.getEntityId(),
        entity.getStatutSignature(),
        entity.getSignataires(),
        entity.getPromoteurReference(),
        entity.getInstitutThese());
  }

  private static Signataire invite(
      final String uuid, final TypeSignataire type, final String matricule) {
    return new Signataire(
        uuid, type, matricule, ChoixEtatSignature.INVITED, null, null, null, List.of());
  }
}
