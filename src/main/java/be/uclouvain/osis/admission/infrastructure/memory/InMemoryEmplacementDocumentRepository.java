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
import be.uclouvain.osis.admission.domain.document.EmplacementDocument;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentNonTrouveException;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import be.uclouvain.osis.admission.domain.document.StatutEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.StatutReclamationEmplacementDocument;
import be.uclouvain.osis.admission.domain.document.TypeEmplacementDocument;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public final class InMemoryEmplacementDocumentRepository
    extends InMemoryRepository<EmplacementDocumentIdentity, EmplacementDocument>
    implements EmplacementDocumentRepository {
  public static final String CURRICULUM = "CURRICULUM.CURRICULUM";
  public static final String CARTE_IDENTITE = "ID.CARTE_IDENTITE";
  public static final String LIBRE_CANDIDAT = "LIBRE_CANDIDAT.fixture-attestation";
  public static final String LIBRE_GESTIONNAIRE = "LIBRE_GESTIONNAIRE.fixture-note";
  public static final String SYSTEME = "SYSTEME.ADMISSION_PDF_RECAPITULATIF";

  private static final LocalDateTime CREE_LE = LocalDateTime.of(2024, 1, 15, 10, 0);

  @Override
  protected List<EmplacementDocument> fixtures() {
    return List.of(
        emplacement(
            InMemoryPropositionRepository.CONFIRMEE,
            CURRICULUM,
            TypeEmplacementDocument.NON_LIBRE,
            StatutEmplacementDocument.A_RECLAMER,
            StatutReclamationEmplacementDocument.ULTERIEUREMENT_NON_BLOQUANT,
            List.of()),
        emplacement(
            InMemoryPropositionRepository.CONFIRMEE,
            CARTE_IDENTITE,
            TypeEmplacementDocument.NON_LIBRE,
            StatutEmplacementDocument.VALIDE,
            null,
            List.of("uuid-carte-identite")),
        emplacement(
            InMemoryPropositionRepository.CONFIRMEE,
            LIBRE_CANDIDAT,
            TypeEmplacementDocument.LIBRE_RECLAMABLE_SIC,
            StatutEmplacementDocument.A_RECLAMER,
            StatutReclamationEmplacementDocument.IMMEDIATEMENT,
            List.of()),
        emplacement(
            InMemoryPropositionRepository.CONFIRMEE,
            LIBRE_GESTIONNAIRE,
            TypeEmplacementDocument.LIBRE_INTERNE_SIC,
            StatutEmplacementDocument.VALIDE,
            null,
            List.of("uuid-note-interne")),
        emplacement(
            InMemoryPropositionRepository.CONFIRMEE,
            SYSTEME,
            TypeEmplacementDocument.SYSTEME,
            StatutEmplacementDocument.VALIDE,
            null,
            List.of("uuid-recapitulatif")),
        reclame(InMemoryPropositionRepository.A_COMPLETER_SIC, CURRICULUM),
        emplacement(
            InMemoryPropositionRepository.ATTENTE_DIRECTION,
            CURRICULUM,
            TypeEmplacementDocument.NON_LIBRE,
            StatutEmplacementDocument.VALIDE,
            null,
            List.of("uuid-curriculum")));
  }

  @Override
  protected EntityNotFoundException notFound(final EmplacementDocumentIdentity entityId) {
    return new EmplacementDocumentNonTrouveException(entityId);
  }

  @Override
  protected EmplacementDocument copy(final EmplacementDocument entity) {
    return new EmplacementDocument(
        entity.getEntityId(),
        entity.getType(),
        entity.getLibelle(),
        entity.getStatut(),
        entity.getStatutReclamation(),
        entity.getRaison(),
        entity.getUuidsDocuments(),
        entity.getJustificationGestionnaire(),
        entity.getDateLimiteReclamation(),
        entity.getReclameLe(),
        entity.getDernierActeur(),
        entity.getDerniereActionLe());
  }

  @Override
  public List<EmplacementDocument> searchByProposition(final String propositionUuid) {
    return filter(
        emplacement -> emplacement.getEntityId().propositionUuid().equals(propositionUuid));
  }

  private static EmplacementDocument emplacement(
      final String propositionUuid,
      final String identifiant,
      final TypeEmplacementDocument type,
      final StatutEmplacementDocument statut,
      final StatutReclamationEmplacementDocument statutReclamation,
      final List<String> documents) {
    return new EmplacementDocument(
        new EmplacementDocumentIdentity(identifiant, propositionUuid),
        type,
        null,
        statut,
        statutReclamation,
        null,
        documents,
        null,
        null,
        null,
        "0123456789",
        CREE_LE);
  }

  private static EmplacementDocument reclame(
      final String propositionUuid, final String identifiant) {
    return new EmplacementDocument(
        new EmplacementDocumentIdentity(identifiant, propositionUuid),
        TypeEmplacementDocument.NON_LIBRE,
        null,
        StatutEmplacementDocument.RECLAME,
        StatutReclamationEmplacementDocument.IMMEDIATEMENT,
        "Document illisible",
        List.of(),
        null,
        LocalDate.of(2024, 3, 1),
        CREE_LE,
        "00321234",
        CREE_LE);
  }
}
