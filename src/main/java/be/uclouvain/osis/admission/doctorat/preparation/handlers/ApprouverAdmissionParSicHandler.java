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

package be.uclouvain.osis.admission.doctorat.preparation.handlers;

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommandHandler;
import be.uclouvain.osis.admission.ddd.cqrs.DomainEvent;
import be.uclouvain.osis.admission.doctorat.events.AdmissionDoctoraleApprouveeParSicEvent;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ApprouverAdmissionParSicCommand;
import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionIdentity;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.doctorat.preparation.service.HistoriqueDoctorat;
import be.uclouvain.osis.admission.doctorat.preparation.service.NotificationDoctorat;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import java.util.Optional;

/**
 * Authorises the admission. Once saved, {@link AdmissionDoctoraleApprouveeParSicEvent} is
 * published so that the candidate gets registered.
 */
public final class ApprouverAdmissionParSicHandler
    extends DomainCommandHandler.Update<
        ApprouverAdmissionParSicCommand, PropositionIdentity, Proposition> {
  private final EmplacementDocumentRepository emplacementDocumentRepository;
  private final HistoriqueDoctorat historique;
  private final NotificationDoctorat notification;

  public ApprouverAdmissionParSicHandler(
      final PropositionRepository repository,
      final EmplacementDocumentRepository emplacementDocumentRepository,
      final HistoriqueDoctorat historique,
      final NotificationDoctorat notification) {
    super(ApprouverAdmissionParSicCommand.class, repository);
    this.emplacementDocumentRepository =
        requireArgument(emplacementDocumentRepository, "Document repository");
    this.historique = requireArgument(historique, "Historique");
    this.notification = requireArgument(notification, "Notification");
  }

  @Override
  protected PropositionIdentity identify(final ApprouverAdmissionParSicCommand command) {
    return new PropositionIdentity(command.uuidProposition());
  }

  @Override
  protected void update(final ApprouverAdmissionParSicCommand command, final Proposition entity) {
    entity.approuverAdmissionParSic(
        emplacementDocumentRepository.searchByProposition(command.uuidProposition()),
        command.auteur());
  }

  @Override
  protected Optional<DomainEvent> onSuccess(
      final ApprouverAdmissionParSicCommand command, final Proposition entity) {
    historique.historiserDecision(
        entity,
        command.auteur(),
        "Approbation de la demande par le SIC",
        notification.notifierSiMessage(entity, command.objetMessage(), command.corpsMessage()));
    return Optional.of(
        new AdmissionDoctoraleApprouveeParSicEvent(
            entity.getEntityId().uuid(),
            entity.getTypeAdmission().name(),
            entity.getMatriculeCandidat(),
            entity.getAnnee()));
  }
}
