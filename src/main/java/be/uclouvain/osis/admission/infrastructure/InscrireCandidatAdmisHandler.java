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

package be.uclouvain.osis.admission.infrastructure;

import be.uclouvain.osis.admission.ddd.cqrs.DomainEventHandler;
import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.doctorat.events.AdmissionDoctoraleApprouveeParSicEvent;
import be.uclouvain.osis.admission.domain.digit.SoumettreTicketPersonneCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits a person ticket to the registry once a doctoral admission has been approved by the
 * enrolment office.
 */
final class InscrireCandidatAdmisHandler
    implements DomainEventHandler<AdmissionDoctoraleApprouveeParSicEvent> {
  private static final Logger log = LoggerFactory.getLogger(InscrireCandidatAdmisHandler.class);

  @Override
  public void handle(
      final AdmissionDoctoraleApprouveeParSicEvent event, final MessageBus messageBus) {
    log.info(
        "Admission {} approved for {}, submitting person ticket",
        event.uuidProposition(),
        event.matricule());
    messageBus.invoke(new SoumettreTicketPersonneCommand(event.matricule()));
  }
}
