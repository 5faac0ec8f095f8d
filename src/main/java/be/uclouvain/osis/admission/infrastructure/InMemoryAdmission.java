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

import be.uclouvain.osis.admission.ddd.async.TaskQueue;
import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryActiviteRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryDigitRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryDoctoratTranslator;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryEmplacementDocumentRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryEpreuveConfirmationRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryGroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryHistorique;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryJuryRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryNotification;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryProfilCandidatTranslator;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionContinueRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionGeneraleRepository;
import be.uclouvain.osis.admission.infrastructure.memory.InMemoryPropositionRepository;

/**
 * Message bus running on in-memory fixtures, with access to the stores behind it.
 *
 * <p>Asynchronous event handlers run inline so that their effects are visible as soon as the
 * command returns.
 */
public final class InMemoryAdmission {
  private final InMemoryPropositionRepository propositions = new InMemoryPropositionRepository();
  private final InMemoryEmplacementDocumentRepository emplacementsDocuments =
      new InMemoryEmplacementDocumentRepository();
  private final InMemoryJuryRepository jurys = new InMemoryJuryRepository();
  private final InMemoryGroupeDeSupervisionRepository groupesDeSupervision =
      new InMemoryGroupeDeSupervisionRepository();
  private final InMemoryEpreuveConfirmationRepository epreuvesConfirmation =
      new InMemoryEpreuveConfirmationRepository();
  private final InMemoryActiviteRepository activites = new InMemoryActiviteRepository();
  private final InMemoryPropositionGeneraleRepository propositionsGenerales =
      new InMemoryPropositionGeneraleRepository();
  private final InMemoryPropositionContinueRepository propositionsContinues =
      new InMemoryPropositionContinueRepository();
  private final InMemoryDigitRepository digit = new InMemoryDigitRepository();
  private final InMemoryProfilCandidatTranslator profilCandidatTranslator =
      new InMemoryProfilCandidatTranslator();
  private final InMemoryHistorique historique = new InMemoryHistorique();
  private final InMemoryNotification notification = new InMemoryNotification();
  private final MessageBus messageBus;

  InMemoryAdmission() {
    this.messageBus =
        AdmissionMessageBusFactory.create(
            new AdmissionDependencies(
                propositions,
                emplacementsDocuments,
                jurys,
                groupesDeSupervision,
                epreuvesConfirmation,
                activites,
                propositionsGenerales,
                propositionsContinues,
                digit,
                new InMemoryDoctoratTranslator(),
                profilCandidatTranslator,
                historique,
                notification),
            AdmissionSettings.defaults(),
            TaskQueue.inline());
  }

  public MessageBus messageBus() {
    return messageBus;
  }

  public InMemoryPropositionRepository propositions() {
    return propositions;
  }

  public InMemoryEmplacementDocumentRepository emplacementsDocuments() {
    return emplacementsDocuments;
  }

  public InMemoryJuryRepository jurys() {
    return jurys;
  }

  public InMemoryGroupeDeSupervisionRepository groupesDeSupervision() {
    return groupesDeSupervision;
  }

  public InMemoryEpreuveConfirmationRepository epreuvesConfirmation() {
    return epreuvesConfirmation;
  }

  public InMemoryActiviteRepository activites() {
    return activites;
  }

  public InMemoryPropositionGeneraleRepository propositionsGenerales() {
    return propositionsGenerales;
  }

  public InMemoryPropositionContinueRepository propositionsContinues() {
    return propositionsContinues;
  }

  public InMemoryDigitRepository digit() {
    return digit;
  }

  public InMemoryProfilCandidatTranslator profilCandidatTranslator() {
    return profilCandidatTranslator;
  }

  public InMemoryHistorique historique() {
    return historique;
  }

  public InMemoryNotification notification() {
    return notification;
  }

  /** Restores every store to its fixtures. */
  public void reset() {
    propositions.reset();
    emplacementsDocuments.reset();
    jurys.reset();
    groupesDeSupervision.reset();
    epreuvesConfirmation.reset();
    activites.reset();
    propositionsGenerales.reset();
    propositionsContinues.reset();
    digit.reset();
    profilCandidatTranslator.reset();
    historique.reset();
    notification.reset();
  }
}
