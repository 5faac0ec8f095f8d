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

import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.domain.digit.ADemandeCreationTicketEnCoursHandler;
import be.uclouvain.osis.admission.domain.digit.RecupererNomaEnvoyeADigitHandler;
import be.uclouvain.osis.admission.domain.digit.SoumettreTicketPersonneHandler;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;
import be.uclouvain.osis.admission.domain.document.handlers.AnnulerReclamationEmplacementDocumentHandler;
import be.uclouvain.osis.admission.domain.document.handlers.InitialiserEmplacementDocumentAReclamerHandler;
import be.uclouvain.osis.admission.domain.document.handlers.InitialiserEmplacementDocumentLibreAReclamerHandler;
import be.uclouvain.osis.admission.domain.document.handlers.InitialiserEmplacementDocumentLibreNonReclamableHandler;
import be.uclouvain.osis.admission.domain.document.handlers.ModifierReclamationEmplacementDocumentHandler;
import be.uclouvain.osis.admission.domain.document.handlers.RemplacerEmplacementDocumentHandler;
import be.uclouvain.osis.admission.domain.document.handlers.RemplirEmplacementDocumentParGestionnaireHandler;
import be.uclouvain.osis.admission.domain.document.handlers.RetyperDocumentHandler;
import be.uclouvain.osis.admission.domain.document.handlers.SupprimerEmplacementDocumentHandler;

/** Handlers shared by every track: document slots and registry tickets. */
final class DocumentHandlers {
  private DocumentHandlers() {
    // Cannot be instantiated
  }

  static void register(final MessageBus.Builder builder, final AdmissionDependencies dependencies) {
    final EmplacementDocumentRepository emplacements = dependencies.emplacementsDocuments();
    builder
        .addCommandHandler(new InitialiserEmplacementDocumentLibreAReclamerHandler(emplacements))
        .addCommandHandler(
            new InitialiserEmplacementDocumentLibreNonReclamableHandler(emplacements))
        .addCommandHandler(new InitialiserEmplacementDocumentAReclamerHandler(emplacements))
        .addCommandHandler(new ModifierReclamationEmplacementDocumentHandler(emplacements))
        .addCommandHandler(new AnnulerReclamationEmplacementDocumentHandler(emplacements))
        .addCommandHandler(new RemplirEmplacementDocumentParGestionnaireHandler(emplacements))
        .addCommandHandler(new RemplacerEmplacementDocumentHandler(emplacements))
        .addCommandHandler(new SupprimerEmplacementDocumentHandler(emplacements))
        .addCommandHandler(new RetyperDocumentHandler(emplacements))
        .addCommandHandler(new SoumettreTicketPersonneHandler(dependencies.digit()))
        .addQueryHandler(new RecupererNomaEnvoyeADigitHandler(dependencies.digit()))
        .addQueryHandler(new ADemandeCreationTicketEnCoursHandler(dependencies.digit()));
  }
}
