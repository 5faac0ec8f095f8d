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
import be.uclouvain.osis.admission.generale.handlers.ApprouverPropositionParFaculteHandler;
import be.uclouvain.osis.admission.generale.handlers.EnvoyerPropositionAFacLorsDeLaDecisionFacultaireHandler;
import be.uclouvain.osis.admission.generale.handlers.RecupererPropositionGeneraleHandler;
import be.uclouvain.osis.admission.generale.handlers.RefuserPropositionParFaculteHandler;
import be.uclouvain.osis.admission.generale.handlers.SpecifierMotifsRefusPropositionParFaculteHandler;
import be.uclouvain.osis.admission.generale.handlers.SpecifierMotifsRefusPropositionParSicHandler;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleRepository;

final class GeneraleHandlers {
  private GeneraleHandlers() {
    // Cannot be instantiated
  }

  static void register(final MessageBus.Builder builder, final AdmissionDependencies dependencies) {
    final PropositionGeneraleRepository propositions = dependencies.propositionsGenerales();
    builder
        .addCommandHandler(
            new EnvoyerPropositionAFacLorsDeLaDecisionFacultaireHandler(propositions))
        .addCommandHandler(new SpecifierMotifsRefusPropositionParFaculteHandler(propositions))
        .addCommandHandler(new RefuserPropositionParFaculteHandler(propositions))
        .addCommandHandler(new ApprouverPropositionParFaculteHandler(propositions))
        .addCommandHandler(new SpecifierMotifsRefusPropositionParSicHandler(propositions))
        .addQueryHandler(new RecupererPropositionGeneraleHandler(propositions));
  }
}
