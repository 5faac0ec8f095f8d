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
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.handlers.CompleterAvisProlongationParCddHandler;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.handlers.ModifierEpreuveConfirmationParCddHandler;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.handlers.RecupererDerniereEpreuveConfirmationHandler;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.handlers.RecupererEpreuvesConfirmationHandler;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.handlers.SoumettreEpreuveConfirmationHandler;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.handlers.SoumettreReportDeDateHandler;
import be.uclouvain.osis.admission.doctorat.epreuveconfirmation.model.EpreuveConfirmationRepository;
import be.uclouvain.osis.admission.doctorat.formation.handlers.SoumettreActivitesHandler;
import be.uclouvain.osis.admission.doctorat.jury.handlers.AjouterMembreHandler;
import be.uclouvain.osis.admission.doctorat.jury.handlers.InitialiserJuryHandler;
import be.uclouvain.osis.admission.doctorat.jury.handlers.ModifierMembreHandler;
import be.uclouvain.osis.admission.doctorat.jury.handlers.ModifierRoleMembreHandler;
import be.uclouvain.osis.admission.doctorat.jury.handlers.RecupererJuryHandler;
import be.uclouvain.osis.admission.doctorat.jury.handlers.RetirerMembreHandler;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.AnnulerReclamationDocumentsAuCandidatHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.ApprouverAdmissionParSicHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.ApprouverPropositionParCddHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.CompleterEmplacementsDocumentsParCandidatHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.EnvoyerPropositionACddLorsDeLaDecisionCddHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.InitierPropositionHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.ListerPropositionsCandidatHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.ModifierStatutChecklistExperienceParcoursAnterieurHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.ModifierStatutChecklistParcoursAnterieurHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.ReclamerDocumentsAuCandidatHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.RecupererPropositionHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.RefuserPropositionParCddHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.RefuserPropositionParSicHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.SpecifierMotifsRefusPropositionParCddHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.SpecifierMotifsRefusPropositionParSicHandler;
import be.uclouvain.osis.admission.doctorat.preparation.handlers.SupprimerPropositionHandler;
import be.uclouvain.osis.admission.doctorat.preparation.model.PropositionRepository;
import be.uclouvain.osis.admission.doctorat.preparation.service.HistoriqueDoctorat;
import be.uclouvain.osis.admission.doctorat.preparation.service.NotificationDoctorat;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.AjouterMembreCAHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.AjouterPromoteurHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.ApprouverPropositionHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.ApprouverPropositionParPdfHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.DemanderSignaturesHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.DesignerPromoteurReferenceHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.RecupererGroupeDeSupervisionHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.RefuserPropositionHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.SupprimerMembreCAHandler;
import be.uclouvain.osis.admission.doctorat.supervision.handlers.SupprimerPromoteurHandler;
import be.uclouvain.osis.admission.doctorat.supervision.model.GroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.doctorat.supervision.service.HistoriqueSupervision;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentRepository;

/**
 * Handlers of the doctoral track: preparation, supervision, jury, confirmation and training
 * activities.
 */
final class DoctoratHandlers {
  private DoctoratHandlers() {
    // Cannot be instantiated
  }

  static void register(
      final MessageBus.Builder builder,
      final AdmissionDependencies dependencies,
      final AdmissionSettings settings) {
    registerPreparation(builder, dependencies, settings);
    registerSupervision(builder, dependencies);
    registerJury(builder, dependencies.jurys(), dependencies.groupesDeSupervision());
    registerEpreuveConfirmation(builder, dependencies.epreuvesConfirmation());
    builder.addCommandHandler(new SoumettreActivitesHandler(dependencies.activites()));
  }

  private static void registerPreparation(
      final MessageBus.Builder builder,
      final AdmissionDependencies dependencies,
      final AdmissionSettings settings) {
    final PropositionRepository propositions = dependencies.propositions();
    final EmplacementDocumentRepository emplacements = dependencies.emplacementsDocuments();
    final HistoriqueDoctorat historique = new HistoriqueDoctorat(dependencies.historique());
    final NotificationDoctorat notification = new NotificationDoctorat(dependencies.notification());

    builder
        .addCommandHandler(
            new InitierPropositionHandler(
                propositions,
                dependencies.doctoratTranslator(),
                settings.maximumPropositionsParCandidat()))
        .addCommandHandler(
            new EnvoyerPropositionACddLorsDeLaDecisionCddHandler(propositions, historique))
        .addCommandHandler(
            new RefuserPropositionParSicHandler(propositions, historique, notification))
        .addCommandHandler(
            new SpecifierMotifsRefusPropositionParSicHandler(propositions, historique))
        .addCommandHandler(new SpecifierMotifsRefusPropositionParCddHandler(propositions))
        .addCommandHandler(
            new RefuserPropositionParCddHandler(propositions, historique, notification))
        .addCommandHandler(new ApprouverPropositionParCddHandler(propositions, historique))
        .addCommandHandler(
            new ApprouverAdmissionParSicHandler(
                propositions, emplacements, historique, notification))
        .addCommandHandler(
            new ReclamerDocumentsAuCandidatHandler(propositions, emplacements, historique))
        .addCommandHandler(
            new AnnulerReclamationDocumentsAuCandidatHandler(propositions, emplacements))
        .addCommandHandler(
            new CompleterEmplacementsDocumentsParCandidatHandler(propositions, emplacements))
        .addCommandHandler(new ModifierStatutChecklistParcoursAnterieurHandler(propositions))
        .addCommandHandler(
            new ModifierStatutChecklistExperienceParcoursAnterieurHandler(propositions))
        .addCommandHandler(new SupprimerPropositionHandler(propositions))
        .addQueryHandler(new RecupererPropositionHandler(propositions))
        .addQueryHandler(new ListerPropositionsCandidatHandler(propositions));
  }

  private static void registerSupervision(
      final MessageBus.Builder builder, final AdmissionDependencies dependencies) {
    final PropositionRepository propositions = dependencies.propositions();
    final GroupeDeSupervisionRepository groupes = dependencies.groupesDeSupervision();
    final HistoriqueSupervision historique = new HistoriqueSupervision(dependencies.historique());

    builder
        .addCommandHandler(new AjouterPromoteurHandler(groupes))
        .addCommandHandler(new AjouterMembreCAHandler(groupes))
        .addCommandHandler(new SupprimerPromoteurHandler(groupes))
        .addCommandHandler(new SupprimerMembreCAHandler(groupes))
        .addCommandHandler(new DesignerPromoteurReferenceHandler(groupes))
        .addCommandHandler(new DemanderSignaturesHandler(propositions, groupes, historique))
        .addCommandHandler(new ApprouverPropositionHandler(groupes, historique))
        .addCommandHandler(new ApprouverPropositionParPdfHandler(groupes, historique))
        .addCommandHandler(new RefuserPropositionHandler(propositions, groupes, historique))
        .addQueryHandler(new RecupererGroupeDeSupervisionHandler(groupes));
  }

  private static void registerJury(
      final MessageBus.Builder builder,
      final JuryRepository jurys,
      final GroupeDeSupervisionRepository groupes) {
    builder
        .addCommandHandler(new InitialiserJuryHandler(jurys, groupes))
        .addCommandHandler(new AjouterMembreHandler(jurys))
        .addCommandHandler(new ModifierMembreHandler(jurys))
        .addCommandHandler(new ModifierRoleMembreHandler(jurys))
        .addCommandHandler(new RetirerMembreHandler(jurys))
        .addQueryHandler(new RecupererJuryHandler(jurys));
  }

  private static void registerEpreuveConfirmation(
      final MessageBus.Builder builder, final EpreuveConfirmationRepository epreuves) {
    builder
        .addCommandHandler(new SoumettreEpreuveConfirmationHandler(epreuves))
        .addCommandHandler(new SoumettreReportDeDateHandler(epreuves))
        .addCommandHandler(new CompleterAvisProlongationParCddHandler(epreuves))
        .addCommandHandler(new ModifierEpreuveConfirmationParCddHandler(epreuves))
        .addQueryHandler(new RecupererDerniereEpreuveConfirmationHandler(epreuves))
        .addQueryHandler(new RecupererEpreuvesConfirmationHandler(epreuves));
  }
}
