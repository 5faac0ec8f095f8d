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

package be.uclouvain.osis.admission.doctorat.supervision.service;

import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.doctorat.supervision.model.ChoixEtatSignature;
import be.uclouvain.osis.admission.doctorat.supervision.model.Signataire;
import be.uclouvain.osis.admission.domain.service.Historique;
import java.util.ArrayList;
import java.util.List;

/** Audit trail of the signatures of the supervision group. */
public final class HistoriqueSupervision {
  public static final List<String> TAGS_DEMANDE =
      List.of("proposition", "supervision", "status-changed");
  public static final List<String> TAGS_AVIS = List.of("proposition", "supervision");

  private final Historique historique;

  public HistoriqueSupervision(final Historique historique) {
    this.historique = historique;
  }

  public void historiserDemandeSignatures(final Proposition proposition) {
    historique.historiser(
        proposition.getEntityId().uuid(),
        proposition.getMatriculeCandidat(),
        "Les demandes de signatures ont été envoyées.",
        TAGS_DEMANDE);
  }

  /**
   * @param uuidProposition signed proposition
   * @param avis approval or refusal as recorded in the group
   * @param auteur who gave the opinion, the uploader for a signed form
   */
  public void historiserAvis(
      final String uuidProposition, final Signataire avis, final String auteur) {
    final StringBuilder message =
        new StringBuilder(
            "%s a %s la proposition %sen tant que %s"
                .formatted(
                    avis.matricule(),
                    avis.etat() == ChoixEtatSignature.DECLINED ? "refusé" : "approuvé",
                    avis.pdf().isEmpty() ? "" : "via PDF ",
                    avis.estPromoteur() ? "promoteur" : "membre du comité d'accompagnement"));

    final List<String> details = new ArrayList<>();
    if (avis.motifRefus() != null && !avis.motifRefus().isBlank()) {
      details.add("motif : " + avis.motifRefus());
    }
    if (avis.commentaireExterne() != null && !avis.commentaireExterne().isBlank()) {
      details.add("commentaire : " + avis.commentaireExterne());
    }
    if (!details.isEmpty()) {
      message.append(" (").append(String.join(" ; ", details)).append(')');
    }

    historique.historiser(uuidProposition, auteur, message.toString(), TAGS_AVIS);
  }
}
