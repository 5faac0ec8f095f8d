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

package be.uclouvain.osis.admission.doctorat.preparation.service;

import be.uclouvain.osis.admission.doctorat.preparation.model.Proposition;
import be.uclouvain.osis.admission.domain.service.EmailMessage;
import be.uclouvain.osis.admission.domain.service.Historique;
import java.util.List;
import java.util.Optional;

/** Writes the audit trail of the decisions taken on doctoral propositions. */
public final class HistoriqueDoctorat {
  public static final List<String> TAGS_STATUT =
      List.of("proposition", "decision", "status-changed");
  public static final List<String> TAGS_MESSAGE = List.of("proposition", "decision", "message");

  private final Historique historique;

  public HistoriqueDoctorat(final Historique historique) {
    this.historique = historique;
  }

  /**
   * @param proposition after the decision
   * @param gestionnaire who decided
   * @param decision summary of the decision
   * @param message sent to the candidate, if any
   */
  public void historiserDecision(
      final Proposition proposition,
      final String gestionnaire,
      final String decision,
      final Optional<EmailMessage> message) {
    final String uuid = proposition.getEntityId().uuid();
    historique.historiser(
        uuid,
        gestionnaire,
        "%s, la demande passe au statut %s.".formatted(decision, proposition.getStatut()),
        TAGS_STATUT);
    message.ifPresent(
        envoye ->
            historique.historiser(
                uuid,
                gestionnaire,
                "Message envoyé au candidat : %s".formatted(envoye.objet()),
                TAGS_MESSAGE));
  }
}
