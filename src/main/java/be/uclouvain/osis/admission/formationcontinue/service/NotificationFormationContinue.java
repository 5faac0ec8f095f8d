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

package be.uclouvain.osis.admission.formationcontinue.service;

import be.uclouvain.osis.admission.domain.service.EmailMessage;
import be.uclouvain.osis.admission.domain.service.Notification;
import be.uclouvain.osis.admission.formationcontinue.model.PropositionContinue;

public final class NotificationFormationContinue {
  private final Notification notification;

  public NotificationFormationContinue(final Notification notification) {
    this.notification = notification;
  }

  /** Every decision is notified, an empty subject falls back to a generic one. */
  public EmailMessage notifierDecision(
      final PropositionContinue proposition, final String objet, final String corps) {
    final String objetEffectif =
        objet == null || objet.isBlank()
            ? "Votre demande d'inscription à %s".formatted(proposition.getSigleFormation())
            : objet;
    return notification.envoyerMessageCandidat(
        proposition.getEntityId().uuid(), proposition.getMatriculeCandidat(), objetEffectif, corps);
  }
}
