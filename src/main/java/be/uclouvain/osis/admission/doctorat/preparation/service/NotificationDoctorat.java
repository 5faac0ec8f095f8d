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
import be.uclouvain.osis.admission.domain.service.Notification;
import java.util.Optional;

/** Sends the decision messages written by managers, when they wrote one. */
public final class NotificationDoctorat {
  private final Notification notification;

  public NotificationDoctorat(final Notification notification) {
    this.notification = notification;
  }

  public Optional<EmailMessage> notifierSiMessage(
      final Proposition proposition, final String objet, final String corps) {
    if (objet == null || objet.isBlank()) {
      return Optional.empty();
    }

    return Optional.of(
        notification.envoyerMessageCandidat(
            proposition.getEntityId().uuid(), proposition.getMatriculeCandidat(), objet, corps));
  }
}
