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

package be.uclouvain.osis.admission.infrastructure.logging;

import be.uclouvain.osis.admission.domain.service.EmailMessage;
import be.uclouvain.osis.admission.domain.service.Notification;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNotification implements Notification {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotification.class);

  @Override
  public EmailMessage envoyerMessageCandidat(
      final String uuidProposition,
      final String matriculeCandidat,
      final String objet,
      final String corps) {
    log.info("Message to candidate {} about {}: {}", matriculeCandidat, uuidProposition, objet);
    log.debug("Message body: {}", corps);
    return new EmailMessage(uuidProposition, matriculeCandidat, objet, corps, LocalDateTime.now());
  }
}
