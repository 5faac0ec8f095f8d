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

package be.uclouvain.osis.admission.infrastructure.memory;

import be.uclouvain.osis.admission.domain.service.EmailMessage;
import be.uclouvain.osis.admission.domain.service.Notification;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/** Keeps the sent messages instead of mailing them. */
public final class InMemoryNotification implements Notification {
  private final List<EmailMessage> messages = new ArrayList<>();

  @Override
  public synchronized EmailMessage envoyerMessageCandidat(
      final String uuidProposition,
      final String matriculeCandidat,
      final String objet,
      final String corps) {
    final EmailMessage message =
        new EmailMessage(uuidProposition, matriculeCandidat, objet, corps, LocalDateTime.now());
    messages.add(message);
    return message;
  }

  /**
   * @param uuidProposition the messages are about
   * @return sent messages, oldest first
   */
  public synchronized List<EmailMessage> messages(final String uuidProposition) {
    return messages.stream()
        .filter(message -> message.uuidProposition().equals(uuidProposition))
        .toList();
  }

  public synchronized void reset() {
    messages.clear();
  }
}
