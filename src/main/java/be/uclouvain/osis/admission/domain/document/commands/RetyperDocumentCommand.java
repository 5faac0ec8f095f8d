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

package be.uclouvain.osis.admission.domain.document.commands;

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommand;
import be.uclouvain.osis.admission.domain.document.EmplacementDocumentIdentity;

/**
 * Moves the files of a slot to another one, the files of the target going back to the source.
 *
 * @param uuidProposition owning both slots
 * @param identifiantSource slot currently holding the document
 * @param identifiantCible slot which should hold it
 * @param auteur of the change
 */
public record RetyperDocumentCommand(
    String uuidProposition, String identifiantSource, String identifiantCible, String auteur)
    implements DomainCommand.Process<EmplacementDocumentIdentity> {}
