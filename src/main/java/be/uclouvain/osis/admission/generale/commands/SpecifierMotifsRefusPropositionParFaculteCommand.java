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

package be.uclouvain.osis.admission.generale.commands;

import be.uclouvain.osis.admission.ddd.cqrs.DomainCommand;
import be.uclouvain.osis.admission.generale.model.PropositionGeneraleIdentity;
import java.util.List;

public record SpecifierMotifsRefusPropositionParFaculteCommand(
    String uuidProposition,
    String gestionnaire,
    List<String> uuidsMotifs,
    List<String> autresMotifs)
    implements DomainCommand.Update<PropositionGeneraleIdentity> {
  public SpecifierMotifsRefusPropositionParFaculteCommand {
    uuidsMotifs = uuidsMotifs == null ? List.of() : List.copyOf(uuidsMotifs);
    autresMotifs = autresMotifs == null ? List.of() : List.copyOf(autresMotifs);
  }
}
