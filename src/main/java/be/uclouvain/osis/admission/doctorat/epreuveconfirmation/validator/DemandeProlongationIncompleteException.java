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

package be.uclouvain.osis.admission.doctorat.epreuveconfirmation.validator;

import be.uclouvain.osis.admission.ddd.validation.BusinessException;
import java.io.Serial;

public class DemandeProlongationIncompleteException extends BusinessException {
  @Serial private static final long serialVersionUID = 6237288076521125739L;

  public DemandeProlongationIncompleteException() {
    super("La nouvelle échéance et une justification succincte doivent être spécifiées.");
  }
}
