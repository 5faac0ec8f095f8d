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

package be.uclouvain.osis.admission.formationcontinue.events;

import be.uclouvain.osis.admission.ddd.cqrs.DomainEvent;

/**
 * Published once a continuing education registration has been validated.
 *
 * @param uuidProposition validated
 * @param matricule of the candidate
 * @param sigleFormation of the training
 * @param annee academic year
 */
public record InscriptionFormationContinueValideeEvent(
    String uuidProposition, String matricule, String sigleFormation, int annee)
    implements DomainEvent {}
