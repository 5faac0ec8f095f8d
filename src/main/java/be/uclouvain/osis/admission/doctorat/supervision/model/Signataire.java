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

package be.uclouvain.osis.admission.doctorat.supervision.model;

import java.util.List;

/**
 * A promoter or a member of the supervisory panel (CA), with the state of their signature.
 *
 * @param uuid of the signatory in the group
 * @param type of the signatory
 * @param matricule of the signatory
 * @param etat of the signature
 * @param commentaireInterne shown to the managers only
 * @param commentaireExterne shown to the candidate
 * @param motifRefus given when declining
 * @param pdf uuids of the signed form uploaded instead of an online approval
 */
public record Signataire(
    String uuid,
    TypeSignataire type,
    String matricule,
    ChoixEtatSignature etat,
    String commentaireInterne,
    String commentaireExterne,
    String motifRefus,
    List<String> pdf) {
  public Signataire {
    pdf = pdf == null ? List.of() : List.copyOf(pdf);
  }

  public static Signataire nonInvite(
      final String uuid, final TypeSignataire type, final String matricule) {
    return new Signataire(
        uuid, type, matricule, ChoixEtatSignature.NOT_INVITED, null, null, null, List.of());
  }

  public boolean estPromoteur() {
    return type == TypeSignataire.PROMOTEUR;
  }

  public boolean estApprouve() {
    return etat == ChoixEtatSignature.APPROVED;
  }

  Signataire avecEtat(final ChoixEtatSignature nouvelEtat) {
    return new Signataire(uuid, type, matricule, nouvelEtat, null, null, null, List.of());
  }

  Signataire approuve(final String interne, final String externe) {
    return new Signataire(
        uuid, type, matricule, ChoixEtatSignature.APPROVED, interne, externe, null, List.of());
  }

  Signataire approuveParPdf(final List<String> documents) {
    return new Signataire(
        uuid, type, matricule, ChoixEtatSignature.APPROVED, null, null, null, documents);
  }

  Signataire refuse(final String interne, final String externe, final String motif) {
    return new Signataire(
        uuid, type, matricule, ChoixEtatSignature.DECLINED, interne, externe, motif, List.of());
  }
}
