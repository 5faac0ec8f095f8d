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

import be.uclouvain.osis.admission.ddd.repository.EntityNotFoundException;
import be.uclouvain.osis.admission.ddd.repository.InMemoryRepository;
import be.uclouvain.osis.admission.doctorat.jury.model.GenreMembre;
import be.uclouvain.osis.admission.doctorat.jury.model.Jury;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryIdentity;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryNonTrouveException;
import be.uclouvain.osis.admission.doctorat.jury.model.JuryRepository;
import be.uclouvain.osis.admission.doctorat.jury.model.MembreJury;
import be.uclouvain.osis.admission.doctorat.jury.model.RoleJury;
import be.uclouvain.osis.admission.doctorat.jury.model.TitreMembre;
import java.util.List;

public final class InMemoryJuryRepository extends InMemoryRepository<JuryIdentity, Jury>
    implements JuryRepository {
  public static final String JURY = "uuid-jury";
  public static final String PROMOTEUR = "uuid-promoteur";
  public static final String PRESIDENT = "uuid-president";
  public static final String MATRICULE_PROMOTEUR = "00321234";
  public static final String MATRICULE_PRESIDENT = "00987890";

  @Override
  protected List<Jury> fixtures() {
    return List.of(
        new Jury(
            new JuryIdentity(JURY),
            List.of(
                interne(PROMOTEUR, RoleJury.MEMBRE, true, MATRICULE_PROMOTEUR),
                interne(PRESIDENT, RoleJury.PRESIDENT, false, MATRICULE_PRESIDENT))));
  }

  @Override
  protected EntityNotFoundException notFound(final JuryIdentity entityId) {
    return new JuryNonTrouveException();
  }

  @Override
  protected Jury copy(final Jury entity) {
    return new Jury(entity.getEntityId(), entity.getMembres());
  }

  private static MembreJury interne(
      final String uuid, final RoleJury role, final boolean estPromoteur, final String matricule) {
    return new MembreJury(
        uuid,
        role,
        estPromoteur,
        matricule,
        "UCLouvain",
        null,
        "BE",
        null,
        null,
        TitreMembre.PROFESSEUR,
        null,
        GenreMembre.AUTRE,
        null);
  }
}
