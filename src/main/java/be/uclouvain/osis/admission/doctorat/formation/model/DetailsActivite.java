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

package be.uclouvain.osis.admission.doctorat.formation.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Category specific details of a training activity. */
public sealed interface DetailsActivite {
  CategorieActivite categorie();

  record Conference(
      String type,
      String nom,
      LocalDate dateDebut,
      LocalDate dateFin,
      String pays,
      String ville,
      BigDecimal ects)
      implements DetailsActivite {
    @Override
    public CategorieActivite categorie() {
      return CategorieActivite.CONFERENCE;
    }
  }

  record Communication(String type, String titre, LocalDate date, BigDecimal ects)
      implements DetailsActivite {
    @Override
    public CategorieActivite categorie() {
      return CategorieActivite.COMMUNICATION;
    }
  }

  record Publication(String type, String titre, String auteurs, LocalDate date, BigDecimal ects)
      implements DetailsActivite {
    @Override
    public CategorieActivite categorie() {
      return CategorieActivite.PUBLICATION;
    }
  }

  record Seminaire(
      String type, String nom, LocalDate dateDebut, LocalDate dateFin, Integer heures)
      implements DetailsActivite {
    @Override
    public CategorieActivite categorie() {
      return CategorieActivite.SEMINAIRE;
    }
  }

  record Service(
      String type, String description, LocalDate dateDebut, LocalDate dateFin, Integer heures)
      implements DetailsActivite {
    @Override
    public CategorieActivite categorie() {
      return CategorieActivite.SERVICE;
    }
  }

  record Cours(String intitule, LocalDate dateDebut, LocalDate dateFin, BigDecimal ects)
      implements DetailsActivite {
    @Override
    public CategorieActivite categorie() {
      return CategorieActivite.COURS;
    }
  }
}
