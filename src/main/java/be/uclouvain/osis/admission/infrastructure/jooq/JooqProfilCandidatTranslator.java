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

package be.uclouvain.osis.admission.infrastructure.jooq;

import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.MERGE_GLOBAL_ID;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.MERGE_STATUS;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.MERGE_VALIDATION;
import static be.uclouvain.osis.admission.infrastructure.jooq.DigitTables.PERSON_MERGE_PROPOSAL;

import be.uclouvain.osis.admission.domain.digit.PersonMergeStatus;
import be.uclouvain.osis.admission.domain.service.MergeProposalDTO;
import be.uclouvain.osis.admission.domain.service.ProfilCandidatTranslator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Record2;

public final class JooqProfilCandidatTranslator implements ProfilCandidatTranslator {
  private static final TypeReference<Map<String, Object>> VALIDATION = new TypeReference<>() {};

  private final DSLContext dsl;
  private final ObjectMapper objectMapper;

  public JooqProfilCandidatTranslator(final DSLContext dsl, final ObjectMapper objectMapper) {
    if (dsl == null || objectMapper == null) {
      throw new IllegalArgumentException("Translator configuration cannot be null");
    }

    this.dsl = dsl;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<MergeProposalDTO> getMergeProposal(final String matricule) {
    return dsl.select(MERGE_STATUS, MERGE_VALIDATION)
        .from(PERSON_MERGE_PROPOSAL)
        .where(MERGE_GLOBAL_ID.eq(matricule))
        .fetchOptional()
        .map(this::toDto);
  }

  private MergeProposalDTO toDto(final Record2<String, String> record) {
    return new MergeProposalDTO(
        PersonMergeStatus.valueOf(record.value1()), readValidation(record.value2()));
  }

  private Map<String, Object> readValidation(final String validation) {
    if (validation == null || validation.isBlank()) {
      return Map.of();
    }

    try {
      return objectMapper.readValue(validation, VALIDATION);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot read merge proposal validation", e);
    }
  }
}
