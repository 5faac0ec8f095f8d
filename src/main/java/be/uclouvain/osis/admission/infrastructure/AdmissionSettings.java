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

package be.uclouvain.osis.admission.infrastructure;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Settings of the admission core, read from {@code admission.properties} on the classpath. A JVM
 * system property with the same key wins over the file.
 *
 * @param maximumPropositionsParCandidat non-cancelled doctoral propositions allowed per candidate
 * @param sequenceNoma row of {@code noma_sequence} to allocate registration numbers from
 * @param taillePoolAsynchrone threads running asynchronous event handlers
 */
public record AdmissionSettings(
    @JsonProperty("admission.max-propositions-par-candidat") int maximumPropositionsParCandidat,
    @JsonProperty("admission.noma-sequence") String sequenceNoma,
    @JsonProperty("admission.async-pool-size") int taillePoolAsynchrone) {
  public static final String MAX_PROPOSITIONS = "admission.max-propositions-par-candidat";
  public static final String NOMA_SEQUENCE = "admission.noma-sequence";
  public static final String ASYNC_POOL_SIZE = "admission.async-pool-size";

  private static final String RESOURCE = "/admission.properties";
  private static final Map<String, String> DEFAULTS =
      Map.of(MAX_PROPOSITIONS, "5", NOMA_SEQUENCE, "noma", ASYNC_POOL_SIZE, "2");

  public AdmissionSettings {
    if (maximumPropositionsParCandidat < 1) {
      throw new IllegalArgumentException(MAX_PROPOSITIONS + " must be positive");
    }

    if (sequenceNoma == null || sequenceNoma.isBlank()) {
      throw new IllegalArgumentException(NOMA_SEQUENCE + " cannot be blank");
    }

    if (taillePoolAsynchrone < 1) {
      throw new IllegalArgumentException(ASYNC_POOL_SIZE + " must be positive");
    }
  }

  /**
   * @return settings with the built-in defaults
   */
  public static AdmissionSettings defaults() {
    return bind(DEFAULTS);
  }

  /**
   * @return settings from the classpath file, overridden by system properties
   * @throws IllegalArgumentException if a value has the wrong type or is out of range
   */
  public static AdmissionSettings load() {
    final Map<String, String> values = new LinkedHashMap<>(DEFAULTS);
    final Properties fichier = new Properties();
    try (InputStream input = AdmissionSettings.class.getResourceAsStream(RESOURCE)) {
      if (input != null) {
        fichier.load(input);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + RESOURCE, e);
    }

    for (String cle : DEFAULTS.keySet()) {
      final String valeur = System.getProperty(cle, fichier.getProperty(cle));
      if (valeur != null) {
        values.put(cle, valeur.strip());
      }
    }

    return bind(values);
  }

  private static AdmissionSettings bind(final Map<String, String> values) {
    return new ObjectMapper().convertValue(values, AdmissionSettings.class);
  }
}
