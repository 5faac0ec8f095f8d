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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates the tables of the jOOQ repositories when they are missing. */
public final class AdmissionSchema {
  private static final Logger log = LoggerFactory.getLogger(AdmissionSchema.class);
  private static final String RESOURCE = "/db/admission_schema.sql";

  private AdmissionSchema() {
    // Cannot be instantiated
  }

  /**
   * @param dsl to run the statements with
   */
  public static void create(final DSLContext dsl) {
    final List<String> statements = statements();
    dsl.transaction(
        (final Configuration trx) -> {
          for (final String statement : statements) {
            trx.dsl().execute(statement);
          }
        });
    log.info("Admission schema ready, {} statements executed", statements.size());
  }

  static List<String> statements() {
    try (InputStream input = AdmissionSchema.class.getResourceAsStream(RESOURCE)) {
      if (input == null) {
        throw new IllegalStateException("Missing classpath resource " + RESOURCE);
      }

      final String script =
          new String(input.readAllBytes(), StandardCharsets.UTF_8)
              .lines()
              .filter(line -> !line.stripLeading().startsWith("--"))
              .collect(Collectors.joining("\n"));
      return Arrays.stream(script.split(";"))
          .map(String::strip)
          .filter(statement -> !statement.isEmpty())
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + RESOURCE, e);
    }
  }
}
