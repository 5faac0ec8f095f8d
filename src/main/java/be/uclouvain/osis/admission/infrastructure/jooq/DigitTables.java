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

import java.time.LocalDateTime;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/** Tables shared with the registry synchronisation. */
final class DigitTables {
  static final Table<Record> PERSON_MERGE_PROPOSAL = DSL.table(DSL.name("person_merge_proposal"));
  static final Field<String> MERGE_GLOBAL_ID =
      DSL.field(DSL.name("global_id"), SQLDataType.VARCHAR);
  static final Field<String> MERGE_STATUS = DSL.field(DSL.name("status"), SQLDataType.VARCHAR);
  static final Field<String> MERGE_REGISTRATION_ID =
      DSL.field(DSL.name("registration_id_sent_to_digit"), SQLDataType.VARCHAR);
  static final Field<String> MERGE_VALIDATION =
      DSL.field(DSL.name("validation"), SQLDataType.VARCHAR);

  static final Table<Record> PERSON_TICKET_CREATION = DSL.table(DSL.name("person_ticket_creation"));
  static final Field<String> TICKET_UUID = DSL.field(DSL.name("uuid"), SQLDataType.VARCHAR);
  static final Field<String> TICKET_GLOBAL_ID =
      DSL.field(DSL.name("global_id"), SQLDataType.VARCHAR);
  static final Field<String> TICKET_STATUS = DSL.field(DSL.name("status"), SQLDataType.VARCHAR);
  static final Field<String> TICKET_NOMA = DSL.field(DSL.name("noma"), SQLDataType.VARCHAR);
  static final Field<LocalDateTime> TICKET_CREATED_AT =
      DSL.field(DSL.name("created_at"), SQLDataType.LOCALDATETIME);

  static final Table<Record> NOMA_SEQUENCE = DSL.table(DSL.name("noma_sequence"));
  static final Field<String> SEQUENCE_NAME = DSL.field(DSL.name("name"), SQLDataType.VARCHAR);
  static final Field<Long> SEQUENCE_NEXT_VALUE =
      DSL.field(DSL.name("next_value"), SQLDataType.BIGINT);

  private DigitTables() {
    // Constants holder
  }
}
