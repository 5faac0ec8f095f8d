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

import be.uclouvain.osis.admission.ddd.async.TaskQueue;
import be.uclouvain.osis.admission.ddd.cqrs.ConsumptionMode;
import be.uclouvain.osis.admission.ddd.cqrs.MessageBus;
import be.uclouvain.osis.admission.ddd.jooq.PayloadMapper;
import be.uclouvain.osis.admission.doctorat.events.AdmissionDoctoraleApprouveeParSicEvent;
import be.uclouvain.osis.admission.formationcontinue.events.InscriptionFormationContinueValideeEvent;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqActiviteRepository;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqDigitRepository;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqDoctoratTranslator;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqEmplacementDocumentRepository;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqEpreuveConfirmationRepository;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqGroupeDeSupervisionRepository;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqHistorique;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqJuryRepository;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqProfilCandidatTranslator;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqPropositionContinueRepository;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqPropositionGeneraleRepository;
import be.uclouvain.osis.admission.infrastructure.jooq.JooqPropositionRepository;
import be.uclouvain.osis.admission.infrastructure.logging.LoggingNotification;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the {@link MessageBus} serving every admission track.
 *
 * <p>Wiring is explicit: each track registers its handlers against the dependencies it is given,
 * so the same bus can run on top of a database or on in-memory fixtures.
 */
public final class AdmissionMessageBusFactory {
  private static final Logger log = LoggerFactory.getLogger(AdmissionMessageBusFactory.class);

  private AdmissionMessageBusFactory() {
    // Cannot be instantiated
  }

  /**
   * @param dependencies repositories, translators and sinks used by the handlers
   * @param settings tunables of the handlers
   * @param taskQueue running asynchronous event handlers
   * @return a bus knowing every command, query and event handler of the admission tracks
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public static MessageBus create(
      final AdmissionDependencies dependencies,
      final AdmissionSettings settings,
      final TaskQueue taskQueue) {
    if (dependencies == null) {
      throw new IllegalArgumentException("Dependencies cannot be null");
    }

    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null");
    }

    final MessageBus.Builder builder = MessageBus.builder().taskQueue(taskQueue);
    DocumentHandlers.register(builder, dependencies);
    DoctoratHandlers.register(builder, dependencies, settings);
    GeneraleHandlers.register(builder, dependencies);
    FormationContinueHandlers.register(builder, dependencies);

    builder
        .addEventHandler(
            AdmissionDoctoraleApprouveeParSicEvent.class,
            ConsumptionMode.ASYNCHRONOUS,
            new InscrireCandidatAdmisHandler())
        .addEventHandler(
            InscriptionFormationContinueValideeEvent.class,
            ConsumptionMode.SYNCHRONOUS,
            new JournaliserInscriptionValideeHandler());

    final MessageBus messageBus = builder.build();
    log.info(
        "Admission message bus ready with {} command handlers",
        messageBus.getSupportedCommandClasses().size());
    return messageBus;
  }

  /**
   * @param dsl connected to a database holding the admission schema
   * @param settings tunables of the handlers
   * @param taskQueue running asynchronous event handlers
   * @return a bus persisting its aggregates with jOOQ
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public static MessageBus production(
      final DSLContext dsl, final AdmissionSettings settings, final TaskQueue taskQueue) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSL context cannot be null");
    }

    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null");
    }

    final ObjectMapper objectMapper = PayloadMapper.create();
    final AdmissionDependencies dependencies =
        new AdmissionDependencies(
            new JooqPropositionRepository(dsl, objectMapper),
            new JooqEmplacementDocumentRepository(dsl, objectMapper),
            new JooqJuryRepository(dsl, objectMapper),
            new JooqGroupeDeSupervisionRepository(dsl, objectMapper),
            new JooqEpreuveConfirmationRepository(dsl, objectMapper),
            new JooqActiviteRepository(dsl, objectMapper),
            new JooqPropositionGeneraleRepository(dsl, objectMapper),
            new JooqPropositionContinueRepository(dsl, objectMapper),
            new JooqDigitRepository(dsl, settings.sequenceNoma()),
            new JooqDoctoratTranslator(dsl),
            new JooqProfilCandidatTranslator(dsl, objectMapper),
            new JooqHistorique(dsl, objectMapper),
            new LoggingNotification());
    return create(dependencies, settings, taskQueue);
  }

  /**
   * @param settings giving the pool size
   * @return a queue backed by a fixed pool of daemon threads
   */
  public static TaskQueue asynchronousTaskQueue(final AdmissionSettings settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null");
    }

    final AtomicInteger counter = new AtomicInteger();
    final ExecutorService executor =
        Executors.newFixedThreadPool(
            settings.taillePoolAsynchrone(),
            runnable -> {
              final Thread thread =
                  new Thread(runnable, "admission-events-" + counter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
    return TaskQueue.executor(executor);
  }

  /**
   * @return a bus running on in-memory fixtures, with event handlers run inline
   */
  public static InMemoryAdmission inMemory() {
    return new InMemoryAdmission();
  }
}
