package be.uclouvain.osis.admission.infrastructure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import be.uclouvain.osis.admission.ddd.async.TaskQueue;
import be.uclouvain.osis.admission.doctorat.jury.commands.AjouterMembreCommand;
import be.uclouvain.osis.admission.doctorat.preparation.commands.ApprouverAdmissionParSicCommand;
import be.uclouvain.osis.admission.domain.digit.RecupererNomaEnvoyeADigitQuery;
import be.uclouvain.osis.admission.domain.digit.SoumettreTicketPersonneCommand;
import be.uclouvain.osis.admission.formationcontinue.commands.ValiderPropositionCommand;
import be.uclouvain.osis.admission.generale.commands.RecupererPropositionGeneraleQuery;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.h2.jdbcx.JdbcDataSource;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;

class AdmissionMessageBusFactoryTest {
  @Test
  void every_track_is_wired() {
    final var messageBus = AdmissionMessageBusFactory.inMemory().messageBus();

    assertTrue(messageBus.getSupportedCommandClasses().contains(AjouterMembreCommand.class));
    assertTrue(
        messageBus.getSupportedCommandClasses().contains(ApprouverAdmissionParSicCommand.class));
    assertTrue(messageBus.getSupportedCommandClasses().contains(ValiderPropositionCommand.class));
    assertTrue(
        messageBus.getSupportedCommandClasses().contains(SoumettreTicketPersonneCommand.class));
    assertTrue(
        messageBus.getSupportedQueryClasses().contains(RecupererPropositionGeneraleQuery.class));
    assertTrue(
        messageBus.getSupportedQueryClasses().contains(RecupererNomaEnvoyeADigitQuery.class));
  }

  @Test
  void production_bus_handles_the_same_messages() {
    final var dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:factory;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE");
    final var dsl = DSL.using(dataSource, SQLDialect.POSTGRES);
    final var inMemory = AdmissionMessageBusFactory.inMemory().messageBus();

    final var production =
        AdmissionMessageBusFactory.production(
            dsl, AdmissionSettings.defaults(), TaskQueue.inline());

    assertEquals(inMemory.getSupportedCommandClasses(), production.getSupportedCommandClasses());
    assertEquals(inMemory.getSupportedQueryClasses(), production.getSupportedQueryClasses());
  }

  @Test
  void asynchronous_queue_runs_on_named_daemon_threads() throws Exception {
    final var taskQueue =
        AdmissionMessageBusFactory.asynchronousTaskQueue(AdmissionSettings.defaults());
    final var thread = new CompletableFuture<Thread>();

    taskQueue.submit(() -> thread.complete(Thread.currentThread()));

    final var worker = thread.get(5, TimeUnit.SECONDS);
    assertTrue(worker.getName().startsWith("admission-events-"));
    assertTrue(worker.isDaemon());
  }

  @Test
  void missing_arguments_are_rejected() {
    final var settings = AdmissionSettings.defaults();
    final var taskQueue = TaskQueue.inline();

    assertThrows(
        IllegalArgumentException.class,
        () -> AdmissionMessageBusFactory.create(null, settings, taskQueue));
    assertThrows(
        IllegalArgumentException.class,
        () -> AdmissionMessageBusFactory.production(null, settings, taskQueue));
    assertThrows(
        IllegalArgumentException.class,
        () -> AdmissionMessageBusFactory.asynchronousTaskQueue(null));
  }
}
