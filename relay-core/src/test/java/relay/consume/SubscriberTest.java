package relay.consume;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.DeliveryCallback;
import relay.Envelope;
import relay.PermanentFailureException;
import relay.ProcessingOutcome;
import relay.TopologyConflictException;
import relay.TopologyValidationException;
import relay.dispatch.RetryPolicy;
import relay.publish.Publisher;
import relay.spi.BrokerConnection;
import relay.testing.Await;
import relay.testing.InMemoryBroker;
import relay.testing.RecordingMetricsExporter;
import relay.topology.DeadLetterPolicy;
import relay.topology.QueueSpec;
import relay.topology.TopologyInstaller;
import relay.util.ReconnectBackoff;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SubscriberTest {

  record Report(int seq, String description) {
  }

  private static final Duration WAIT = Duration.ofSeconds(10);

  private final InMemoryBroker broker = new InMemoryBroker();
  private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();
  private final List<AutoCloseable> closeables = new ArrayList<>();

  @AfterEach
  void tearDown() throws Exception {
    for (int i = closeables.size() - 1; i >= 0; i--) {
      closeables.get(i).close();
    }
    broker.close();
  }

  private Subscriber.Builder builder() {
    return Subscriber.builder()
        .connector(broker)
        .exchange("reports")
        .queue("analysis")
        .metrics(metrics)
        .deadLetterPolicy(DeadLetterPolicy.defaultExchange())
        .drainTimeout(Duration.ofSeconds(5))
        .reconnectBackoff(new ReconnectBackoff(Duration.ofMillis(20), Duration.ofMillis(100)));
  }

  private Subscriber start(Subscriber.Builder builder, Map<String, DeliveryCallback> callbacks) {
    Subscriber subscriber = builder.build();
    closeables.add(subscriber);
    subscriber.start(callbacks);
    return subscriber;
  }

  private Publisher publisher() {
    Publisher publisher = Publisher.builder()
        .connector(broker)
        .exchange("reports")
        .routingKey("report.raw")
        .build();
    closeables.add(publisher);
    return publisher;
  }

  private static RetryPolicy retries(int maxRetries, Duration delay) {
    return RetryPolicy.builder().maxRetries(maxRetries).delay(delay).build();
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void missingDeadLetterChoiceFailsAtBuild() {
    assertThrows(TopologyValidationException.class, () ->
        Subscriber.builder().connector(broker).exchange("reports").queue("analysis").build());
  }

  @Test
  void builderRejectsMissingQueue() {
    assertThrows(NullPointerException.class, () ->
        Subscriber.builder().connector(broker).exchange("reports")
            .deadLetterPolicy(DeadLetterPolicy.discard()).build());
  }

  @Test
  void builderRejectsZeroConcurrency() {
    assertThrows(IllegalArgumentException.class, () -> builder().concurrency(0).build());
  }

  @Test
  void workerCountIsMinOfConcurrencyAndPrefetch() {
    assertEquals(20, builder().build().workerCount());
    assertEquals(5, builder().prefetch(5).build().workerCount());
    assertEquals(3, builder().concurrency(3).prefetch(10).build().workerCount());
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  @Test
  void startMayBeCalledOnce() {
    Subscriber subscriber = start(builder(), Map.of("report.raw", d -> { }));

    assertThrows(IllegalStateException.class, () -> subscriber.start(Map.of("report.raw", d -> { })));
  }

  @Test
  void startRequiresCallbacks() {
    Subscriber subscriber = builder().build();
    closeables.add(subscriber);

    assertThrows(IllegalArgumentException.class, () -> subscriber.start(Map.of()));
  }

  @Test
  void startAfterCloseFails() {
    Subscriber subscriber = builder().build();
    subscriber.close();

    assertThrows(IllegalStateException.class, () -> subscriber.start(Map.of("report.raw", d -> { })));
  }

  @Test
  void startInstallsTopologyAndReportsHealth() {
    Subscriber subscriber = start(builder().prefetch(4), Map.of("report.raw", d -> { }, "report.tagged", d -> { }));

    assertTrue(subscriber.isConnected());
    assertNotNull(subscriber.lastConnectAt());
    assertNull(subscriber.lastDeliveryAt());
    assertTrue(metrics.connected());
    assertEquals("reports", subscriber.exchange());
    assertEquals("analysis", subscriber.queue());
    assertEquals(2, broker.bindingKeys("reports", "analysis").size());
    assertNotNull(broker.queueSpec("analysis.retry"));
    assertNotNull(broker.queueSpec("analysis.dlq"));

    SubscriberHealth health = subscriber.health();
    assertTrue(health.connected());
    assertEquals(0, health.inFlight());
  }

  @Test
  void conflictingTopologyFailsStart() {
    try (BrokerConnection connection = broker.connect()) {
      new TopologyInstaller(connection.openChannel())
          .declare(QueueSpec.builder("analysis.retry").messageTtl(Duration.ofMinutes(5)).build());
    }
    Subscriber subscriber = builder().retryPolicy(retries(3, Duration.ofSeconds(1))).build();
    closeables.add(subscriber);

    assertThrows(TopologyConflictException.class, () -> subscriber.start(Map.of("report.raw", d -> { })));
    assertFalse(subscriber.isConnected());
    assertNotNull(subscriber.lastError());
  }

  @Test
  void closeStopsConsuming() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    Subscriber subscriber = start(builder(), Map.of("report.raw", d -> calls.incrementAndGet()));

    subscriber.close();
    publisher().publish(new Report(1, "late"));

    assertFalse(subscriber.isConnected());
    assertTrue(broker.awaitMessageCount("analysis", 1, WAIT));
    assertEquals(0, calls.get());
  }

  // ── Delivery ────────────────────────────────────────────────────

  @Test
  void roundTripDeliversAndAcks() throws Exception {
    List<Report> received = new CopyOnWriteArrayList<>();
    Subscriber subscriber = start(builder(),
        Map.of("report.raw", d -> received.add(d.payloadAs(Report.class))));

    publisher().publish(new Report(42, "test"));

    assertTrue(Await.until(() -> metrics.processed(ProcessingOutcome.ACKED) == 1, WAIT));
    assertEquals(List.of(new Report(42, "test")), received);
    assertNotNull(subscriber.lastDeliveryAt());
    assertNotNull(metrics.deliveryObservedAt());
    assertEquals(0, broker.messageCount("analysis"));
    assertTrue(Await.until(() -> broker.unackedCount() == 0, WAIT));
  }

  @Test
  void dispatchesByRoutingKey() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    start(builder(), Map.of(
        "report.raw", d -> seen.add("raw:" + d.routingKey()),
        "report.tagged", d -> seen.add("tagged:" + d.routingKey())));

    Publisher publisher = publisher();
    publisher.publish("report.raw", new Report(1, "a"));
    publisher.publish("report.tagged", new Report(2, "b"));

    assertTrue(Await.until(() -> seen.size() == 2, WAIT));
    assertTrue(seen.contains("raw:report.raw"));
    assertTrue(seen.contains("tagged:report.tagged"));
  }

  @Test
  void transientFailureRetriesAfterDelay() throws Exception {
    List<Long> invokedAt = new CopyOnWriteArrayList<>();
    List<Integer> attempts = new CopyOnWriteArrayList<>();
    start(builder().retryPolicy(retries(3, Duration.ofSeconds(1))), Map.of("report.raw", d -> {
      invokedAt.add(System.nanoTime());
      attempts.add(d.attempt());
      if (d.attempt() == 0) {
        throw new IllegalStateException("first try fails");
      }
      assertEquals(new Report(42, "test"), d.payloadAs(Report.class));
    }));

    publisher().publish(new Report(42, "test"));

    assertTrue(Await.until(() -> metrics.processed(ProcessingOutcome.ACKED) == 1, WAIT));
    assertEquals(List.of(0, 1), attempts);
    assertEquals(1, metrics.processed(ProcessingOutcome.RETRIED_TRANSIENT));
    long gapMs = (invokedAt.get(1) - invokedAt.get(0)) / 1_000_000;
    assertTrue(gapMs >= 1_000, "gap=" + gapMs);
  }

  @Test
  void transientFailuresBelowCeilingInvokeKPlusOneTimes() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    start(builder().retryPolicy(retries(3, Duration.ofMillis(50))), Map.of("report.raw", d -> {
      if (calls.incrementAndGet() <= 2) {
        throw new Exception("flaky");
      }
    }));

    publisher().publish(new Report(7, "flaky"));

    assertTrue(Await.until(() -> metrics.processed(ProcessingOutcome.ACKED) == 1, WAIT));
    assertEquals(3, calls.get());
    assertEquals(2, metrics.processed(ProcessingOutcome.RETRIED_TRANSIENT));
    assertEquals(0, broker.messageCount("analysis.dlq"));
  }

  @Test
  void alwaysFailingDeliveryEndsInDeadLetterQueueOnce() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    start(builder().retryPolicy(retries(2, Duration.ofMillis(50))), Map.of("report.raw", d -> {
      calls.incrementAndGet();
      throw new Exception("poison");
    }));

    publisher().publish(new Report(13, "poison"));

    assertTrue(broker.awaitMessageCount("analysis.dlq", 1, WAIT));
    Thread.sleep(300);
    assertEquals(3, calls.get());
    assertEquals(1, broker.messageCount("analysis.dlq"));
    assertEquals(0, broker.messageCount("analysis.retry"));
    assertEquals(1, metrics.processed(ProcessingOutcome.DEAD_LETTERED));

    Envelope dead = broker.peek("analysis.dlq").get(0);
    assertEquals(2, dead.attempt());
    assertEquals("analysis.dlq", dead.routingKey());
  }

  @Test
  void permanentFailureSkipsRetries() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    start(builder().retryPolicy(retries(5, Duration.ofMillis(50))), Map.of("report.raw", d -> {
      calls.incrementAndGet();
      throw new PermanentFailureException("unparseable report");
    }));

    publisher().publish(new Report(1, "bad"));

    assertTrue(broker.awaitMessageCount("analysis.dlq", 1, WAIT));
    assertEquals(1, calls.get());
    assertEquals(1, metrics.processed(ProcessingOutcome.PERMANENT_REJECT));
  }

  @Test
  void unmatchedRoutingKeyIsDeadLetteredWithoutCallbacks() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    start(builder(), Map.of("report.raw", d -> calls.incrementAndGet()));

    try (BrokerConnection connection = broker.connect()) {
      // the default exchange routes on queue name, bypassing the bindings
      connection.openChannel().publish("", Envelope.ofJson("analysis", "{}"), Duration.ofSeconds(1));
    }

    assertTrue(broker.awaitMessageCount("analysis.dlq", 1, WAIT));
    assertEquals(0, calls.get());
    assertEquals(1, metrics.processed(ProcessingOutcome.PERMANENT_REJECT));
  }

  @Test
  void discardPolicyDropsExhaustedDeliveries() throws Exception {
    start(builder().deadLetterPolicy(DeadLetterPolicy.discard()).retryPolicy(retries(0, Duration.ofMillis(50))),
        Map.of("report.raw", d -> {
          throw new Exception("poison");
        }));

    publisher().publish(new Report(1, "dropped"));

    assertTrue(Await.until(() -> metrics.processed(ProcessingOutcome.DEAD_LETTERED) == 1, WAIT));
    assertNull(broker.queueSpec("analysis.dlq"));
    assertTrue(Await.until(() -> broker.unackedCount() == 0, WAIT));
    assertEquals(0, broker.messageCount("analysis"));
  }

  @Test
  void retryPublishFailureRequeuesOriginal() throws Exception {
    broker.failPublishesTo("relay-retry.analysis");
    List<Boolean> redelivered = new CopyOnWriteArrayList<>();
    List<Integer> attempts = new CopyOnWriteArrayList<>();
    start(builder().retryPolicy(retries(3, Duration.ofMillis(50))), Map.of("report.raw", d -> {
      redelivered.add(d.redelivered());
      attempts.add(d.attempt());
      if (attempts.size() == 2) {
        broker.clearPublishFailures();
      }
      if (attempts.size() <= 2) {
        throw new Exception("transient");
      }
    }));

    publisher().publish(new Report(3, "requeued"));

    assertTrue(Await.until(() -> metrics.processed(ProcessingOutcome.ACKED) == 1, WAIT));
    assertEquals(1, metrics.retryPublishFailures());
    assertEquals(List.of(0, 0, 1), attempts);
    assertFalse(redelivered.get(0));
    assertTrue(redelivered.get(1));
  }

  @Test
  void ackFailureIsCounted() throws Exception {
    start(builder(), Map.of("report.raw", d -> broker.failAcks(true)));

    publisher().publish(new Report(1, "x"));

    assertTrue(Await.until(() -> metrics.ackFailures() == 1, WAIT));
    broker.failAcks(false);
    assertEquals(1, metrics.processed(ProcessingOutcome.ACKED));
  }

  // ── Concurrency ─────────────────────────────────────────────────

  @Test
  void inFlightNeverExceedsWorkerCountAndReturnsToZero() throws Exception {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    start(builder().concurrency(4).prefetch(8), Map.of("report.raw", d -> {
      peak.accumulateAndGet(running.incrementAndGet(), Math::max);
      Thread.sleep(20);
      running.decrementAndGet();
    }));

    Publisher publisher = publisher();
    for (int i = 0; i < 30; i++) {
      publisher.publish(new Report(i, "load"));
    }

    assertTrue(Await.until(() -> metrics.processed(ProcessingOutcome.ACKED) == 30, WAIT));
    assertTrue(peak.get() <= 4, "peak=" + peak.get());
    assertTrue(metrics.maxInFlight() <= 4, "maxInFlight=" + metrics.maxInFlight());
    assertTrue(Await.until(() -> metrics.inFlight() == 0, WAIT));
  }

  // ── Reconnect ───────────────────────────────────────────────────

  @Test
  void recoversAfterConnectionDrop() throws Exception {
    List<Integer> seqs = new CopyOnWriteArrayList<>();
    Subscriber subscriber = start(builder(), Map.of("report.raw", d -> seqs.add(d.payloadAs(Report.class).seq())));
    Publisher publisher = publisher();
    publisher.publish(new Report(1, "before"));
    assertTrue(Await.until(() -> seqs.size() == 1, WAIT));

    broker.setDown(true);
    broker.kill();
    assertTrue(Await.until(() -> !subscriber.isConnected(), WAIT));
    assertTrue(Await.until(() -> broker.connectAttempts() >= 5, WAIT));
    assertNotNull(subscriber.lastError());

    broker.setDown(false);
    assertTrue(Await.until(subscriber::isConnected, WAIT));
    publisher.publish(new Report(2, "after"));

    assertTrue(Await.until(() -> seqs.size() == 2, WAIT));
    assertEquals(List.of(1, 2), seqs);
    assertTrue(metrics.connected());
  }

  @Test
  void unackedDeliveriesAreRedeliveredAfterReconnect() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    List<Boolean> redelivered = new CopyOnWriteArrayList<>();
    start(builder(), Map.of("report.raw", d -> {
      redelivered.add(d.redelivered());
      if (calls.incrementAndGet() == 1) {
        broker.kill();
      }
    }));

    publisher().publish(new Report(1, "interrupted"));

    assertTrue(Await.until(() -> metrics.processed(ProcessingOutcome.ACKED) == 2, WAIT));
    assertEquals(List.of(false, true), redelivered);
    assertEquals(1, metrics.ackFailures());
  }
}
