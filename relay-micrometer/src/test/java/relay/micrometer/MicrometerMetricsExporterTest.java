package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.ProcessingOutcome;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void connectedGaugeFlips() {
    assertEquals(0.0, gauge("relay.connected").value());
    exporter.recordConnected(true);
    assertEquals(1.0, gauge("relay.connected").value());
    exporter.recordConnected(false);
    assertEquals(0.0, gauge("relay.connected").value());
  }

  @Test
  void timestampsAreEpochMillis() {
    Instant at = Instant.parse("2024-03-01T12:00:00Z");
    exporter.recordConnectedAt(at);
    exporter.recordDeliveryObservedAt(at.plusSeconds(5));

    assertEquals((double) at.toEpochMilli(), gauge("relay.last.connect.timestamp").value());
    assertEquals((double) at.plusSeconds(5).toEpochMilli(), gauge("relay.last.delivery.timestamp").value());
  }

  @Test
  void inFlightGauge() {
    exporter.recordInFlight(7);
    assertEquals(7.0, gauge("relay.worker.in.flight").value());
    exporter.recordInFlight(0);
    assertEquals(0.0, gauge("relay.worker.in.flight").value());
  }

  @Test
  void processedIsTaggedByOutcome() {
    exporter.recordProcessed(ProcessingOutcome.ACKED, TimeUnit.MILLISECONDS.toNanos(5));
    exporter.recordProcessed(ProcessingOutcome.ACKED, TimeUnit.MILLISECONDS.toNanos(15));
    exporter.recordProcessed(ProcessingOutcome.DEAD_LETTERED, TimeUnit.MILLISECONDS.toNanos(1));

    assertEquals(2.0, processed("success").count());
    assertEquals(1.0, processed("dead_lettered").count());
    assertEquals(0.0, processed("transient_error").count());
    assertEquals(0.0, processed("permanent_error").count());

    Timer timer = registry.find("relay.processing.duration").tag("outcome", "success").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(20.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void failureCounters() {
    exporter.incrementAckFailure();
    exporter.incrementRejectFailure();
    exporter.incrementRejectFailure();
    exporter.incrementRetryPublishFailure();

    assertEquals(1.0, counter("relay.ack.errors").count());
    assertEquals(2.0, counter("relay.reject.errors").count());
    assertEquals(1.0, counter("relay.retry.publish.errors").count());
  }

  @Test
  void publisherCounters() {
    exporter.incrementPublished();
    exporter.incrementPublished();
    exporter.incrementPublishFailure();

    assertEquals(2.0, counter("relay.publish.success").count());
    assertEquals(1.0, counter("relay.publish.failure").count());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "analysis.relay");
    custom.recordInFlight(3);
    custom.incrementAckFailure();

    assertEquals(3.0, gauge("analysis.relay.worker.in.flight").value());
    assertEquals(1.0, counter("analysis.relay.ack.errors").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementAckFailure();
    exporter.recordProcessed(ProcessingOutcome.ACKED, 1L);

    assertNull(registry.find("relay.ack.errors").counter());
    assertNull(registry.find("relay.processed").counter());
    assertNull(registry.find("relay.connected").gauge());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void badPrefixThrows() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "relay."));
  }

  private Counter processed(String outcome) {
    Counter c = registry.find("relay.processed").tag("outcome", outcome).counter();
    assertNotNull(c, "Counter not found for outcome " + outcome);
    return c;
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
