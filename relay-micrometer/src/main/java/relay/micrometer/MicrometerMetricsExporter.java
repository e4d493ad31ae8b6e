package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import relay.ProcessingOutcome;
import relay.spi.MetricsExporter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and timers with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.connected}: 1 while the subscriber holds a broker connection</li>
 *   <li>{@code relay.last.connect.timestamp}: epoch millis of the last (re)connect</li>
 *   <li>{@code relay.last.delivery.timestamp}: epoch millis of the last delivery</li>
 *   <li>{@code relay.worker.in.flight}: deliveries currently owned by workers</li>
 * </ul>
 *
 * <h3>Counters and timers</h3>
 * <ul>
 *   <li>{@code relay.processed{outcome}}: settled deliveries</li>
 *   <li>{@code relay.processing.duration{outcome}}: dispatch to settlement</li>
 *   <li>{@code relay.ack.errors}, {@code relay.reject.errors}: failed settlements</li>
 *   <li>{@code relay.retry.publish.errors}: retry copies the broker refused</li>
 *   <li>{@code relay.publish.success}, {@code relay.publish.failure}: publisher results</li>
 * </ul>
 *
 * <p>The {@code outcome} tag carries {@link ProcessingOutcome#tag()}.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String OUTCOME_TAG = "outcome";

  private final MeterRegistry registry;
  private final List<Meter> meters = new ArrayList<>();
  private final Map<ProcessingOutcome, Counter> processed = new EnumMap<>(ProcessingOutcome.class);
  private final Map<ProcessingOutcome, Timer> durations = new EnumMap<>(ProcessingOutcome.class);
  private final Counter ackErrors;
  private final Counter rejectErrors;
  private final Counter retryPublishErrors;
  private final Counter publishSuccess;
  private final Counter publishFailure;

  private final AtomicInteger connected = new AtomicInteger();
  private final AtomicLong lastConnectMs = new AtomicLong();
  private final AtomicLong lastDeliveryMs = new AtomicLong();
  private final AtomicInteger inFlight = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix, one per stage when several
   * subscribers share a registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "analysis.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;

    meters.add(Gauge.builder(namePrefix + ".connected", connected, AtomicInteger::get)
        .description("1 while a broker connection is held")
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".last.connect.timestamp", lastConnectMs, AtomicLong::get)
        .description("Epoch millis of the most recent connect")
        .baseUnit("milliseconds")
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".last.delivery.timestamp", lastDeliveryMs, AtomicLong::get)
        .description("Epoch millis of the most recent delivery")
        .baseUnit("milliseconds")
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".worker.in.flight", inFlight, AtomicInteger::get)
        .description("Deliveries currently owned by workers")
        .register(registry));

    for (ProcessingOutcome outcome : ProcessingOutcome.values()) {
      Counter counter = Counter.builder(namePrefix + ".processed")
          .tag(OUTCOME_TAG, outcome.tag())
          .description("Deliveries settled")
          .register(registry);
      Timer timer = Timer.builder(namePrefix + ".processing.duration")
          .tag(OUTCOME_TAG, outcome.tag())
          .description("Time from dispatch to ack or reject")
          .publishPercentileHistogram()
          .register(registry);
      processed.put(outcome, counter);
      durations.put(outcome, timer);
      meters.add(counter);
      meters.add(timer);
    }

    this.ackErrors = counter(namePrefix + ".ack.errors", "Acks the broker did not accept");
    this.rejectErrors = counter(namePrefix + ".reject.errors", "Rejects the broker did not accept");
    this.retryPublishErrors = counter(namePrefix + ".retry.publish.errors",
        "Retry copies the broker did not accept");
    this.publishSuccess = counter(namePrefix + ".publish.success", "Confirmed publishes");
    this.publishFailure = counter(namePrefix + ".publish.failure", "Failed publishes");
  }

  private Counter counter(String name, String description) {
    Counter counter = Counter.builder(name).description(description).register(registry);
    meters.add(counter);
    return counter;
  }

  @Override
  public void recordConnected(boolean connected) {
    if (closed) return;
    this.connected.set(connected ? 1 : 0);
  }

  @Override
  public void recordConnectedAt(Instant at) {
    if (closed) return;
    lastConnectMs.set(at.toEpochMilli());
  }

  @Override
  public void recordDeliveryObservedAt(Instant at) {
    if (closed) return;
    lastDeliveryMs.set(at.toEpochMilli());
  }

  @Override
  public void recordInFlight(int inFlight) {
    if (closed) return;
    this.inFlight.set(inFlight);
  }

  @Override
  public void recordProcessed(ProcessingOutcome outcome, long durationNanos) {
    if (closed) return;
    processed.get(outcome).increment();
    durations.get(outcome).record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void incrementAckFailure() {
    if (closed) return;
    ackErrors.increment();
  }

  @Override
  public void incrementRejectFailure() {
    if (closed) return;
    rejectErrors.increment();
  }

  @Override
  public void incrementRetryPublishFailure() {
    if (closed) return;
    retryPublishErrors.increment();
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    publishSuccess.increment();
  }

  @Override
  public void incrementPublishFailure() {
    if (closed) return;
    publishFailure.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the subscriber is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
