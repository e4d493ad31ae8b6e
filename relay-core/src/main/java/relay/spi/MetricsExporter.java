package relay.spi;

import relay.ProcessingOutcome;

import java.time.Instant;

/**
 * Observability hook for exporting pipeline gauges, counters and latencies to a
 * metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implementations are called from
 * worker, broker and supervisor threads concurrently and must be thread-safe.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Records whether the subscriber currently holds a live broker connection.
   */
  void recordConnected(boolean connected);

  /**
   * Records the time of the most recent successful (re)connect.
   */
  void recordConnectedAt(Instant at);

  /**
   * Records the time the most recent delivery arrived from the broker.
   */
  void recordDeliveryObservedAt(Instant at);

  /**
   * Records the number of deliveries currently owned by workers.
   */
  void recordInFlight(int inFlight);

  /**
   * Records one settled delivery and the time from dispatch to ack or reject.
   *
   * @param outcome       the terminal outcome
   * @param durationNanos processing time in nanoseconds (non-negative)
   */
  void recordProcessed(ProcessingOutcome outcome, long durationNanos);

  void incrementAckFailure();

  void incrementRejectFailure();

  /**
   * Increments the count of retry copies the broker did not accept. The original
   * delivery is requeued in that case.
   */
  void incrementRetryPublishFailure();

  default void incrementPublished() {
  }

  default void incrementPublishFailure() {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void recordConnected(boolean connected) {
    }

    @Override
    public void recordConnectedAt(Instant at) {
    }

    @Override
    public void recordDeliveryObservedAt(Instant at) {
    }

    @Override
    public void recordInFlight(int inFlight) {
    }

    @Override
    public void recordProcessed(ProcessingOutcome outcome, long durationNanos) {
    }

    @Override
    public void incrementAckFailure() {
    }

    @Override
    public void incrementRejectFailure() {
    }

    @Override
    public void incrementRetryPublishFailure() {
    }
  }
}
