package relay.dispatch;

import relay.Delivery;
import relay.DeliveryCallback;
import relay.ProcessingOutcome;
import relay.registry.CallbackRegistry;
import relay.spi.BrokerChannel;
import relay.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one delivery through its callback and settles it exactly once.
 *
 * <p>Received, then Processing, then one of Acked, RetriedTransient, DeadLettered or
 * PermanentReject. A delivery whose routing key has no callback is rejected without
 * requeue and no callback runs. Processing time, from dispatch to settlement, is
 * recorded per outcome. Anything thrown outside the callback, by the registry or by a
 * collaborator, still settles the delivery: it is rejected without requeue and counted
 * as PermanentReject.
 */
public final class DeliveryProcessor {
  private static final Logger logger = Logger.getLogger(DeliveryProcessor.class.getName());

  private final CallbackRegistry registry;
  private final BrokerChannel channel;
  private final RetryCoordinator retries;
  private final List<DeliveryInterceptor> interceptors;
  private final MetricsExporter metrics;

  /**
   * @param registry     callback lookup
   * @param channel      the channel the deliveries arrived on, used for ack and reject
   * @param retries      failure handling
   * @param interceptors hooks around each callback
   * @param metrics      receives outcome counts and durations
   */
  public DeliveryProcessor(CallbackRegistry registry, BrokerChannel channel, RetryCoordinator retries,
                           List<DeliveryInterceptor> interceptors, MetricsExporter metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.retries = Objects.requireNonNull(retries, "retries");
    this.interceptors = interceptors == null
        ? List.of() : Collections.unmodifiableList(new ArrayList<>(interceptors));
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Processes and settles a delivery.
   *
   * @param delivery the delivery
   * @return the outcome, one per delivery
   */
  public ProcessingOutcome process(Delivery delivery) {
    long start = System.nanoTime();
    DeliverySettlement settlement = new DeliverySettlement(channel, delivery.deliveryTag(), metrics);
    logger.log(Level.FINE, "Processing {0}", delivery);

    ProcessingOutcome outcome;
    try {
      outcome = dispatch(delivery, settlement);
    } catch (Throwable t) {
      if (settlement.isSettled()) {
        logger.log(Level.SEVERE, "Processing failed after settlement of " + delivery, t);
      } else {
        settlement.reject(false);
        logger.log(Level.SEVERE, "Processing failed, rejecting " + delivery, t);
      }
      outcome = ProcessingOutcome.PERMANENT_REJECT;
    }

    long elapsed = System.nanoTime() - start;
    metrics.recordProcessed(outcome, elapsed);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Finished " + delivery + " outcome=" + outcome.tag()
          + " durationMs=" + elapsed / 1_000_000);
    }
    return outcome;
  }

  private ProcessingOutcome dispatch(Delivery delivery, DeliverySettlement settlement) {
    DeliveryCallback callback = registry.callbackFor(delivery.routingKey());
    if (callback == null) {
      settlement.reject(false);
      logger.log(Level.SEVERE, "No callback for routingKey=" + delivery.routingKey()
          + ", rejecting messageId=" + delivery.envelope().messageId());
      return ProcessingOutcome.PERMANENT_REJECT;
    }
    Throwable failure = invoke(callback, delivery);
    if (failure == null) {
      settlement.ack();
      return ProcessingOutcome.ACKED;
    }
    return retries.onFailure(delivery, failure, settlement);
  }

  private Throwable invoke(DeliveryCallback callback, Delivery delivery) {
    int completedBefore = 0;
    Throwable failure = null;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDispatch(delivery);
        completedBefore = i + 1;
      }
      callback.onDelivery(delivery);
    } catch (Throwable t) {
      failure = t;
    }
    runAfterDispatch(delivery, failure, completedBefore);
    return failure;
  }

  private void runAfterDispatch(Delivery delivery, Throwable error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(delivery, error);
      } catch (Throwable ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }
}
