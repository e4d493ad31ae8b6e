package relay.dispatch;

import relay.Delivery;
import relay.Envelope;
import relay.PermanentFailureException;
import relay.ProcessingOutcome;
import relay.RelayException;
import relay.spi.BrokerChannel;
import relay.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides and carries out what happens to a delivery whose processing failed.
 *
 * <ul>
 *   <li>{@link PermanentFailureException} or an {@link Error}: reject without requeue
 *       ({@link ProcessingOutcome#PERMANENT_REJECT}).</li>
 *   <li>Attempt at or above the ceiling: reject without requeue, which the primary
 *       queue's dead-letter exchange routes to {@code <queue>.dlq}
 *       ({@link ProcessingOutcome#DEAD_LETTERED}).</li>
 *   <li>Otherwise: publish a copy with {@code attempt + 1} to the retry exchange, then ack
 *       the original ({@link ProcessingOutcome#RETRIED_TRANSIENT}). If the copy is not
 *       confirmed, the original is requeued instead so it is never lost.</li>
 * </ul>
 */
public final class RetryCoordinator {
  private static final Logger logger = Logger.getLogger(RetryCoordinator.class.getName());

  private final String queue;
  private final RetryPolicy policy;
  private final BrokerChannel retryChannel;
  private final Duration publishTimeout;
  private final MetricsExporter metrics;

  /**
   * @param queue          primary queue the deliveries come from
   * @param policy         retry ceiling and exchange naming
   * @param retryChannel   channel used to publish retry copies, with access serialized by the caller
   * @param publishTimeout confirm timeout for retry copies
   * @param metrics        receives retry-publish failures
   */
  public RetryCoordinator(String queue, RetryPolicy policy, BrokerChannel retryChannel,
                          Duration publishTimeout, MetricsExporter metrics) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.retryChannel = Objects.requireNonNull(retryChannel, "retryChannel");
    this.publishTimeout = Objects.requireNonNull(publishTimeout, "publishTimeout");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Settles a failed delivery.
   *
   * @param delivery   the delivery
   * @param failure    what the callback (or an interceptor) threw
   * @param settlement the delivery's settlement
   * @return the outcome
   */
  public ProcessingOutcome onFailure(Delivery delivery, Throwable failure, DeliverySettlement settlement) {
    int attempt = delivery.attempt();
    if (failure instanceof PermanentFailureException || failure instanceof Error) {
      settlement.reject(false);
      logger.log(Level.SEVERE, "Permanent failure, rejecting " + describe(delivery), failure);
      return ProcessingOutcome.PERMANENT_REJECT;
    }
    if (policy.isExhausted(attempt)) {
      settlement.reject(false);
      logger.log(Level.SEVERE, "Retries exhausted (" + policy.maxRetries() + "), dead-lettering "
          + describe(delivery), failure);
      return ProcessingOutcome.DEAD_LETTERED;
    }

    Envelope retry = delivery.envelope().withAttempt(attempt + 1);
    String exchange = policy.retryExchangeFor(queue);
    try {
      retryChannel.publish(exchange, retry, publishTimeout);
    } catch (RelayException e) {
      settlement.reject(true);
      metrics.incrementRetryPublishFailure();
      logger.log(Level.WARNING, "Retry publish to " + exchange + " failed, requeueing "
          + describe(delivery), e);
      return ProcessingOutcome.RETRIED_TRANSIENT;
    }
    settlement.ack();
    logger.log(Level.WARNING, "Processing failed, retry " + (attempt + 1) + "/" + policy.maxRetries()
        + " in " + policy.delay().toMillis() + " ms for " + describe(delivery) + ": " + failure);
    return ProcessingOutcome.RETRIED_TRANSIENT;
  }

  private String describe(Delivery delivery) {
    return "queue=" + queue
        + " routingKey=" + delivery.routingKey()
        + " messageId=" + delivery.envelope().messageId()
        + " attempt=" + delivery.attempt();
  }
}
