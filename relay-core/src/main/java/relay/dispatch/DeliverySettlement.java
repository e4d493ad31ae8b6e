package relay.dispatch;

import relay.RelayException;
import relay.spi.BrokerChannel;
import relay.spi.MetricsExporter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single terminal broker action for one delivery tag.
 *
 * <p>The first call to {@link #ack()} or {@link #reject(boolean)} claims the
 * delivery; later calls do nothing and return {@code false}. A failed ack or reject is
 * counted and logged but not retried: the broker redelivers the message once the
 * channel closes.
 */
public final class DeliverySettlement {
  private static final Logger logger = Logger.getLogger(DeliverySettlement.class.getName());

  private final BrokerChannel channel;
  private final long deliveryTag;
  private final MetricsExporter metrics;
  private final AtomicBoolean settled = new AtomicBoolean();

  public DeliverySettlement(BrokerChannel channel, long deliveryTag, MetricsExporter metrics) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.deliveryTag = deliveryTag;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * @return {@code true} if the ack reached the broker
   */
  public boolean ack() {
    if (!settled.compareAndSet(false, true)) {
      return false;
    }
    try {
      channel.ack(deliveryTag);
      return true;
    } catch (RelayException e) {
      metrics.incrementAckFailure();
      logger.log(Level.WARNING, "Failed to ack deliveryTag=" + deliveryTag, e);
      return false;
    }
  }

  /**
   * @param requeue {@code true} to put the message back on its queue
   * @return {@code true} if the reject reached the broker
   */
  public boolean reject(boolean requeue) {
    if (!settled.compareAndSet(false, true)) {
      return false;
    }
    try {
      channel.reject(deliveryTag, requeue);
      return true;
    } catch (RelayException e) {
      metrics.incrementRejectFailure();
      logger.log(Level.WARNING, "Failed to reject deliveryTag=" + deliveryTag + " requeue=" + requeue, e);
      return false;
    }
  }

  public boolean isSettled() {
    return settled.get();
  }

  public long deliveryTag() {
    return deliveryTag;
  }
}
