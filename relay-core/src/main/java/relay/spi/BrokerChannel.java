package relay.spi;

import relay.Envelope;
import relay.topology.BindingSpec;
import relay.topology.ExchangeSpec;
import relay.topology.QueueSpec;

import java.time.Duration;

/**
 * A single AMQP channel. Implementations are <b>not</b> thread-safe; callers
 * serialize access.
 *
 * <p>All failures surface as unchecked {@link relay.RelayException}s. A failed declaration
 * closes the channel, as it does on a real broker.
 */
public interface BrokerChannel extends AutoCloseable {

  /**
   * Declares an exchange. Idempotent for identical parameters.
   *
   * @throws relay.TopologyConflictException if it exists with different parameters
   * @throws relay.DeclarationException for other declaration failures
   */
  void declareExchange(ExchangeSpec exchange);

  /**
   * Declares a queue. Idempotent for identical parameters.
   *
   * @throws relay.TopologyConflictException if it exists with different parameters or arguments
   * @throws relay.DeclarationException for other declaration failures
   */
  void declareQueue(QueueSpec queue);

  /**
   * Binds a queue to an exchange.
   *
   * @throws relay.DeclarationException if the exchange or queue does not exist
   */
  void bindQueue(BindingSpec binding);

  /**
   * Publishes a message and waits for the broker to confirm it.
   *
   * <p>A message whose routing key matches no binding is confirmed and dropped.
   *
   * @param exchange       target exchange
   * @param envelope       the message
   * @param confirmTimeout maximum time to wait for the confirm
   * @throws relay.PublishTimeoutException if no confirm arrives in time
   * @throws relay.BrokerOperationException if the broker nacks the message
   * @throws relay.BrokerConnectionException if the channel or connection is closed
   */
  void publish(String exchange, Envelope envelope, Duration confirmTimeout);

  /**
   * Limits unacknowledged deliveries on this channel.
   */
  void qos(int prefetch);

  /**
   * Starts a manual-acknowledgment consumer.
   *
   * @return the consumer tag
   */
  String consume(String queue, DeliverySink sink);

  void ack(long deliveryTag);

  /**
   * Rejects one delivery. Without requeue the broker dead-letters it when the queue
   * has a dead-letter exchange, and drops it otherwise.
   */
  void reject(long deliveryTag, boolean requeue);

  void cancel(String consumerTag);

  boolean isOpen();

  @Override
  void close();
}
