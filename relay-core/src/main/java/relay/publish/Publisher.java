package relay.publish;

import relay.BrokerConnectionException;
import relay.BrokerOperationException;
import relay.Envelope;
import relay.PublishTimeoutException;
import relay.RelayException;
import relay.RoutingKey;
import relay.spi.BrokerChannel;
import relay.spi.BrokerConnection;
import relay.spi.BrokerConnector;
import relay.spi.MetricsExporter;
import relay.topology.ExchangeSpec;
import relay.topology.ExchangeType;
import relay.util.PayloadCodec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends JSON events to one exchange with publisher confirms.
 *
 * <p>The publisher owns one connection and one channel. Sends are serialized through a
 * lock; each call waits at most the confirm timeout, covering lock acquisition, a lazy
 * connect and exchange declaration, and the broker confirm. A call that used up the
 * timeout before sending fails without sending. The connection is opened and the exchange declared lazily on first
 * use (or eagerly with {@link #connect()}), and reopened on the next call after a loss.
 *
 * <p>A returned call means the broker accepted the message. A message whose routing key
 * matches no binding is accepted and delivered nowhere.
 *
 * <pre>{@code
 * try (Publisher publisher = Publisher.builder()
 *     .connector(connector)
 *     .exchange("reports")
 *     .routingKey("report.raw")
 *     .build()) {
 *   publisher.publish(new Report(42, "test"));
 *   publisher.publish("report.tagged", tagged);
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class Publisher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Publisher.class.getName());

  public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(60);

  private final BrokerConnector connector;
  private final ExchangeSpec exchange;
  private final String defaultRoutingKey;
  private final PayloadCodec codec;
  private final Duration confirmTimeout;
  private final MetricsExporter metrics;

  private final ReentrantLock lock = new ReentrantLock();
  private BrokerConnection connection;
  private BrokerChannel channel;
  private boolean exchangeDeclared;
  private volatile boolean connected;
  private volatile boolean closed;

  private Publisher(Builder builder) {
    this.connector = Objects.requireNonNull(builder.connector, "connector");
    Objects.requireNonNull(builder.exchange, "exchange");
    this.exchange = ExchangeSpec.durable(builder.exchange,
        builder.exchangeType != null ? builder.exchangeType : ExchangeType.DIRECT);
    this.defaultRoutingKey = Objects.requireNonNull(builder.routingKey, "routingKey");
    this.codec = builder.codec != null ? builder.codec : PayloadCodec.json();
    this.confirmTimeout = Objects.requireNonNull(builder.confirmTimeout, "confirmTimeout");
    if (confirmTimeout.isZero() || confirmTimeout.isNegative()) {
      throw new IllegalArgumentException("confirmTimeout must be > 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Publishes a payload with the default routing key.
   *
   * @param payload the payload, serialized with the configured codec
   * @throws relay.PayloadEncodingException if the payload cannot be serialized
   * @throws RelayException if the broker did not accept the message
   */
  public void publish(Object payload) {
    publish(defaultRoutingKey, payload);
  }

  public void publish(RoutingKey routingKey, Object payload) {
    Objects.requireNonNull(routingKey, "routingKey");
    publish(routingKey.name(), payload);
  }

  /**
   * Publishes a payload with an explicit routing key.
   *
   * @param routingKey the routing key
   * @param payload    the payload, serialized with the configured codec
   * @throws relay.PayloadEncodingException if the payload cannot be serialized
   * @throws RelayException if the broker did not accept the message
   */
  public void publish(String routingKey, Object payload) {
    Objects.requireNonNull(routingKey, "routingKey");
    byte[] body = codec.encode(payload);
    publishEnvelope(Envelope.builder(routingKey)
        .contentType(codec.contentType())
        .persistent(true)
        .payload(body)
        .build());
  }

  /**
   * Publishes a pre-built envelope as is.
   *
   * @param envelope the message
   * @throws PublishTimeoutException if the send was not confirmed within the timeout;
   *     the message may or may not have been delivered
   * @throws RelayException for connection, declaration or broker failures
   */
  public void publishEnvelope(Envelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    ensureOpen();
    long deadline = System.nanoTime() + confirmTimeout.toNanos();
    acquire();
    try {
      ensureOpen();
      BrokerChannel ch = ensureChannel();
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new PublishTimeoutException(confirmTimeout);
      }
      ch.publish(exchange.name(), envelope, Duration.ofNanos(remaining));
      metrics.incrementPublished();
      logger.log(Level.FINE, "Published {0} to {1}", new Object[]{envelope, exchange.name()});
    } catch (RelayException e) {
      metrics.incrementPublishFailure();
      onFailure(e);
      throw e;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Opens the connection and declares the exchange now instead of on first publish.
   *
   * @throws RelayException if the broker is unreachable or the declaration fails
   */
  public void connect() {
    ensureOpen();
    acquire();
    try {
      ensureChannel();
    } catch (RelayException e) {
      onFailure(e);
      throw e;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the last known connection state. This is a cached flag, not a live probe.
   */
  public boolean isConnected() {
    return connected;
  }

  public String exchange() {
    return exchange.name();
  }

  public String defaultRoutingKey() {
    return defaultRoutingKey;
  }

  private void acquire() {
    try {
      if (!lock.tryLock(confirmTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new PublishTimeoutException(confirmTimeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerOperationException("Interrupted while waiting for the publisher channel", e);
    }
  }

  private BrokerChannel ensureChannel() {
    if (connection == null || !connection.isOpen()) {
      closeQuietly();
      connection = connector.connect();
      connected = true;
      logger.log(Level.INFO, "Publisher connected for exchange {0}", exchange.name());
    }
    if (channel == null || !channel.isOpen()) {
      channel = connection.openChannel();
      exchangeDeclared = false;
    }
    if (!exchangeDeclared) {
      channel.declareExchange(exchange);
      exchangeDeclared = true;
    }
    return channel;
  }

  private void onFailure(RelayException e) {
    if (e instanceof BrokerConnectionException) {
      connected = false;
      logger.log(Level.WARNING, "Publisher lost its broker connection: " + e.getMessage());
      closeQuietly();
    } else if (e instanceof PublishTimeoutException) {
      // unconfirmed messages may still be pending on this channel
      closeChannelQuietly();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Publisher has been closed");
    }
  }

  private void closeChannelQuietly() {
    BrokerChannel ch = channel;
    channel = null;
    exchangeDeclared = false;
    if (ch != null) {
      try {
        ch.close();
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Error closing publisher channel", e);
      }
    }
  }

  private void closeQuietly() {
    closeChannelQuietly();
    BrokerConnection conn = connection;
    connection = null;
    if (conn != null) {
      try {
        conn.close();
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Error closing publisher connection", e);
      }
    }
  }

  /**
   * Waits for an in-progress send, then closes the channel and connection.
   * Later publishes fail with {@link IllegalStateException}.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    lock.lock();
    try {
      closeQuietly();
      connected = false;
    } finally {
      lock.unlock();
    }
    logger.log(Level.INFO, "Publisher for exchange {0} closed", exchange.name());
  }

  /** Builder for {@link Publisher}. */
  public static final class Builder {
    private BrokerConnector connector;
    private String exchange;
    private ExchangeType exchangeType;
    private String routingKey = "";
    private PayloadCodec codec;
    private Duration confirmTimeout = DEFAULT_CONFIRM_TIMEOUT;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the broker connector.
     *
     * <p><b>Required.</b>
     *
     * @param connector the connector
     * @return this builder
     */
    public Builder connector(BrokerConnector connector) {
      this.connector = connector;
      return this;
    }

    /**
     * Sets the exchange every message is published to. It is declared durable on first use.
     *
     * <p><b>Required.</b>
     *
     * @param exchange the exchange name
     * @return this builder
     */
    public Builder exchange(String exchange) {
      this.exchange = exchange;
      return this;
    }

    /**
     * Sets the exchange kind.
     *
     * <p>Optional. Defaults to {@link ExchangeType#DIRECT}.
     *
     * @param exchangeType the exchange kind
     * @return this builder
     */
    public Builder exchangeType(ExchangeType exchangeType) {
      this.exchangeType = exchangeType;
      return this;
    }

    /**
     * Sets the routing key used by {@link Publisher#publish(Object)}.
     *
     * <p>Optional. Defaults to the empty key.
     *
     * @param routingKey the default routing key
     * @return this builder
     */
    public Builder routingKey(String routingKey) {
      this.routingKey = routingKey;
      return this;
    }

    /**
     * Sets the payload codec.
     *
     * <p>Optional. Defaults to {@link PayloadCodec#json()}.
     *
     * @param codec the codec
     * @return this builder
     */
    public Builder codec(PayloadCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the maximum time a publish call may take, lock wait included.
     *
     * <p>Optional. Defaults to 60 seconds.
     *
     * @param confirmTimeout the timeout
     * @return this builder
     */
    public Builder confirmTimeout(Duration confirmTimeout) {
      this.confirmTimeout = confirmTimeout;
      return this;
    }

    /**
     * Sets the metrics exporter for publish success and failure counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the publisher. No connection is opened until the first publish or
     * {@link Publisher#connect()}.
     *
     * @return a new publisher
     * @throws NullPointerException if {@code connector}, {@code exchange} or the routing key is null
     * @throws IllegalArgumentException if the exchange name is empty or the timeout is not positive
     */
    public Publisher build() {
      return new Publisher(this);
    }
  }
}
