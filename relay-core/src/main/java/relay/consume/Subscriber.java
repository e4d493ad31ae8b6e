package relay.consume;

import relay.Delivery;
import relay.DeliveryCallback;
import relay.RelayException;
import relay.TopologyValidationException;
import relay.dispatch.DeliveryInterceptor;
import relay.dispatch.DeliveryProcessor;
import relay.dispatch.RetryCoordinator;
import relay.dispatch.RetryPolicy;
import relay.dispatch.WorkerPool;
import relay.registry.CallbackRegistry;
import relay.registry.DefaultCallbackRegistry;
import relay.spi.BrokerChannel;
import relay.spi.BrokerConnection;
import relay.spi.BrokerConnector;
import relay.spi.DeliverySink;
import relay.spi.MetricsExporter;
import relay.topology.DeadLetterPolicy;
import relay.topology.ExchangeSpec;
import relay.topology.ExchangeType;
import relay.topology.QueueTopology;
import relay.topology.TopologyInstaller;
import relay.util.DaemonThreadFactory;
import relay.util.ReconnectBackoff;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes one queue and hands each delivery to the callback registered for its
 * routing key, on a bounded pool of workers.
 *
 * <p>{@link #start} installs the queue's topology (see {@link QueueTopology}), sets the
 * channel prefetch to the worker count and starts a manual-ack consumer. A supervisor
 * thread then watches the connection; when it drops, the subscriber reconnects with
 * exponential backoff (1 s doubling to 30 s by default) and installs the topology
 * again before consuming.
 *
 * <p>Callback success acks the delivery. A failure goes through the retry/dead-letter
 * path of {@link RetryCoordinator}; deliveries are never requeued directly.
 *
 * <pre>{@code
 * Subscriber subscriber = Subscriber.builder()
 *     .connector(connector)
 *     .exchange("reports")
 *     .queue("analysis")
 *     .prefetch(10)
 *     .retryPolicy(RetryPolicy.builder().delay(Duration.ofSeconds(5)).maxRetries(3).build())
 *     .deadLetterPolicy(DeadLetterPolicy.defaultExchange())
 *     .build();
 * subscriber.start(Map.of("report.raw", delivery -> analyse(delivery)));
 * }</pre>
 *
 * <p>This class is thread-safe. {@link #start} may be called once.
 */
public final class Subscriber implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Subscriber.class.getName());

  public static final int DEFAULT_CONCURRENCY = 20;

  private final BrokerConnector connector;
  private final ExchangeSpec exchange;
  private final String queue;
  private final int workerCount;
  private final RetryPolicy retryPolicy;
  private final DeadLetterPolicy deadLetterPolicy;
  private final MetricsExporter metrics;
  private final List<DeliveryInterceptor> interceptors;
  private final Duration drainTimeout;
  private final Duration retryPublishTimeout;
  private final ReconnectBackoff backoff;

  private CallbackRegistry registry;
  private QueueTopology topology;
  private WorkerPool pool;
  private Thread supervisor;
  private volatile Session session;
  private volatile boolean started;
  private volatile boolean closed;

  private volatile boolean connected;
  private volatile Instant lastConnectAt;
  private volatile Instant lastDeliveryAt;
  private volatile String lastError;

  private Subscriber(Builder builder) {
    this.connector = Objects.requireNonNull(builder.connector, "connector");
    Objects.requireNonNull(builder.exchange, "exchange");
    this.exchange = ExchangeSpec.durable(builder.exchange,
        builder.exchangeType != null ? builder.exchangeType : ExchangeType.DIRECT);
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    if (queue.isEmpty()) {
      throw new IllegalArgumentException("queue cannot be empty");
    }
    if (builder.concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1, got: " + builder.concurrency);
    }
    if (builder.prefetch < 0) {
      throw new IllegalArgumentException("prefetch must be >= 0, got: " + builder.prefetch);
    }
    this.workerCount = builder.prefetch > 0
        ? Math.min(builder.concurrency, builder.prefetch) : builder.concurrency;
    if (builder.deadLetterPolicy == null) {
      throw new TopologyValidationException("No dead-letter policy for queue '" + queue
          + "': configure a dead-letter exchange or choose DeadLetterPolicy.discard()");
    }
    this.deadLetterPolicy = builder.deadLetterPolicy;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = List.copyOf(builder.interceptors);
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    this.retryPublishTimeout = Objects.requireNonNull(builder.retryPublishTimeout, "retryPublishTimeout");
    this.backoff = builder.backoff != null ? builder.backoff : new ReconnectBackoff();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts consuming with one callback per routing key.
   *
   * @param callbacks routing key to callback
   * @see #start(CallbackRegistry)
   */
  public void start(Map<String, ? extends DeliveryCallback> callbacks) {
    start(DefaultCallbackRegistry.of(callbacks));
  }

  /**
   * Installs the topology, binds the queue for every routing key in the registry and
   * starts consuming. Returns once the consumer is attached.
   *
   * @param registry the callbacks
   * @throws IllegalStateException if already started or closed
   * @throws IllegalArgumentException if the registry has no routing keys
   * @throws RelayException if the first connection or the topology install fails; the
   *     subscriber is left unstarted
   */
  public synchronized void start(CallbackRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    if (closed) {
      throw new IllegalStateException("Subscriber has been closed");
    }
    if (started) {
      throw new IllegalStateException("Subscriber for queue '" + queue + "' already started");
    }
    if (registry.routingKeys().isEmpty()) {
      throw new IllegalArgumentException("at least one callback must be registered");
    }
    this.registry = registry;
    this.topology = QueueTopology.of(exchange, queue, registry.routingKeys(), retryPolicy, deadLetterPolicy);
    this.pool = new WorkerPool(workerCount, "relay-worker-" + queue + "-", metrics, drainTimeout);
    try {
      this.session = openSession();
    } catch (RuntimeException e) {
      recordError(e);
      pool.close();
      pool = null;
      throw e;
    }
    started = true;
    supervisor = new DaemonThreadFactory("relay-supervisor-" + queue + "-").newThread(this::supervise);
    supervisor.start();
    logger.log(Level.INFO, "Subscriber consuming queue {0} from exchange {1} with {2} workers, routing keys {3}",
        new Object[]{queue, exchange.name(), workerCount, registry.routingKeys()});
  }

  private Session openSession() {
    BrokerConnection connection = connector.connect();
    try {
      BrokerChannel channel = connection.openChannel();
      new TopologyInstaller(channel).install(topology);
      SerializedChannel consumeChannel = new SerializedChannel(channel);
      SerializedChannel retryChannel = new SerializedChannel(connection.openChannel());
      consumeChannel.qos(workerCount);

      RetryCoordinator retries = new RetryCoordinator(queue, retryPolicy, retryChannel,
          retryPublishTimeout, metrics);
      DeliveryProcessor processor = new DeliveryProcessor(registry, consumeChannel, retries,
          interceptors, metrics);
      Session opened = new Session(connection, consumeChannel, retryChannel, processor);
      opened.consumerTag = consumeChannel.consume(queue, opened);
      markConnected();
      return opened;
    } catch (RuntimeException e) {
      try {
        connection.close();
      } catch (RuntimeException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  private void supervise() {
    while (!closed) {
      Session current = session;
      try {
        current.awaitEnd();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (closed) {
        return;
      }
      current.close();
      logger.log(Level.WARNING, "Subscriber for queue {0} lost its broker link ({1}); reconnecting",
          new Object[]{queue, lastError});
      if (!reconnect()) {
        return;
      }
    }
  }

  private boolean reconnect() {
    int failures = 0;
    while (!closed) {
      failures++;
      long delayMs = backoff.computeDelayMs(failures);
      try {
        Thread.sleep(delayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
      if (closed) {
        return false;
      }
      try {
        Session opened = openSession();
        session = opened;
        if (closed) {
          opened.close();
          return false;
        }
        logger.log(Level.INFO, "Subscriber for queue {0} reconnected after {1} attempt(s)",
            new Object[]{queue, failures});
        return true;
      } catch (RelayException e) {
        recordError(e);
        logger.log(Level.WARNING, "Reconnect attempt " + failures + " for queue " + queue
            + " failed: " + e.getMessage() + "; next in " + backoff.computeDelayMs(failures + 1) + " ms");
      } catch (RuntimeException e) {
        recordError(e);
        logger.log(Level.SEVERE, "Reconnect attempt " + failures + " for queue " + queue + " failed", e);
      }
    }
    return false;
  }

  private void markConnected() {
    Instant now = Instant.now();
    lastConnectAt = now;
    connected = true;
    metrics.recordConnected(true);
    metrics.recordConnectedAt(now);
  }

  private void markDisconnected(String reason) {
    connected = false;
    lastError = reason;
    metrics.recordConnected(false);
  }

  private void recordError(Exception e) {
    lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
  }

  public SubscriberHealth health() {
    WorkerPool p = pool;
    return new SubscriberHealth(connected, lastConnectAt, lastDeliveryAt, lastError,
        p == null ? 0 : p.inFlight());
  }

  /**
   * Returns {@code true} while a consumer is attached. Cached, not a live probe.
   */
  public boolean isConnected() {
    return connected;
  }

  public Instant lastConnectAt() {
    return lastConnectAt;
  }

  public Instant lastDeliveryAt() {
    return lastDeliveryAt;
  }

  public String lastError() {
    return lastError;
  }

  public String exchange() {
    return exchange.name();
  }

  public String queue() {
    return queue;
  }

  /**
   * Returns the number of workers, which is also the channel prefetch.
   */
  public int workerCount() {
    return workerCount;
  }

  /**
   * Returns the installed topology, or {@code null} before {@link #start}.
   */
  public QueueTopology topology() {
    return topology;
  }

  /**
   * Stops consuming, waits for running callbacks up to the drain timeout so their
   * deliveries can still be settled, then closes the connection. Unsettled deliveries
   * are redelivered by the broker.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }
    Thread sup = supervisor;
    if (sup != null) {
      sup.interrupt();
      try {
        sup.join(5_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    Session current = session;
    if (current != null) {
      current.cancel();
    }
    if (pool != null) {
      pool.close();
    }
    if (current != null) {
      current.close();
    }
    connected = false;
    metrics.recordConnected(false);
    logger.log(Level.INFO, "Subscriber for queue {0} closed", queue);
  }

  /**
   * One connection's worth of consumer state. Ends when the broker shuts the consumer down.
   */
  private final class Session implements DeliverySink {
    private final BrokerConnection connection;
    private final SerializedChannel consumeChannel;
    private final SerializedChannel retryChannel;
    private final DeliveryProcessor processor;
    private final CountDownLatch ended = new CountDownLatch(1);
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile String consumerTag;

    Session(BrokerConnection connection, SerializedChannel consumeChannel,
            SerializedChannel retryChannel, DeliveryProcessor processor) {
      this.connection = connection;
      this.consumeChannel = consumeChannel;
      this.retryChannel = retryChannel;
      this.processor = processor;
    }

    @Override
    public void onDelivery(Delivery delivery) {
      Instant now = Instant.now();
      lastDeliveryAt = now;
      metrics.recordDeliveryObservedAt(now);
      try {
        pool.submit(() -> processor.process(delivery));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.WARNING, "Interrupted before dispatching {0}; the broker will redeliver it", delivery);
      } catch (RejectedExecutionException e) {
        logger.log(Level.FINE, "Subscriber closing, leaving {0} for redelivery", delivery);
      }
    }

    @Override
    public void onShutdown(String reason) {
      if (!closed) {
        markDisconnected(reason);
      }
      ended.countDown();
    }

    void awaitEnd() throws InterruptedException {
      ended.await();
    }

    void cancel() {
      String tag = consumerTag;
      if (tag == null || !consumeChannel.isOpen()) {
        return;
      }
      try {
        consumeChannel.cancel(tag);
      } catch (RelayException e) {
        logger.log(Level.FINE, "Consumer cancel failed for queue " + queue, e);
      }
    }

    void close() {
      if (!released.compareAndSet(false, true)) {
        return;
      }
      try {
        retryChannel.close();
        consumeChannel.close();
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Error closing channels for queue " + queue, e);
      }
      try {
        connection.close();
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Error closing connection for queue " + queue, e);
      }
    }
  }

  /** Builder for {@link Subscriber}. */
  public static final class Builder {
    private BrokerConnector connector;
    private String exchange;
    private ExchangeType exchangeType;
    private String queue;
    private int prefetch;
    private int concurrency = DEFAULT_CONCURRENCY;
    private RetryPolicy retryPolicy;
    private DeadLetterPolicy deadLetterPolicy;
    private MetricsExporter metrics;
    private final List<DeliveryInterceptor> interceptors = new ArrayList<>();
    private Duration drainTimeout = Duration.ofSeconds(30);
    private Duration retryPublishTimeout = Duration.ofSeconds(10);
    private ReconnectBackoff backoff;

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connector(BrokerConnector connector) {
      this.connector = connector;
      return this;
    }

    /**
     * Sets the main exchange the queue is bound to and retries return through.
     *
     * <p><b>Required.</b>
     */
    public Builder exchange(String exchange) {
      this.exchange = exchange;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExchangeType#DIRECT}. With {@link ExchangeType#TOPIC},
     * registered routing keys may be patterns.
     */
    public Builder exchangeType(ExchangeType exchangeType) {
      this.exchangeType = exchangeType;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder queue(String queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets the broker prefetch. When positive, the worker count becomes
     * {@code min(concurrency, prefetch)}.
     *
     * <p>Optional. Defaults to {@code 0} (worker count equals concurrency).
     */
    public Builder prefetch(int prefetch) {
      this.prefetch = prefetch;
      return this;
    }

    /**
     * Optional. Defaults to {@value Subscriber#DEFAULT_CONCURRENCY}. Must be &ge; 1.
     */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * Optional. Defaults to {@link RetryPolicy#defaults()}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets where exhausted or permanently failed deliveries go.
     *
     * <p><b>Required.</b> Use {@link DeadLetterPolicy#discard()} to drop them explicitly.
     */
    public Builder deadLetterPolicy(DeadLetterPolicy deadLetterPolicy) {
      this.deadLetterPolicy = deadLetterPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder interceptor(DeliveryInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<DeliveryInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Sets how long {@link Subscriber#close()} waits for running callbacks.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets the confirm timeout for retry copies.
     *
     * <p>Optional. Defaults to 10 seconds.
     */
    public Builder retryPublishTimeout(Duration retryPublishTimeout) {
      this.retryPublishTimeout = retryPublishTimeout;
      return this;
    }

    /**
     * Optional. Defaults to 1 second doubling to 30 seconds.
     */
    public Builder reconnectBackoff(ReconnectBackoff backoff) {
      this.backoff = backoff;
      return this;
    }

    /**
     * @throws NullPointerException if {@code connector}, {@code exchange} or {@code queue} is null
     * @throws IllegalArgumentException if {@code concurrency < 1} or {@code prefetch < 0}
     * @throws TopologyValidationException if no dead-letter policy was chosen
     */
    public Subscriber build() {
      return new Subscriber(this);
    }
  }
}
