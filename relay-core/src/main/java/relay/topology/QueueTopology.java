package relay.topology;

import relay.TopologyValidationException;
import relay.dispatch.RetryPolicy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Every broker object one consuming stage needs, derived from its main exchange,
 * queue name, routing keys and retry/dead-letter policies.
 *
 * <table>
 *   <caption>Derived objects</caption>
 *   <tr><td>Primary queue</td><td>{@code <queue>}, dead-letters to the DLX with key {@code <queue>.dlq}</td></tr>
 *   <tr><td>Dead-letter exchange</td><td>direct, durable</td></tr>
 *   <tr><td>Dead-letter queue</td><td>{@code <queue>.dlq}, bound with {@code <queue>.dlq}</td></tr>
 *   <tr><td>Retry exchange</td><td>topic, {@code <prefix><queue>}</td></tr>
 *   <tr><td>Retry queue</td><td>{@code <queue>.retry}, TTL = retry delay, dead-letters to the main exchange, bound with {@code #}</td></tr>
 * </table>
 *
 * <p>With {@link DeadLetterPolicy#discard()} the primary queue carries no dead-letter
 * arguments and no DLX or DLQ is declared.
 */
public final class QueueTopology {
  public static final String RETRY_BINDING_KEY = "#";

  private final ExchangeSpec mainExchange;
  private final String queue;
  private final Set<String> routingKeys;
  private final RetryPolicy retryPolicy;
  private final DeadLetterPolicy deadLetterPolicy;

  private final List<ExchangeSpec> exchanges = new ArrayList<>();
  private final List<QueueSpec> queues = new ArrayList<>();
  private final List<BindingSpec> bindings = new ArrayList<>();

  private QueueTopology(ExchangeSpec mainExchange, String queue, Collection<String> routingKeys,
                        RetryPolicy retryPolicy, DeadLetterPolicy deadLetterPolicy) {
    this.mainExchange = mainExchange;
    this.queue = queue;
    this.routingKeys = Collections.unmodifiableSet(new LinkedHashSet<>(routingKeys));
    this.retryPolicy = retryPolicy;
    this.deadLetterPolicy = deadLetterPolicy;
    derive();
  }

  /**
   * Derives and validates the topology for one primary queue.
   *
   * @throws TopologyValidationException if no dead-letter policy was chosen, names are
   *     missing, or derived names collide with the main exchange
   */
  public static QueueTopology of(ExchangeSpec mainExchange, String queue, Collection<String> routingKeys,
                                 RetryPolicy retryPolicy, DeadLetterPolicy deadLetterPolicy) {
    Objects.requireNonNull(mainExchange, "mainExchange");
    Objects.requireNonNull(routingKeys, "routingKeys");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    if (queue == null || queue.isEmpty()) {
      throw new TopologyValidationException("queue name must be set");
    }
    if (deadLetterPolicy == null) {
      throw new TopologyValidationException("No dead-letter policy for queue '" + queue
          + "': configure a dead-letter exchange or choose DeadLetterPolicy.discard()");
    }
    for (String key : routingKeys) {
      if (key == null) {
        throw new TopologyValidationException("routing keys cannot contain null");
      }
    }
    if (mainExchange.name().equals(retryPolicy.retryExchangeFor(queue))) {
      throw new TopologyValidationException("retry exchange collides with main exchange: "
          + mainExchange.name());
    }
    if (!deadLetterPolicy.isDiscard() && mainExchange.name().equals(deadLetterPolicy.exchange())) {
      throw new TopologyValidationException("dead-letter exchange must differ from main exchange: "
          + mainExchange.name());
    }
    return new QueueTopology(mainExchange, queue, routingKeys, retryPolicy, deadLetterPolicy);
  }

  private void derive() {
    exchanges.add(mainExchange);

    QueueSpec.Builder primary = QueueSpec.builder(queue);
    if (!deadLetterPolicy.isDiscard()) {
      String dlx = deadLetterPolicy.exchange();
      exchanges.add(ExchangeSpec.durable(dlx, ExchangeType.DIRECT));
      primary.deadLetterExchange(dlx).deadLetterRoutingKey(deadLetterPolicy.routingKeyFor(queue));
      queues.add(QueueSpec.builder(deadLetterPolicy.queueFor(queue)).build());
      bindings.add(new BindingSpec(dlx, deadLetterPolicy.queueFor(queue), deadLetterPolicy.routingKeyFor(queue)));
    }
    queues.add(primary.build());

    String retryExchange = retryPolicy.retryExchangeFor(queue);
    String retryQueue = retryPolicy.retryQueueFor(queue);
    exchanges.add(ExchangeSpec.durable(retryExchange, ExchangeType.TOPIC));
    queues.add(QueueSpec.builder(retryQueue)
        .messageTtl(retryPolicy.delay())
        .deadLetterExchange(mainExchange.name())
        .build());
    bindings.add(new BindingSpec(retryExchange, retryQueue, RETRY_BINDING_KEY));

    for (String key : routingKeys) {
      bindings.add(new BindingSpec(mainExchange.name(), queue, key));
    }
  }

  public ExchangeSpec mainExchange() {
    return mainExchange;
  }

  public String queue() {
    return queue;
  }

  public Set<String> routingKeys() {
    return routingKeys;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public DeadLetterPolicy deadLetterPolicy() {
    return deadLetterPolicy;
  }

  public String retryExchange() {
    return retryPolicy.retryExchangeFor(queue);
  }

  public String retryQueue() {
    return retryPolicy.retryQueueFor(queue);
  }

  /**
   * Returns the dead-letter queue name, or {@code null} when rejected messages are discarded.
   */
  public String deadLetterQueue() {
    return deadLetterPolicy.isDiscard() ? null : deadLetterPolicy.queueFor(queue);
  }

  /** Exchanges in declaration order. */
  public List<ExchangeSpec> exchanges() {
    return Collections.unmodifiableList(exchanges);
  }

  /** Queues in declaration order: dead-letter queue, primary, retry. */
  public List<QueueSpec> queues() {
    return Collections.unmodifiableList(queues);
  }

  /** Bindings in declaration order; primary-queue bindings come last. */
  public List<BindingSpec> bindings() {
    return Collections.unmodifiableList(bindings);
  }

  public QueueSpec primaryQueue() {
    for (QueueSpec spec : queues) {
      if (spec.name().equals(queue)) {
        return spec;
      }
    }
    throw new IllegalStateException("primary queue missing");
  }

  @Override
  public String toString() {
    return "QueueTopology{exchange=" + mainExchange.name() + ", queue=" + queue
        + ", routingKeys=" + routingKeys + ", " + retryPolicy + ", " + deadLetterPolicy + '}';
  }
}
