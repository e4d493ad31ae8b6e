package relay.topology;

import java.util.Objects;

/**
 * What happens to a message the pipeline gives up on.
 *
 * <p>Either the primary queue dead-letters into an exchange, which routes to a
 * per-queue {@code <queue>.dlq}, or rejected messages are discarded. There is no
 * implicit default: a subscriber without a policy fails to build.
 */
public final class DeadLetterPolicy {
  public static final String DEFAULT_EXCHANGE = "relay-dlx";
  public static final String QUEUE_SUFFIX = ".dlq";

  private static final DeadLetterPolicy DISCARD = new DeadLetterPolicy(null);

  private final String exchange;

  private DeadLetterPolicy(String exchange) {
    this.exchange = exchange;
  }

  /**
   * Dead-letters into the given exchange.
   *
   * @param exchange the dead-letter exchange name
   * @return the policy
   */
  public static DeadLetterPolicy toExchange(String exchange) {
    Objects.requireNonNull(exchange, "exchange");
    if (exchange.isEmpty()) {
      throw new IllegalArgumentException("dead-letter exchange cannot be empty");
    }
    return new DeadLetterPolicy(exchange);
  }

  /**
   * Dead-letters into {@value #DEFAULT_EXCHANGE}.
   */
  public static DeadLetterPolicy defaultExchange() {
    return toExchange(DEFAULT_EXCHANGE);
  }

  /**
   * Drops rejected messages. Poison messages are lost; choose this only for
   * disposable traffic.
   */
  public static DeadLetterPolicy discard() {
    return DISCARD;
  }

  public boolean isDiscard() {
    return exchange == null;
  }

  /**
   * Returns the dead-letter exchange, or {@code null} for {@link #discard()}.
   */
  public String exchange() {
    return exchange;
  }

  public String queueFor(String queue) {
    return queue + QUEUE_SUFFIX;
  }

  public String routingKeyFor(String queue) {
    return queue + QUEUE_SUFFIX;
  }

  @Override
  public String toString() {
    return isDiscard() ? "DeadLetterPolicy{discard}" : "DeadLetterPolicy{exchange=" + exchange + '}';
  }
}
