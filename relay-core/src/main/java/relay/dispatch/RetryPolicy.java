package relay.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Delayed-redelivery settings for a consuming queue.
 *
 * <p>A failed delivery on attempt {@code n < maxRetries} is republished with attempt
 * {@code n + 1} to the retry exchange {@code <exchangePrefix><queue>}. That exchange feeds
 * the delay queue {@code <queue>.retry}, whose per-message TTL equals {@link #delay()}
 * and whose dead-letter exchange is the main exchange, so the copy returns with its
 * original routing key once the TTL expires.
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .delay(Duration.ofSeconds(5))
 *     .maxRetries(3)
 *     .build();
 * }</pre>
 */
public final class RetryPolicy {
  public static final String DEFAULT_EXCHANGE_PREFIX = "relay-retry.";
  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_RETRIES = 10;
  public static final String RETRY_QUEUE_SUFFIX = ".retry";

  private static final RetryPolicy DEFAULTS = builder().build();

  private final String exchangePrefix;
  private final Duration delay;
  private final int maxRetries;

  private RetryPolicy(Builder builder) {
    this.exchangePrefix = Objects.requireNonNull(builder.exchangePrefix, "exchangePrefix");
    this.delay = Objects.requireNonNull(builder.delay, "delay");
    if (exchangePrefix.isEmpty()) {
      throw new IllegalArgumentException("exchangePrefix cannot be empty");
    }
    if (delay.toMillis() < 1) {
      throw new IllegalArgumentException("delay must be >= 1ms, got: " + delay);
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    this.maxRetries = builder.maxRetries;
  }

  public static RetryPolicy defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String exchangePrefix() {
    return exchangePrefix;
  }

  public Duration delay() {
    return delay;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public String retryExchangeFor(String queue) {
    return exchangePrefix + queue;
  }

  public String retryQueueFor(String queue) {
    return queue + RETRY_QUEUE_SUFFIX;
  }

  /**
   * Returns {@code true} when a failure on {@code attempt} must dead-letter
   * instead of being retried.
   */
  public boolean isExhausted(int attempt) {
    return attempt >= maxRetries;
  }

  @Override
  public String toString() {
    return "RetryPolicy{exchangePrefix=" + exchangePrefix + ", delay=" + delay
        + ", maxRetries=" + maxRetries + '}';
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private String exchangePrefix = DEFAULT_EXCHANGE_PREFIX;
    private Duration delay = DEFAULT_DELAY;
    private int maxRetries = DEFAULT_MAX_RETRIES;

    private Builder() {}

    /**
     * Optional. Defaults to {@value RetryPolicy#DEFAULT_EXCHANGE_PREFIX}.
     */
    public Builder exchangePrefix(String exchangePrefix) {
      this.exchangePrefix = exchangePrefix;
      return this;
    }

    /**
     * Sets the time a failed delivery waits in the delay queue.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder delay(Duration delay) {
      this.delay = delay;
      return this;
    }

    /**
     * Sets the retry ceiling. {@code 0} dead-letters on the first failure.
     *
     * <p>Optional. Defaults to {@value RetryPolicy#DEFAULT_MAX_RETRIES}.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
