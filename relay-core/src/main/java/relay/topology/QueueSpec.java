package relay.topology;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declaration parameters for a queue.
 *
 * <p>Queues declared by the pipeline are never exclusive. The optional arguments map
 * holds broker extensions such as {@value #MESSAGE_TTL}, {@value #DEAD_LETTER_EXCHANGE}
 * and {@value #DEAD_LETTER_ROUTING_KEY}.
 */
public final class QueueSpec {
  public static final String MESSAGE_TTL = "x-message-ttl";
  public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
  public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";

  private final String name;
  private final boolean durable;
  private final boolean autoDelete;
  private final Map<String, Object> arguments;

  private QueueSpec(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("queue name cannot be empty");
    }
    this.durable = builder.durable;
    this.autoDelete = builder.autoDelete;
    this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public boolean durable() {
    return durable;
  }

  public boolean exclusive() {
    return false;
  }

  public boolean autoDelete() {
    return autoDelete;
  }

  public Map<String, Object> arguments() {
    return arguments;
  }

  /**
   * Returns the per-message TTL argument, or {@code null} when the queue has none.
   */
  public Duration messageTtl() {
    Object ttl = arguments.get(MESSAGE_TTL);
    return ttl instanceof Number number ? Duration.ofMillis(number.longValue()) : null;
  }

  public String deadLetterExchange() {
    return (String) arguments.get(DEAD_LETTER_EXCHANGE);
  }

  public String deadLetterRoutingKey() {
    return (String) arguments.get(DEAD_LETTER_ROUTING_KEY);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QueueSpec other)) return false;
    return durable == other.durable
        && autoDelete == other.autoDelete
        && name.equals(other.name)
        && arguments.equals(other.arguments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, durable, autoDelete, arguments);
  }

  @Override
  public String toString() {
    return "QueueSpec{name=" + name + ", durable=" + durable
        + ", autoDelete=" + autoDelete + ", arguments=" + arguments + '}';
  }

  /** Builder for {@link QueueSpec}. */
  public static final class Builder {
    private final String name;
    private boolean durable = true;
    private boolean autoDelete;
    private final Map<String, Object> arguments = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Optional. Defaults to {@code true}.
     */
    public Builder durable(boolean durable) {
      this.durable = durable;
      return this;
    }

    /**
     * Optional. Defaults to {@code false}.
     */
    public Builder autoDelete(boolean autoDelete) {
      this.autoDelete = autoDelete;
      return this;
    }

    /**
     * Sets how long a message may sit in the queue before the broker expires it.
     *
     * @param ttl the TTL, at least one millisecond
     * @return this builder
     */
    public Builder messageTtl(Duration ttl) {
      Objects.requireNonNull(ttl, "ttl");
      if (ttl.toMillis() < 1) {
        throw new IllegalArgumentException("ttl must be >= 1ms, got: " + ttl);
      }
      arguments.put(MESSAGE_TTL, ttl.toMillis());
      return this;
    }

    public Builder deadLetterExchange(String exchange) {
      arguments.put(DEAD_LETTER_EXCHANGE, Objects.requireNonNull(exchange, "exchange"));
      return this;
    }

    public Builder deadLetterRoutingKey(String routingKey) {
      arguments.put(DEAD_LETTER_ROUTING_KEY, Objects.requireNonNull(routingKey, "routingKey"));
      return this;
    }

    public Builder argument(String key, Object value) {
      arguments.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public QueueSpec build() {
      return new QueueSpec(this);
    }
  }
}
