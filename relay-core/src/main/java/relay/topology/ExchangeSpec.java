package relay.topology;

import java.util.Objects;

/**
 * Declaration parameters for an exchange.
 *
 * @param name       exchange name, never empty
 * @param type       routing kind
 * @param durable    whether the exchange survives a broker restart
 * @param autoDelete whether the broker deletes it once the last binding is removed
 */
public record ExchangeSpec(String name, ExchangeType type, boolean durable, boolean autoDelete) {

  public ExchangeSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("exchange name cannot be empty");
    }
  }

  /**
   * Durable, non-auto-delete exchange, the only kind used in production topologies.
   */
  public static ExchangeSpec durable(String name, ExchangeType type) {
    return new ExchangeSpec(name, type, true, false);
  }
}
