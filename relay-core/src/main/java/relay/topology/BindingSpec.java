package relay.topology;

import java.util.Objects;

/**
 * Routes messages published to {@code exchange} with a matching {@code routingKey}
 * into {@code queue}.
 */
public record BindingSpec(String exchange, String queue, String routingKey) {

  public BindingSpec {
    Objects.requireNonNull(exchange, "exchange");
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(routingKey, "routingKey");
  }
}
