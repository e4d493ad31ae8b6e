package relay.registry;

import relay.DeliveryCallback;
import relay.RoutingKey;
import relay.topology.TopicMatcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Thread-safe registry holding one callback per routing key.
 *
 * <p>Keys containing {@code *} or {@code #} words are topic patterns: a delivery whose
 * key has no exact registration is matched against the patterns in registration order.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CallbackRegistry registry = new DefaultCallbackRegistry()
 *     .register("report.raw", delivery -> analyse(delivery.payloadAs(Report.class)))
 *     .register(ReportKeys.TAGGED, delivery -> notify(delivery));
 * }</pre>
 *
 * @see CallbackRegistry
 */
public final class DefaultCallbackRegistry implements CallbackRegistry {
  private final Map<String, DeliveryCallback> callbacks = new LinkedHashMap<>();

  /**
   * Creates a registry from a routing-key map, preserving its iteration order.
   */
  public static DefaultCallbackRegistry of(Map<String, ? extends DeliveryCallback> callbacks) {
    Objects.requireNonNull(callbacks, "callbacks");
    DefaultCallbackRegistry registry = new DefaultCallbackRegistry();
    callbacks.forEach(registry::register);
    return registry;
  }

  public DefaultCallbackRegistry register(RoutingKey routingKey, DeliveryCallback callback) {
    Objects.requireNonNull(routingKey, "routingKey");
    return register(routingKey.name(), callback);
  }

  /**
   * Registers the callback for a routing key.
   *
   * @return this registry for chaining
   * @throws IllegalStateException if the key already has a callback
   */
  public synchronized DefaultCallbackRegistry register(String routingKey, DeliveryCallback callback) {
    Objects.requireNonNull(routingKey, "routingKey");
    Objects.requireNonNull(callback, "callback");
    if (callbacks.putIfAbsent(routingKey, callback) != null) {
      throw new IllegalStateException("Duplicate callback for routing key '" + routingKey + "'");
    }
    return this;
  }

  @Override
  public synchronized DeliveryCallback callbackFor(String routingKey) {
    DeliveryCallback exact = callbacks.get(routingKey);
    if (exact != null) {
      return exact;
    }
    for (Map.Entry<String, DeliveryCallback> entry : callbacks.entrySet()) {
      if (TopicMatcher.isPattern(entry.getKey()) && TopicMatcher.matches(entry.getKey(), routingKey)) {
        return entry.getValue();
      }
    }
    return null;
  }

  @Override
  public synchronized Set<String> routingKeys() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(callbacks.keySet()));
  }
}
