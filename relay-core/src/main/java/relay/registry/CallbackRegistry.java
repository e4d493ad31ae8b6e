package relay.registry;

import relay.DeliveryCallback;

import java.util.Set;

/**
 * Maps routing keys to the {@link DeliveryCallback} that processes them.
 *
 * <p>The subscriber binds its queue once per {@link #routingKeys() routing key} and looks
 * up the callback for every delivery. A delivery with no callback is rejected without
 * requeue.
 *
 * @see DefaultCallbackRegistry
 */
public interface CallbackRegistry {

  /**
   * Returns the callback for a delivery's routing key.
   *
   * @param routingKey the routing key the message was published with
   * @return the callback, or {@code null} if none matches
   */
  DeliveryCallback callbackFor(String routingKey);

  /**
   * Returns the registered routing keys (or topic patterns), in registration order.
   */
  Set<String> routingKeys();
}
