package relay.spi;

import relay.Delivery;

/**
 * Receives messages pushed by {@link BrokerChannel#consume}.
 *
 * <p>Calls for one consumer arrive sequentially on a single broker thread; blocking in
 * {@link #onDelivery} holds back further deliveries for that consumer.
 */
public interface DeliverySink {

  void onDelivery(Delivery delivery);

  /**
   * Called once when the consumer stops because its channel or connection closed, or
   * the broker cancelled it. Not called after {@link BrokerChannel#cancel}.
   *
   * @param reason a human-readable cause
   */
  void onShutdown(String reason);
}
