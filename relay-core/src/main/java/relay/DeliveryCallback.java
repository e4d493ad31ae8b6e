package relay;

/**
 * Processing stage entry point, invoked once per delivery on a worker thread.
 *
 * <p>This is the only contract between the pipeline and a stage's business logic:
 * returning normally acknowledges the delivery; throwing sends it down the
 * retry/dead-letter path.
 *
 * <h2>Error Handling</h2>
 * <ul>
 *   <li>Any {@link Exception} is treated as transient. The delivery is republished to the
 *       queue's retry exchange with its {@code attempt} header incremented, and comes
 *       back after the retry delay.</li>
 *   <li>Once {@code attempt} reaches the ceiling, the delivery is rejected without
 *       requeue and the broker routes it to the dead-letter queue.</li>
 *   <li>{@link PermanentFailureException} skips the retries and dead-letters at once.</li>
 * </ul>
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once. A callback may see the same message more than once
 * (after a retry-publish failure, a lost ack, or a reconnect); deduplicate on
 * {@link Envelope#messageId()} where it matters.
 *
 * @see relay.registry.CallbackRegistry
 */
@FunctionalInterface
public interface DeliveryCallback {

  /**
   * Processes a delivery.
   *
   * @param delivery the delivery, owned by this invocation until it returns
   * @throws Exception if processing fails; triggers retry or dead-letter handling
   */
  void onDelivery(Delivery delivery) throws Exception;
}
