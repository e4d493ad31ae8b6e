package relay.dispatch;

import relay.Delivery;

/**
 * Cross-cutting hook around callback invocation.
 *
 * <p>Interceptors run around the callback:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Callback execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the callback is skipped and the failure takes the
 * retry/dead-letter path like a callback failure. {@code afterDispatch} exceptions are
 * logged and ignored.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Subscriber.builder()
 *     .interceptor(DeliveryInterceptor.before(delivery ->
 *         audit.log(delivery.routingKey(), delivery.envelope().messageId())))
 *     .interceptor(DeliveryInterceptor.after((delivery, error) -> {
 *         if (error != null) alerts.record(delivery.routingKey(), error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface DeliveryInterceptor {

  /**
   * Called before the callback is invoked.
   *
   * @param delivery the delivery about to be processed
   * @throws Exception to skip the callback and trigger retry/dead-letter handling
   */
  default void beforeDispatch(Delivery delivery) throws Exception {
  }

  /**
   * Called after callback invocation (or after a {@code beforeDispatch} failure).
   *
   * @param delivery the delivery
   * @param error    null on success, the failure otherwise
   */
  default void afterDispatch(Delivery delivery, Throwable error) {
  }

  static DeliveryInterceptor before(BeforeHook hook) {
    return new DeliveryInterceptor() {
      @Override
      public void beforeDispatch(Delivery delivery) throws Exception {
        hook.accept(delivery);
      }
    };
  }

  static DeliveryInterceptor after(AfterHook hook) {
    return new DeliveryInterceptor() {
      @Override
      public void afterDispatch(Delivery delivery, Throwable error) {
        hook.accept(delivery, error);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(Delivery delivery) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(Delivery delivery, Throwable error);
  }
}
