/**
 * Bounded-concurrency processing of deliveries with retry and dead-letter handling.
 *
 * <p>{@link relay.dispatch.WorkerPool} bounds in-flight work;
 * {@link relay.dispatch.DeliveryProcessor} invokes callbacks and settles each delivery
 * once through {@link relay.dispatch.DeliverySettlement};
 * {@link relay.dispatch.RetryCoordinator} routes failures to the delay queue or the
 * dead-letter queue according to the {@link relay.dispatch.RetryPolicy}.
 */
package relay.dispatch;
