package relay.consume;

import java.time.Instant;

/**
 * Point-in-time view of a subscriber's broker link.
 *
 * @param connected      whether a consumer is currently attached
 * @param lastConnectAt  last successful (re)connect, or {@code null} if never connected
 * @param lastDeliveryAt last delivery received, or {@code null} if none yet
 * @param lastError      message of the most recent connection or consumer failure, or {@code null}
 * @param inFlight       deliveries currently owned by workers
 */
public record SubscriberHealth(boolean connected, Instant lastConnectAt, Instant lastDeliveryAt,
                               String lastError, int inFlight) {
}
