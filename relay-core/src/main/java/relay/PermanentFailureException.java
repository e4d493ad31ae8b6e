package relay;

/**
 * Thrown by a {@link DeliveryCallback} to signal that a delivery can never succeed,
 * however often it is retried (malformed payload, unknown entity, rejected by a
 * business rule).
 *
 * <p>The delivery is rejected without requeue straight away and, when the queue has a
 * dead-letter exchange, lands in its dead-letter queue. Any other exception thrown by a
 * callback is treated as transient and retried until the attempt ceiling.
 *
 * <pre>{@code
 * registry.register("report.raw", delivery -> {
 *   Report report;
 *   try {
 *     report = delivery.payloadAs(Report.class);
 *   } catch (PayloadEncodingException e) {
 *     throw new PermanentFailureException("unreadable report", e);
 *   }
 *   analyzer.analyze(report);
 * });
 * }</pre>
 */
public class PermanentFailureException extends RuntimeException {

    public PermanentFailureException(String message) {
        super(message);
    }

    public PermanentFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public PermanentFailureException(Throwable cause) {
        super(cause == null ? "permanent failure" : cause.getMessage(), cause);
    }
}
