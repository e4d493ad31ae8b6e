package relay;

/**
 * Type-safe routing key, identifying an event type on the wire.
 *
 * <p>Enums work when their constant names are the keys themselves; keys with dots
 * need a small class:
 * <pre>{@code
 * public final class ReportRaw implements RoutingKey {
 *   public String name() { return "report.raw"; }
 * }
 *
 * publisher.publish(new ReportRaw(), report);
 * }</pre>
 *
 * @see StringRoutingKey
 */
public interface RoutingKey {

  /**
   * Returns the routing key string used on the wire.
   *
   * @return the routing key, never empty
   */
  String name();
}
