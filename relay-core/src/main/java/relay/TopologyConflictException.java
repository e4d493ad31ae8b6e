package relay;

/**
 * An exchange or queue already exists with parameters different from the ones being
 * declared. The broker keeps the old definition; this is never silently accepted.
 */
public class TopologyConflictException extends DeclarationException {

  public TopologyConflictException(String message) {
    super(message);
  }

  public TopologyConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
