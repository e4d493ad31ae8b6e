package relay;

/**
 * A topology was configured in a way that would lose messages without the owner
 * having chosen to, e.g. a primary queue with no dead-letter decision.
 */
public class TopologyValidationException extends RelayException {

  public TopologyValidationException(String message) {
    super(message);
  }
}
