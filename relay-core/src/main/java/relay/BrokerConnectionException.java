package relay;

/**
 * The broker could not be reached, or the connection or channel was lost while an
 * operation was in progress.
 */
public class BrokerConnectionException extends RelayException {

  public BrokerConnectionException(String message) {
    super(message);
  }

  public BrokerConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
