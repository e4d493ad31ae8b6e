package relay;

/**
 * The broker refused an operation on an otherwise reachable connection: a negative
 * publisher confirm, a failed ack or reject, a bind against a missing exchange.
 */
public class BrokerOperationException extends RelayException {

  public BrokerOperationException(String message) {
    super(message);
  }

  public BrokerOperationException(String message, Throwable cause) {
    super(message, cause);
  }
}
