package relay;

/**
 * A payload could not be serialized for publishing or deserialized after delivery.
 */
public class PayloadEncodingException extends RelayException {

  public PayloadEncodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
