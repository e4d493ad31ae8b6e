package relay;

/**
 * Declaring an exchange, queue or binding failed.
 */
public class DeclarationException extends RelayException {

  public DeclarationException(String message) {
    super(message);
  }

  public DeclarationException(String message, Throwable cause) {
    super(message, cause);
  }
}
