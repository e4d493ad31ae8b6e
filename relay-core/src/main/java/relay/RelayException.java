package relay;

/**
 * Base type for every failure raised by the relay client itself.
 *
 * <p>Subtypes separate "the data was malformed" from "the broker is unreachable"
 * from "the topology is wrong", so callers can react to each differently.
 * Failures thrown by {@link DeliveryCallback}s are never wrapped in this type;
 * they stay inside the retry/dead-letter path.
 */
public abstract class RelayException extends RuntimeException {

  protected RelayException(String message) {
    super(message);
  }

  protected RelayException(String message, Throwable cause) {
    super(message, cause);
  }
}
