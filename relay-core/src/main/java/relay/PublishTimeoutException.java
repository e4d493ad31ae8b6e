package relay;

import java.time.Duration;

/**
 * A publish did not complete (channel acquisition plus broker confirm) within its
 * deadline. The message may or may not have reached the broker.
 */
public class PublishTimeoutException extends RelayException {

  private final Duration timeout;

  public PublishTimeoutException(Duration timeout) {
    super("Publish not confirmed within " + timeout.toMillis() + " ms");
    this.timeout = timeout;
  }

  public PublishTimeoutException(Duration timeout, Throwable cause) {
    super("Publish not confirmed within " + timeout.toMillis() + " ms", cause);
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
