package relay;

/**
 * Terminal outcome of one delivery. Every delivery admitted to a worker ends in
 * exactly one of these.
 */
public enum ProcessingOutcome {

  /** The callback succeeded and the delivery was acknowledged. */
  ACKED("success"),

  /**
   * The callback failed with budget left: a copy went to the retry exchange and the
   * original was acknowledged (or, if the retry publish failed, the original was
   * requeued).
   */
  RETRIED_TRANSIENT("transient_error"),

  /** The retry budget was exhausted and the delivery was rejected without requeue. */
  DEAD_LETTERED("dead_lettered"),

  /**
   * The delivery was rejected without requeue on first sight: the callback signalled a
   * {@link PermanentFailureException}, threw an {@link Error}, or no callback was
   * registered for its routing key.
   */
  PERMANENT_REJECT("permanent_error");

  private final String tag;

  ProcessingOutcome(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the label used for this outcome in metrics and log lines.
   *
   * @return the metric tag value
   */
  public String tag() {
    return tag;
  }
}
