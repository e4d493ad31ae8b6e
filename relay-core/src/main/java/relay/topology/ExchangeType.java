package relay.topology;

/**
 * Exchange routing kinds used by the pipeline.
 */
public enum ExchangeType {
  /** Routes on exact routing-key equality. */
  DIRECT("direct"),
  /** Routes on dot-separated patterns with {@code *} and {@code #} wildcards. */
  TOPIC("topic");

  private final String wireName;

  ExchangeType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the AMQP type name ({@code "direct"}, {@code "topic"}).
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a type from its AMQP name, ignoring case.
   *
   * @throws IllegalArgumentException for unsupported names
   */
  public static ExchangeType fromWireName(String name) {
    for (ExchangeType type : values()) {
      if (type.wireName.equalsIgnoreCase(name)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported exchange type: " + name);
  }
}
