package relay.spi;

/**
 * Opens connections to the message broker.
 *
 * <p>Each call returns a new, independent connection. The publisher and the subscriber
 * each own one connection and call this again after losing it.
 */
@FunctionalInterface
public interface BrokerConnector {

  /**
   * Opens a connection.
   *
   * @return an open connection
   * @throws relay.BrokerConnectionException if the broker is unreachable or refuses the login
   */
  BrokerConnection connect();
}
