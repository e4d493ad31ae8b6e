package relay.spi;

/**
 * A live connection to the broker, multiplexing {@link BrokerChannel}s.
 */
public interface BrokerConnection extends AutoCloseable {

  /**
   * Opens a new channel on this connection.
   *
   * @return an open channel
   * @throws relay.BrokerConnectionException if the connection is closed
   */
  BrokerChannel openChannel();

  boolean isOpen();

  /**
   * Closes the connection and every channel on it. Closing twice is a no-op.
   */
  @Override
  void close();
}
