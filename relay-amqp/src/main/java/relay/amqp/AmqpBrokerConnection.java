package relay.amqp;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import relay.BrokerConnectionException;
import relay.spi.BrokerChannel;
import relay.spi.BrokerConnection;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerConnection} over an amqp-client {@link Connection}. Every channel it opens
 * has publisher confirms enabled.
 */
final class AmqpBrokerConnection implements BrokerConnection {
  private static final Logger logger = Logger.getLogger(AmqpBrokerConnection.class.getName());

  private final Connection connection;

  AmqpBrokerConnection(Connection connection) {
    this.connection = connection;
  }

  @Override
  public BrokerChannel openChannel() {
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (IOException | AlreadyClosedException e) {
      throw new BrokerConnectionException("Failed to open channel on " + connection, e);
    }
    if (channel == null) {
      throw new BrokerConnectionException("No channel number available on " + connection);
    }
    try {
      channel.confirmSelect();
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.operation("confirm.select", e);
    }
    return new AmqpBrokerChannel(channel);
  }

  @Override
  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public void close() {
    if (!connection.isOpen()) {
      return;
    }
    try {
      connection.close();
    } catch (AlreadyClosedException e) {
      logger.log(Level.FINE, "Connection {0} already closed", connection);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Failed to close connection " + connection, e);
    }
  }

  @Override
  public String toString() {
    return "AmqpBrokerConnection{" + connection + '}';
  }
}
