package relay.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.ShutdownSignalException;
import relay.BrokerOperationException;
import relay.Delivery;
import relay.Envelope;
import relay.PublishTimeoutException;
import relay.spi.BrokerChannel;
import relay.spi.DeliverySink;
import relay.topology.BindingSpec;
import relay.topology.ExchangeSpec;
import relay.topology.QueueSpec;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerChannel} over an amqp-client {@link Channel} in confirm mode.
 */
final class AmqpBrokerChannel implements BrokerChannel {
  private static final Logger logger = Logger.getLogger(AmqpBrokerChannel.class.getName());

  private final Channel channel;

  AmqpBrokerChannel(Channel channel) {
    this.channel = channel;
  }

  @Override
  public void declareExchange(ExchangeSpec exchange) {
    try {
      channel.exchangeDeclare(exchange.name(), exchange.type().wireName(),
          exchange.durable(), exchange.autoDelete(), null);
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.declaration("exchange '" + exchange.name() + "'", e);
    }
  }

  @Override
  public void declareQueue(QueueSpec queue) {
    try {
      channel.queueDeclare(queue.name(), queue.durable(), queue.exclusive(), queue.autoDelete(),
          queue.arguments().isEmpty() ? null : queue.arguments());
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.declaration("queue '" + queue.name() + "'", e);
    }
  }

  @Override
  public void bindQueue(BindingSpec binding) {
    try {
      channel.queueBind(binding.queue(), binding.exchange(), binding.routingKey());
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.declaration("binding " + binding.exchange() + " -> " + binding.queue()
          + " on '" + binding.routingKey() + "'", e);
    }
  }

  @Override
  public void publish(String exchange, Envelope envelope, Duration confirmTimeout) {
    boolean confirmed;
    try {
      channel.basicPublish(exchange, envelope.routingKey(), AmqpMessages.toProperties(envelope),
          envelope.payload());
      confirmed = channel.waitForConfirms(Math.max(1L, confirmTimeout.toMillis()));
    } catch (TimeoutException e) {
      throw new PublishTimeoutException(confirmTimeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerOperationException("Interrupted waiting for confirm of " + envelope, e);
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.operation("Publish to '" + exchange + "'", e);
    }
    if (!confirmed) {
      throw new BrokerOperationException("Broker nacked publish of " + envelope + " to '" + exchange + "'");
    }
  }

  @Override
  public void qos(int prefetch) {
    try {
      channel.basicQos(prefetch);
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.operation("basic.qos", e);
    }
  }

  @Override
  public String consume(String queue, DeliverySink sink) {
    try {
      return channel.basicConsume(queue, false, new SinkConsumer(channel, sink));
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.declaration("consumer on queue '" + queue + "'", e);
    }
  }

  @Override
  public void ack(long deliveryTag) {
    try {
      channel.basicAck(deliveryTag, false);
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.operation("basic.ack of " + deliveryTag, e);
    }
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) {
    try {
      channel.basicReject(deliveryTag, requeue);
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.operation("basic.reject of " + deliveryTag, e);
    }
  }

  @Override
  public void cancel(String consumerTag) {
    try {
      channel.basicCancel(consumerTag);
    } catch (IOException | RuntimeException e) {
      throw AmqpErrors.operation("basic.cancel of " + consumerTag, e);
    }
  }

  @Override
  public boolean isOpen() {
    return channel.isOpen();
  }

  @Override
  public void close() {
    if (!channel.isOpen()) {
      return;
    }
    try {
      channel.close();
    } catch (AlreadyClosedException e) {
      logger.log(Level.FINE, "Channel {0} already closed", channel.getChannelNumber());
    } catch (IOException | TimeoutException e) {
      logger.log(Level.WARNING, "Failed to close channel " + channel.getChannelNumber(), e);
    }
  }

  /**
   * Pushes broker deliveries into a {@link DeliverySink}. Runs on the connection's
   * consumer dispatch thread.
   */
  private static final class SinkConsumer extends DefaultConsumer {
    private final DeliverySink sink;
    private final AtomicBoolean ended = new AtomicBoolean();

    SinkConsumer(Channel channel, DeliverySink sink) {
      super(channel);
      this.sink = sink;
    }

    @Override
    public void handleDelivery(String consumerTag, com.rabbitmq.client.Envelope envelope,
                               AMQP.BasicProperties properties, byte[] body) {
      Delivery delivery;
      try {
        delivery = AmqpMessages.toDelivery(envelope, properties, body);
      } catch (IllegalArgumentException e) {
        logger.log(Level.SEVERE, "Rejecting unreadable message " + envelope.getDeliveryTag()
            + " with routingKey=" + envelope.getRoutingKey(), e);
        rejectUnreadable(envelope.getDeliveryTag());
        return;
      }
      sink.onDelivery(delivery);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
      end(AmqpErrors.reason(sig));
    }

    @Override
    public void handleCancel(String consumerTag) {
      end("consumer " + consumerTag + " cancelled by broker");
    }

    private void end(String reason) {
      if (ended.compareAndSet(false, true)) {
        sink.onShutdown(reason);
      }
    }

    private void rejectUnreadable(long deliveryTag) {
      try {
        getChannel().basicReject(deliveryTag, false);
      } catch (IOException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to reject unreadable message " + deliveryTag, e);
      }
    }
  }
}
