package relay.dispatch;

import relay.BrokerConnectionException;
import relay.BrokerOperationException;
import relay.Envelope;
import relay.spi.BrokerChannel;
import relay.spi.DeliverySink;
import relay.topology.BindingSpec;
import relay.topology.ExchangeSpec;
import relay.topology.QueueSpec;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records settlement calls and publishes; failures are switched on per operation.
 */
class StubBrokerChannel implements BrokerChannel {
  record Published(String exchange, Envelope envelope) {
  }

  record Rejected(long tag, boolean requeue) {
  }

  final List<Long> acks = new CopyOnWriteArrayList<>();
  final List<Rejected> rejects = new CopyOnWriteArrayList<>();
  final List<Published> published = new CopyOnWriteArrayList<>();
  volatile boolean failAck;
  volatile boolean failReject;
  volatile boolean failPublish;

  @Override
  public void declareExchange(ExchangeSpec exchange) {
  }

  @Override
  public void declareQueue(QueueSpec queue) {
  }

  @Override
  public void bindQueue(BindingSpec binding) {
  }

  @Override
  public void publish(String exchange, Envelope envelope, Duration confirmTimeout) {
    if (failPublish) {
      throw new BrokerOperationException("nacked");
    }
    published.add(new Published(exchange, envelope));
  }

  @Override
  public void qos(int prefetch) {
  }

  @Override
  public String consume(String queue, DeliverySink sink) {
    return "ctag";
  }

  @Override
  public void ack(long deliveryTag) {
    if (failAck) {
      throw new BrokerConnectionException("channel closed");
    }
    acks.add(deliveryTag);
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) {
    if (failReject) {
      throw new BrokerConnectionException("channel closed");
    }
    rejects.add(new Rejected(deliveryTag, requeue));
  }

  @Override
  public void cancel(String consumerTag) {
  }

  @Override
  public boolean isOpen() {
    return true;
  }

  @Override
  public void close() {
  }
}
