package relay.consume;

import relay.Envelope;
import relay.spi.BrokerChannel;
import relay.spi.DeliverySink;
import relay.topology.BindingSpec;
import relay.topology.ExchangeSpec;
import relay.topology.QueueSpec;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Makes a {@link BrokerChannel} safe to share between worker threads by running every
 * operation under one lock.
 */
final class SerializedChannel implements BrokerChannel {
  private final BrokerChannel delegate;
  private final ReentrantLock lock = new ReentrantLock();

  SerializedChannel(BrokerChannel delegate) {
    this.delegate = delegate;
  }

  @Override
  public void declareExchange(ExchangeSpec exchange) {
    lock.lock();
    try {
      delegate.declareExchange(exchange);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void declareQueue(QueueSpec queue) {
    lock.lock();
    try {
      delegate.declareQueue(queue);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void bindQueue(BindingSpec binding) {
    lock.lock();
    try {
      delegate.bindQueue(binding);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void publish(String exchange, Envelope envelope, Duration confirmTimeout) {
    lock.lock();
    try {
      delegate.publish(exchange, envelope, confirmTimeout);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void qos(int prefetch) {
    lock.lock();
    try {
      delegate.qos(prefetch);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String consume(String queue, DeliverySink sink) {
    lock.lock();
    try {
      return delegate.consume(queue, sink);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void ack(long deliveryTag) {
    lock.lock();
    try {
      delegate.ack(deliveryTag);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) {
    lock.lock();
    try {
      delegate.reject(deliveryTag, requeue);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void cancel(String consumerTag) {
    lock.lock();
    try {
      delegate.cancel(consumerTag);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isOpen() {
    return delegate.isOpen();
  }

  @Override
  public void close() {
    lock.lock();
    try {
      delegate.close();
    } finally {
      lock.unlock();
    }
  }
}
