package relay.topology;

import relay.spi.BrokerChannel;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Declares broker objects through a {@link BrokerChannel}.
 *
 * <p>Declarations are idempotent, so installing the same topology on every reconnect is
 * safe. A conflicting declaration aborts the install with
 * {@link relay.TopologyConflictException}; the channel is closed by the broker at that
 * point and must not be reused.
 */
public final class TopologyInstaller {
  private static final Logger logger = Logger.getLogger(TopologyInstaller.class.getName());

  private final BrokerChannel channel;

  public TopologyInstaller(BrokerChannel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  /**
   * Declares exchanges, then queues, then bindings.
   *
   * @param topology the topology to install
   */
  public void install(QueueTopology topology) {
    Objects.requireNonNull(topology, "topology");
    for (ExchangeSpec exchange : topology.exchanges()) {
      declare(exchange);
    }
    for (QueueSpec queue : topology.queues()) {
      declare(queue);
    }
    for (BindingSpec binding : topology.bindings()) {
      bind(binding);
    }
    logger.log(Level.FINE, "Installed {0}", topology);
  }

  public void declare(ExchangeSpec exchange) {
    channel.declareExchange(exchange);
    logger.log(Level.FINE, "Declared exchange {0} ({1})",
        new Object[]{exchange.name(), exchange.type().wireName()});
  }

  public void declare(QueueSpec queue) {
    channel.declareQueue(queue);
    logger.log(Level.FINE, "Declared queue {0} {1}", new Object[]{queue.name(), queue.arguments()});
  }

  public void bind(BindingSpec binding) {
    channel.bindQueue(binding);
    logger.log(Level.FINE, "Bound {0} -> {1} with key ''{2}''",
        new Object[]{binding.exchange(), binding.queue(), binding.routingKey()});
  }
}
