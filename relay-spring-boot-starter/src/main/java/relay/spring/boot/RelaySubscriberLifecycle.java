package relay.spring.boot;

import org.springframework.context.SmartLifecycle;
import relay.consume.Subscriber;
import relay.registry.CallbackRegistry;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts the {@link Subscriber} once the context is refreshed and every
 * {@link RelayListener} is registered, and closes it when the context stops.
 *
 * <p>A subscriber is single-use, so a stopped lifecycle cannot be restarted.
 */
public class RelaySubscriberLifecycle implements SmartLifecycle {
  private static final Logger logger = Logger.getLogger(RelaySubscriberLifecycle.class.getName());

  private final Subscriber subscriber;
  private final CallbackRegistry registry;
  private final boolean autoStartup;
  private volatile boolean running;

  public RelaySubscriberLifecycle(Subscriber subscriber, CallbackRegistry registry, boolean autoStartup) {
    this.subscriber = subscriber;
    this.registry = registry;
    this.autoStartup = autoStartup;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    if (registry.routingKeys().isEmpty()) {
      logger.log(Level.WARNING, "No @RelayListener beans registered; subscriber for queue {0} not started",
          subscriber.queue());
      return;
    }
    subscriber.start(registry);
    running = true;
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    subscriber.close();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return autoStartup;
  }

  public Subscriber subscriber() {
    return subscriber;
  }
}
