package relay.spring.boot;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import relay.amqp.AmqpBrokerConnector;
import relay.consume.Subscriber;
import relay.dispatch.DeliveryInterceptor;
import relay.dispatch.RetryPolicy;
import relay.publish.Publisher;
import relay.registry.DefaultCallbackRegistry;
import relay.spi.BrokerConnector;
import relay.spi.MetricsExporter;
import relay.topology.DeadLetterPolicy;

import java.util.List;

/**
 * Auto-configuration for relay.
 *
 * <p>Wires a RabbitMQ {@link BrokerConnector} from {@link RelayProperties}, a
 * {@link Publisher} (unless {@code relay.publisher.enabled=false}) and, when
 * {@code relay.consumer.queue} is set, a {@link Subscriber} fed by
 * {@link RelayListener} beans.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass({Subscriber.class, AmqpBrokerConnector.class})
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(BrokerConnector.class)
  public AmqpBrokerConnector relayBrokerConnector(RelayProperties props) {
    RelayProperties.Connection c = props.getConnection();
    var builder = AmqpBrokerConnector.builder()
        .uri(c.getUri())
        .host(c.getHost())
        .username(c.getUsername())
        .password(c.getPassword())
        .virtualHost(c.getVirtualHost())
        .connectionName(c.getConnectionName())
        .connectionTimeout(c.getConnectionTimeout());
    if (c.getPort() != null) {
      builder.port(c.getPort());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultCallbackRegistry relayCallbackRegistry() {
    return new DefaultCallbackRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public RelayListenerRegistrar relayListenerRegistrar(ListableBeanFactory beanFactory,
      DefaultCallbackRegistry callbackRegistry) {
    return new RelayListenerRegistrar(beanFactory, callbackRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "relay.publisher", name = "enabled", matchIfMissing = true)
  public Publisher relayPublisher(RelayProperties props, BrokerConnector connector,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = Publisher.builder()
        .connector(connector)
        .exchange(props.getExchange().getName())
        .exchangeType(props.getExchange().getType())
        .routingKey(props.getPublisher().getRoutingKey())
        .confirmTimeout(props.getPublisher().getConfirmTimeout());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "relay.consumer", name = "queue")
  public Subscriber relaySubscriber(RelayProperties props, BrokerConnector connector,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DeliveryInterceptor> interceptorProvider) {
    RelayProperties.Consumer consumer = props.getConsumer();
    RelayProperties.Retry retry = props.getRetry();
    RelayProperties.DeadLetter deadLetter = props.getDeadLetter();

    DeadLetterPolicy deadLetterPolicy = deadLetter.isDiscardOnReject()
        ? DeadLetterPolicy.discard()
        : DeadLetterPolicy.toExchange(deadLetter.getExchange());
    RetryPolicy retryPolicy = RetryPolicy.builder()
        .exchangePrefix(retry.getExchangePrefix())
        .delay(retry.getDelay())
        .maxRetries(retry.getMaxRetries())
        .build();
    List<DeliveryInterceptor> interceptors = interceptorProvider.orderedStream().toList();

    var builder = Subscriber.builder()
        .connector(connector)
        .exchange(props.getExchange().getName())
        .exchangeType(props.getExchange().getType())
        .queue(consumer.getQueue())
        .prefetch(consumer.getPrefetch())
        .concurrency(consumer.getConcurrency())
        .drainTimeout(consumer.getDrainTimeout())
        .retryPublishTimeout(consumer.getRetryPublishTimeout())
        .retryPolicy(retryPolicy)
        .deadLetterPolicy(deadLetterPolicy)
        .interceptors(interceptors);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "relay.consumer", name = "queue")
  public RelaySubscriberLifecycle relaySubscriberLifecycle(Subscriber subscriber,
      DefaultCallbackRegistry callbackRegistry, RelayProperties props) {
    return new RelaySubscriberLifecycle(subscriber, callbackRegistry, props.getConsumer().isAutoStartup());
  }
}
