/**
 * RabbitMQ implementation of the broker SPI on top of {@code com.rabbitmq:amqp-client}.
 *
 * <p>{@link relay.amqp.AmqpBrokerConnector} opens connections with automatic recovery
 * turned off: the subscriber and publisher own reconnection. Every channel runs in
 * publisher-confirm mode.
 */
package relay.amqp;
