/**
 * Service provider interfaces for pluggable broker and metrics backends.
 *
 * <p>{@link relay.spi.BrokerConnector}, {@link relay.spi.BrokerConnection} and
 * {@link relay.spi.BrokerChannel} abstract the AMQP client; {@code relay-amqp} implements
 * them on RabbitMQ. {@link relay.spi.MetricsExporter} exports gauges and counters;
 * {@code relay-micrometer} bridges it to Micrometer.
 */
package relay.spi;
