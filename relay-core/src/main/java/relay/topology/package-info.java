/**
 * Broker object model and the per-queue retry/dead-letter topology.
 *
 * <p>{@link relay.topology.QueueTopology} derives every exchange, queue and binding a
 * consuming stage needs; {@link relay.topology.TopologyInstaller} declares them through a
 * {@link relay.spi.BrokerChannel}.
 */
package relay.topology;
