/**
 * Spring Boot auto-configuration for relay.
 *
 * <p>Binds {@code relay.*} properties, creates the publisher and subscriber, registers
 * {@link relay.spring.boot.RelayListener} beans as delivery callbacks and bridges metrics
 * to Micrometer when it is present.
 */
package relay.spring.boot;
