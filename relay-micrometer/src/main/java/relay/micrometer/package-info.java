/**
 * Micrometer bridge for exporting subscriber health and delivery metrics to Prometheus,
 * Grafana, and other backends.
 *
 * <p>{@link relay.micrometer.MicrometerMetricsExporter} implements the
 * {@link relay.spi.MetricsExporter} SPI using Micrometer counters, gauges and timers.
 *
 * @see relay.micrometer.MicrometerMetricsExporter
 */
package relay.micrometer;
