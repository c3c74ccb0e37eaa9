/**
 * Micrometer bridge for {@link relay.spi.MetricsExporter}.
 *
 * @see relay.micrometer.MicrometerMetricsExporter
 */
package relay.micrometer;
