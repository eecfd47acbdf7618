/**
 * Micrometer bridge for exporting pool and recorder metrics to Prometheus, Grafana,
 * and other backends.
 *
 * <p>{@link eventsourcing.micrometer.MicrometerMetricsExporter} implements the
 * {@link eventsourcing.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 *
 * @see eventsourcing.micrometer.MicrometerMetricsExporter
 */
package eventsourcing.micrometer;
