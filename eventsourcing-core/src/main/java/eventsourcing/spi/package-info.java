/**
 * Recorder contracts and extension points.
 *
 * <p>{@link eventsourcing.spi.AggregateRecorder}, {@link eventsourcing.spi.ApplicationRecorder}
 * and {@link eventsourcing.spi.ProcessRecorder} are the storage capabilities; the
 * {@code eventsourcing-jdbc} module implements them. {@link eventsourcing.spi.ConnectionProvider}
 * and {@link eventsourcing.spi.MetricsExporter} are what integrators plug in.
 *
 * @see eventsourcing.spi.AggregateRecorder
 * @see eventsourcing.spi.ConnectionProvider
 * @see eventsourcing.spi.MetricsExporter
 */
package eventsourcing.spi;
