package eventsourcing.micrometer;

import eventsourcing.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventsourcing.connections.opened}: sessions opened</li>
 *   <li>{@code eventsourcing.connections.closed}: sessions closed, for any reason</li>
 *   <li>{@code eventsourcing.connections.expired}: sessions closed on reaching their maximum age</li>
 *   <li>{@code eventsourcing.connections.ping.failed}: sessions replaced after a failed liveness probe</li>
 *   <li>{@code eventsourcing.events.inserted}: events committed</li>
 *   <li>{@code eventsourcing.tracking.inserted}: tracking rows committed</li>
 *   <li>{@code eventsourcing.insert.conflicts}: inserts rejected by a uniqueness constraint</li>
 *   <li>{@code eventsourcing.errors.operational}: non-conflict storage failures</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventsourcing.pool.size}: sessions held by the pool</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter connectionsOpened;
  private final Counter connectionsClosed;
  private final Counter connectionsExpired;
  private final Counter pingFailures;
  private final Counter eventsInserted;
  private final Counter trackingInserted;
  private final Counter conflicts;
  private final Counter operationalErrors;
  private final Gauge poolSizeGauge;

  private final AtomicInteger poolSize = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventsourcing"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventsourcing");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several datastores in
   * one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.eventsourcing"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.connectionsOpened = Counter.builder(namePrefix + ".connections.opened")
        .description("Database sessions opened")
        .register(registry);
    this.connectionsClosed = Counter.builder(namePrefix + ".connections.closed")
        .description("Database sessions closed")
        .register(registry);
    this.connectionsExpired = Counter.builder(namePrefix + ".connections.expired")
        .description("Database sessions closed on reaching their maximum age")
        .register(registry);
    this.pingFailures = Counter.builder(namePrefix + ".connections.ping.failed")
        .description("Database sessions replaced after a failed liveness probe")
        .register(registry);
    this.eventsInserted = Counter.builder(namePrefix + ".events.inserted")
        .description("Events committed")
        .register(registry);
    this.trackingInserted = Counter.builder(namePrefix + ".tracking.inserted")
        .description("Tracking rows committed")
        .register(registry);
    this.conflicts = Counter.builder(namePrefix + ".insert.conflicts")
        .description("Inserts rejected by a uniqueness constraint")
        .register(registry);
    this.operationalErrors = Counter.builder(namePrefix + ".errors.operational")
        .description("Storage failures other than conflicts")
        .register(registry);

    this.poolSizeGauge = Gauge.builder(namePrefix + ".pool.size", poolSize, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementConnectionsOpened() {
    if (closed) return;
    connectionsOpened.increment();
  }

  @Override
  public void incrementConnectionsClosed() {
    if (closed) return;
    connectionsClosed.increment();
  }

  @Override
  public void incrementConnectionsExpired() {
    if (closed) return;
    connectionsExpired.increment();
  }

  @Override
  public void incrementPingFailures() {
    if (closed) return;
    pingFailures.increment();
  }

  @Override
  public void incrementEventsInserted(int count) {
    if (closed) return;
    eventsInserted.increment(count);
  }

  @Override
  public void incrementTrackingInserted() {
    if (closed) return;
    trackingInserted.increment();
  }

  @Override
  public void incrementConflicts() {
    if (closed) return;
    conflicts.increment();
  }

  @Override
  public void incrementOperationalErrors() {
    if (closed) return;
    operationalErrors.increment();
  }

  @Override
  public void recordPoolSize(int size) {
    if (closed) return;
    poolSize.set(size);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this after closing the datastore that reports to this exporter, to
   * prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(connectionsOpened, connectionsClosed, connectionsExpired,
        pingFailures, eventsInserted, trackingInserted, conflicts, operationalErrors,
        poolSizeGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
