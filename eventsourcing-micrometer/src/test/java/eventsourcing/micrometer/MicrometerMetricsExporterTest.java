package eventsourcing.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void connectionLifecycleCounters() {
    exporter.incrementConnectionsOpened();
    exporter.incrementConnectionsOpened();
    exporter.incrementConnectionsClosed();
    exporter.incrementConnectionsExpired();
    exporter.incrementPingFailures();

    assertEquals(2.0, counter("eventsourcing.connections.opened").count());
    assertEquals(1.0, counter("eventsourcing.connections.closed").count());
    assertEquals(1.0, counter("eventsourcing.connections.expired").count());
    assertEquals(1.0, counter("eventsourcing.connections.ping.failed").count());
  }

  @Test
  void eventsInsertedCountsBatchSize() {
    exporter.incrementEventsInserted(3);
    exporter.incrementEventsInserted(2);
    assertEquals(5.0, counter("eventsourcing.events.inserted").count());
  }

  @Test
  void trackingInserted() {
    exporter.incrementTrackingInserted();
    assertEquals(1.0, counter("eventsourcing.tracking.inserted").count());
  }

  @Test
  void failureCounters() {
    exporter.incrementConflicts();
    exporter.incrementConflicts();
    exporter.incrementOperationalErrors();
    assertEquals(2.0, counter("eventsourcing.insert.conflicts").count());
    assertEquals(1.0, counter("eventsourcing.errors.operational").count());
  }

  @Test
  void recordPoolSize() {
    exporter.recordPoolSize(4);
    assertEquals(4.0, gauge("eventsourcing.pool.size").value());

    exporter.recordPoolSize(0);
    assertEquals(0.0, gauge("eventsourcing.pool.size").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "orders.store");
    custom.incrementEventsInserted(1);
    custom.recordPoolSize(2);

    assertEquals(1.0, counter("orders.store.events.inserted").count());
    assertEquals(2.0, gauge("orders.store.pool.size").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();

    assertNull(registry.find("eventsourcing.events.inserted").counter());
    assertNull(registry.find("eventsourcing.pool.size").gauge());
    assertDoesNotThrow(() -> {
      exporter.incrementEventsInserted(1);
      exporter.recordPoolSize(3);
    });
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "app."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
