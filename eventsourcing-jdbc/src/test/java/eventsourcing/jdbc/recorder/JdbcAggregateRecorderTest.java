package eventsourcing.jdbc.recorder;

import eventsourcing.InsertResult;
import eventsourcing.OperationalException;
import eventsourcing.jdbc.JdbcDatastore;
import eventsourcing.jdbc.JdbcTemplate;
import eventsourcing.jdbc.RecordingMetrics;
import eventsourcing.jdbc.TestDatastores;
import eventsourcing.model.EventQuery;
import eventsourcing.model.StoredEvent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static eventsourcing.jdbc.recorder.Events.event;
import static org.junit.jupiter.api.Assertions.*;

class JdbcAggregateRecorderTest {

  private final RecordingMetrics metrics = new RecordingMetrics();
  private JdbcDatastore datastore;
  private JdbcAggregateRecorder recorder;
  private final UUID id = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    datastore = TestDatastores.h2(TestDatastores.h2Provider(TestDatastores.h2Url()), metrics);
    recorder = new JdbcAggregateRecorder(datastore, "stored_events");
    recorder.createSchema();
  }

  @AfterEach
  void tearDown() {
    datastore.close();
  }

  @Test
  void createSchemaIsIdempotent() {
    assertDoesNotThrow(() -> recorder.createSchema());
  }

  @Test
  void insertedEventsAreReadBackInVersionOrder() {
    assertTrue(recorder.insertEvents(List.of(event(id, 2), event(id, 1), event(id, 3))).isOk());

    List<StoredEvent> events = recorder.selectEvents(id);

    assertEquals(List.of(1, 2, 3), versions(events));
    assertEquals(event(id, 2), events.get(1));
    assertEquals("v2", Events.state(events.get(1)));
    assertEquals(3, metrics.eventsInserted.get());
  }

  @Test
  void versionRangesAndOrdering() {
    recorder.insertEvents(List.of(event(id, 1), event(id, 2), event(id, 3), event(id, 4), event(id, 5)))
        .orElseThrow();

    assertEquals(List.of(3, 4, 5), versions(recorder.selectEvents(id, EventQuery.all().after(2))));
    assertEquals(List.of(1, 2, 3), versions(recorder.selectEvents(id, EventQuery.all().upTo(3))));
    assertEquals(List.of(3, 4), versions(recorder.selectEvents(id, EventQuery.all().after(2).upTo(4))));
    assertEquals(List.of(5, 4, 3, 2, 1), versions(recorder.selectEvents(id, EventQuery.all().descending())));
    assertEquals(List.of(5), versions(recorder.selectEvents(id, EventQuery.all().descending().limit(1))));
    assertEquals(List.of(1, 2), versions(recorder.selectEvents(id, EventQuery.all().limit(2))));
    assertEquals(List.of(4, 3), versions(recorder.selectEvents(id,
        EventQuery.all().upTo(4).descending().limit(2))));
  }

  @Test
  void emptyRangeAndUnknownAggregateReturnEmpty() {
    recorder.insertEvents(List.of(event(id, 1))).orElseThrow();

    assertTrue(recorder.selectEvents(id, EventQuery.all().after(1)).isEmpty());
    assertTrue(recorder.selectEvents(UUID.randomUUID()).isEmpty());
  }

  @Test
  void aggregatesAreIsolated() {
    UUID other = UUID.randomUUID();
    recorder.insertEvents(List.of(event(id, 1), event(other, 1), event(other, 2))).orElseThrow();

    assertEquals(1, recorder.selectEvents(id).size());
    assertEquals(2, recorder.selectEvents(other).size());
  }

  @Test
  void emptyBatchIsOk() {
    assertTrue(recorder.insertEvents(List.of()).isOk());
    assertEquals(0, metrics.eventsInserted.get());
  }

  @Test
  void versionReuseIsConflict() {
    recorder.insertEvents(List.of(event(id, 1))).orElseThrow();

    InsertResult result = recorder.insertEvents(List.of(event(id, 1)));

    assertInstanceOf(InsertResult.Conflict.class, result);
    assertEquals(1, metrics.conflicts.get());
  }

  @Test
  void conflictingBatchStoresNothing() {
    recorder.insertEvents(List.of(event(id, 3))).orElseThrow();

    InsertResult result = recorder.insertEvents(List.of(event(id, 1), event(id, 2), event(id, 3)));

    assertInstanceOf(InsertResult.Conflict.class, result);
    assertEquals(List.of(3), versions(recorder.selectEvents(id)));
    assertEquals(1, metrics.eventsInserted.get());
  }

  @Test
  void duplicateWithinOneBatchIsConflict() {
    InsertResult result = recorder.insertEvents(List.of(event(id, 1), event(id, 1)));

    assertInstanceOf(InsertResult.Conflict.class, result);
    assertTrue(recorder.selectEvents(id).isEmpty());
  }

  @Test
  void concurrentWritersOfOneVersionHaveExactlyOneWinner() throws Exception {
    int rounds = 20;
    ExecutorService writers = Executors.newFixedThreadPool(2);
    try {
      for (int round = 0; round < rounds; round++) {
        UUID aggregate = UUID.randomUUID();
        StoredEvent first = new StoredEvent(aggregate, 1, "test.Event", "first".getBytes(StandardCharsets.UTF_8));
        StoredEvent second = new StoredEvent(aggregate, 1, "test.Event", "second".getBytes(StandardCharsets.UTF_8));
        CyclicBarrier start = new CyclicBarrier(2);

        Future<InsertResult> a = writers.submit(() -> {
          start.await(5, TimeUnit.SECONDS);
          return recorder.insertEvents(List.of(first));
        });
        Future<InsertResult> b = writers.submit(() -> {
          start.await(5, TimeUnit.SECONDS);
          return recorder.insertEvents(List.of(second));
        });
        InsertResult resultA = a.get(30, TimeUnit.SECONDS);
        InsertResult resultB = b.get(30, TimeUnit.SECONDS);

        assertTrue(resultA.isOk() ^ resultB.isOk(), "round " + round + ": " + resultA + ", " + resultB);
        InsertResult loser = resultA.isOk() ? resultB : resultA;
        assertInstanceOf(InsertResult.Conflict.class, loser, "round " + round);
        StoredEvent winner = resultA.isOk() ? first : second;
        assertEquals(List.of(winner), recorder.selectEvents(aggregate));
      }
    } finally {
      writers.shutdownNow();
    }
    assertEquals(rounds, metrics.conflicts.get());
    assertEquals(rounds, metrics.eventsInserted.get());
  }

  @Test
  void failingMetricsExporterDoesNotFailCommittedInsert() {
    metrics.failInsertCounters = true;

    InsertResult result = recorder.insertEvents(List.of(event(id, 1), event(id, 2)));

    assertTrue(result.isOk());
    assertEquals(List.of(1, 2), versions(recorder.selectEvents(id)));
  }

  @Test
  void droppedTableIsOperational() {
    datastore.executeStatements("dropping", List.of("DROP TABLE stored_events"));

    InsertResult result = recorder.insertEvents(List.of(event(id, 1)));

    assertInstanceOf(InsertResult.Operational.class, result);
    assertThrows(OperationalException.class, result::orElseThrow);
    assertThrows(OperationalException.class, () -> recorder.selectEvents(id));
  }

  @Test
  void recoversAfterSessionIsClosedUnderneath() throws Exception {
    recorder.insertEvents(List.of(event(id, 1))).orElseThrow();
    var session = datastore.pool().acquire();
    session.markIdle();
    session.connection().close();

    assertEquals(1, recorder.selectEvents(id).size());
    assertTrue(recorder.insertEvents(List.of(event(id, 2))).isOk());
  }

  @Test
  void tableIsCreatedWithCompositePrimaryKey() {
    long keyColumns = datastore.read("inspecting", tx -> JdbcTemplate.queryForLong(tx.connection(),
        "SELECT COUNT(*) FROM INFORMATION_SCHEMA.KEY_COLUMN_USAGE WHERE TABLE_NAME = 'STORED_EVENTS'"));

    assertEquals(2L, keyColumns);
  }

  @Test
  void invalidTableNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new JdbcAggregateRecorder(datastore, "bad-name"));
  }

  private static List<Integer> versions(List<StoredEvent> events) {
    List<Integer> versions = new ArrayList<>();
    for (StoredEvent event : events) {
      versions.add(event.originatorVersion());
    }
    return versions;
  }
}
