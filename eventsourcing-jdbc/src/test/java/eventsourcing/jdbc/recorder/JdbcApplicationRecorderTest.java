package eventsourcing.jdbc.recorder;

import eventsourcing.InsertResult;
import eventsourcing.jdbc.JdbcDatastore;
import eventsourcing.jdbc.TestDatastores;
import eventsourcing.jdbc.tx.TransactionScope;
import eventsourcing.model.Notification;
import eventsourcing.model.StoredEvent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static eventsourcing.jdbc.recorder.Events.event;
import static org.junit.jupiter.api.Assertions.*;

class JdbcApplicationRecorderTest {

  private JdbcDatastore datastore;
  private JdbcApplicationRecorder recorder;

  @BeforeEach
  void setUp() {
    datastore = TestDatastores.h2();
    recorder = new JdbcApplicationRecorder(datastore, "orders_events");
    recorder.createSchema();
  }

  @AfterEach
  void tearDown() {
    datastore.close();
  }

  @Test
  void emptyLogHasMaxIdZero() {
    assertEquals(0L, recorder.maxNotificationId());
    assertTrue(recorder.selectNotifications(1, 10).isEmpty());
  }

  @Test
  void notificationsFollowInsertionOrder() {
    UUID a = UUID.randomUUID();
    UUID b = UUID.randomUUID();
    recorder.insertEvents(List.of(event(a, 1), event(a, 2))).orElseThrow();
    recorder.insertEvents(List.of(event(b, 1))).orElseThrow();

    List<Notification> notifications = recorder.selectNotifications(1, 10);

    assertEquals(3, notifications.size());
    assertEquals(event(a, 1), notifications.get(0).toStoredEvent());
    assertEquals(event(a, 2), notifications.get(1).toStoredEvent());
    assertEquals(event(b, 1), notifications.get(2).toStoredEvent());
    assertStrictlyIncreasing(notifications);
    assertEquals(notifications.get(2).id(), recorder.maxNotificationId());
  }

  @Test
  void pagingWithStartAndLimit() {
    UUID id = UUID.randomUUID();
    recorder.insertEvents(List.of(event(id, 1), event(id, 2), event(id, 3), event(id, 4), event(id, 5)))
        .orElseThrow();
    List<Notification> all = recorder.selectNotifications(1, 100);

    List<Notification> firstPage = recorder.selectNotifications(all.get(0).id(), 2);
    List<Notification> secondPage = recorder.selectNotifications(firstPage.get(1).id() + 1, 2);
    List<Notification> lastPage = recorder.selectNotifications(secondPage.get(1).id() + 1, 2);

    assertEquals(all.subList(0, 2), firstPage);
    assertEquals(all.subList(2, 4), secondPage);
    assertEquals(all.subList(4, 5), lastPage);
    assertTrue(recorder.selectNotifications(all.get(4).id() + 1, 2).isEmpty());
  }

  @Test
  void startIsInclusive() {
    UUID id = UUID.randomUUID();
    recorder.insertEvents(List.of(event(id, 1), event(id, 2))).orElseThrow();
    long secondId = recorder.maxNotificationId();

    List<Notification> fromSecond = recorder.selectNotifications(secondId, 10);

    assertEquals(1, fromSecond.size());
    assertEquals(2, fromSecond.get(0).originatorVersion());
  }

  @Test
  void conflictLeavesLogUnchanged() {
    UUID id = UUID.randomUUID();
    recorder.insertEvents(List.of(event(id, 1))).orElseThrow();
    long before = recorder.maxNotificationId();

    InsertResult result = recorder.insertEvents(List.of(event(id, 2), event(id, 1)));

    assertInstanceOf(InsertResult.Conflict.class, result);
    assertEquals(1, recorder.selectNotifications(1, 10).size());
    assertTrue(recorder.maxNotificationId() >= before);
  }

  @Test
  void idsStayIncreasingAcrossRolledBackInserts() {
    UUID id = UUID.randomUUID();
    recorder.insertEvents(List.of(event(id, 1))).orElseThrow();
    recorder.insertEvents(List.of(event(id, 2), event(id, 1)));
    recorder.insertEvents(List.of(event(id, 2))).orElseThrow();

    List<Notification> notifications = recorder.selectNotifications(1, 10);

    assertEquals(2, notifications.size());
    assertStrictlyIncreasing(notifications);
  }

  @Test
  void aggregateQueriesStillWork() {
    UUID id = UUID.randomUUID();
    recorder.insertEvents(List.of(event(id, 1), event(id, 2))).orElseThrow();

    List<StoredEvent> events = recorder.selectEvents(id);

    assertEquals(List.of(event(id, 1), event(id, 2)), events);
  }

  @Test
  void readerNeverPagesPastAnUncommittedNotification() throws Exception {
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();
    CountDownLatch firstWritten = new CountDownLatch(1);
    CountDownLatch commitFirst = new CountDownLatch(1);
    ExecutorService writers = Executors.newFixedThreadPool(2);
    try {
      Future<?> slowWriter = writers.submit(() -> {
        try (TransactionScope tx = datastore.pool().transaction()) {
          recorder.writeEvents(tx, List.of(event(first, 1)));
          firstWritten.countDown();
          assertTrue(commitFirst.await(10, TimeUnit.SECONDS));
          tx.commit();
        }
        return null;
      });
      assertTrue(firstWritten.await(10, TimeUnit.SECONDS));
      Future<InsertResult> fastWriter = writers.submit(() -> recorder.insertEvents(List.of(event(second, 1))));

      // the second writer queues behind the first one's lock
      assertThrows(TimeoutException.class, () -> fastWriter.get(300, TimeUnit.MILLISECONDS));
      List<Long> paged = new ArrayList<>();
      long next = readAll(paged, 1);

      commitFirst.countDown();
      slowWriter.get(10, TimeUnit.SECONDS);
      fastWriter.get(10, TimeUnit.SECONDS).orElseThrow();
      readAll(paged, next);

      List<Long> committed = new ArrayList<>();
      readAll(committed, 1);
      assertEquals(2, committed.size());
      assertEquals(committed, paged);
      assertEquals(first, recorder.selectNotifications(committed.get(0), 1).get(0).originatorId());
    } finally {
      writers.shutdownNow();
    }
  }

  @Test
  void nonPositiveLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> recorder.selectNotifications(1, 0));
  }

  private long readAll(List<Long> seen, long start) {
    long next = start;
    List<Notification> page = recorder.selectNotifications(next, 10);
    while (!page.isEmpty()) {
      for (Notification notification : page) {
        seen.add(notification.id());
        next = notification.id() + 1;
      }
      page = recorder.selectNotifications(next, 10);
    }
    return next;
  }

  private static void assertStrictlyIncreasing(List<Notification> notifications) {
    for (int i = 1; i < notifications.size(); i++) {
      assertTrue(notifications.get(i).id() > notifications.get(i - 1).id(),
          "ids not increasing: " + notifications);
    }
  }
}
