package eventsourcing.jdbc.example;

import eventsourcing.InsertResult;
import eventsourcing.jdbc.JdbcDatastore;
import eventsourcing.jdbc.JdbcRecorderFactory;
import eventsourcing.jdbc.TestDatastores;
import eventsourcing.model.EventQuery;
import eventsourcing.model.Notification;
import eventsourcing.model.StoredEvent;
import eventsourcing.model.Tracking;
import eventsourcing.spi.AggregateRecorder;
import eventsourcing.spi.ApplicationRecorder;
import eventsourcing.spi.ProcessRecorder;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DogEndToEndTest {

  private JdbcDatastore datastore;
  private JdbcRecorderFactory dogs;
  private final UUID id = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    datastore = TestDatastores.h2();
    dogs = new JdbcRecorderFactory("dogs", datastore, true);
  }

  @AfterEach
  void tearDown() {
    dogs.close();
  }

  @Test
  void registerAndTeachTricks() {
    ApplicationRecorder recorder = dogs.applicationRecorder();
    DogEvent.Registered registered = new DogEvent.Registered(id, 1, "Fido");
    recorder.insertEvents(List.of(DogCodec.encode(registered))).orElseThrow();

    Dog fido = Dog.replay(DogCodec.decodeAll(recorder.selectEvents(id)));
    DogEvent.TrickAdded rollOver = fido.addTrick("roll over");
    DogEvent.TrickAdded playDead = Dog.mutate(rollOver, fido).addTrick("play dead");
    recorder.insertEvents(DogCodec.encodeAll(List.of(rollOver, playDead))).orElseThrow();

    List<StoredEvent> sinceRegistration = recorder.selectEvents(id, EventQuery.all().after(1));
    assertEquals(List.of(2, 3), List.of(
        sinceRegistration.get(0).originatorVersion(), sinceRegistration.get(1).originatorVersion()));

    Dog replayed = Dog.replay(DogCodec.decodeAll(recorder.selectEvents(id)));
    assertEquals("Fido", replayed.name());
    assertEquals(List.of("roll over", "play dead"), replayed.tricks());
    assertEquals(3, replayed.version());
  }

  @Test
  void staleCommandConflictsAndRetrySucceeds() {
    ApplicationRecorder recorder = dogs.applicationRecorder();
    recorder.insertEvents(List.of(DogCodec.encode(new DogEvent.Registered(id, 1, "Fido")))).orElseThrow();
    Dog seenByA = Dog.replay(DogCodec.decodeAll(recorder.selectEvents(id)));
    Dog seenByB = Dog.replay(DogCodec.decodeAll(recorder.selectEvents(id)));

    assertTrue(recorder.insertEvents(List.of(DogCodec.encode(seenByA.addTrick("sit")))).isOk());
    InsertResult stale = recorder.insertEvents(List.of(DogCodec.encode(seenByB.addTrick("stay"))));
    assertInstanceOf(InsertResult.Conflict.class, stale);

    Dog reloaded = Dog.replay(DogCodec.decodeAll(recorder.selectEvents(id)));
    assertTrue(recorder.insertEvents(List.of(DogCodec.encode(reloaded.addTrick("stay")))).isOk());

    Dog latest = Dog.replay(DogCodec.decodeAll(recorder.selectEvents(id)));
    assertEquals(List.of("sit", "stay"), latest.tricks());
  }

  @Test
  void snapshotRestoresStateWithoutFullReplay() {
    ApplicationRecorder events = dogs.applicationRecorder();
    AggregateRecorder snapshots = dogs.aggregateRecorder("snapshots");

    Dog dog = Dog.mutate(new DogEvent.Registered(id, 1, "Fido"), null);
    List<DogEvent> history = new ArrayList<>();
    history.add(new DogEvent.Registered(id, 1, "Fido"));
    for (String trick : List.of("sit", "stay", "fetch")) {
      DogEvent.TrickAdded added = dog.addTrick(trick);
      history.add(added);
      dog = Dog.mutate(added, dog);
    }
    events.insertEvents(DogCodec.encodeAll(history)).orElseThrow();
    snapshots.insertEvents(List.of(DogCodec.encode(dog.snapshot()))).orElseThrow();
    DogEvent.TrickAdded later = dog.addTrick("beg");
    events.insertEvents(List.of(DogCodec.encode(later))).orElseThrow();

    StoredEvent latestSnapshot = snapshots.selectEvents(id, EventQuery.all().descending().limit(1)).get(0);
    List<DogEvent> replay = new ArrayList<>();
    replay.add(DogCodec.decode(latestSnapshot));
    replay.addAll(DogCodec.decodeAll(
        events.selectEvents(id, EventQuery.all().after(latestSnapshot.originatorVersion()))));
    Dog restored = Dog.replay(replay);

    assertEquals(5, restored.version());
    assertEquals(List.of("sit", "stay", "fetch", "beg"), restored.tricks());
  }

  @Test
  void downstreamProcessTracksWhatItConsumed() {
    ApplicationRecorder upstream = dogs.applicationRecorder();
    upstream.insertEvents(DogCodec.encodeAll(List.of(
        new DogEvent.Registered(id, 1, "Fido"),
        new DogEvent.TrickAdded(id, 2, "sit")))).orElseThrow();
    ProcessRecorder counter = new JdbcRecorderFactory("trickcounter", datastore, true).processRecorder();

    long position = counter.maxTrackingId("dogs");
    List<Notification> pending = upstream.selectNotifications(position + 1, 10);
    UUID tally = UUID.randomUUID();
    int version = 0;
    for (Notification notification : pending) {
      List<StoredEvent> produced = new ArrayList<>();
      if (DogCodec.TRICK_ADDED.equals(notification.topic())) {
        produced.add(new StoredEvent(tally, ++version, "counter.Incremented", new byte[0]));
      }
      counter.insertEvents(produced, new Tracking("dogs", notification.id())).orElseThrow();
    }

    assertEquals(pending.get(pending.size() - 1).id(), counter.maxTrackingId("dogs"));
    assertEquals(1, counter.selectEvents(tally).size());
    InsertResult replayed = counter.insertEvents(List.of(), new Tracking("dogs", pending.get(0).id()));
    assertInstanceOf(InsertResult.Conflict.class, replayed);
  }

  @Test
  void unknownTopicIsRejected() {
    StoredEvent unknown = new StoredEvent(id, 1, "dogs.Unknown", new byte[0]);

    assertThrows(IllegalArgumentException.class, () -> DogCodec.decode(unknown));
  }

  @Test
  void trickBeforeRegistrationIsRejected() {
    assertThrows(IllegalStateException.class, () -> Dog.mutate(new DogEvent.TrickAdded(id, 1, "sit"), null));
  }
}
