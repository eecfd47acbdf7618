package eventsourcing.jdbc.example;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Events of the {@link Dog} aggregate.
 */
sealed interface DogEvent permits DogEvent.Registered, DogEvent.TrickAdded, DogEvent.Snapshot {

  UUID originatorId();

  int originatorVersion();

  record Registered(UUID originatorId, int originatorVersion, String name) implements DogEvent {
    public Registered {
      Objects.requireNonNull(name, "name");
    }
  }

  record TrickAdded(UUID originatorId, int originatorVersion, String trick) implements DogEvent {
    public TrickAdded {
      Objects.requireNonNull(trick, "trick");
    }
  }

  /** Full state at {@code originatorVersion}, stored in the snapshots table. */
  record Snapshot(UUID originatorId, int originatorVersion, String name, List<String> tricks)
      implements DogEvent {
    public Snapshot {
      Objects.requireNonNull(name, "name");
      tricks = List.copyOf(tricks);
    }
  }
}
