package eventsourcing;

import java.util.Objects;

/**
 * Outcome of an insert on a recorder.
 *
 * <ul>
 *   <li>{@link Ok}: every row of the batch was committed.</li>
 *   <li>{@link Conflict}: a uniqueness constraint rejected the batch; nothing was
 *       committed. Re-read and retry the command.</li>
 *   <li>{@link Operational}: any other failure; nothing was committed and the
 *       session was discarded.</li>
 * </ul>
 *
 * <pre>{@code
 * InsertResult result = recorder.insertEvents(events);
 * if (result instanceof InsertResult.Conflict) {
 *     // reload the aggregate and run the command again
 * }
 * result.orElseThrow();
 * }</pre>
 */
public sealed interface InsertResult permits InsertResult.Ok, InsertResult.Conflict, InsertResult.Operational {

    /**
     * Singleton indicating a committed insert.
     */
    Ok OK = new Ok();

    static Ok ok() {
        return OK;
    }

    static Conflict conflict(RecordConflictException cause) {
        return new Conflict(cause);
    }

    static Operational operational(OperationalException cause) {
        return new Operational(cause);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * Throws the failure carried by this result, if any.
     *
     * @throws RecordConflictException for {@link Conflict}
     * @throws OperationalException    for {@link Operational}
     */
    default void orElseThrow() {
        if (this instanceof Conflict c) {
            throw c.cause();
        }
        if (this instanceof Operational o) {
            throw o.cause();
        }
    }

    /**
     * The batch was committed.
     */
    record Ok() implements InsertResult {
    }

    /**
     * The batch lost an optimistic-concurrency race.
     *
     * @param cause the conflict, wrapping the driver's constraint violation
     */
    record Conflict(RecordConflictException cause) implements InsertResult {
        public Conflict {
            Objects.requireNonNull(cause, "cause");
        }
    }

    /**
     * The batch failed for a non-conflict reason.
     *
     * @param cause the failure, wrapping the driver's exception
     */
    record Operational(OperationalException cause) implements InsertResult {
        public Operational {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
