package eventsourcing.spi;

import eventsourcing.InsertResult;
import eventsourcing.model.EventQuery;
import eventsourcing.model.StoredEvent;

import java.util.List;
import java.util.UUID;

/**
 * Append-only store of events grouped by aggregate.
 *
 * <p>Rows are never updated or deleted. Writers are serialized per aggregate only by
 * the uniqueness of {@code (originatorId, originatorVersion)}: of two writers proposing
 * the same version, exactly one commits and the other gets a
 * {@link InsertResult.Conflict}.
 *
 * @see ApplicationRecorder
 * @see ProcessRecorder
 */
public interface AggregateRecorder {

    /**
     * Creates the backing tables and indexes if they do not exist yet.
     *
     * @throws eventsourcing.OperationalException if the statements fail
     */
    void createSchema();

    /**
     * Inserts all events in one transaction.
     *
     * @param events the batch to append; an empty batch is a no-op
     * @return {@link InsertResult.Ok} when committed, otherwise the failure
     */
    InsertResult insertEvents(List<StoredEvent> events);

    /**
     * Selects an aggregate's events in a version range.
     *
     * <p>No contiguity checks are applied to the returned versions.
     *
     * @param originatorId aggregate identifier
     * @param query        version bounds, order and limit
     * @return matching events, possibly empty
     * @throws eventsourcing.OperationalException if the query fails
     */
    List<StoredEvent> selectEvents(UUID originatorId, EventQuery query);

    /**
     * Selects all events of an aggregate, ascending by version.
     */
    default List<StoredEvent> selectEvents(UUID originatorId) {
        return selectEvents(originatorId, EventQuery.all());
    }
}
