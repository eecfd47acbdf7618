package eventsourcing.spi;

import eventsourcing.InsertResult;
import eventsourcing.model.StoredEvent;
import eventsourcing.model.Tracking;

import java.util.List;

/**
 * {@link ApplicationRecorder} that also records which notifications a consumer has
 * processed.
 *
 * <p>The tracking row and the events written in response to a notification commit
 * together or not at all. A second attempt to record the same tracking pair yields a
 * {@link InsertResult.Conflict} and none of its events become visible.
 */
public interface ProcessRecorder extends ApplicationRecorder {

    /**
     * Inserts events and, when given, a tracking row in one transaction.
     *
     * @param events   events produced while processing the notification
     * @param tracking consumer checkpoint, or {@code null} for a plain insert
     * @return {@link InsertResult.Ok} when committed, otherwise the failure
     */
    InsertResult insertEvents(List<StoredEvent> events, Tracking tracking);

    @Override
    default InsertResult insertEvents(List<StoredEvent> events) {
        return insertEvents(events, null);
    }

    /**
     * Returns the highest notification id recorded for {@code applicationName}, or
     * {@code 0} if the consumer has recorded none. This is where a restarting consumer
     * resumes.
     *
     * @throws eventsourcing.OperationalException if the query fails
     */
    long maxTrackingId(String applicationName);
}
