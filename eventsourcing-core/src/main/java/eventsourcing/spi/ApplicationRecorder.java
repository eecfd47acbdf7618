package eventsourcing.spi;

import eventsourcing.model.Notification;

import java.util.List;

/**
 * {@link AggregateRecorder} whose events also form a global, ordered notification log.
 *
 * <p>Notification ids are assigned by the store when events are inserted. They follow
 * commit order for committed rows and may contain gaps.
 */
public interface ApplicationRecorder extends AggregateRecorder {

    /**
     * Returns notifications with {@code id >= start}, ascending by id.
     *
     * @param start first id to include
     * @param limit maximum number of notifications, positive
     * @return the page, possibly empty
     * @throws eventsourcing.OperationalException if the query fails
     */
    List<Notification> selectNotifications(long start, int limit);

    /**
     * Returns the highest committed notification id, or {@code 0} for an empty log.
     *
     * @throws eventsourcing.OperationalException if the query fails
     */
    long maxNotificationId();
}
