package eventsourcing.model;

import java.util.Objects;

/**
 * Checkpoint stating that {@code applicationName} has durably processed the
 * notification with {@code notificationId}.
 *
 * <p>Recorded in the same transaction as the events produced while processing that
 * notification. Recording the same pair twice fails, which is what prevents a
 * consumer from processing a notification twice.
 *
 * @param applicationName consumer name
 * @param notificationId  id of the processed notification
 */
public record Tracking(String applicationName, long notificationId) {

    public Tracking {
        Objects.requireNonNull(applicationName, "applicationName");
        if (applicationName.isEmpty()) {
            throw new IllegalArgumentException("applicationName must not be empty");
        }
        if (notificationId <= 0L) {
            throw new IllegalArgumentException("notificationId must be > 0");
        }
    }
}
