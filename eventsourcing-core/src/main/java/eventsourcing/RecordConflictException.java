package eventsourcing;

/**
 * A write violated the uniqueness of {@code (originator_id, originator_version)} or of a
 * consumer's {@code (application_name, notification_id)} tracking row.
 *
 * <p>Expected under concurrent writers. The caller recovers by reading current state
 * again and retrying its command, not by repeating the same write.
 */
public class RecordConflictException extends PersistenceException {

    public RecordConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
