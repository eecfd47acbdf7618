package eventsourcing;

/**
 * Any storage failure other than a record conflict: lost connectivity, malformed
 * statements, other constraint violations, failure to open a session.
 *
 * <p>Recorders do not retry. The session that raised it has already been discarded,
 * so the next call from the same worker starts on a fresh one.
 */
public class OperationalException extends PersistenceException {

    public OperationalException(String message, Throwable cause) {
        super(message, cause);
    }
}
