package eventsourcing;

/**
 * Base type for failures raised by recorders and their infrastructure.
 *
 * @see RecordConflictException
 * @see OperationalException
 * @see ConfigurationException
 */
public abstract class PersistenceException extends RuntimeException {

    protected PersistenceException(String message) {
        super(message);
    }

    protected PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
