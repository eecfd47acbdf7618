package eventsourcing;

/**
 * Required settings are missing or a setting has a malformed value.
 */
public class ConfigurationException extends PersistenceException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
