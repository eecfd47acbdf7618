package eventsourcing.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens physical JDBC sessions for the connection pool.
 *
 * <p>Each call must return a new, exclusively owned session. The pool configures
 * auto-commit and closes the session when it is released or expires.
 */
public interface ConnectionProvider {

    /**
     * Opens a new JDBC connection.
     *
     * @return an open connection; ownership passes to the caller
     * @throws SQLException if a connection cannot be opened
     */
    Connection getConnection() throws SQLException;
}
