/**
 * JDBC recorders for PostgreSQL and H2.
 *
 * <p>{@link eventsourcing.jdbc.JdbcRecorderFactory} is the entry point. Recorders share a
 * {@link eventsourcing.jdbc.JdbcDatastore}, which runs each call in a transaction on the
 * calling thread's session from {@link eventsourcing.jdbc.pool.ConnectionPool}.
 */
package eventsourcing.jdbc;
