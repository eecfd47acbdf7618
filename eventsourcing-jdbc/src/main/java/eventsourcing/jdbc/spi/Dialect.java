package eventsourcing.jdbc.spi;

import eventsourcing.model.EventQuery;

import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific DDL and SQL for the recorders, and
 * classify driver errors. Register custom dialects via
 * {@code META-INF/services/eventsourcing.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, H2.
 *
 * @see eventsourcing.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Idempotent DDL for an aggregate events table keyed by
   * {@code (originator_id, originator_version)}.
   */
  List<String> createEventsTableSql(String table);

  /**
   * Idempotent DDL for an events table that also carries an auto-assigned
   * {@code notification_id} with a unique index.
   */
  List<String> createNotificationEventsTableSql(String table);

  /**
   * Idempotent DDL for a tracking table keyed by
   * {@code (application_name, notification_id)}.
   */
  List<String> createTrackingTableSql(String table);

  /**
   * Statements run before inserting into a notification events table, in the same
   * transaction, so that concurrent writers commit their notification ids in the order
   * the ids were assigned. Empty when the database needs none.
   */
  default List<String> lockEventsTableSql(String table) {
    return List.of();
  }

  /**
   * SQL for inserting one event.
   *
   * <p>Parameters: originator_id (UUID), originator_version (int), topic (String),
   * state (byte[])
   */
  String insertEventSql(String table);

  /**
   * SQL for selecting an aggregate's events.
   *
   * <p>Parameters, in order: originator_id, then {@code gt}, {@code lte} and
   * {@code limit} for those set on the query.
   *
   * <p>Returns columns: originator_id, originator_version, topic, state
   */
  String selectEventsSql(String table, EventQuery query);

  /**
   * SQL for a page of notifications.
   *
   * <p>Parameters: start (long), limit (int)
   *
   * <p>Returns columns: notification_id, originator_id, originator_version, topic, state
   */
  String selectNotificationsSql(String table);

  /**
   * SQL returning the highest notification id as a single value (NULL when empty).
   */
  String maxNotificationIdSql(String table);

  /**
   * SQL for inserting a tracking row.
   *
   * <p>Parameters: application_name (String), notification_id (long)
   */
  String insertTrackingSql(String table);

  /**
   * SQL returning the highest tracked id for one application (NULL when none).
   *
   * <p>Parameters: application_name (String)
   */
  String maxTrackingIdSql(String table);

  /**
   * Returns {@code true} if the exception, or any exception chained to it, reports
   * a unique-key violation.
   */
  boolean isUniqueViolation(SQLException e);
}
