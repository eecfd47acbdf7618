package eventsourcing.jdbc.dialect;

import eventsourcing.jdbc.spi.Dialect;
import eventsourcing.model.EventQuery;

import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses supply column types and may override any statement.
 */
public abstract class AbstractDialect implements Dialect {

  /** SQLSTATE for unique_violation, shared by PostgreSQL and H2. */
  protected static final String UNIQUE_VIOLATION = "23505";

  /** Column type for {@code originator_id}. */
  protected abstract String uuidType();

  /** Column type for {@code topic} and {@code application_name}. */
  protected abstract String textType();

  /** Column type for {@code state}. */
  protected abstract String bytesType();

  /** Column definition for the auto-assigned {@code notification_id}. */
  protected abstract String notificationIdColumn();

  @Override
  public List<String> createEventsTableSql(String table) {
    return List.of("CREATE TABLE IF NOT EXISTS " + table + " (" +
        "originator_id " + uuidType() + " NOT NULL, " +
        "originator_version INTEGER NOT NULL, " +
        "topic " + textType() + ", " +
        "state " + bytesType() + ", " +
        "PRIMARY KEY (originator_id, originator_version))");
  }

  @Override
  public List<String> createNotificationEventsTableSql(String table) {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + table + " (" +
            "originator_id " + uuidType() + " NOT NULL, " +
            "originator_version INTEGER NOT NULL, " +
            "topic " + textType() + ", " +
            "state " + bytesType() + ", " +
            "notification_id " + notificationIdColumn() + ", " +
            "PRIMARY KEY (originator_id, originator_version))",
        "CREATE UNIQUE INDEX IF NOT EXISTS " + table + "_notification_id_idx " +
            "ON " + table + " (notification_id ASC)");
  }

  @Override
  public List<String> createTrackingTableSql(String table) {
    return List.of("CREATE TABLE IF NOT EXISTS " + table + " (" +
        "application_name " + textType() + " NOT NULL, " +
        "notification_id BIGINT NOT NULL, " +
        "PRIMARY KEY (application_name, notification_id))");
  }

  @Override
  public String insertEventSql(String table) {
    return "INSERT INTO " + table +
        " (originator_id, originator_version, topic, state) VALUES (?, ?, ?, ?)";
  }

  @Override
  public String selectEventsSql(String table, EventQuery query) {
    StringBuilder sql = new StringBuilder(
        "SELECT originator_id, originator_version, topic, state FROM ")
        .append(table)
        .append(" WHERE originator_id = ?");
    if (query.gt() != null) {
      sql.append(" AND originator_version > ?");
    }
    if (query.lte() != null) {
      sql.append(" AND originator_version <= ?");
    }
    sql.append(" ORDER BY originator_version ").append(query.isDescending() ? "DESC" : "ASC");
    if (query.limit() != null) {
      sql.append(" LIMIT ?");
    }
    return sql.toString();
  }

  @Override
  public String selectNotificationsSql(String table) {
    return "SELECT notification_id, originator_id, originator_version, topic, state " +
        "FROM " + table + " WHERE notification_id >= ? " +
        "ORDER BY notification_id LIMIT ?";
  }

  @Override
  public String maxNotificationIdSql(String table) {
    return "SELECT MAX(notification_id) FROM " + table;
  }

  @Override
  public String insertTrackingSql(String table) {
    return "INSERT INTO " + table + " (application_name, notification_id) VALUES (?, ?)";
  }

  @Override
  public String maxTrackingIdSql(String table) {
    return "SELECT MAX(notification_id) FROM " + table + " WHERE application_name = ?";
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    Set<Throwable> seen = new HashSet<>();
    Throwable current = e;
    while (current != null && seen.add(current)) {
      if (current instanceof SQLException sql) {
        if (UNIQUE_VIOLATION.equals(sql.getSQLState())) {
          return true;
        }
        SQLException next = sql.getNextException();
        if (next != null && isUniqueViolation(next, seen)) {
          return true;
        }
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isUniqueViolation(SQLException e, Set<Throwable> seen) {
    for (SQLException current = e; current != null && seen.add(current); current = current.getNextException()) {
      if (UNIQUE_VIOLATION.equals(current.getSQLState())) {
        return true;
      }
    }
    return false;
  }
}
