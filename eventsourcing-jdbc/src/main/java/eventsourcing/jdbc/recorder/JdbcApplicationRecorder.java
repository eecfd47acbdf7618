package eventsourcing.jdbc.recorder;

import eventsourcing.InsertResult;
import eventsourcing.jdbc.JdbcDatastore;
import eventsourcing.jdbc.JdbcTemplate;
import eventsourcing.jdbc.tx.TransactionScope;
import eventsourcing.model.EventQuery;
import eventsourcing.model.Notification;
import eventsourcing.model.StoredEvent;
import eventsourcing.spi.ApplicationRecorder;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JDBC {@link ApplicationRecorder}: an events table that also assigns each row a
 * {@code notification_id}, readable in order as the application's notification log.
 *
 * <p>Where the dialect provides one, a table lock is taken before inserting so that
 * ids become visible in the order they were assigned. Ids left behind by rolled back
 * inserts are never reused, so readers must tolerate gaps.
 */
public final class JdbcApplicationRecorder implements ApplicationRecorder {
  private final JdbcDatastore datastore;
  private final JdbcAggregateRecorder events;

  public JdbcApplicationRecorder(JdbcDatastore datastore, String table) {
    this.datastore = Objects.requireNonNull(datastore, "datastore");
    this.events = new JdbcAggregateRecorder(datastore, table, true);
  }

  public String table() {
    return events.table();
  }

  @Override
  public void createSchema() {
    events.createSchema();
  }

  List<String> createTableStatements() {
    return events.createTableStatements();
  }

  @Override
  public InsertResult insertEvents(List<StoredEvent> events) {
    List<StoredEvent> batch = List.copyOf(events);
    if (batch.isEmpty()) {
      return InsertResult.ok();
    }
    return datastore.write("inserting events into " + table(), tx -> {
      writeEvents(tx, batch);
      return null;
    });
  }

  void writeEvents(TransactionScope tx, List<StoredEvent> batch) throws SQLException {
    if (batch.isEmpty()) {
      return;
    }
    for (String lock : datastore.dialect().lockEventsTableSql(table())) {
      JdbcTemplate.execute(tx.connection(), lock);
    }
    events.insertEvents(tx, batch);
  }

  @Override
  public List<StoredEvent> selectEvents(UUID originatorId, EventQuery query) {
    return events.selectEvents(originatorId, query);
  }

  /**
   * Returns up to {@code limit} notifications with {@code id >= start}, in id order.
   *
   * @throws IllegalArgumentException if {@code limit} is not positive
   */
  @Override
  public List<Notification> selectNotifications(long start, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String sql = datastore.dialect().selectNotificationsSql(table());
    return datastore.read("selecting notifications from " + table(), tx ->
        JdbcTemplate.query(tx.connection(), sql, rs -> new Notification(
            rs.getLong(1),
            rs.getObject(2, UUID.class),
            rs.getInt(3),
            rs.getString(4),
            rs.getBytes(5)), start, limit));
  }

  @Override
  public long maxNotificationId() {
    String sql = datastore.dialect().maxNotificationIdSql(table());
    return datastore.read("reading max notification id from " + table(), tx ->
        JdbcTemplate.queryForLong(tx.connection(), sql));
  }

  @Override
  public String toString() {
    return "JdbcApplicationRecorder[" + table() + "]";
  }
}
