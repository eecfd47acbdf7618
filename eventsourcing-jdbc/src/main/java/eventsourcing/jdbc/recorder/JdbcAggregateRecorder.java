package eventsourcing.jdbc.recorder;

import eventsourcing.InsertResult;
import eventsourcing.jdbc.JdbcDatastore;
import eventsourcing.jdbc.JdbcTemplate;
import eventsourcing.jdbc.TableNames;
import eventsourcing.jdbc.tx.TransactionScope;
import eventsourcing.model.EventQuery;
import eventsourcing.model.StoredEvent;
import eventsourcing.spi.AggregateRecorder;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JDBC {@link AggregateRecorder} over a single events table.
 *
 * <p>A batch is written with one JDBC batch statement in one transaction, so either
 * every event is stored or none is. The primary key on
 * {@code (originator_id, originator_version)} rejects a batch that reuses a stored
 * version, which is reported as {@link InsertResult.Conflict}.
 */
public final class JdbcAggregateRecorder implements AggregateRecorder {
  private final JdbcDatastore datastore;
  private final String table;
  private final boolean notificationLog;

  public JdbcAggregateRecorder(JdbcDatastore datastore, String table) {
    this(datastore, table, false);
  }

  JdbcAggregateRecorder(JdbcDatastore datastore, String table, boolean notificationLog) {
    this.datastore = Objects.requireNonNull(datastore, "datastore");
    this.table = TableNames.validate(table);
    this.notificationLog = notificationLog;
  }

  public String table() {
    return table;
  }

  @Override
  public void createSchema() {
    datastore.executeStatements("creating table " + table, createTableStatements());
  }

  List<String> createTableStatements() {
    return notificationLog
        ? datastore.dialect().createNotificationEventsTableSql(table)
        : datastore.dialect().createEventsTableSql(table);
  }

  @Override
  public InsertResult insertEvents(List<StoredEvent> events) {
    List<StoredEvent> batch = List.copyOf(events);
    if (batch.isEmpty()) {
      return InsertResult.ok();
    }
    return datastore.write("inserting events into " + table, tx -> {
      insertEvents(tx, batch);
      return null;
    });
  }

  void insertEvents(TransactionScope tx, List<StoredEvent> events) throws SQLException {
    if (events.isEmpty()) {
      return;
    }
    List<Object[]> rows = new ArrayList<>(events.size());
    for (StoredEvent event : events) {
      rows.add(new Object[]{
          event.originatorId(), event.originatorVersion(), event.topic(), event.state()});
    }
    JdbcTemplate.batch(tx.connection(), datastore.dialect().insertEventSql(table), rows);
    int count = events.size();
    datastore.afterCommitMetrics(tx, m -> m.incrementEventsInserted(count));
  }

  @Override
  public List<StoredEvent> selectEvents(UUID originatorId, EventQuery query) {
    Objects.requireNonNull(originatorId, "originatorId");
    Objects.requireNonNull(query, "query");
    List<Object> params = new ArrayList<>(4);
    params.add(originatorId);
    if (query.gt() != null) {
      params.add(query.gt());
    }
    if (query.lte() != null) {
      params.add(query.lte());
    }
    if (query.limit() != null) {
      params.add(query.limit());
    }
    String sql = datastore.dialect().selectEventsSql(table, query);
    return datastore.read("selecting events from " + table, tx ->
        JdbcTemplate.query(tx.connection(), sql, rs -> new StoredEvent(
            rs.getObject(1, UUID.class),
            rs.getInt(2),
            rs.getString(3),
            rs.getBytes(4)), params.toArray()));
  }

  @Override
  public String toString() {
    return "JdbcAggregateRecorder[" + table + "]";
  }
}
