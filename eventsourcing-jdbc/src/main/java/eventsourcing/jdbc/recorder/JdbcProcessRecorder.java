package eventsourcing.jdbc.recorder;

import eventsourcing.InsertResult;
import eventsourcing.jdbc.JdbcDatastore;
import eventsourcing.jdbc.JdbcTemplate;
import eventsourcing.jdbc.TableNames;
import eventsourcing.model.EventQuery;
import eventsourcing.model.Notification;
import eventsourcing.model.StoredEvent;
import eventsourcing.model.Tracking;
import eventsourcing.spi.MetricsExporter;
import eventsourcing.spi.ProcessRecorder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JDBC {@link ProcessRecorder}: an application recorder plus a tracking table.
 *
 * <p>The events and the tracking row of one call commit together. Tracking the same
 * {@code (applicationName, notificationId)} twice is a conflict, and nothing from the
 * second call is stored.
 */
public final class JdbcProcessRecorder implements ProcessRecorder {
  private final JdbcDatastore datastore;
  private final JdbcApplicationRecorder application;
  private final String trackingTable;

  public JdbcProcessRecorder(JdbcDatastore datastore, String eventsTable, String trackingTable) {
    this.datastore = Objects.requireNonNull(datastore, "datastore");
    this.application = new JdbcApplicationRecorder(datastore, eventsTable);
    this.trackingTable = TableNames.validate(trackingTable);
  }

  public String table() {
    return application.table();
  }

  public String trackingTable() {
    return trackingTable;
  }

  @Override
  public void createSchema() {
    List<String> statements = new ArrayList<>(application.createTableStatements());
    statements.addAll(datastore.dialect().createTrackingTableSql(trackingTable));
    datastore.executeStatements("creating tables " + table() + ", " + trackingTable, statements);
  }

  /**
   * Inserts the events and, when {@code tracking} is not null, the tracking row in one
   * transaction. An empty batch with a tracking row records only the tracking row.
   */
  @Override
  public InsertResult insertEvents(List<StoredEvent> events, Tracking tracking) {
    List<StoredEvent> batch = List.copyOf(events);
    if (batch.isEmpty() && tracking == null) {
      return InsertResult.ok();
    }
    return datastore.write("inserting events into " + table(), tx -> {
      application.writeEvents(tx, batch);
      if (tracking != null) {
        JdbcTemplate.update(tx.connection(), datastore.dialect().insertTrackingSql(trackingTable),
            tracking.applicationName(), tracking.notificationId());
        datastore.afterCommitMetrics(tx, MetricsExporter::incrementTrackingInserted);
      }
      return null;
    });
  }

  @Override
  public List<StoredEvent> selectEvents(UUID originatorId, EventQuery query) {
    return application.selectEvents(originatorId, query);
  }

  @Override
  public List<Notification> selectNotifications(long start, int limit) {
    return application.selectNotifications(start, limit);
  }

  @Override
  public long maxNotificationId() {
    return application.maxNotificationId();
  }

  /**
   * Returns the highest notification id tracked for {@code applicationName}, or 0.
   */
  @Override
  public long maxTrackingId(String applicationName) {
    Objects.requireNonNull(applicationName, "applicationName");
    String sql = datastore.dialect().maxTrackingIdSql(trackingTable);
    return datastore.read("reading max tracking id from " + trackingTable, tx ->
        JdbcTemplate.queryForLong(tx.connection(), sql, applicationName));
  }

  @Override
  public String toString() {
    return "JdbcProcessRecorder[" + table() + ", " + trackingTable + "]";
  }
}
