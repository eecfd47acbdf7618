package eventsourcing.jdbc;

import eventsourcing.ConfigurationException;
import eventsourcing.jdbc.dialect.Dialects;
import eventsourcing.jdbc.pool.ConnectionPool;
import eventsourcing.jdbc.recorder.JdbcAggregateRecorder;
import eventsourcing.jdbc.recorder.JdbcApplicationRecorder;
import eventsourcing.jdbc.recorder.JdbcProcessRecorder;
import eventsourcing.spi.AggregateRecorder;
import eventsourcing.spi.ApplicationRecorder;
import eventsourcing.spi.MetricsExporter;
import eventsourcing.spi.ProcessRecorder;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds recorders for one application over a shared {@link JdbcDatastore}.
 *
 * <p>Table names derive from the application name: {@code <app>_events} for events
 * and {@code <app>_tracking} for tracking, lower-cased. With an empty application name
 * they are {@code stored_events} and {@code notification_tracking}.
 *
 * <pre>{@code
 * try (JdbcRecorderFactory factory = JdbcRecorderFactory.fromEnvironment("orders", System.getenv())) {
 *     ApplicationRecorder recorder = factory.applicationRecorder();
 *     recorder.insertEvents(events).orElseThrow();
 * }
 * }</pre>
 */
public final class JdbcRecorderFactory implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JdbcRecorderFactory.class.getName());

  public static final String DEFAULT_PURPOSE = "events";

  private final String applicationName;
  private final JdbcDatastore datastore;
  private final boolean createTables;

  /**
   * @param applicationName names the tables; may be empty
   * @param datastore       shared datastore, closed by {@link #close()}
   * @param createTables    whether recorders create their tables on construction
   */
  public JdbcRecorderFactory(String applicationName, JdbcDatastore datastore, boolean createTables) {
    this.applicationName = Objects.requireNonNull(applicationName, "applicationName");
    this.datastore = Objects.requireNonNull(datastore, "datastore");
    this.createTables = createTables;
  }

  /**
   * Reads {@link DatastoreSettings} from {@code env} and connects to PostgreSQL.
   *
   * @throws ConfigurationException if settings are missing or malformed
   */
  public static JdbcRecorderFactory fromEnvironment(String applicationName, Map<String, String> env) {
    return fromSettings(applicationName, DatastoreSettings.fromEnvironment(applicationName, env),
        MetricsExporter.NOOP);
  }

  public static JdbcRecorderFactory fromSettings(String applicationName, DatastoreSettings settings,
      MetricsExporter metrics) {
    Objects.requireNonNull(applicationName, "applicationName");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(metrics, "metrics");
    logger.log(Level.FINE, "Configuring datastore for {0}: {1}",
        new Object[]{applicationName, settings});
    ConnectionPool pool = ConnectionPool.builder()
        .connectionProvider(new DriverManagerConnectionProvider(
            settings.jdbcUrl(), settings.user(), settings.password()))
        .maxAge(settings.connMaxAge())
        .prePing(settings.prePing())
        .metrics(metrics)
        .build();
    JdbcDatastore datastore = new JdbcDatastore(pool, Dialects.forUrl(settings.jdbcUrl()), metrics);
    return new JdbcRecorderFactory(applicationName, datastore, settings.createTable());
  }

  public AggregateRecorder aggregateRecorder() {
    return aggregateRecorder(DEFAULT_PURPOSE);
  }

  /**
   * Returns a recorder over {@code <app>_<purpose>}, for example {@code orders_snapshots}.
   */
  public AggregateRecorder aggregateRecorder(String purpose) {
    JdbcAggregateRecorder recorder = new JdbcAggregateRecorder(datastore, eventsTable(purpose));
    maybeCreateSchema(recorder);
    return recorder;
  }

  public ApplicationRecorder applicationRecorder() {
    JdbcApplicationRecorder recorder = new JdbcApplicationRecorder(datastore, eventsTable(DEFAULT_PURPOSE));
    maybeCreateSchema(recorder);
    return recorder;
  }

  public ProcessRecorder processRecorder() {
    JdbcProcessRecorder recorder = new JdbcProcessRecorder(
        datastore, eventsTable(DEFAULT_PURPOSE), trackingTable());
    maybeCreateSchema(recorder);
    return recorder;
  }

  public String applicationName() {
    return applicationName;
  }

  public JdbcDatastore datastore() {
    return datastore;
  }

  @Override
  public void close() {
    datastore.close();
  }

  private void maybeCreateSchema(AggregateRecorder recorder) {
    if (createTables) {
      recorder.createSchema();
    }
  }

  private String eventsTable(String purpose) {
    try {
      return TableNames.eventsTable(applicationName, purpose);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Application name '" + applicationName
          + "' or purpose '" + purpose + "' does not form a valid table name", e);
    }
  }

  private String trackingTable() {
    try {
      return TableNames.trackingTable(applicationName);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Application name '" + applicationName
          + "' does not form a valid table name", e);
    }
  }
}
