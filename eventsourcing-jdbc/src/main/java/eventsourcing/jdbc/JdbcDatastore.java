package eventsourcing.jdbc;

import eventsourcing.InsertResult;
import eventsourcing.OperationalException;
import eventsourcing.RecordConflictException;
import eventsourcing.jdbc.pool.ConnectionPool;
import eventsourcing.jdbc.spi.Dialect;
import eventsourcing.jdbc.tx.TransactionScope;
import eventsourcing.spi.MetricsExporter;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs recorder work in transactions on the calling worker's pooled session and
 * classifies failures.
 *
 * <p>A unique-key violation becomes {@link InsertResult.Conflict}. Any other
 * {@link SQLException} releases the worker's session, so its next call starts on a
 * fresh one, and surfaces as an {@link OperationalException}.
 */
public final class JdbcDatastore implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JdbcDatastore.class.getName());

  private final ConnectionPool pool;
  private final Dialect dialect;
  private final MetricsExporter metrics;

  public JdbcDatastore(ConnectionPool pool, Dialect dialect) {
    this(pool, dialect, MetricsExporter.NOOP);
  }

  public JdbcDatastore(ConnectionPool pool, Dialect dialect, MetricsExporter metrics) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Work run inside a transaction.
   */
  @FunctionalInterface
  public interface SqlWork<T> {
    T apply(TransactionScope tx) throws SQLException;
  }

  /**
   * Runs read-only work and returns its result.
   *
   * @param description what is being read, for error messages
   * @throws OperationalException if the work fails
   */
  public <T> T read(String description, SqlWork<T> work) {
    try {
      return inTransaction(work);
    } catch (SQLException e) {
      throw operationalFailure(description, e);
    }
  }

  /**
   * Runs a write and reports its outcome without throwing.
   *
   * @param description what is being written, for error messages
   */
  public InsertResult write(String description, SqlWork<?> work) {
    try {
      inTransaction(work);
      return InsertResult.ok();
    } catch (SQLException e) {
      if (dialect.isUniqueViolation(e)) {
        metrics.incrementConflicts();
        logger.log(Level.FINE, "Conflict while {0}: {1}", new Object[]{description, e.getMessage()});
        return InsertResult.conflict(new RecordConflictException("Conflict while " + description, e));
      }
      return InsertResult.operational(operationalFailure(description, e));
    }
  }

  /**
   * Runs each statement in one transaction. Used for schema creation.
   *
   * @throws OperationalException if any statement fails
   */
  public void executeStatements(String description, List<String> statements) {
    read(description, tx -> {
      for (String sql : statements) {
        JdbcTemplate.execute(tx.connection(), sql);
      }
      return null;
    });
  }

  /**
   * Updates metrics once {@code tx} has committed. An exporter failure is logged and
   * never turns a committed write into a failed one.
   */
  public void afterCommitMetrics(TransactionScope tx, Consumer<MetricsExporter> update) {
    tx.afterCommit(() -> {
      try {
        update.accept(metrics);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Metrics exporter failed after commit", e);
      }
    });
  }

  public ConnectionPool pool() {
    return pool;
  }

  public Dialect dialect() {
    return dialect;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  /**
   * Closes the pool.
   */
  @Override
  public void close() {
    pool.close();
  }

  private <T> T inTransaction(SqlWork<T> work) throws SQLException {
    try (TransactionScope tx = pool.transaction()) {
      T result = work.apply(tx);
      tx.commit();
      return result;
    }
  }

  private OperationalException operationalFailure(String description, SQLException e) {
    metrics.incrementOperationalErrors();
    logger.log(Level.WARNING, "Failed while " + description + ", discarding connection", e);
    pool.release();
    return new OperationalException("Failed while " + description + ": " + e.getMessage(), e);
  }
}
