package eventsourcing.jdbc.tx;

import eventsourcing.jdbc.pool.PooledConnection;
import eventsourcing.util.DaemonThreadFactory;

import java.lang.ref.Cleaner;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One transaction on a pooled session. Use via try-with-resources:
 * <pre>{@code
 * try (TransactionScope tx = pool.transaction()) {
 *     JdbcTemplate.update(tx.connection(), sql, params);
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>If neither {@link #commit()} nor {@link #rollback()} is called, {@link #close()}
 * rolls back. However the scope ends, the session is signalled idle before control
 * returns, so an expiring session can be closed.
 *
 * <p>Not thread-safe; a scope belongs to the worker that opened it.
 */
public final class TransactionScope implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TransactionScope.class.getName());
  private static final Cleaner CLEANER = Cleaner.create(new DaemonThreadFactory("eventsourcing-tx-cleaner-"));

  private final PooledConnection pooled;
  private final ScopeState state;
  private final Cleaner.Cleanable cleanable;
  private final List<Runnable> afterCommit = new ArrayList<>();
  private final List<Runnable> afterRollback = new ArrayList<>();
  private boolean completed;

  private TransactionScope(PooledConnection pooled) {
    this.pooled = pooled;
    this.state = new ScopeState(pooled, pooled.lease());
    this.cleanable = CLEANER.register(this, state);
  }

  /**
   * Opens a scope on a session the caller has already marked in use.
   */
  public static TransactionScope open(PooledConnection pooled) {
    return new TransactionScope(Objects.requireNonNull(pooled, "pooled"));
  }

  /**
   * Returns the session's JDBC connection and marks the scope as used.
   *
   * @throws IllegalStateException if the scope has already committed or rolled back
   */
  public Connection connection() {
    if (completed) {
      throw new IllegalStateException("Transaction already completed");
    }
    state.entered = true;
    return pooled.connection();
  }

  /**
   * Registers a callback to run after a successful commit.
   */
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    afterCommit.add(callback);
  }

  /**
   * Registers a callback to run after a rollback, including the rollback performed
   * when a commit fails.
   */
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    afterRollback.add(callback);
  }

  public boolean isCompleted() {
    return completed;
  }

  /**
   * Commits. A failed commit is rolled back before the exception propagates.
   * No-op once the scope has completed.
   */
  public void commit() throws SQLException {
    if (completed) {
      return;
    }
    Connection connection = pooled.connection();
    boolean committed = false;
    try {
      connection.commit();
      committed = true;
    } catch (SQLException e) {
      try {
        connection.rollback();
      } catch (SQLException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw e;
    } finally {
      finish(committed);
    }
  }

  /**
   * Rolls back. No-op once the scope has completed.
   */
  public void rollback() throws SQLException {
    if (completed) {
      return;
    }
    try {
      pooled.connection().rollback();
    } finally {
      finish(false);
    }
  }

  /**
   * Rolls back unless the scope has already completed.
   */
  @Override
  public void close() throws SQLException {
    if (state.closed) {
      return;
    }
    try {
      if (!completed) {
        rollback();
      }
    } finally {
      if (!state.entered) {
        logger.log(Level.WARNING, "Transaction scope was closed without being used");
      }
      state.closed = true;
      cleanable.clean();
    }
  }

  private void finish(boolean committed) {
    try {
      runCallbacks(committed ? afterCommit : afterRollback);
    } finally {
      completed = true;
      afterCommit.clear();
      afterRollback.clear();
      pooled.markIdle(state.lease);
    }
  }

  private static void runCallbacks(List<Runnable> callbacks) {
    RuntimeException first = null;
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  // Must not reference the scope, or the scope would never become unreachable.
  private static final class ScopeState implements Runnable {
    private final PooledConnection pooled;
    private final long lease;
    private volatile boolean entered;
    private volatile boolean closed;

    private ScopeState(PooledConnection pooled, long lease) {
      this.pooled = pooled;
      this.lease = lease;
    }

    @Override
    public void run() {
      if (closed) {
        return;
      }
      logger.log(Level.WARNING, "Transaction scope was abandoned without being closed");
      pooled.markIdle(lease);
    }
  }
}
