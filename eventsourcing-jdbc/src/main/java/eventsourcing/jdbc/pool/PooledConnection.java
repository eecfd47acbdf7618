package eventsourcing.jdbc.pool;

import eventsourcing.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One physical JDBC session owned by a single pool key.
 *
 * <p>The owner marks the connection in use for the length of a transaction and idle
 * afterwards. Closing, whether from the expiry timer, a release or pool shutdown,
 * waits for the idle signal before the session is physically closed.
 */
public final class PooledConnection {
  private static final Logger logger = Logger.getLogger(PooledConnection.class.getName());

  private final Connection connection;
  private final MetricsExporter metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition idle = lock.newCondition();

  private boolean inUse;
  private long lease;
  private boolean closing;
  private boolean closed;
  private ScheduledFuture<?> expiry;

  PooledConnection(Connection connection, MetricsExporter metrics) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * The physical session. Only the key holding this connection in use may run
   * statements on it.
   */
  public Connection connection() {
    return connection;
  }

  public ConnectionState state() {
    lock.lock();
    try {
      if (closed) {
        return ConnectionState.CLOSED;
      }
      if (closing) {
        return ConnectionState.CLOSING;
      }
      return inUse ? ConnectionState.IN_USE : ConnectionState.IDLE;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns {@code true} once closing has begun or the physical session reports
   * itself closed.
   */
  public boolean isClosed() {
    lock.lock();
    try {
      if (closing || closed) {
        return true;
      }
    } finally {
      lock.unlock();
    }
    try {
      return connection.isClosed();
    } catch (SQLException e) {
      logger.log(Level.FINE, "isClosed check failed, treating connection as closed", e);
      return true;
    }
  }

  /**
   * Moves the connection to {@code IN_USE}. Fails when closing has already begun,
   * which is how the owner loses a race against the expiry timer.
   */
  boolean tryMarkInUse() {
    lock.lock();
    try {
      if (closing || closed) {
        return false;
      }
      inUse = true;
      lease++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Identifies the current use of this session. Increases each time the session is
   * marked in use.
   */
  public long lease() {
    lock.lock();
    try {
      return lease;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Signals that the current transaction has finished with the session.
   */
  public void markIdle() {
    lock.lock();
    try {
      inUse = false;
      idle.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Signals idle only if the session has not been marked in use again since
   * {@code expectedLease} was read.
   *
   * @return {@code true} if the session was marked idle
   */
  public boolean markIdle(long expectedLease) {
    lock.lock();
    try {
      if (lease != expectedLease) {
        return false;
      }
      inUse = false;
      idle.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Liveness probe.
   *
   * @return {@code false} if the driver reports the session unusable or the probe fails
   */
  boolean ping(int timeoutSeconds) {
    try {
      return connection.isValid(timeoutSeconds);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Liveness probe raised an error", e);
      return false;
    }
  }

  void scheduleExpiry(ScheduledExecutorService timer, Executor closer, Duration maxAge,
      Duration closeTimeout, Runnable onExpired) {
    Runnable expire = () -> {
      try {
        closer.execute(() -> {
          if (close(closeTimeout)) {
            onExpired.run();
          }
        });
      } catch (RejectedExecutionException e) {
        logger.log(Level.FINE, "Pool is shutting down, closing expired connection inline", e);
        close(Duration.ZERO);
      }
    };
    lock.lock();
    try {
      if (!closing && !closed) {
        expiry = timer.schedule(expire, maxAge.toNanos(), TimeUnit.NANOSECONDS);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Begins closing, waits for the idle signal, then closes the physical session.
   *
   * @param timeout how long to wait for an in-flight transaction; {@code null} waits
   *     indefinitely. When the wait times out the session is closed anyway.
   * @return {@code true} if this call closed the session, {@code false} if it was
   *     already closed
   */
  public boolean close(Duration timeout) {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      closing = true;
      if (expiry != null) {
        expiry.cancel(false);
      }
      boolean wasIdle = awaitIdle(timeout);
      if (closed) {
        // another closer finished while this one waited
        return false;
      }
      if (!wasIdle) {
        logger.log(Level.WARNING,
            "Closing connection still in use after waiting {0}", timeout);
      }
      closed = true;
    } finally {
      lock.unlock();
    }
    closePhysical();
    return true;
  }

  // caller holds the lock
  private boolean awaitIdle(Duration timeout) {
    try {
      if (timeout == null) {
        while (inUse) {
          idle.await();
        }
        return true;
      }
      long remaining = timeout.toNanos();
      while (inUse) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = idle.awaitNanos(remaining);
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return !inUse;
    }
  }

  private void closePhysical() {
    try {
      connection.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close connection", e);
    } finally {
      metrics.incrementConnectionsClosed();
    }
  }

  @Override
  public String toString() {
    return "PooledConnection[" + state() + "]";
  }
}
