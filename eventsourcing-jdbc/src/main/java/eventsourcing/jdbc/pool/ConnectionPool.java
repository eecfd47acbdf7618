package eventsourcing.jdbc.pool;

import eventsourcing.jdbc.tx.TransactionScope;
import eventsourcing.spi.ConnectionProvider;
import eventsourcing.spi.MetricsExporter;
import eventsourcing.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps one JDBC session per worker key.
 *
 * <p>Sessions are never shared between keys. The default key is the calling thread,
 * so each thread reuses its own session across transactions. A session is replaced
 * when it has been closed, has expired, or (with pre-ping on) fails its liveness
 * probe.
 *
 * <p>When {@code maxAge} is set, each session is closed once it reaches that age. An
 * expiring session waits for its in-flight transaction to finish, up to
 * {@code expiryCloseTimeout}, and the next acquire for its key opens a fresh one.
 *
 * <pre>{@code
 * ConnectionPool pool = ConnectionPool.builder()
 *     .connectionProvider(provider)
 *     .maxAge(Duration.ofMinutes(30))
 *     .prePing(true)
 *     .build();
 *
 * try (TransactionScope tx = pool.transaction()) {
 *     JdbcTemplate.update(tx.connection(), sql, params);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionPool.class.getName());

  private static final Duration SHUTDOWN_CLOSE_TIMEOUT = Duration.ofSeconds(1);

  private final ConnectionProvider connectionProvider;
  private final Duration maxAge;
  private final Duration expiryCloseTimeout;
  private final boolean prePing;
  private final int pingTimeoutSeconds;
  private final MetricsExporter metrics;

  private final Map<Object, PooledConnection> connections = new HashMap<>();
  private final ScheduledThreadPoolExecutor timer;
  private final ExecutorService closer;
  private volatile boolean closed;

  private ConnectionPool(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.maxAge != null && (builder.maxAge.isNegative() || builder.maxAge.isZero())) {
      throw new IllegalArgumentException("maxAge must be > 0");
    }
    if (builder.expiryCloseTimeout != null && builder.expiryCloseTimeout.isNegative()) {
      throw new IllegalArgumentException("expiryCloseTimeout must be >= 0");
    }
    if (builder.pingTimeoutSeconds < 0) {
      throw new IllegalArgumentException("pingTimeoutSeconds must be >= 0");
    }
    this.maxAge = builder.maxAge;
    this.expiryCloseTimeout = builder.expiryCloseTimeout;
    this.prePing = builder.prePing;
    this.pingTimeoutSeconds = builder.pingTimeoutSeconds;

    if (maxAge != null) {
      this.timer = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory("eventsourcing-pool-expiry-"));
      this.timer.setRemoveOnCancelPolicy(true);
      this.closer = Executors.newCachedThreadPool(new DaemonThreadFactory("eventsourcing-pool-closer-"));
    } else {
      this.timer = null;
      this.closer = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the calling thread's session, marked in use.
   *
   * @throws SQLException if a new session cannot be opened
   */
  public PooledConnection acquire() throws SQLException {
    return acquire(currentThreadKey());
  }

  /**
   * Returns the session for {@code key}, marked in use, opening a new one when the key
   * has none or its session is no longer usable.
   *
   * @param key worker handle; sessions are never shared between keys
   * @throws SQLException if a new session cannot be opened
   * @throws IllegalStateException if the pool is closed
   */
  public PooledConnection acquire(Object key) throws SQLException {
    Objects.requireNonNull(key, "key");
    ensureOpen();
    PooledConnection existing;
    synchronized (connections) {
      existing = connections.get(key);
    }
    if (existing != null) {
      if (!existing.isClosed() && existing.tryMarkInUse()) {
        if (!prePing || existing.ping(pingTimeoutSeconds)) {
          logger.log(Level.FINE, "Reusing connection for key {0}", key);
          return existing;
        }
        metrics.incrementPingFailures();
        logger.log(Level.WARNING, "Liveness probe failed for key {0}, opening a new connection", key);
        existing.markIdle();
      }
      discard(key, existing);
    }
    return create(key);
  }

  /**
   * Starts a transaction on the calling thread's session.
   */
  public TransactionScope transaction() throws SQLException {
    return transaction(currentThreadKey());
  }

  /**
   * Starts a transaction on {@code key}'s session.
   */
  public TransactionScope transaction(Object key) throws SQLException {
    return TransactionScope.open(acquire(key));
  }

  /**
   * Closes and forgets the calling thread's session. The next acquire opens a new one.
   */
  public void release() {
    release(currentThreadKey());
  }

  /**
   * Closes and forgets {@code key}'s session without waiting for it to become idle.
   */
  public void release(Object key) {
    PooledConnection removed;
    int size;
    synchronized (connections) {
      removed = connections.remove(key);
      size = connections.size();
    }
    if (removed != null) {
      removed.close(Duration.ZERO);
      logger.log(Level.FINE, "Released connection for key {0}", key);
      metrics.recordPoolSize(size);
    }
  }

  /**
   * Closes every pooled session, waiting up to {@code timeout} for each in-flight
   * transaction before closing it anyway.
   *
   * @param timeout per-session wait; {@code null} waits indefinitely
   */
  public void closeAll(Duration timeout) {
    List<PooledConnection> toClose;
    synchronized (connections) {
      toClose = new ArrayList<>(connections.values());
      connections.clear();
    }
    for (PooledConnection connection : toClose) {
      connection.close(timeout);
    }
    metrics.recordPoolSize(0);
  }

  /** Number of sessions currently held. */
  public int size() {
    synchronized (connections) {
      return connections.size();
    }
  }

  /**
   * Closes all sessions, waiting up to one second for each, and stops the expiry
   * threads. The pool cannot be used afterwards.
   */
  @Override
  public void close() {
    synchronized (connections) {
      if (closed) {
        return;
      }
      closed = true;
    }
    closeAll(SHUTDOWN_CLOSE_TIMEOUT);
    if (timer != null) {
      timer.shutdownNow();
      closer.shutdown();
    }
  }

  public boolean isClosed() {
    return closed;
  }

  private PooledConnection create(Object key) throws SQLException {
    Connection raw = connectionProvider.getConnection();
    try {
      raw.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        raw.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    PooledConnection pooled = new PooledConnection(raw, metrics);
    metrics.incrementConnectionsOpened();
    pooled.tryMarkInUse();

    boolean rejected;
    int size;
    synchronized (connections) {
      rejected = closed;
      if (!rejected) {
        connections.put(key, pooled);
      }
      size = connections.size();
    }
    if (rejected) {
      pooled.markIdle();
      pooled.close(Duration.ZERO);
      throw new IllegalStateException("Connection pool is closed");
    }
    if (maxAge != null) {
      pooled.scheduleExpiry(timer, closer, maxAge, expiryCloseTimeout, () -> onExpired(key, pooled));
    }
    logger.log(Level.FINE, "Opened connection for key {0}", key);
    metrics.recordPoolSize(size);
    return pooled;
  }

  private void discard(Object key, PooledConnection stale) {
    int size;
    synchronized (connections) {
      connections.remove(key, stale);
      size = connections.size();
    }
    stale.close(Duration.ZERO);
    metrics.recordPoolSize(size);
  }

  private void onExpired(Object key, PooledConnection expired) {
    metrics.incrementConnectionsExpired();
    int size;
    synchronized (connections) {
      connections.remove(key, expired);
      size = connections.size();
    }
    logger.log(Level.FINE, "Connection for key {0} reached its maximum age and was closed", key);
    metrics.recordPoolSize(size);
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Connection pool is closed");
    }
  }

  private static Object currentThreadKey() {
    return Thread.currentThread().getId();
  }

  /** Builder for {@link ConnectionPool}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Duration maxAge;
    private Duration expiryCloseTimeout;
    private boolean prePing;
    private int pingTimeoutSeconds = 5;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the source of physical sessions.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the age at which a session is closed and replaced.
     *
     * <p>Optional. Defaults to {@code null}: sessions never expire. Must be &gt; 0.
     *
     * @param maxAge maximum session age
     * @return this builder
     */
    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    /**
     * Sets how long an expiring session waits for its in-flight transaction.
     *
     * <p>Optional. Defaults to {@code null}: wait until the transaction finishes.
     *
     * @param expiryCloseTimeout wait before a forced close
     * @return this builder
     */
    public Builder expiryCloseTimeout(Duration expiryCloseTimeout) {
      this.expiryCloseTimeout = expiryCloseTimeout;
      return this;
    }

    /**
     * Probes each session with {@link Connection#isValid(int)} before reuse.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @param prePing whether to probe before reuse
     * @return this builder
     */
    public Builder prePing(boolean prePing) {
      this.prePing = prePing;
      return this;
    }

    /**
     * Sets the liveness probe timeout.
     *
     * <p>Optional. Defaults to {@code 5}. {@code 0} means no timeout.
     *
     * @param pingTimeoutSeconds probe timeout in seconds
     * @return this builder
     */
    public Builder pingTimeoutSeconds(int pingTimeoutSeconds) {
      this.pingTimeoutSeconds = pingTimeoutSeconds;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ConnectionPool build() {
      return new ConnectionPool(this);
    }
  }
}
