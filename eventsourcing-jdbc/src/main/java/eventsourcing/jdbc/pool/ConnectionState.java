package eventsourcing.jdbc.pool;

/**
 * Lifecycle of a {@link PooledConnection}.
 *
 * <p>{@code IDLE <-> IN_USE}, then {@code CLOSING -> CLOSED} once expiry, release or
 * pool shutdown begins. A connection never leaves {@code CLOSED}.
 */
public enum ConnectionState {
  IDLE,
  IN_USE,
  CLOSING,
  CLOSED
}
