/**
 * Per-worker JDBC sessions with age-based expiry and optional liveness probing.
 */
package eventsourcing.jdbc.pool;
