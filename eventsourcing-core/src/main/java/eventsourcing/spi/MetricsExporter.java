package eventsourcing.spi;

/**
 * Observability hook for connection pool and recorder counters.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge
 * into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * A new physical session was opened.
     */
    void incrementConnectionsOpened();

    /**
     * A physical session was closed, for any reason.
     */
    void incrementConnectionsClosed();

    /**
     * A session reached its maximum age and was closed by the expiry timer.
     */
    void incrementConnectionsExpired();

    /**
     * A liveness probe failed and the session was replaced.
     */
    default void incrementPingFailures() {
    }

    /**
     * Events were committed.
     *
     * @param count number of events in the committed batch
     */
    void incrementEventsInserted(int count);

    /**
     * A tracking row was committed.
     */
    default void incrementTrackingInserted() {
    }

    /**
     * An insert was rejected by a uniqueness constraint.
     */
    void incrementConflicts();

    /**
     * A statement failed for a non-conflict reason.
     */
    void incrementOperationalErrors();

    /**
     * Records the number of pooled sessions.
     *
     * @param size current pool size
     */
    void recordPoolSize(int size);

    /**
     * No-op implementation.
     */
    final class Noop implements MetricsExporter {
        private Noop() {
        }

        @Override
        public void incrementConnectionsOpened() {
        }

        @Override
        public void incrementConnectionsClosed() {
        }

        @Override
        public void incrementConnectionsExpired() {
        }

        @Override
        public void incrementEventsInserted(int count) {
        }

        @Override
        public void incrementConflicts() {
        }

        @Override
        public void incrementOperationalErrors() {
        }

        @Override
        public void recordPoolSize(int size) {
        }
    }
}
