package eventsourcing.model;

import java.util.Objects;

/**
 * Version range and ordering for
 * {@link eventsourcing.spi.AggregateRecorder#selectEvents(java.util.UUID, EventQuery)}.
 *
 * <p>Instances are immutable; each method returns a modified copy.
 * <pre>{@code
 * // versions 2 and 3, newest first
 * EventQuery.all().after(1).upTo(3).descending();
 * }</pre>
 */
public final class EventQuery {

    private static final EventQuery ALL = new EventQuery(null, null, false, null);

    private final Integer gt;
    private final Integer lte;
    private final boolean descending;
    private final Integer limit;

    private EventQuery(Integer gt, Integer lte, boolean descending, Integer limit) {
        this.gt = gt;
        this.lte = lte;
        this.descending = descending;
        this.limit = limit;
    }

    /**
     * Returns the unbounded, ascending query.
     */
    public static EventQuery all() {
        return ALL;
    }

    /**
     * Only versions strictly greater than {@code version}.
     */
    public EventQuery after(int version) {
        return new EventQuery(version, lte, descending, limit);
    }

    /**
     * Only versions less than or equal to {@code version}.
     */
    public EventQuery upTo(int version) {
        return new EventQuery(gt, version, descending, limit);
    }

    /**
     * Orders by version, highest first.
     */
    public EventQuery descending() {
        return new EventQuery(gt, lte, true, limit);
    }

    /**
     * Caps the number of returned events.
     *
     * @throws IllegalArgumentException if {@code limit} is not positive
     */
    public EventQuery limit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return new EventQuery(gt, lte, descending, limit);
    }

    /** Exclusive lower bound, or {@code null}. */
    public Integer gt() {
        return gt;
    }

    /** Inclusive upper bound, or {@code null}. */
    public Integer lte() {
        return lte;
    }

    public boolean isDescending() {
        return descending;
    }

    /** Maximum number of rows, or {@code null} for no cap. */
    public Integer limit() {
        return limit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventQuery other)) return false;
        return descending == other.descending
                && Objects.equals(gt, other.gt)
                && Objects.equals(lte, other.lte)
                && Objects.equals(limit, other.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gt, lte, descending, limit);
    }

    @Override
    public String toString() {
        return "EventQuery[gt=" + gt + ", lte=" + lte + ", descending=" + descending + ", limit=" + limit + "]";
    }
}
