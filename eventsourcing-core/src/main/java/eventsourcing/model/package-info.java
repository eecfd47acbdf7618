/**
 * Immutable values handled by recorders.
 *
 * <p>{@link eventsourcing.model.StoredEvent} and {@link eventsourcing.model.Notification}
 * carry opaque topics and payloads; {@link eventsourcing.model.Tracking} is a consumer
 * checkpoint; {@link eventsourcing.model.EventQuery} selects a version range.
 */
package eventsourcing.model;
