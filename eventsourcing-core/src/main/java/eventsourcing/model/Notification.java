package eventsourcing.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * A stored event exposed with its position in the global notification log.
 *
 * <p>Ids are assigned by the backing store. They increase with commit order for
 * committed rows but are not gapless: an id reserved by a transaction that rolled
 * back is never reused. Readers page forward with {@code start = lastId + 1} and
 * must tolerate gaps.
 *
 * @param id                notification id assigned by the store
 * @param originatorId      aggregate identifier
 * @param originatorVersion aggregate version
 * @param topic             type-identifying string for the payload
 * @param state             serialized payload (copied on the way in and out)
 */
public record Notification(long id, UUID originatorId, int originatorVersion, String topic, byte[] state) {

    public Notification {
        Objects.requireNonNull(originatorId, "originatorId");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(state, "state");
        if (id <= 0L) {
            throw new IllegalArgumentException("id must be > 0");
        }
        state = state.clone();
    }

    @Override
    public byte[] state() {
        return state.clone();
    }

    /**
     * Returns the underlying event without its notification id.
     */
    public StoredEvent toStoredEvent() {
        return new StoredEvent(originatorId, originatorVersion, topic, state);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Notification other)) return false;
        return id == other.id
                && originatorVersion == other.originatorVersion
                && originatorId.equals(other.originatorId)
                && topic.equals(other.topic)
                && Arrays.equals(state, other.state);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, originatorId, originatorVersion, topic);
        return 31 * result + Arrays.hashCode(state);
    }

    @Override
    public String toString() {
        return "Notification[id=" + id
                + ", originatorId=" + originatorId
                + ", originatorVersion=" + originatorVersion
                + ", topic=" + topic + "]";
    }
}
