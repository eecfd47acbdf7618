package eventsourcing.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable event record as held by a recorder.
 *
 * <p>{@code topic} and {@code state} are opaque to the store: the topic names the
 * decodable event type and the state is the serialized payload. The pair
 * {@code (originatorId, originatorVersion)} is unique across a store, which is the
 * only concurrency control applied to writers.
 *
 * @param originatorId      aggregate identifier
 * @param originatorVersion aggregate version, positive and caller-assigned
 * @param topic             type-identifying string for the payload
 * @param state             serialized payload (copied on the way in and out)
 */
public record StoredEvent(UUID originatorId, int originatorVersion, String topic, byte[] state) {

    public StoredEvent {
        Objects.requireNonNull(originatorId, "originatorId");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(state, "state");
        if (originatorVersion <= 0) {
            throw new IllegalArgumentException("originatorVersion must be > 0");
        }
        state = state.clone();
    }

    @Override
    public byte[] state() {
        return state.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredEvent other)) return false;
        return originatorVersion == other.originatorVersion
                && originatorId.equals(other.originatorId)
                && topic.equals(other.topic)
                && Arrays.equals(state, other.state);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(originatorId, originatorVersion, topic);
        return 31 * result + Arrays.hashCode(state);
    }

    @Override
    public String toString() {
        return "StoredEvent[originatorId=" + originatorId
                + ", originatorVersion=" + originatorVersion
                + ", topic=" + topic
                + ", state=" + state.length + " bytes]";
    }
}
