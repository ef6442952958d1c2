package io.hearthwarrio.mobitium.core.event;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * One application-emitted event, numbered by the receiver.
 * <p>
 * Sequence numbers are unique within a test session; the matched/consumed state is kept outside the event, in
 * {@link EventLog}.
 */
public final class TelemetryEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final long sequenceNumber;
    private final String timestamp;
    private final String name;
    private final EventData data;

    public TelemetryEvent(long sequenceNumber, String timestamp, String name, EventData data) {
        this.sequenceNumber = sequenceNumber;
        this.timestamp = timestamp;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.data = data;
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getName() {
        return name;
    }

    /**
     * @return request details, or {@code null} for events without payload
     */
    public EventData getData() {
        return data;
    }

    /**
     * Serialized {@link EventData}, or {@code null} when there is none.
     */
    public String payloadJson() {
        return data == null ? null : MAPPER.valueToTree(data).toString();
    }

    @Override
    public String toString() {
        return "TelemetryEvent{" +
                "#" + sequenceNumber +
                ", name='" + name + '\'' +
                ", time=" + timestamp +
                '}';
    }
}
