package io.hearthwarrio.mobitium.core.event;

/**
 * Default stdout logger for telemetry events.
 */
public final class StdOutEventMatchLogger implements EventMatchLogger {

    private final boolean includePayload;

    public StdOutEventMatchLogger() {
        this(true);
    }

    public StdOutEventMatchLogger(boolean includePayload) {
        this.includePayload = includePayload;
    }

    @Override
    public void eventStored(TelemetryEvent event) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("[Mobitium] stored event '").append(event.getName()).append('\'')
                .append(", #").append(event.getSequenceNumber())
                .append(", time=").append(event.getTimestamp());
        if (includePayload && event.getData() != null) {
            sb.append(", body=").append(event.getData().getBody());
        }
        System.out.println(sb);
    }

    @Override
    public void eventMatched(TelemetryEvent event, String pattern, boolean background) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("[Mobitium] expected event '").append(event.getName()).append("' found")
                .append(" (#").append(event.getSequenceNumber());
        if (pattern != null) {
            sb.append(", by data");
        }
        if (background) {
            sb.append(", background");
        }
        sb.append(')');
        System.out.println(sb);
    }
}
