package io.hearthwarrio.mobitium.core.event;

import java.time.Duration;

/**
 * Thrown when no matching telemetry event arrived in time.
 */
public class EventNotFoundException extends RuntimeException {

    private final String eventName;
    private final String pattern;
    private final Duration timeout;

    public EventNotFoundException(String message, String eventName, String pattern, Duration timeout) {
        super(message);
        this.eventName = eventName;
        this.pattern = pattern;
        this.timeout = timeout;
    }

    public String getEventName() {
        return eventName;
    }

    /**
     * @return pattern text, or {@code null} when waiting by name only
     */
    public String getPattern() {
        return pattern;
    }

    /**
     * @return waiting budget, or {@code null} for lookups that do not wait
     */
    public Duration getTimeout() {
        return timeout;
    }
}
