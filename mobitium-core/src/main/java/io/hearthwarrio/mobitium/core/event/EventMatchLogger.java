package io.hearthwarrio.mobitium.core.event;

/**
 * Receives event log activity.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
public interface EventMatchLogger {

    /**
     * Called once per newly stored event.
     */
    void eventStored(TelemetryEvent event);

    /**
     * Called when a wait consumed an event.
     *
     * @param pattern    pattern text used for the match, {@code null} when matching by name only
     * @param background whether the wait ran as a background check
     */
    void eventMatched(TelemetryEvent event, String pattern, boolean background);
}
