package io.hearthwarrio.mobitium.core.event;

/**
 * Scope of the "already matched" markers used by {@link EventCorrelator}.
 */
public enum ConsumptionMode {

    /**
     * Markers live in the shared {@link EventLog}: an event matched by any wait is invisible to every other wait in
     * the session, even one with a different pattern.
     */
    GLOBAL,

    /**
     * Each correlator keeps its own markers, so independent correlators may match the same event.
     */
    PER_WAITER
}
