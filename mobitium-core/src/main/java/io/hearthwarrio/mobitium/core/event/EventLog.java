package io.hearthwarrio.mobitium.core.event;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only store of received telemetry events plus the set of consumed sequence numbers.
 * <p>
 * Events are never modified after they are appended, so readers scan snapshots without locking. The only shared
 * mutable decision is "who consumed event N": {@link #markConsumed(long)} is an atomic set insertion and exactly
 * one caller wins per sequence number.
 * <p>
 * Consumption is session-wide: once any wait has matched an event, no other wait sees it again, whatever pattern it
 * uses.
 */
public final class EventLog {

    private final List<TelemetryEvent> events = new CopyOnWriteArrayList<>();
    private final Set<Long> knownNumbers = ConcurrentHashMap.newKeySet();
    private final Set<Long> consumed = ConcurrentHashMap.newKeySet();

    private volatile EventMatchLogger logger;

    public EventLog() {
        this(null);
    }

    public EventLog(EventMatchLogger logger) {
        this.logger = logger;
    }

    public EventMatchLogger getLogger() {
        return logger;
    }

    /**
     * Replaces the logger ({@code null} disables logging).
     */
    public void setLogger(EventMatchLogger logger) {
        this.logger = logger;
    }

    /**
     * Appends events in the given order, skipping sequence numbers that are already stored.
     *
     * @return number of events actually appended
     */
    public synchronized int addEvents(Collection<TelemetryEvent> newEvents) {
        int added = 0;
        for (TelemetryEvent event : newEvents) {
            if (knownNumbers.add(event.getSequenceNumber())) {
                events.add(event);
                added++;
                EventMatchLogger l = logger;
                if (l != null) {
                    l.eventStored(event);
                }
            }
        }
        return added;
    }

    /**
     * Claims an event.
     *
     * @return {@code true} if this call consumed it, {@code false} if it was already consumed
     */
    public boolean markConsumed(long sequenceNumber) {
        return consumed.add(sequenceNumber);
    }

    public boolean isConsumed(long sequenceNumber) {
        return consumed.contains(sequenceNumber);
    }

    /**
     * Snapshot of every stored event in arrival order, consumed ones included.
     */
    public List<TelemetryEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    /**
     * Events stored at or after {@code index}, consumed ones included.
     *
     * @return matching events, empty when the index is outside the log
     */
    public List<TelemetryEvent> eventsFrom(int index) {
        List<TelemetryEvent> snapshot = new ArrayList<>(events);
        if (index < 0 || index >= snapshot.size()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(snapshot.subList(index, snapshot.size())));
    }

    public int size() {
        return events.size();
    }

    public Optional<TelemetryEvent> lastEvent() {
        List<TelemetryEvent> snapshot = new ArrayList<>(events);
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }

    /**
     * Drops all events and consumed markers. Meant for the start of a test case.
     */
    public synchronized void clear() {
        events.clear();
        knownNumbers.clear();
        consumed.clear();
    }
}
