package io.hearthwarrio.mobitium.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import io.hearthwarrio.mobitium.core.MobitiumDefaults;
import io.hearthwarrio.mobitium.core.Polling;
import io.hearthwarrio.mobitium.core.json.JsonSubsetMatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Waits for telemetry events in an {@link EventLog} and claims them.
 * <p>
 * A wait polls the log until the first unconsumed event with the expected name whose payload contains the pattern
 * shows up. Claiming goes through an atomic "mark consumed" call, so every event satisfies at most one wait even when
 * foreground and background waits race for it.
 * <p>
 * Patterns are JSON objects (or paths to files holding one). Each top-level pattern property must occur somewhere in
 * the event's {@code event.data}; see {@link JsonSubsetMatcher#containsEventData(String, String)}.
 * <p>
 * Background waits only look at events that arrive after they were registered and report failures through
 * {@link #awaitAllBackgroundChecks()}, which must be called before the session is torn down.
 */
public final class EventCorrelator implements AutoCloseable {

    private final EventLog log;
    private final Polling polling;
    private final ConsumptionMode consumptionMode;
    private final Duration pollInterval;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    private final Set<Long> ownConsumed = ConcurrentHashMap.newKeySet();
    private final Queue<CompletableFuture<TelemetryEvent>> backgroundChecks = new ConcurrentLinkedQueue<>();

    public EventCorrelator(EventLog log) {
        this(log, Polling.system(), ConsumptionMode.GLOBAL);
    }

    public EventCorrelator(EventLog log, Polling polling, ConsumptionMode consumptionMode) {
        this(log, polling, consumptionMode, MobitiumDefaults.EVENT_POLL_INTERVAL, null);
    }

    /**
     * @param executor runs background waits; {@code null} creates a daemon thread pool owned by this correlator
     */
    public EventCorrelator(EventLog log, Polling polling, ConsumptionMode consumptionMode, Duration pollInterval,
                           Executor executor) {
        this.log = Objects.requireNonNull(log, "log must not be null");
        this.polling = Objects.requireNonNull(polling, "polling must not be null");
        this.consumptionMode = Objects.requireNonNull(consumptionMode, "consumptionMode must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (executor == null) {
            this.ownedExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "mobitium-event-check");
                t.setDaemon(true);
                return t;
            });
            this.executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.executor = executor;
        }
    }

    public EventLog getLog() {
        return log;
    }

    public ConsumptionMode getConsumptionMode() {
        return consumptionMode;
    }

    /**
     * Waits for an event over the whole log.
     *
     * @param name          expected event name
     * @param patternOrPath JSON object pattern, a path to a file with one, or {@code null} to match by name only
     * @param timeout       waiting budget; at least one scan always happens
     * @return the consumed event
     * @throws EventNotFoundException if nothing matched in time
     * @throws io.hearthwarrio.mobitium.core.MisconfigurationException if the pattern is not a JSON object
     */
    public TelemetryEvent awaitEvent(String name, String patternOrPath, Duration timeout) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        String pattern = resolvePattern(patternOrPath);
        return await(name, pattern, timeout, 0, false);
    }

    /**
     * Starts a wait on a background thread that only considers events appended after this call.
     * <p>
     * The returned future is also tracked for {@link #awaitAllBackgroundChecks()}.
     */
    public CompletableFuture<TelemetryEvent> awaitEventInBackground(String name, String patternOrPath,
                                                                    Duration timeout) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        String pattern = resolvePattern(patternOrPath);
        int origin = log.size();

        CompletableFuture<TelemetryEvent> future =
                CompletableFuture.supplyAsync(() -> await(name, pattern, timeout, origin, true), executor);
        backgroundChecks.add(future);
        return future;
    }

    /**
     * Waits for every background check registered so far and forgets them.
     * <p>
     * All checks are awaited even if one fails; the first failure is rethrown with the others attached as suppressed.
     */
    public void awaitAllBackgroundChecks() {
        List<CompletableFuture<TelemetryEvent>> toWait = new ArrayList<>();
        CompletableFuture<TelemetryEvent> next;
        while ((next = backgroundChecks.poll()) != null) {
            toWait.add(next);
        }

        RuntimeException first = null;
        for (CompletableFuture<TelemetryEvent> future : toWait) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while awaiting background event checks", e);
            } catch (ExecutionException e) {
                RuntimeException failure = unwrap(e.getCause());
                if (first == null) {
                    first = failure;
                } else {
                    first.addSuppressed(failure);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Number of background checks not yet collected by {@link #awaitAllBackgroundChecks()}.
     */
    public int pendingBackgroundChecks() {
        return backgroundChecks.size();
    }

    /**
     * All stored events (consumed or not) with the given name whose payload contains the pattern, in log order.
     */
    public List<TelemetryEvent> findMatchingEvents(String name, String patternOrPath) {
        Objects.requireNonNull(name, "name must not be null");
        String pattern = resolvePattern(patternOrPath);
        List<TelemetryEvent> out = new ArrayList<>();
        for (TelemetryEvent event : log.events()) {
            if (matches(event, name, pattern)) {
                out.add(event);
            }
        }
        return out;
    }

    /**
     * Picks the first or last stored event matching the pattern and returns the {@code name} of the first entry of
     * its {@code event.data.items} that contains every pattern property.
     * <p>
     * Does not wait and does not consume anything.
     *
     * @throws EventNotFoundException         if no stored event matches
     * @throws EventPayloadMismatchException if the event has no items array, no matching item, or the item has no
     *                                        string name
     */
    public String findItemName(String name, String patternOrPath, EventPosition position) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(position, "position must not be null");
        String pattern = resolvePattern(patternOrPath);
        JsonNode patternNode = pattern == null ? null : EventPatterns.parseObject(pattern);

        List<TelemetryEvent> matching = new ArrayList<>();
        for (TelemetryEvent event : log.events()) {
            if (event.getData() != null && matches(event, name, pattern)) {
                matching.add(event);
            }
        }
        if (matching.isEmpty()) {
            throw new EventNotFoundException(
                    "Event '" + name + "' with filter '" + pattern + "' not found (position=" + position + ")",
                    name, pattern, null);
        }
        TelemetryEvent picked = position == EventPosition.LAST ? matching.get(matching.size() - 1) : matching.get(0);

        JsonNode data = JsonSubsetMatcher.extractEventData(picked.payloadJson());
        JsonNode items = data == null ? null : data.get("items");
        if (items == null || !items.isArray()) {
            throw new EventPayloadMismatchException(
                    "Event '" + name + "' #" + picked.getSequenceNumber() + " has no event.data.items array",
                    EventPayloadMismatchException.Reason.NO_ITEMS_ARRAY, picked.getSequenceNumber());
        }

        JsonNode matchedItem = null;
        for (JsonNode item : items) {
            if (patternNode == null || JsonSubsetMatcher.containsAll(item, patternNode)) {
                matchedItem = item;
                break;
            }
        }
        if (matchedItem == null) {
            throw new EventPayloadMismatchException(
                    "No item of event '" + name + "' #" + picked.getSequenceNumber() + " matches " + pattern,
                    EventPayloadMismatchException.Reason.NO_MATCHING_ITEM, picked.getSequenceNumber());
        }

        JsonNode itemName = matchedItem.get("name");
        if (itemName == null || !itemName.isTextual() || itemName.textValue().isEmpty()) {
            throw new EventPayloadMismatchException(
                    "Matched item of event '" + name + "' #" + picked.getSequenceNumber()
                            + " has no string 'name' field",
                    EventPayloadMismatchException.Reason.ITEM_WITHOUT_NAME, picked.getSequenceNumber());
        }
        return itemName.textValue();
    }

    /**
     * Shuts down the owned background executor, if any. Pending checks are not awaited.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private TelemetryEvent await(String name, String pattern, Duration timeout, int origin, boolean background) {
        AtomicInteger scanned = new AtomicInteger();

        Optional<TelemetryEvent> found = polling.until(timeout, pollInterval, () -> {
            List<TelemetryEvent> candidates = log.eventsFrom(origin);
            scanned.set(candidates.size());
            for (TelemetryEvent event : candidates) {
                if (isConsumed(event.getSequenceNumber()) || !matches(event, name, pattern)) {
                    continue;
                }
                if (claim(event.getSequenceNumber())) {
                    EventMatchLogger logger = log.getLogger();
                    if (logger != null) {
                        logger.eventMatched(event, pattern, background);
                    }
                    return Optional.of(event);
                }
            }
            return Optional.empty();
        });

        return found.orElseThrow(() -> new EventNotFoundException(
                describeMissing(name, pattern, timeout, scanned.get(), background), name, pattern, timeout));
    }

    private boolean matches(TelemetryEvent event, String name, String pattern) {
        if (!event.getName().equals(name)) {
            return false;
        }
        if (pattern == null) {
            return true;
        }
        String payload = event.payloadJson();
        return payload != null && JsonSubsetMatcher.containsEventData(payload, pattern);
    }

    private boolean isConsumed(long sequenceNumber) {
        return consumptionMode == ConsumptionMode.GLOBAL
                ? log.isConsumed(sequenceNumber)
                : ownConsumed.contains(sequenceNumber);
    }

    private boolean claim(long sequenceNumber) {
        return consumptionMode == ConsumptionMode.GLOBAL
                ? log.markConsumed(sequenceNumber)
                : ownConsumed.add(sequenceNumber);
    }

    private static String resolvePattern(String patternOrPath) {
        String pattern = EventPatterns.resolve(patternOrPath);
        if (pattern != null) {
            EventPatterns.parseObject(pattern);
        }
        return pattern;
    }

    private static String describeMissing(String name, String pattern, Duration timeout, int scanned,
                                          boolean background) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("Expected event '").append(name).append('\'');
        if (pattern != null) {
            sb.append(" with data '").append(pattern).append('\'');
        }
        sb.append(" was not found within ").append(timeout.toMillis()).append(" ms")
                .append(" (events scanned: ").append(scanned);
        if (background) {
            sb.append(", background");
        }
        sb.append(')');
        return sb.toString();
    }

    private static RuntimeException unwrap(Throwable t) {
        Throwable cause = t;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Background event check failed", cause);
    }
}
