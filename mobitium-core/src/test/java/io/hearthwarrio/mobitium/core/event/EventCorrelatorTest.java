package io.hearthwarrio.mobitium.core.event;

import io.hearthwarrio.mobitium.core.ManualClock;
import io.hearthwarrio.mobitium.core.MisconfigurationException;
import io.hearthwarrio.mobitium.core.MobitiumDefaults;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class EventCorrelatorTest {

    private static final String CART = "{\"items\":[{\"sku\":\"A1\",\"name\":\"Red shoes\"},"
            + "{\"sku\":\"B2\",\"name\":\"Blue hat\"}]}";

    private final ManualClock clock = new ManualClock();
    private final List<Runnable> deferred = new ArrayList<>();
    private final EventLog log = new EventLog();

    private EventCorrelator correlator(ConsumptionMode mode) {
        return new EventCorrelator(log, clock.polling(), mode, MobitiumDefaults.EVENT_POLL_INTERVAL, deferred::add);
    }

    @Test
    void matchesByNameWhenNoPatternGiven() {
        log.addEvents(Arrays.asList(TestEvents.bare(1, "open"), TestEvents.bare(2, "view")));

        TelemetryEvent event = correlator(ConsumptionMode.GLOBAL).awaitEvent("view", null, Duration.ofSeconds(1));

        assertEquals(2, event.getSequenceNumber());
        assertTrue(log.isConsumed(2));
    }

    @Test
    void matchesByEventData() {
        log.addEvents(Arrays.asList(
                TestEvents.event(1, "cart", "{\"items\":[{\"sku\":\"C3\"}]}"),
                TestEvents.event(2, "cart", CART)));

        TelemetryEvent event = correlator(ConsumptionMode.GLOBAL)
                .awaitEvent("cart", "{\"sku\":\"B2\"}", Duration.ofSeconds(1));

        assertEquals(2, event.getSequenceNumber());
    }

    @Test
    void eachEventSatisfiesAtMostOneWait() {
        log.addEvents(List.of(TestEvents.event(1, "cart", CART)));
        EventCorrelator correlator = correlator(ConsumptionMode.GLOBAL);

        correlator.awaitEvent("cart", "{\"sku\":\"A1\"}", Duration.ofSeconds(1));
        EventNotFoundException ex = assertThrows(EventNotFoundException.class,
                () -> correlator.awaitEvent("cart", "{\"sku\":\"B2\"}", Duration.ofSeconds(2)));

        assertEquals("cart", ex.getEventName());
        assertTrue(ex.getMessage().contains("events scanned: 1"), ex.getMessage());
    }

    @Test
    void globalConsumptionIsSharedAcrossCorrelators() {
        log.addEvents(List.of(TestEvents.bare(1, "open")));

        correlator(ConsumptionMode.GLOBAL).awaitEvent("open", null, Duration.ZERO);

        assertThrows(EventNotFoundException.class,
                () -> correlator(ConsumptionMode.GLOBAL).awaitEvent("open", null, Duration.ZERO));
    }

    @Test
    void perWaiterConsumptionIsPrivate() {
        log.addEvents(List.of(TestEvents.bare(1, "open")));
        EventCorrelator first = correlator(ConsumptionMode.PER_WAITER);

        first.awaitEvent("open", null, Duration.ZERO);

        assertEquals(1, correlator(ConsumptionMode.PER_WAITER).awaitEvent("open", null, Duration.ZERO)
                .getSequenceNumber());
        assertThrows(EventNotFoundException.class, () -> first.awaitEvent("open", null, Duration.ZERO));
        assertFalse(log.isConsumed(1));
    }

    @Test
    void timeoutMessageNamesEventPatternAndBudget() {
        EventNotFoundException ex = assertThrows(EventNotFoundException.class,
                () -> correlator(ConsumptionMode.GLOBAL).awaitEvent("pay", "{\"sum\":1}", Duration.ofSeconds(3)));

        assertTrue(ex.getMessage().contains("'pay'"));
        assertTrue(ex.getMessage().contains("{\"sum\":1}"));
        assertTrue(ex.getMessage().contains("3000 ms"));
        assertEquals(Duration.ofSeconds(3), ex.getTimeout());
    }

    @Test
    void patternMayBeReadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pattern.json");
        Files.write(file, "{\"sku\":\"A1\"}".getBytes(StandardCharsets.UTF_8));
        log.addEvents(List.of(TestEvents.event(1, "cart", CART)));

        TelemetryEvent event = correlator(ConsumptionMode.GLOBAL)
                .awaitEvent("cart", file.toString(), Duration.ZERO);

        assertEquals(1, event.getSequenceNumber());
    }

    @Test
    void invalidPatternFailsFast() {
        assertThrows(MisconfigurationException.class,
                () -> correlator(ConsumptionMode.GLOBAL).awaitEvent("cart", "{sku:", Duration.ofSeconds(5)));
        assertThrows(MisconfigurationException.class,
                () -> correlator(ConsumptionMode.GLOBAL).awaitEvent("cart", "[1,2]", Duration.ofSeconds(5)));
    }

    @Test
    void backgroundWaitIgnoresEventsThatAlreadyArrived() {
        log.addEvents(List.of(TestEvents.bare(1, "open")));
        EventCorrelator correlator = correlator(ConsumptionMode.GLOBAL);

        CompletableFuture<TelemetryEvent> check = correlator.awaitEventInBackground("open", null, Duration.ZERO);
        log.addEvents(List.of(TestEvents.bare(2, "open")));
        deferred.forEach(Runnable::run);

        assertEquals(2, check.join().getSequenceNumber());
        assertFalse(log.isConsumed(1));
        assertDoesNotThrow(correlator::awaitAllBackgroundChecks);
        assertEquals(0, correlator.pendingBackgroundChecks());
    }

    @Test
    void backgroundFailuresSurfaceWhenAwaited() {
        EventCorrelator correlator = correlator(ConsumptionMode.GLOBAL);
        correlator.awaitEventInBackground("first", null, Duration.ZERO);
        correlator.awaitEventInBackground("second", null, Duration.ZERO);
        deferred.forEach(Runnable::run);

        EventNotFoundException ex = assertThrows(EventNotFoundException.class, correlator::awaitAllBackgroundChecks);

        assertEquals("first", ex.getEventName());
        assertEquals(1, ex.getSuppressed().length);
        assertDoesNotThrow(correlator::awaitAllBackgroundChecks);
    }

    @Test
    void foregroundAndBackgroundCompeteForOneEvent() {
        EventCorrelator correlator = correlator(ConsumptionMode.GLOBAL);
        CompletableFuture<TelemetryEvent> check = correlator.awaitEventInBackground("open", null, Duration.ZERO);
        log.addEvents(List.of(TestEvents.bare(1, "open")));

        correlator.awaitEvent("open", null, Duration.ZERO);
        deferred.forEach(Runnable::run);

        assertThrows(EventNotFoundException.class, correlator::awaitAllBackgroundChecks);
        assertTrue(check.isCompletedExceptionally());
    }

    @Test
    void findItemNamePicksFirstOrLastEvent() {
        log.addEvents(Arrays.asList(
                TestEvents.event(1, "cart", "{\"items\":[{\"sku\":\"A1\",\"name\":\"Old shoes\"}]}"),
                TestEvents.event(2, "cart", "{\"items\":[{\"sku\":\"A1\",\"name\":\"New shoes\"}]}")));
        EventCorrelator correlator = correlator(ConsumptionMode.GLOBAL);

        assertEquals("Old shoes", correlator.findItemName("cart", "{\"sku\":\"A1\"}", EventPosition.FIRST));
        assertEquals("New shoes", correlator.findItemName("cart", "{\"sku\":\"A1\"}", EventPosition.LAST));
    }

    @Test
    void findItemNameReturnsFirstMatchingItem() {
        log.addEvents(List.of(TestEvents.event(1, "cart", CART)));

        assertEquals("Blue hat",
                correlator(ConsumptionMode.GLOBAL).findItemName("cart", "{\"sku\":\"B2\"}", EventPosition.FIRST));
    }

    @Test
    void findItemNameReportsEachFailureDistinctly() {
        log.addEvents(Arrays.asList(
                TestEvents.event(1, "noitems", "{\"items\":{\"sku\":\"A1\"}}"),
                TestEvents.event(2, "nomatch", "{\"sku\":\"A1\",\"items\":[{\"sku\":\"Z9\"}]}"),
                TestEvents.event(3, "noname", "{\"items\":[{\"sku\":\"A1\",\"name\":5}]}")));
        EventCorrelator correlator = correlator(ConsumptionMode.GLOBAL);
        String pattern = "{\"sku\":\"A1\"}";

        assertThrows(EventNotFoundException.class,
                () -> correlator.findItemName("missing", pattern, EventPosition.FIRST));
        assertEquals(EventPayloadMismatchException.Reason.NO_ITEMS_ARRAY, assertThrows(
                EventPayloadMismatchException.class,
                () -> correlator.findItemName("noitems", pattern, EventPosition.FIRST)).getReason());
        assertEquals(EventPayloadMismatchException.Reason.NO_MATCHING_ITEM, assertThrows(
                EventPayloadMismatchException.class,
                () -> correlator.findItemName("nomatch", pattern, EventPosition.FIRST)).getReason());
        assertEquals(EventPayloadMismatchException.Reason.ITEM_WITHOUT_NAME, assertThrows(
                EventPayloadMismatchException.class,
                () -> correlator.findItemName("noname", pattern, EventPosition.FIRST)).getReason());
    }

    @Test
    void matchedEventsAreReportedToLogger() {
        List<String> matched = new ArrayList<>();
        log.setLogger(new EventMatchLogger() {
            @Override
            public void eventStored(TelemetryEvent event) {
            }

            @Override
            public void eventMatched(TelemetryEvent event, String pattern, boolean background) {
                matched.add(event.getName() + ":" + pattern + ":" + background);
            }
        });
        log.addEvents(List.of(TestEvents.bare(1, "open")));

        correlator(ConsumptionMode.GLOBAL).awaitEvent("open", null, Duration.ZERO);

        assertEquals(List.of("open:null:false"), matched);
    }
}
