package io.hearthwarrio.mobitium.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import io.hearthwarrio.mobitium.core.json.JsonSubsetMatcher;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TelemetryBatchParserTest {

    private final TelemetryBatchParser parser =
            new TelemetryBatchParser(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void numbersEventsAfterLastSequenceUnlessClientProvidesOne() {
        String body = "{\"meta\":{\"app\":\"shop\"},\"events\":["
                + "{\"name\":\"open\"},"
                + "{\"name\":\"view\",\"event_num\":100},"
                + "{\"name\":\"tap\"}]}";

        List<TelemetryEvent> events = parser.parse(body, 10, "/m/batch", "10.0.0.2", null, null);

        assertEquals(3, events.size());
        assertEquals(11, events.get(0).getSequenceNumber());
        assertEquals(100, events.get(1).getSequenceNumber());
        assertEquals(13, events.get(2).getSequenceNumber());
    }

    @Test
    void missingNameAndTimeGetDefaults() {
        List<TelemetryEvent> events = parser.parse("{\"events\":[{\"name\":\"\"},42]}", 0, "/m/batch", null, null, null);

        assertEquals(TelemetryBatchParser.UNKNOWN_NAME, events.get(0).getName());
        assertEquals(TelemetryBatchParser.UNKNOWN_NAME, events.get(1).getName());
        assertEquals("2024-05-01T10:00:00Z", events.get(0).getTimestamp());
    }

    @Test
    void bodyWrapsBatchMetaAndSingleEvent() {
        String body = "{\"meta\":{\"app\":\"shop\"},\"events\":[{\"name\":\"buy\",\"event_time\":\"t1\","
                + "\"data\":{\"sku\":\"A1\"}}]}";

        TelemetryEvent event = parser.parse(body, 0, "/m/batch", null, null, "v=2").get(0);
        JsonNode stored = JsonSubsetMatcher.tryParse(event.getData().getBody());

        assertEquals("t1", event.getTimestamp());
        assertEquals("shop", stored.path("meta").path("app").asText());
        assertEquals("A1", stored.path("event").path("data").path("sku").asText());
        assertEquals("v=2", event.getData().getQuery());
        assertTrue(JsonSubsetMatcher.containsEventData(event.payloadJson(), "{\"sku\":\"A1\"}"));
    }

    @Test
    void headerNamesAreLowerCased() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Content-Type", Arrays.asList("application/json"));

        TelemetryEvent event = parser.parse("{\"events\":[{\"name\":\"a\"}]}", 0, "/m/batch", null, headers, null).get(0);

        assertEquals(Arrays.asList("application/json"), event.getData().getHeaders().get("content-type"));
    }

    @Test
    void emptyBodyIsEmptyBatch() {
        assertTrue(parser.parse("", 0, "/m/batch", null, null, null).isEmpty());
        assertTrue(parser.parse("{\"meta\":{}}", 0, "/m/batch", null, null, null).isEmpty());
    }

    @Test
    void badJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{oops", 0, "/m/batch", null, null, null));
    }

    @Test
    void parseIntoContinuesNumberingFromLog() {
        EventLog log = new EventLog();
        log.addEvents(List.of(TestEvents.bare(7, "earlier")));

        parser.parseInto(log, "{\"events\":[{\"name\":\"a\"},{\"name\":\"b\"}]}", "/m/batch", null, null, null);

        assertEquals(3, log.size());
        assertEquals(9, log.lastEvent().get().getSequenceNumber());
    }
}
