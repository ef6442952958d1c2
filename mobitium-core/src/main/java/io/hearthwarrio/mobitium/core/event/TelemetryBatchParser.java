package io.hearthwarrio.mobitium.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns one telemetry batch request into {@link TelemetryEvent}s.
 * <p>
 * Batch body:
 * <pre>{@code
 * {"meta": {...}, "events": [{"name": "...", "event_num": 7, "event_time": "...", "data": {...}}, ...]}
 * }</pre>
 * Each element becomes one event. The client's numeric {@code event_num} is kept; otherwise the event is numbered
 * {@code lastSequence + index + 1}. A missing name becomes {@value #UNKNOWN_NAME}, a missing time becomes "now".
 * The stored {@link EventData#getBody()} is the JSON string {@code {"meta": <batch meta>, "event": <element>}}.
 */
public final class TelemetryBatchParser {

    public static final String UNKNOWN_NAME = "UNKNOWN";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Clock clock;

    public TelemetryBatchParser() {
        this(Clock.systemUTC());
    }

    public TelemetryBatchParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Parses a batch body against the current end of {@code log} and appends the result.
     *
     * @return events that were parsed (duplicates are skipped by the log)
     */
    public List<TelemetryEvent> parseInto(EventLog log, String body, String uri, String remoteAddress,
                                          Map<String, List<String>> headers, String query) {
        Objects.requireNonNull(log, "log must not be null");
        long last = log.lastEvent().map(TelemetryEvent::getSequenceNumber).orElse(0L);
        List<TelemetryEvent> parsed = parse(body, last, uri, remoteAddress, headers, query);
        log.addEvents(parsed);
        return parsed;
    }

    /**
     * Parses a batch body.
     *
     * @param body         request body; {@code null} or empty is an empty batch
     * @param lastSequence number of the last stored event, 0 when none
     * @throws IllegalArgumentException if the body is not valid JSON
     */
    public List<TelemetryEvent> parse(String body, long lastSequence, String uri, String remoteAddress,
                                      Map<String, List<String>> headers, String query) {
        JsonNode root = readRoot(body);

        JsonNode meta = root.has("meta") ? root.get("meta") : JsonNodeFactory.instance.nullNode();
        JsonNode events = root.get("events");
        if (events == null || !events.isArray()) {
            return Collections.emptyList();
        }

        Map<String, List<String>> normalizedHeaders = normalizeHeaders(headers);
        String now = Instant.now(clock).toString();

        List<TelemetryEvent> out = new ArrayList<>(events.size());
        int idx = 0;
        for (JsonNode element : events) {
            JsonNode ev = element.isObject() ? element : JsonNodeFactory.instance.objectNode();

            long number = ev.path("event_num").isNumber()
                    ? ev.get("event_num").asLong()
                    : lastSequence + idx + 1;
            String name = nonEmptyText(ev.get("name"), UNKNOWN_NAME);
            String time = nonEmptyText(ev.get("event_time"), now);

            ObjectNode record = JsonNodeFactory.instance.objectNode();
            record.set("meta", meta);
            record.set("event", element);

            EventData data = new EventData(uri, remoteAddress, normalizedHeaders, query, record.toString());
            out.add(new TelemetryEvent(number, time, name, data));
            idx++;
        }
        return out;
    }

    /**
     * Lower-cases header names; {@code null} values become empty lists.
     */
    public static Map<String, List<String>> normalizeHeaders(Map<String, List<String>> headers) {
        if (headers == null) {
            return Collections.emptyMap();
        }
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey() == null) {
                continue;
            }
            List<String> values = e.getValue() == null ? Collections.emptyList() : List.copyOf(e.getValue());
            out.put(e.getKey().toLowerCase(Locale.ROOT), values);
        }
        return out;
    }

    private static JsonNode readRoot(String body) {
        if (body == null || body.isEmpty()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            JsonNode root = MAPPER.readTree(body);
            return root == null || !root.isObject() ? JsonNodeFactory.instance.objectNode() : root;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad JSON in telemetry batch: " + e.getOriginalMessage(), e);
        }
    }

    private static String nonEmptyText(JsonNode node, String fallback) {
        if (node == null || !node.isTextual() || node.textValue().isEmpty()) {
            return fallback;
        }
        return node.textValue();
    }
}
