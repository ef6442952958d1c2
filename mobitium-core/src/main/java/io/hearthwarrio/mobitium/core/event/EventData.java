package io.hearthwarrio.mobitium.core.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request details of one received telemetry event.
 * <p>
 * {@link #getBody()} is the JSON string {@code {"meta": ..., "event": ...}} built by the receiver; the application
 * payload sits under {@code event.data}.
 */
public final class EventData {

    private final String uri;
    private final String remoteAddress;
    private final Map<String, List<String>> headers;
    private final String query;
    private final String body;

    public EventData(String uri, String remoteAddress, Map<String, List<String>> headers, String query, String body) {
        this.uri = uri;
        this.remoteAddress = remoteAddress;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.query = query;
        this.body = body;
    }

    public String getUri() {
        return uri;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public String getQuery() {
        return query;
    }

    public String getBody() {
        return body;
    }
}
