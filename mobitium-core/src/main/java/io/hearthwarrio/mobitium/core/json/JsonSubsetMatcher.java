package io.hearthwarrio.mobitium.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

/**
 * Structural "pattern is contained in candidate" matching over JSON trees.
 * <p>
 * Primitive pattern values, compared as strings:
 * <ul>
 *   <li>{@code "*"} matches any primitive</li>
 *   <li>{@code ""} matches only an empty string</li>
 *   <li>{@code "~text"} matches when the candidate contains {@code text}</li>
 *   <li>anything else must be equal</li>
 * </ul>
 * Object patterns are a one-way subset (every pattern key must be present and match, extra candidate keys are fine).
 * Array patterns are existential: every pattern element must match at least one candidate element, in any order,
 * and two pattern elements may match the same candidate element.
 * <p>
 * A candidate string that itself holds JSON is parsed and matched against a non-primitive pattern, which lets a
 * pattern reach into payloads that were serialized into string fields.
 * <p>
 * All methods are pure and never throw on malformed input: anything unparsable simply does not match.
 */
public final class JsonSubsetMatcher {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonSubsetMatcher() {
        // utility class
    }

    /**
     * Parses both sides and matches them.
     *
     * @return {@code false} when either side is not valid JSON
     */
    public static boolean matches(String candidateJson, String patternJson) {
        JsonNode candidate = tryParse(candidateJson);
        JsonNode pattern = tryParse(patternJson);
        if (candidate == null || pattern == null) {
            return false;
        }
        return matches(candidate, pattern);
    }

    public static boolean matches(JsonNode candidate, JsonNode pattern) {
        if (candidate == null || pattern == null) {
            return false;
        }

        if (isPrimitive(candidate) && isPrimitive(pattern)) {
            return matchesPrimitive(stringify(candidate), stringify(pattern));
        }

        // an empty object pattern constrains nothing
        if (pattern.isObject() && pattern.size() == 0 && candidate.isContainerNode()) {
            return true;
        }

        if (candidate.isTextual()) {
            JsonNode parsed = tryParse(candidate.textValue());
            if (parsed != null) {
                return matches(parsed, pattern);
            }
        }

        if (candidate.isObject() && pattern.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = pattern.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!candidate.has(field.getKey()) || !matches(candidate.get(field.getKey()), field.getValue())) {
                    return false;
                }
            }
            return true;
        }

        if (candidate.isArray() && pattern.isArray()) {
            for (JsonNode expected : pattern) {
                if (!anyElementMatches(candidate, expected)) {
                    return false;
                }
            }
            return true;
        }

        return false;
    }

    /**
     * Searches the whole tree for a property named {@code key} whose value matches {@code value}.
     * <p>
     * Unlike {@link #matches(JsonNode, JsonNode)} this does not anchor at the root: the property may sit at any depth,
     * inside objects or arrays.
     */
    public static boolean findKeyValueInTree(JsonNode root, String key, JsonNode value) {
        if (root == null) {
            return false;
        }
        if (root.isArray()) {
            for (JsonNode element : root) {
                if (findKeyValueInTree(element, key, value)) {
                    return true;
                }
            }
            return false;
        }
        if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if ((field.getKey().equals(key) && matches(field.getValue(), value))
                        || findKeyValueInTree(field.getValue(), key, value)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns {@code true} when every top-level property of {@code pattern} occurs somewhere in {@code tree}.
     */
    public static boolean containsAll(JsonNode tree, JsonNode pattern) {
        if (pattern == null || !pattern.isObject()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = pattern.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!findKeyValueInTree(tree, field.getKey(), field.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Matches a serialized event payload against a pattern object.
     * <p>
     * The payload's string {@code body} is parsed and {@code event.data} is located inside it; every top-level
     * property of the pattern must then be found somewhere in that subtree.
     *
     * @param eventDataJson serialized event payload ({@code uri}, {@code headers}, {@code body}, ...)
     * @param patternJson   JSON object
     * @return {@code false} when any stage is missing or unparsable
     */
    public static boolean containsEventData(String eventDataJson, String patternJson) {
        JsonNode data = extractEventData(eventDataJson);
        JsonNode pattern = tryParse(patternJson);
        if (data == null || pattern == null) {
            return false;
        }
        return containsAll(data, pattern);
    }

    /**
     * Locates {@code event.data} inside the string {@code body} of a serialized event payload.
     *
     * @return the {@code event.data} node, or {@code null} when the payload has no such node
     */
    public static JsonNode extractEventData(String eventDataJson) {
        JsonNode envelope = tryParse(eventDataJson);
        if (envelope == null || !envelope.isObject()) {
            return null;
        }
        JsonNode body = envelope.get("body");
        if (body == null || !body.isTextual()) {
            return null;
        }
        JsonNode parsedBody = tryParse(body.textValue());
        if (parsedBody == null || !parsedBody.isObject()) {
            return null;
        }
        JsonNode event = parsedBody.get("event");
        if (event == null || !event.isObject()) {
            return null;
        }
        return event.get("data");
    }

    /**
     * Parses JSON text.
     *
     * @return parsed tree, or {@code null} for {@code null}, empty, literal {@code null} or invalid input
     */
    public static JsonNode tryParse(String json) {
        if (json == null) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || node.isMissingNode() || node.isNull()) {
                return null;
            }
            return node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static boolean anyElementMatches(JsonNode candidates, JsonNode expected) {
        for (JsonNode actual : candidates) {
            if (matches(actual, expected)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesPrimitive(String actual, String expected) {
        if (expected.equals("*")) {
            return true;
        }
        if (expected.isEmpty()) {
            return actual.isEmpty();
        }
        if (expected.startsWith("~")) {
            return actual.contains(expected.substring(1));
        }
        return actual.equals(expected);
    }

    private static boolean isPrimitive(JsonNode node) {
        return !node.isContainerNode();
    }

    private static String stringify(JsonNode node) {
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isFloatingPointNumber()) {
            // integral floats render without a fraction: 1.0 and 1e3 read as "1" and "1000"
            BigDecimal value = node.decimalValue().stripTrailingZeros();
            if (value.scale() <= 0) {
                return value.toPlainString();
            }
        }
        return node.asText();
    }
}
