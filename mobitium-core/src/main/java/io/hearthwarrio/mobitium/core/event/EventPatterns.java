package io.hearthwarrio.mobitium.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import io.hearthwarrio.mobitium.core.MisconfigurationException;
import io.hearthwarrio.mobitium.core.json.JsonSubsetMatcher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves a pattern argument that may be either literal JSON or a path to a JSON file.
 */
public final class EventPatterns {

    private EventPatterns() {
        // utility class
    }

    /**
     * Returns the contents of the file named by {@code patternOrPath} if it is an existing regular file, otherwise
     * the argument itself.
     *
     * @return pattern text, or {@code null} when the argument is {@code null} or blank
     */
    public static String resolve(String patternOrPath) {
        if (patternOrPath == null || patternOrPath.trim().isEmpty()) {
            return null;
        }
        Path path = toPath(patternOrPath);
        if (path == null || !Files.isRegularFile(path)) {
            return patternOrPath;
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read event pattern file: " + path.toAbsolutePath(), e);
        }
    }

    /**
     * Reads the JSON pattern as a tree.
     *
     * @throws MisconfigurationException if the text is not a JSON object
     */
    static JsonNode parseObject(String pattern) {
        JsonNode node = JsonSubsetMatcher.tryParse(pattern);
        if (node == null || !node.isObject()) {
            throw new MisconfigurationException("Event pattern must be a JSON object or a path to one: " + pattern);
        }
        return node;
    }

    private static Path toPath(String candidate) {
        try {
            return Paths.get(candidate);
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
