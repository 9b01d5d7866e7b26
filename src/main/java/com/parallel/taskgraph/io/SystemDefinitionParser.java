package com.parallel.taskgraph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link SystemDefinition}s from JSON.
 */
public final class SystemDefinitionParser {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private SystemDefinitionParser() {
        // Utility class
    }

    /** Parses a JSON file into a SystemDefinition. */
    public static SystemDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a JSON string into a SystemDefinition.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or has no
     *                                  {@code system} object.
     */
    public static SystemDefinition parse(String json) {
        SystemDefinition def;
        try {
            def = MAPPER.readValue(json, SystemDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed system definition: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.getSystem() == null)
            throw new IllegalArgumentException("Missing 'system' key");
        return def;
    }
}
