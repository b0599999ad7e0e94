package com.automata.fsa.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads automaton definitions and login settings from JSON.
 *
 * Read-only: definitions are loaded from strings, files or the classpath and
 * are never written back.
 */
public final class DefinitionLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private DefinitionLoader() {
        // Utility class
    }

    /** Parses a JSON string into an AutomatonDefinition. */
    public static AutomatonDefinition parse(String json) {
        return read(json, AutomatonDefinition.class);
    }

    /** Parses a JSON file into an AutomatonDefinition. */
    public static AutomatonDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Loads a definition bundled on the classpath, e.g.
     * {@code "automata/login_nfa.json"}.
     */
    public static AutomatonDefinition fromClasspath(String resource) {
        return readResource(resource, AutomatonDefinition.class);
    }

    public static LoginSettings loginSettings(String resource) {
        return readResource(resource, LoginSettings.class);
    }

    public static LoginSettings loginSettingsFile(Path path) throws IOException {
        return read(Files.readString(path), LoginSettings.class);
    }

    private static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    private static <T> T readResource(String resource, Class<T> type) {
        ClassLoader cl = DefinitionLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Resource not found on classpath: " + resource);
            return MAPPER.readValue(in, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " JSON in " + resource
                    + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + resource, e);
        }
    }
}
