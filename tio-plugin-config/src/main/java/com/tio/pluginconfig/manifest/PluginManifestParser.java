package com.tio.pluginconfig.manifest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Parses plugin manifests from JSON. Thread-safe. */
public final class PluginManifestParser {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false);

    private PluginManifestParser() {
    }

    /**
     * @throws UncheckedIOException if the JSON is malformed
     */
    public static PluginManifest fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Manifest JSON is empty");
        }
        try {
            return MAPPER.readValue(json, PluginManifest.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static PluginManifest fromStream(InputStream in) {
        try {
            return MAPPER.readValue(in, PluginManifest.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static PluginManifest fromFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return fromStream(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read manifest " + file, e);
        }
    }
}
