package com.tio.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tio.pluginconfig.PluginKind;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-job parameter overrides: plugin name to (parameter name to value). Plugin names are unique
 * across kinds, so the map is flat. Values are used verbatim, including null.
 */
public final class RuntimeConfiguration {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final RuntimeConfiguration EMPTY = new RuntimeConfiguration(Map.of());

    private final Map<String, Map<String, Object>> overrides;

    public RuntimeConfiguration(Map<String, Map<String, Object>> overrides) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (overrides != null) {
            for (Map.Entry<String, Map<String, Object>> e : overrides.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
            }
        }
        this.overrides = Collections.unmodifiableMap(copy);
    }

    public static RuntimeConfiguration empty() {
        return EMPTY;
    }

    /**
     * Parses overrides from JSON. Accepts the flat shape {@code {"Plugin": {"param": value}}} and the
     * per-kind shape {@code {"analyzers": {"Plugin": {...}}, "connectors": {...}}}, which is flattened.
     *
     * @param json JSON object; null or blank gives an empty configuration
     * @throws UncheckedIOException if the JSON is malformed
     */
    public static RuntimeConfiguration fromJson(String json) {
        if (json == null || json.isBlank()) return EMPTY;
        Map<String, Map<String, Object>> raw;
        try {
            raw = MAPPER.readValue(json, new TypeReference<Map<String, Map<String, Object>>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Map<String, Map<String, Object>> flat = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> e : raw.entrySet()) {
            if (isKindKey(e.getKey())) {
                for (Map.Entry<String, Object> plugin : e.getValue().entrySet()) {
                    flat.put(plugin.getKey(), asParameterMap(plugin.getKey(), plugin.getValue()));
                }
            } else {
                flat.put(e.getKey(), e.getValue());
            }
        }
        return new RuntimeConfiguration(flat);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asParameterMap(String pluginName, Object value) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw new IllegalArgumentException("Runtime configuration for " + pluginName + " must be an object");
    }

    private static boolean isKindKey(String key) {
        for (PluginKind kind : PluginKind.values()) {
            if (kind.getPluralKey().equals(key)) return true;
        }
        return false;
    }

    /** Whether an override exists for the parameter (its value may be null). */
    public boolean hasOverride(String pluginName, String parameterName) {
        Map<String, Object> params = overrides.get(pluginName);
        return params != null && params.containsKey(parameterName);
    }

    /** The override value; check {@link #hasOverride} first, since null is a legal override. */
    public Object getOverride(String pluginName, String parameterName) {
        Map<String, Object> params = overrides.get(pluginName);
        return params != null ? params.get(parameterName) : null;
    }

    public Map<String, Object> forPlugin(String pluginName) {
        return overrides.getOrDefault(pluginName, Map.of());
    }

    public Map<String, Map<String, Object>> asMap() {
        return overrides;
    }

    public boolean isEmpty() {
        return overrides.isEmpty();
    }

    @Override
    public String toString() {
        return "RuntimeConfiguration(plugins=" + overrides.keySet() + ")";
    }
}
