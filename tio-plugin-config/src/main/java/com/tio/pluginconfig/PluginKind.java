package com.tio.pluginconfig;

import java.util.Locale;

/**
 * Plugin category. A single {@link PluginConfiguration} shape carries the kind as a tag;
 * category-specific fields live behind it ({@link AnalyzerAttributes}, {@link PivotAttributes}).
 */
public enum PluginKind {

    ANALYZER("analyzers"),
    CONNECTOR("connectors"),
    VISUALIZER("visualizers"),
    PIVOT("pivots");

    private final String pluralKey;

    PluginKind(String pluralKey) {
        this.pluralKey = pluralKey;
    }

    /** Plural key used in job requests and manifests (e.g. "analyzers"). */
    public String getPluralKey() {
        return pluralKey;
    }

    /**
     * Parses a kind from its name or plural key, case-insensitive ("analyzer", "ANALYZERS").
     *
     * @throws IllegalArgumentException if unknown
     */
    public static PluginKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Plugin kind must be non-blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (PluginKind kind : values()) {
            if (kind.name().toLowerCase(Locale.ROOT).equals(v) || kind.pluralKey.equals(v)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown plugin kind: " + value);
    }
}
