package com.tio.pluginconfig;

import java.util.Locale;

/** Classification of a submitted observable. */
public enum ObservableClassification {
    IP,
    URL,
    DOMAIN,
    HASH,
    GENERIC;

    public static ObservableClassification fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Observable classification must be non-blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
