package com.tio.registry;

import com.tio.pluginconfig.PluginConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of registering a plugin configuration: the registered (possibly adjusted) configuration plus
 * warnings, or the errors it was rejected for.
 */
public final class RegistrationResult {

    private final String pluginName;
    private final PluginConfiguration configuration;
    private final List<String> warnings;
    private final List<String> errors;

    private RegistrationResult(String pluginName, PluginConfiguration configuration,
                               List<String> warnings, List<String> errors) {
        this.pluginName = pluginName;
        this.configuration = configuration;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static RegistrationResult success(PluginConfiguration configuration, List<String> warnings) {
        Objects.requireNonNull(configuration, "configuration");
        return new RegistrationResult(configuration.getName(), configuration,
                warnings != null ? warnings : List.of(), List.of());
    }

    public static RegistrationResult failure(String pluginName, String error) {
        return new RegistrationResult(pluginName, null, List.of(),
                List.of(Objects.requireNonNull(error, "error")));
    }

    public boolean isRegistered() {
        return configuration != null;
    }

    public String getPluginName() {
        return pluginName;
    }

    /** The configuration as registered; null on failure. */
    public PluginConfiguration getConfiguration() {
        return configuration;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return isRegistered()
                ? "Registered " + pluginName + (warnings.isEmpty() ? "" : " with warnings " + warnings)
                : "Rejected " + pluginName + ": " + String.join("; ", errors);
    }
}
