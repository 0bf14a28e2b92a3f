package com.tio.registry;

/** Registration of a plugin that must be present (e.g. a built-in) failed. */
public final class PluginRegistrationException extends RuntimeException {

    private final RegistrationResult result;

    public PluginRegistrationException(RegistrationResult result) {
        super(result != null ? result.toString() : "Plugin registration failed");
        this.result = result;
    }

    public RegistrationResult getResult() {
        return result;
    }
}
