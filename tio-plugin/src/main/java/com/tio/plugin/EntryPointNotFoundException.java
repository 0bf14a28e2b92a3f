package com.tio.plugin;

/** Thrown when a plugin configuration's entry point cannot be resolved to a compiled-in handler. */
public class EntryPointNotFoundException extends RuntimeException {

    private final String entryPoint;

    public EntryPointNotFoundException(String entryPoint) {
        super("No plugin handler registered for entry point: " + entryPoint);
        this.entryPoint = entryPoint;
    }

    public String getEntryPoint() {
        return entryPoint;
    }
}
