package com.tio.plugin;

import com.tio.pluginconfig.PluginKind;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Static registry of compiled-in handlers keyed by entry point. This is the {@link EntryPointLoader}
 * the plugin configuration registry validates entry points against, and the one workers load handlers from.
 * The worker uses the shared {@link #getInstance()}; tests may create their own.
 */
public final class PluginHandlerRegistry implements EntryPointLoader {

    private static final PluginHandlerRegistry INSTANCE = new PluginHandlerRegistry();

    private final Map<String, HandlerEntry> handlers = new ConcurrentHashMap<>();

    public static PluginHandlerRegistry getInstance() {
        return INSTANCE;
    }

    /**
     * Registers a handler under the given entry point.
     *
     * @throws IllegalArgumentException if the entry point is blank or already registered
     */
    public void register(String entryPoint, PluginKind kind, String version, PluginHandler handler) {
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(kind, "kind");
        String ep = Objects.requireNonNull(entryPoint, "entryPoint").trim();
        if (ep.isEmpty()) {
            throw new IllegalArgumentException("Entry point must be non-blank");
        }
        HandlerEntry entry = new HandlerEntry(ep, kind, version, handler);
        if (handlers.putIfAbsent(ep, entry) != null) {
            throw new IllegalArgumentException("Handler already registered for entry point: " + ep);
        }
    }

    /** Registers the provider's handler under its entry point. */
    public void register(PluginHandlerProvider provider) {
        Objects.requireNonNull(provider, "provider");
        register(provider.getEntryPoint(), provider.getKind(), provider.getVersion(), provider.getHandler());
    }

    /** Returns the entry, or null if not registered. */
    public HandlerEntry get(String entryPoint) {
        if (entryPoint == null || entryPoint.isBlank()) return null;
        return handlers.get(entryPoint.trim());
    }

    public boolean contains(String entryPoint) {
        return get(entryPoint) != null;
    }

    @Override
    public PluginHandler load(String entryPoint) {
        HandlerEntry e = get(entryPoint);
        if (e == null) {
            throw new EntryPointNotFoundException(entryPoint);
        }
        return e.getHandler();
    }

    public Map<String, HandlerEntry> getAll() {
        return Collections.unmodifiableMap(handlers);
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        handlers.clear();
    }

    /** Registered handler: entry point, kind, version and the instance. */
    public static final class HandlerEntry {
        private final String entryPoint;
        private final PluginKind kind;
        private final String version;
        private final PluginHandler handler;

        HandlerEntry(String entryPoint, PluginKind kind, String version, PluginHandler handler) {
            this.entryPoint = entryPoint;
            this.kind = kind;
            this.version = version;
            this.handler = handler;
        }

        public String getEntryPoint() {
            return entryPoint;
        }

        public PluginKind getKind() {
            return kind;
        }

        public String getVersion() {
            return version;
        }

        public PluginHandler getHandler() {
            return handler;
        }
    }
}
