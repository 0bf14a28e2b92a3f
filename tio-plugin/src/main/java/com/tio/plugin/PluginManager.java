package com.tio.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Collects handler providers: explicit internal registration (shipped with the worker) and
 * discovery of additional providers on the classpath via {@link ServiceLoader}.
 * <p>
 * Registration policy lives with the caller: internal provider failures are fatal, discovered
 * provider failures are logged and skipped. A discovered provider whose entry point is already
 * served by an internal provider is ignored.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final List<PluginHandlerProvider> internalProviders = new ArrayList<>();
    private final List<PluginHandlerProvider> discoveredProviders = new ArrayList<>();

    /** Registers an internal provider (must be on the worker classpath). */
    public void registerInternal(PluginHandlerProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
        }
    }

    /**
     * Discovers providers declared in META-INF/services on the given class loader. A provider that fails
     * to instantiate is logged at error level and skipped.
     *
     * @param classLoader loader to scan; null means the thread context loader
     */
    public void discoverProviders(ClassLoader classLoader) {
        ClassLoader cl = classLoader != null ? classLoader : Thread.currentThread().getContextClassLoader();
        Set<String> known = new HashSet<>();
        for (PluginHandlerProvider p : internalProviders) known.add(p.getEntryPoint());
        for (PluginHandlerProvider p : discoveredProviders) known.add(p.getEntryPoint());

        Iterator<PluginHandlerProvider> it = ServiceLoader.load(PluginHandlerProvider.class, cl).iterator();
        int n = 0;
        while (true) {
            PluginHandlerProvider provider;
            try {
                if (!it.hasNext()) break;
                provider = it.next();
            } catch (ServiceConfigurationError e) {
                log.error("Plugin handler provider failed to load (skipping): {}", e.getMessage(), e);
                continue;
            }
            if (!known.add(provider.getEntryPoint())) {
                log.debug("Provider {} for entry point {} already registered; ignoring discovered copy",
                        provider.getClass().getName(), provider.getEntryPoint());
                continue;
            }
            discoveredProviders.add(provider);
            n++;
        }
        if (n > 0) {
            log.info("Discovered {} plugin handler provider(s) on the classpath", n);
        }
    }

    /** Internal providers only (for registration where failure is fatal). */
    public List<PluginHandlerProvider> getInternalProviders() {
        return new ArrayList<>(internalProviders);
    }

    /** Discovered providers only (for registration where failure is log-and-skip). */
    public List<PluginHandlerProvider> getDiscoveredProviders() {
        return new ArrayList<>(discoveredProviders);
    }

    /** All providers: internal first, then discovered. */
    public List<PluginHandlerProvider> getProviders() {
        List<PluginHandlerProvider> all = new ArrayList<>(internalProviders);
        all.addAll(discoveredProviders);
        return all;
    }

    public int getInternalCount() {
        return internalProviders.size();
    }

    public int getDiscoveredCount() {
        return discoveredProviders.size();
    }
}
