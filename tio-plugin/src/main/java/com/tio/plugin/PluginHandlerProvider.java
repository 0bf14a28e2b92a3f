package com.tio.plugin;

import com.tio.pluginconfig.PluginKind;

/**
 * SPI for compiled-in plugin handlers. Internal providers are registered explicitly by the worker;
 * extra providers on the classpath are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.tio.plugin.PluginHandlerProvider).
 */
public interface PluginHandlerProvider {

    /**
     * Entry point this provider serves (e.g. "validin.Validin"). Must match the
     * {@code entry_point} of the plugin configurations that use it.
     */
    String getEntryPoint();

    /** Kind of plugin the handler implements. */
    PluginKind getKind();

    PluginHandler getHandler();

    default String getVersion() {
        return "1.0";
    }

    /**
     * Whether this provider should be registered. Override to skip registration when the
     * environment it needs is unset.
     */
    default boolean isEnabled() {
        return true;
    }
}
