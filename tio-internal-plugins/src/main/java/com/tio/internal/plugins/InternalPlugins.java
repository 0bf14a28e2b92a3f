package com.tio.internal.plugins;

import com.tio.internal.plugins.export.JsonExportConnectorProvider;
import com.tio.internal.plugins.observable.ObservableInfoAnalyzerProvider;
import com.tio.internal.plugins.pivot.ExtractHostPivotProvider;
import com.tio.internal.plugins.validin.ValidinAnalyzerProvider;
import com.tio.internal.plugins.visualizer.ObservableSummaryVisualizerProvider;
import com.tio.plugin.PluginManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plugin-side bootstrap: creates a {@link PluginManager} with the internal handler providers registered
 * and additional providers discovered on the classpath. The worker only calls {@link #createPluginManager()}
 * and then registers the returned providers with {@link com.tio.plugin.PluginHandlerRegistry}.
 */
public final class InternalPlugins {

    private static final Logger log = LoggerFactory.getLogger(InternalPlugins.class);

    private InternalPlugins() {
    }

    /**
     * Creates a PluginManager with internal providers (Validin, ObservableInfo, JsonExport,
     * ObservableSummary, ExtractHost) registered, then discovers providers declared in
     * META-INF/services on this module's class loader.
     *
     * @return configured PluginManager; use {@link PluginManager#getProviders()} to register handlers
     */
    public static PluginManager createPluginManager() {
        PluginManager pluginManager = new PluginManager();

        pluginManager.registerInternal(new ValidinAnalyzerProvider());
        pluginManager.registerInternal(new ObservableInfoAnalyzerProvider());
        pluginManager.registerInternal(new JsonExportConnectorProvider());
        pluginManager.registerInternal(new ObservableSummaryVisualizerProvider());
        pluginManager.registerInternal(new ExtractHostPivotProvider());

        pluginManager.discoverProviders(InternalPlugins.class.getClassLoader());

        log.info("Plugin handlers: {} internal, {} discovered",
                pluginManager.getInternalCount(), pluginManager.getDiscoveredCount());

        return pluginManager;
    }
}
