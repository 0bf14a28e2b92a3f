package com.tio.internal.plugins.visualizer;

import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginHandlerProvider;
import com.tio.pluginconfig.PluginKind;

/** Provider for the observable summary visualizer. */
public final class ObservableSummaryVisualizerProvider implements PluginHandlerProvider {

    public static final String ENTRY_POINT = "observable_summary.ObservableSummary";

    private final ObservableSummaryVisualizer handler = new ObservableSummaryVisualizer();

    @Override
    public String getEntryPoint() {
        return ENTRY_POINT;
    }

    @Override
    public PluginKind getKind() {
        return PluginKind.VISUALIZER;
    }

    @Override
    public PluginHandler getHandler() {
        return handler;
    }
}
