package com.tio.internal.plugins.observable;

import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginHandlerProvider;
import com.tio.pluginconfig.PluginKind;

/** Provider for the offline observable-info analyzer. */
public final class ObservableInfoAnalyzerProvider implements PluginHandlerProvider {

    public static final String ENTRY_POINT = "observable_info.ObservableInfo";

    private final ObservableInfoAnalyzer handler = new ObservableInfoAnalyzer();

    @Override
    public String getEntryPoint() {
        return ENTRY_POINT;
    }

    @Override
    public PluginKind getKind() {
        return PluginKind.ANALYZER;
    }

    @Override
    public PluginHandler getHandler() {
        return handler;
    }
}
