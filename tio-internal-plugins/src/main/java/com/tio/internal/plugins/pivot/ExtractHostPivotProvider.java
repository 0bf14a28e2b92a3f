package com.tio.internal.plugins.pivot;

import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginHandlerProvider;
import com.tio.pluginconfig.PluginKind;

/** Provider for the URL host pivot. */
public final class ExtractHostPivotProvider implements PluginHandlerProvider {

    public static final String ENTRY_POINT = "extract_host.ExtractHost";

    private final ExtractHostPivot handler = new ExtractHostPivot();

    @Override
    public String getEntryPoint() {
        return ENTRY_POINT;
    }

    @Override
    public PluginKind getKind() {
        return PluginKind.PIVOT;
    }

    @Override
    public PluginHandler getHandler() {
        return handler;
    }
}
