package com.tio.internal.plugins.export;

import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginHandlerProvider;
import com.tio.pluginconfig.PluginKind;

/** Provider for the JSON-lines export connector. */
public final class JsonExportConnectorProvider implements PluginHandlerProvider {

    public static final String ENTRY_POINT = "json_export.JsonExport";

    private final JsonExportConnector handler = new JsonExportConnector();

    @Override
    public String getEntryPoint() {
        return ENTRY_POINT;
    }

    @Override
    public PluginKind getKind() {
        return PluginKind.CONNECTOR;
    }

    @Override
    public PluginHandler getHandler() {
        return handler;
    }
}
