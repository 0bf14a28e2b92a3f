package com.tio.internal.plugins.validin;

import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginHandlerProvider;
import com.tio.pluginconfig.PluginKind;

/**
 * Provider for the Validin DNS-history analyzer. Entry point {@value #ENTRY_POINT}.
 */
public final class ValidinAnalyzerProvider implements PluginHandlerProvider {

    public static final String ENTRY_POINT = "validin.Validin";

    private final ValidinAnalyzer handler = new ValidinAnalyzer();

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
