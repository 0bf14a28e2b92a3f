package com.tio.plugin;

/** Resolves a plugin configuration's entry point to the handler that implements it. */
public interface EntryPointLoader {

    /**
     * @param entryPoint entry point reference from the plugin configuration
     * @return the handler; never null
     * @throws EntryPointNotFoundException if nothing is registered under that entry point
     */
    PluginHandler load(String entryPoint);
}
