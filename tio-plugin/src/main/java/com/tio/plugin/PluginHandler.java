package com.tio.plugin;

import java.util.Map;

/**
 * Compiled-in implementation behind a plugin configuration's entry point. Handlers are shared across
 * jobs and may run concurrently on several worker threads; implement as thread-safe.
 */
public interface PluginHandler {

    /**
     * Runs the plugin for one job.
     *
     * @param invocation resolved parameters plus the job's observable; never null
     * @return report body (JSON-serializable map)
     * @throws Exception on execution failure; the worker records it in the plugin report
     */
    Map<String, Object> run(PluginInvocation invocation) throws Exception;
}
