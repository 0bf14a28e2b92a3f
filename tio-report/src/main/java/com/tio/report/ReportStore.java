package com.tio.report;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for plugin reports. One report per (job, plugin name); {@link #save} replaces it.
 */
public interface ReportStore {

    void save(PluginReport report);

    Optional<PluginReport> find(String jobId, String pluginName);

    /** Every report of a job, in the order they were first saved. */
    List<PluginReport> forJob(String jobId);
}
