package com.tio.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Report store backed by a concurrent map; used by tests and single-process workers. */
public final class InMemoryReportStore implements ReportStore {

    private final Map<String, Map<String, PluginReport>> reportsByJob = new ConcurrentHashMap<>();

    @Override
    public void save(PluginReport report) {
        Objects.requireNonNull(report, "report");
        Map<String, PluginReport> reports = reportsByJob.computeIfAbsent(report.getJobId(), k -> new LinkedHashMap<>());
        synchronized (reports) {
            reports.put(report.getPlugin().getName(), report);
        }
    }

    @Override
    public Optional<PluginReport> find(String jobId, String pluginName) {
        Map<String, PluginReport> reports = reportsByJob.get(jobId);
        if (reports == null) {
            return Optional.empty();
        }
        synchronized (reports) {
            return Optional.ofNullable(reports.get(pluginName));
        }
    }

    @Override
    public List<PluginReport> forJob(String jobId) {
        Map<String, PluginReport> reports = reportsByJob.get(jobId);
        if (reports == null) {
            return List.of();
        }
        synchronized (reports) {
            return new ArrayList<>(reports.values());
        }
    }
}
