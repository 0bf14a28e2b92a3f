package com.tio.worker;

import com.tio.config.TioConfig;
import com.tio.job.JobStore;
import com.tio.parameters.ParameterStore;
import com.tio.pipeline.DispatchMetrics;
import com.tio.pipeline.JobPipelineCoordinator;
import com.tio.plugin.PluginHandlerRegistry;
import com.tio.registry.PluginConfigRegistry;
import com.tio.report.ReportStore;

import java.util.Objects;

/**
 * Everything the worker wires at bootstrap: configuration, handler and plugin registries, stores,
 * the coordinator and the task executor.
 */
public final class WorkerContext {

    private final TioConfig config;
    private final PluginHandlerRegistry handlers;
    private final ParameterStore parameterStore;
    private final PluginConfigRegistry registry;
    private final JobStore jobStore;
    private final ReportStore reportStore;
    private final DispatchMetrics metrics;
    private final JobPipelineCoordinator coordinator;
    private final TaskExecutor executor;

    WorkerContext(TioConfig config, PluginHandlerRegistry handlers, ParameterStore parameterStore,
                  PluginConfigRegistry registry, JobStore jobStore, ReportStore reportStore,
                  DispatchMetrics metrics, JobPipelineCoordinator coordinator, TaskExecutor executor) {
        this.config = Objects.requireNonNull(config, "config");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.parameterStore = Objects.requireNonNull(parameterStore, "parameterStore");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.reportStore = Objects.requireNonNull(reportStore, "reportStore");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public TioConfig getConfig() {
        return config;
    }

    public PluginHandlerRegistry getHandlers() {
        return handlers;
    }

    public ParameterStore getParameterStore() {
        return parameterStore;
    }

    public PluginConfigRegistry getRegistry() {
        return registry;
    }

    public JobStore getJobStore() {
        return jobStore;
    }

    public ReportStore getReportStore() {
        return reportStore;
    }

    public DispatchMetrics getMetrics() {
        return metrics;
    }

    public JobPipelineCoordinator getCoordinator() {
        return coordinator;
    }

    public TaskExecutor getExecutor() {
        return executor;
    }
}
