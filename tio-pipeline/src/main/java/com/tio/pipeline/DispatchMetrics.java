package com.tio.pipeline;

import com.tio.job.JobStatus;
import com.tio.job.RejectionReason;
import com.tio.pluginconfig.PluginKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;

/** Counters for task dispatch and stage transitions. */
public final class DispatchMetrics {

    static final String TASKS_SUBMITTED = "tio.tasks.submitted";
    static final String SUBMIT_FAILURES = "tio.tasks.submit_failures";
    static final String PLUGINS_SKIPPED = "tio.plugins.skipped";
    static final String STAGE_TRANSITIONS = "tio.stage.transitions";

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    void taskSubmitted(PluginKind kind) {
        registry.counter(TASKS_SUBMITTED, "kind", tag(kind)).increment();
    }

    void submitFailed(PluginKind kind) {
        registry.counter(SUBMIT_FAILURES, "kind", tag(kind)).increment();
    }

    void pluginSkipped(PluginKind kind, RejectionReason.Cause cause) {
        registry.counter(PLUGINS_SKIPPED, "kind", tag(kind), "cause", cause.name().toLowerCase(Locale.ROOT)).increment();
    }

    void stageTransition(JobStatus target) {
        registry.counter(STAGE_TRANSITIONS, "target", target.name().toLowerCase(Locale.ROOT)).increment();
    }

    private static String tag(PluginKind kind) {
        return kind != null ? kind.name().toLowerCase(Locale.ROOT) : "transition";
    }
}
