package com.tio.job;

import com.tio.pluginconfig.PluginKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Pipeline status of a job. Stages run analyzers, then connectors, then visualizers;
 * FAILED is reachable from every non-terminal status.
 */
public enum JobStatus {

    PENDING,
    ANALYZERS_RUNNING,
    ANALYZERS_COMPLETED,
    CONNECTORS_RUNNING,
    CONNECTORS_COMPLETED,
    VISUALIZERS_RUNNING,
    VISUALIZERS_COMPLETED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Statuses that may follow this one. */
    public Set<JobStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ANALYZERS_RUNNING, FAILED);
            case ANALYZERS_RUNNING:
                return EnumSet.of(ANALYZERS_COMPLETED, FAILED);
            case ANALYZERS_COMPLETED:
                return EnumSet.of(CONNECTORS_RUNNING, FAILED);
            case CONNECTORS_RUNNING:
                return EnumSet.of(CONNECTORS_COMPLETED, FAILED);
            case CONNECTORS_COMPLETED:
                return EnumSet.of(VISUALIZERS_RUNNING, FAILED);
            case VISUALIZERS_RUNNING:
                return EnumSet.of(VISUALIZERS_COMPLETED, FAILED);
            case VISUALIZERS_COMPLETED:
                return EnumSet.of(COMPLETED, FAILED);
            default:
                return EnumSet.noneOf(JobStatus.class);
        }
    }

    public boolean canTransitionTo(JobStatus target) {
        return allowedNext().contains(target);
    }

    public boolean isRunningStage() {
        return this == ANALYZERS_RUNNING || this == CONNECTORS_RUNNING || this == VISUALIZERS_RUNNING;
    }

    public boolean isCompletedStage() {
        return this == ANALYZERS_COMPLETED || this == CONNECTORS_COMPLETED || this == VISUALIZERS_COMPLETED;
    }

    /**
     * Plugin kind whose stage this status belongs to, or null for PENDING, COMPLETED and FAILED.
     * Pivots have no stage.
     */
    public PluginKind stageKind() {
        switch (this) {
            case ANALYZERS_RUNNING:
            case ANALYZERS_COMPLETED:
                return PluginKind.ANALYZER;
            case CONNECTORS_RUNNING:
            case CONNECTORS_COMPLETED:
                return PluginKind.CONNECTOR;
            case VISUALIZERS_RUNNING:
            case VISUALIZERS_COMPLETED:
                return PluginKind.VISUALIZER;
            default:
                return null;
        }
    }

    /** Running status of a stage kind. */
    public static JobStatus runningFor(PluginKind kind) {
        switch (kind) {
            case ANALYZER:
                return ANALYZERS_RUNNING;
            case CONNECTOR:
                return CONNECTORS_RUNNING;
            case VISUALIZER:
                return VISUALIZERS_RUNNING;
            default:
                throw new IllegalArgumentException("No pipeline stage for " + kind);
        }
    }

    /** Completed status of a stage kind. */
    public static JobStatus completedFor(PluginKind kind) {
        switch (kind) {
            case ANALYZER:
                return ANALYZERS_COMPLETED;
            case CONNECTOR:
                return CONNECTORS_COMPLETED;
            case VISUALIZER:
                return VISUALIZERS_COMPLETED;
            default:
                throw new IllegalArgumentException("No pipeline stage for " + kind);
        }
    }
}
