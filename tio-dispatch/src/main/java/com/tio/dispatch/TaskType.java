package com.tio.dispatch;

/** What a task descriptor does when a worker runs it. */
public enum TaskType {
    /** Run one plugin for one job. */
    PLUGIN_RUN,
    /** Advance a job to the next pipeline status once its dependencies have finished. */
    STAGE_TRANSITION
}
