package com.tio.dispatch;

import java.util.Objects;

/** Result of running one plugin task, reported back to the pipeline. */
public final class TaskOutcome {

    private final String token;
    private final String jobId;
    private final String pluginName;
    private final boolean succeeded;
    private final String error;

    private TaskOutcome(String token, String jobId, String pluginName, boolean succeeded, String error) {
        this.token = Objects.requireNonNull(token, "token");
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.pluginName = pluginName;
        this.succeeded = succeeded;
        this.error = error;
    }

    public static TaskOutcome success(TaskDescriptor descriptor) {
        return new TaskOutcome(descriptor.getToken(), descriptor.getJobId(), descriptor.getPluginName(), true, null);
    }

    public static TaskOutcome failure(TaskDescriptor descriptor, String error) {
        return new TaskOutcome(descriptor.getToken(), descriptor.getJobId(), descriptor.getPluginName(), false,
                error != null ? error : "unknown error");
    }

    public String getToken() {
        return token;
    }

    public String getJobId() {
        return jobId;
    }

    public String getPluginName() {
        return pluginName;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    /** Failure message; null on success. */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "TaskOutcome(" + token + ", job=" + jobId + ", plugin=" + pluginName + ", "
                + (succeeded ? "success" : "failed: " + error) + ")";
    }
}
