package com.tio.report;

import com.tio.pluginconfig.PluginRef;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of running one plugin for one job. A job has at most one report per plugin; the task id is the
 * idempotency token of the task that produced it.
 * <p>
 * Instances are immutable. {@link #running}, {@link #succeeded} and {@link #failed} return the next state.
 */
public final class PluginReport {

    private final String jobId;
    private final PluginRef plugin;
    private final ReportStatus status;
    private final Map<String, Object> report;
    private final List<String> errors;
    private final Instant startTime;
    private final Instant endTime;
    private final String taskId;

    private PluginReport(Builder b) {
        this.jobId = Objects.requireNonNull(b.jobId, "jobId");
        this.plugin = Objects.requireNonNull(b.plugin, "plugin");
        this.status = b.status != null ? b.status : ReportStatus.PENDING;
        this.report = Collections.unmodifiableMap(new LinkedHashMap<>(b.report));
        this.errors = List.copyOf(b.errors);
        this.startTime = b.startTime;
        this.endTime = b.endTime;
        this.taskId = b.taskId;
    }

    public static Builder builder(String jobId, PluginRef plugin) {
        return new Builder(jobId, plugin);
    }

    /** A PENDING report for a task that was submitted but has not started. */
    public static PluginReport pending(String jobId, PluginRef plugin, String taskId) {
        return builder(jobId, plugin).taskId(taskId).build();
    }

    public PluginReport running(Instant startTime) {
        return toBuilder().status(ReportStatus.RUNNING).startTime(startTime).build();
    }

    public PluginReport succeeded(Map<String, Object> report, Instant endTime) {
        return toBuilder().status(ReportStatus.SUCCESS).report(report).endTime(endTime).build();
    }

    public PluginReport failed(String error, Instant endTime) {
        Builder b = toBuilder().status(ReportStatus.FAILED).endTime(endTime);
        if (error != null) b.error(error);
        return b.build();
    }

    public String getJobId() {
        return jobId;
    }

    public PluginRef getPlugin() {
        return plugin;
    }

    public ReportStatus getStatus() {
        return status;
    }

    public Map<String, Object> getReport() {
        return report;
    }

    public List<String> getErrors() {
        return errors;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public String getTaskId() {
        return taskId;
    }

    /** Time between start and end; zero until both are known. */
    public Duration getProcessTime() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    public Builder toBuilder() {
        Builder b = new Builder(jobId, plugin);
        b.status = status;
        b.report.putAll(report);
        b.errors.addAll(errors);
        b.startTime = startTime;
        b.endTime = endTime;
        b.taskId = taskId;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginReport that = (PluginReport) o;
        return jobId.equals(that.jobId) && plugin.equals(that.plugin) && status == that.status
                && report.equals(that.report) && errors.equals(that.errors)
                && Objects.equals(startTime, that.startTime) && Objects.equals(endTime, that.endTime)
                && Objects.equals(taskId, that.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, plugin, status, taskId);
    }

    @Override
    public String toString() {
        return "PluginReport{jobId=" + jobId + ", plugin=" + plugin + ", status=" + status
                + ", errors=" + errors.size() + ", taskId=" + taskId + "}";
    }

    public static final class Builder {
        private final String jobId;
        private final PluginRef plugin;
        private ReportStatus status = ReportStatus.PENDING;
        private final Map<String, Object> report = new LinkedHashMap<>();
        private final List<String> errors = new ArrayList<>();
        private Instant startTime;
        private Instant endTime;
        private String taskId;

        private Builder(String jobId, PluginRef plugin) {
            this.jobId = jobId;
            this.plugin = plugin;
        }

        public Builder status(ReportStatus status) {
            this.status = status;
            return this;
        }

        public Builder report(Map<String, Object> report) {
            this.report.clear();
            if (report != null) this.report.putAll(report);
            return this;
        }

        public Builder error(String error) {
            this.errors.add(Objects.requireNonNull(error, "error"));
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors.clear();
            if (errors != null) this.errors.addAll(errors);
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public PluginReport build() {
            return new PluginReport(this);
        }
    }
}
