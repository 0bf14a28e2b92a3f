package com.tio.job;

import com.tio.identity.User;
import com.tio.pluginconfig.PluginKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One user submission: an observable, the plugins requested per kind, runtime overrides and the pipeline state.
 * <p>
 * Identity and request fields are immutable. Status, history, warnings and failure are guarded by the
 * job's monitor; status changes go through {@link #transition(JobStatus, JobStatus)}, a compare-and-set,
 * so concurrent or duplicate transition deliveries cannot move a job twice.
 */
public final class Job {

    private final String id;
    private final User user;
    private final Observable observable;
    private final Map<PluginKind, Set<String>> requestedPlugins;
    private final RuntimeConfiguration runtimeConfiguration;
    private final Instant createdAt;

    private JobStatus status = JobStatus.PENDING;
    private final List<StatusChange> history = new ArrayList<>();
    private final List<RejectionReason> warnings = new ArrayList<>();
    private JobFailure failure;

    private Job(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.user = b.user;
        this.observable = Objects.requireNonNull(b.observable, "observable");
        Map<PluginKind, Set<String>> requested = new EnumMap<>(PluginKind.class);
        for (Map.Entry<PluginKind, Set<String>> e : b.requestedPlugins.entrySet()) {
            requested.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        this.requestedPlugins = Collections.unmodifiableMap(requested);
        this.runtimeConfiguration = b.runtimeConfiguration != null ? b.runtimeConfiguration : RuntimeConfiguration.empty();
        this.createdAt = Instant.now();
        this.history.add(new StatusChange(null, JobStatus.PENDING, createdAt));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    /** Requesting user; null for system jobs. */
    public User getUser() {
        return user;
    }

    public Observable getObservable() {
        return observable;
    }

    /**
     * Plugin names explicitly requested for a kind. Empty means every runnable plugin of that kind.
     */
    public Set<String> getRequestedPlugins(PluginKind kind) {
        return requestedPlugins.getOrDefault(kind, Set.of());
    }

    public RuntimeConfiguration getRuntimeConfiguration() {
        return runtimeConfiguration;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized List<StatusChange> getHistory() {
        return List.copyOf(history);
    }

    public synchronized List<RejectionReason> getWarnings() {
        return List.copyOf(warnings);
    }

    /** Failure record; null unless the job is FAILED. */
    public synchronized JobFailure getFailure() {
        return failure;
    }

    /**
     * Moves the job from {@code expected} to {@code target} if it is still in {@code expected}
     * and the move is allowed.
     *
     * @return true if the status changed
     */
    public synchronized boolean transition(JobStatus expected, JobStatus target) {
        if (status != expected || !status.canTransitionTo(target)) {
            return false;
        }
        history.add(new StatusChange(status, target, Instant.now()));
        status = target;
        return true;
    }

    /**
     * Marks the job FAILED from any non-terminal status.
     *
     * @return true if the job was not already terminal
     */
    public synchronized boolean fail(String reason, String correlationId) {
        if (status.isTerminal()) {
            return false;
        }
        history.add(new StatusChange(status, JobStatus.FAILED, Instant.now()));
        status = JobStatus.FAILED;
        failure = new JobFailure(reason, correlationId, Instant.now());
        return true;
    }

    public synchronized void addWarning(RejectionReason reason) {
        warnings.add(Objects.requireNonNull(reason, "reason"));
    }

    @Override
    public String toString() {
        return "Job(" + id + ", " + observable + ", status=" + getStatus() + ")";
    }

    public static final class Builder {
        private String id;
        private User user;
        private Observable observable;
        private final Map<PluginKind, Set<String>> requestedPlugins = new EnumMap<>(PluginKind.class);
        private RuntimeConfiguration runtimeConfiguration;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder user(User user) {
            this.user = user;
            return this;
        }

        public Builder observable(Observable observable) {
            this.observable = observable;
            return this;
        }

        public Builder requestPlugins(PluginKind kind, String... names) {
            Set<String> set = requestedPlugins.computeIfAbsent(kind, k -> new LinkedHashSet<>());
            Collections.addAll(set, names);
            return this;
        }

        public Builder runtimeConfiguration(RuntimeConfiguration runtimeConfiguration) {
            this.runtimeConfiguration = runtimeConfiguration;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
