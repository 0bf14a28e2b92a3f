package com.tio.worker;

import com.tio.dispatch.TaskDescriptor;
import com.tio.dispatch.TaskOutcome;
import com.tio.dispatch.TaskType;
import com.tio.job.Job;
import com.tio.job.JobStore;
import com.tio.job.Observable;
import com.tio.pipeline.JobPipelineCoordinator;
import com.tio.plugin.EntryPointLoader;
import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginInvocation;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginRef;
import com.tio.report.PluginReport;
import com.tio.report.ReportStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes one task descriptor on a worker.
 * <p>
 * A plugin run loads the handler behind the descriptor's entry point, invokes it with the descriptor's
 * parameters and the job's observable, writes the plugin report (RUNNING, then SUCCESS or FAILED) and
 * reports the outcome to the coordinator. A stage transition calls {@link JobPipelineCoordinator#advance}.
 * <p>
 * Completion is recorded once per token: after {@link #fail} (e.g. on timeout) a late handler result is dropped,
 * and running a completed token again returns its recorded outcome. Outcomes of a job are released once the job
 * is COMPLETED or FAILED and none of its tasks is still running.
 */
public final class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final EntryPointLoader handlers;
    private final JobStore jobs;
    private final ReportStore reports;
    private final JobPipelineCoordinator coordinator;
    private final Map<String, TaskOutcome> outcomes = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> tokensByJob = new HashMap<>();
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public TaskExecutor(EntryPointLoader handlers, JobStore jobs, ReportStore reports,
                        JobPipelineCoordinator coordinator) {
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.reports = Objects.requireNonNull(reports, "reports");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    }

    /**
     * Runs the task. Never throws for plugin failures; they become a FAILED outcome.
     *
     * @return the outcome, or the recorded outcome if the token already completed
     */
    public TaskOutcome execute(TaskDescriptor descriptor) {
        if (descriptor.getType() == TaskType.STAGE_TRANSITION) {
            return advance(descriptor);
        }
        TaskOutcome earlier = outcomes.get(descriptor.getToken());
        if (earlier != null) {
            log.debug("Task {} already completed; not running it again", descriptor.getToken());
            return earlier;
        }
        running.add(descriptor.getToken());
        try {
            return run(descriptor);
        } finally {
            running.remove(descriptor.getToken());
            releaseIfFinished(descriptor.getJobId());
        }
    }

    private TaskOutcome run(TaskDescriptor descriptor) {
        Optional<Job> job = jobs.find(descriptor.getJobId());
        if (job.isEmpty()) {
            return fail(descriptor, "unknown job " + descriptor.getJobId());
        }
        PluginRef plugin = pluginOf(descriptor);
        PluginReport report = reports.find(descriptor.getJobId(), plugin.getName())
                .filter(r -> descriptor.getToken().equals(r.getTaskId()))
                .orElseGet(() -> PluginReport.pending(descriptor.getJobId(), plugin, descriptor.getToken()))
                .running(Instant.now());
        reports.save(report);

        PluginInvocation invocation = invocationOf(descriptor, plugin, job.get());
        try {
            PluginHandler handler = handlers.load(descriptor.getEntryPoint());
            Map<String, Object> body = handler.run(invocation);
            return complete(descriptor, report.succeeded(body, Instant.now()), TaskOutcome.success(descriptor));
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Plugin {} failed for job {}: {}", plugin, descriptor.getJobId(), error, e);
            return complete(descriptor, report.failed(error, Instant.now()), TaskOutcome.failure(descriptor, error));
        }
    }

    /**
     * Completes a plugin task as FAILED without running it (time limit exceeded, execution rejected).
     * Stage transitions are only logged.
     */
    public TaskOutcome fail(TaskDescriptor descriptor, String error) {
        TaskOutcome outcome = TaskOutcome.failure(descriptor, error);
        if (descriptor.getType() == TaskType.STAGE_TRANSITION) {
            log.error("Stage transition {} of job {} failed: {}", descriptor.getTargetStatus(), descriptor.getJobId(), error);
            return outcome;
        }
        PluginRef plugin = pluginOf(descriptor);
        PluginReport base = reports.find(descriptor.getJobId(), plugin.getName())
                .filter(r -> descriptor.getToken().equals(r.getTaskId()))
                .orElseGet(() -> PluginReport.pending(descriptor.getJobId(), plugin, descriptor.getToken()));
        return complete(descriptor, base.failed(error, Instant.now()), outcome);
    }

    /** Whether the task with this token has completed (successfully or not) and is still tracked. */
    public boolean isCompleted(String token) {
        return outcomes.containsKey(token);
    }

    /** Whether the job is known and COMPLETED or FAILED. */
    public boolean isJobFinished(String jobId) {
        return jobs.find(jobId).map(job -> job.getStatus().isTerminal()).orElse(false);
    }

    /** Number of task outcomes still held. */
    int getTrackedOutcomeCount() {
        return outcomes.size();
    }

    private TaskOutcome complete(TaskDescriptor descriptor, PluginReport report, TaskOutcome outcome) {
        synchronized (tokensByJob) {
            TaskOutcome earlier = outcomes.putIfAbsent(descriptor.getToken(), outcome);
            if (earlier != null) {
                log.debug("Task {} already completed; dropping late {} result", descriptor.getToken(),
                        report.getStatus());
                return earlier;
            }
            tokensByJob.computeIfAbsent(descriptor.getJobId(), id -> new LinkedHashSet<>()).add(descriptor.getToken());
        }
        reports.save(report);
        coordinator.onTaskFinished(outcome);
        releaseIfFinished(descriptor.getJobId());
        return outcome;
    }

    private TaskOutcome advance(TaskDescriptor descriptor) {
        boolean moved = coordinator.advance(descriptor.getJobId(), descriptor.getTargetStatus());
        log.debug("Transition {} for job {}: {}", descriptor.getTargetStatus(), descriptor.getJobId(),
                moved ? "applied" : "ignored");
        releaseIfFinished(descriptor.getJobId());
        return TaskOutcome.success(descriptor);
    }

    private void releaseIfFinished(String jobId) {
        if (!isJobFinished(jobId)) {
            return;
        }
        synchronized (tokensByJob) {
            Set<String> tokens = tokensByJob.get(jobId);
            if (tokens == null) {
                return;
            }
            for (Iterator<String> it = tokens.iterator(); it.hasNext(); ) {
                String token = it.next();
                if (!running.contains(token)) {
                    outcomes.remove(token);
                    it.remove();
                }
            }
            if (tokens.isEmpty()) {
                tokensByJob.remove(jobId);
            }
        }
    }

    /** Stage tasks carry their kind; pivots are submitted outside any stage. */
    static PluginRef pluginOf(TaskDescriptor descriptor) {
        PluginKind kind = descriptor.getStageKind() != null ? descriptor.getStageKind() : PluginKind.PIVOT;
        return PluginRef.of(kind, descriptor.getPluginName());
    }

    private static PluginInvocation invocationOf(TaskDescriptor descriptor, PluginRef plugin, Job job) {
        Observable observable = job.getObservable();
        return new PluginInvocation(descriptor.getJobId(), plugin, descriptor.getParameters(),
                observable.getName(), observable.getClassification(), observable.getMimeType(),
                job.getUser() != null ? job.getUser().getId() : null);
    }
}
