package com.tio.pipeline;

import com.tio.dispatch.PluginNotRunnableException;
import com.tio.dispatch.TaskCompletionListener;
import com.tio.dispatch.TaskDescriptor;
import com.tio.dispatch.TaskOutcome;
import com.tio.dispatch.TaskSignatureBuilder;
import com.tio.dispatch.TaskSubmitter;
import com.tio.job.Job;
import com.tio.job.JobStatus;
import com.tio.job.JobStore;
import com.tio.job.Observable;
import com.tio.job.RejectionReason;
import com.tio.parameters.ParameterNotConfiguredException;
import com.tio.parameters.ParameterResolver;
import com.tio.pluginconfig.AnalyzerAttributes;
import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginRef;
import com.tio.registry.PluginConfigRegistry;
import com.tio.registry.RunnabilityCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives a job through its stages: analyzers, then connectors, then visualizers.
 * <p>
 * Entering a stage submits one task per runnable plugin of that kind, then one stage-transition task that
 * depends on exactly those tasks. When the transition runs, the worker calls {@link #advance}, which moves the
 * job to the stage's completed status and starts the next stage. Plugins that cannot run are recorded as job
 * warnings and skipped; plugin failures never fail the job. Pivots are submitted after the analyzer and
 * connector stages and are not dependencies of any transition.
 * <p>
 * Status changes are compare-and-set on the job, so duplicate or concurrent transition deliveries are ignored.
 */
public final class JobPipelineCoordinator implements TaskCompletionListener {

    private static final Logger log = LoggerFactory.getLogger(JobPipelineCoordinator.class);

    static final String DISPATCH_FAILURE_REASON = "Job could not be dispatched to the worker pool";
    static final String CANCELLED_REASON = "Job cancelled";

    private final JobStore jobs;
    private final PluginConfigRegistry registry;
    private final ParameterResolver resolver;
    private final TaskSignatureBuilder signatures;
    private final TaskSubmitter submitter;
    private final DispatchMetrics metrics;
    private final Map<String, Map<PluginKind, StageProgress>> progressByJob = new ConcurrentHashMap<>();

    public JobPipelineCoordinator(JobStore jobs, PluginConfigRegistry registry, TaskSignatureBuilder signatures,
                                  TaskSubmitter submitter, DispatchMetrics metrics) {
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = registry.getResolver();
        this.signatures = Objects.requireNonNull(signatures, "signatures");
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.metrics = metrics != null ? metrics : new DispatchMetrics(null);
    }

    /**
     * Persists the job and starts the analyzer stage.
     *
     * @throws IllegalStateException if the job is not PENDING
     */
    public Job start(Job job) {
        Objects.requireNonNull(job, "job");
        jobs.save(job);
        if (!job.transition(JobStatus.PENDING, JobStatus.ANALYZERS_RUNNING)) {
            throw new IllegalStateException("Job " + job.getId() + " already started (status " + job.getStatus() + ")");
        }
        log.info("Job {} started for {}", job.getId(), job.getObservable());
        enterStage(job, PluginKind.ANALYZER);
        return job;
    }

    @Override
    public void onTaskFinished(TaskOutcome outcome) {
        Map<PluginKind, StageProgress> stages = progressByJob.get(outcome.getJobId());
        boolean known = false;
        if (stages != null) {
            for (StageProgress stage : stages.values()) {
                if (stage.record(outcome)) {
                    known = true;
                    break;
                }
            }
        }
        if (!known) {
            // e.g. a pivot finishing after its job completed
            log.debug("Outcome for unknown task {} of job {} ignored", outcome.getToken(), outcome.getJobId());
        } else if (outcome.isSucceeded()) {
            log.debug("Job {}: plugin {} finished", outcome.getJobId(), outcome.getPluginName());
        } else {
            log.warn("Job {}: plugin {} failed: {}", outcome.getJobId(), outcome.getPluginName(), outcome.getError());
        }
    }

    /**
     * Runs a stage transition: moves the job to {@code target} (a stage's completed status) and starts what
     * follows. Duplicate deliveries and transitions of FAILED jobs are ignored.
     *
     * @return true if this call moved the job
     * @throws IllegalArgumentException if {@code target} is not a completed-stage status
     */
    public boolean advance(String jobId, JobStatus target) {
        if (target == null || !target.isCompletedStage()) {
            throw new IllegalArgumentException("Not a stage completion status: " + target);
        }
        Optional<Job> found = jobs.find(jobId);
        if (found.isEmpty()) {
            log.warn("Stage transition for unknown job {} ignored", jobId);
            return false;
        }
        Job job = found.get();
        PluginKind kind = target.stageKind();
        if (!job.transition(JobStatus.runningFor(kind), target)) {
            log.debug("Job {}: transition to {} ignored (status {})", jobId, target, job.getStatus());
            return false;
        }
        metrics.stageTransition(target);
        log.info("Job {} -> {}", jobId, target);

        switch (target) {
            case ANALYZERS_COMPLETED:
                submitPivots(job, kind);
                startStage(job, target, PluginKind.CONNECTOR);
                break;
            case CONNECTORS_COMPLETED:
                submitPivots(job, kind);
                startStage(job, target, PluginKind.VISUALIZER);
                break;
            default:
                if (job.transition(JobStatus.VISUALIZERS_COMPLETED, JobStatus.COMPLETED)) {
                    metrics.stageTransition(JobStatus.COMPLETED);
                    release(jobId);
                    log.info("Job {} completed", jobId);
                }
                break;
        }
        return true;
    }

    /**
     * Marks the job FAILED. No further stage is started; already-submitted tasks are not recalled.
     *
     * @return true if the job was cancelled by this call
     */
    public boolean cancel(String jobId) {
        Optional<Job> job = jobs.find(jobId);
        if (job.isEmpty()) {
            return false;
        }
        boolean cancelled = job.get().fail(CANCELLED_REASON, UUID.randomUUID().toString());
        if (cancelled) {
            release(jobId);
            log.info("Job {} cancelled", jobId);
        }
        return cancelled;
    }

    /** Progress of a stage (or of the job's pivots) for a job; empty once the job is COMPLETED or FAILED. */
    public Optional<StageProgress> progress(String jobId, PluginKind kind) {
        Map<PluginKind, StageProgress> stages = progressByJob.get(jobId);
        return stages != null ? Optional.ofNullable(stages.get(kind)) : Optional.empty();
    }

    private void startStage(Job job, JobStatus from, PluginKind kind) {
        if (!job.transition(from, JobStatus.runningFor(kind))) {
            log.debug("Job {}: stage {} not started (status {})", job.getId(), kind, job.getStatus());
            return;
        }
        enterStage(job, kind);
    }

    private void enterStage(Job job, PluginKind kind) {
        StageProgress stage = stageOf(job.getId(), kind);
        List<TaskDescriptor> descriptors = new ArrayList<>();
        for (PluginConfiguration plugin : selectPlugins(job, kind, true)) {
            buildTask(job, plugin).ifPresent(descriptors::add);
        }

        Set<String> submitted = new LinkedHashSet<>();
        for (TaskDescriptor d : descriptors) {
            if (stopped(job, kind)) return;
            if (submit(job, stage, d)) {
                submitted.add(d.getToken());
            }
        }
        if (stopped(job, kind)) return;
        if (!descriptors.isEmpty() && submitted.isEmpty()) {
            failJob(job, "no " + kind.getPluralKey() + " task could be submitted");
            return;
        }

        TaskDescriptor transition = signatures.buildStageTransition(job, JobStatus.completedFor(kind), submitted);
        try {
            submitter.submit(transition);
            stage.setTransitionToken(transition.getToken());
            log.info("Job {}: submitted {} {} task(s) and transition {}", job.getId(), submitted.size(),
                    kind.getPluralKey(), transition.getToken());
        } catch (RuntimeException e) {
            metrics.submitFailed(null);
            failJob(job, "stage transition to " + transition.getTargetStatus() + " could not be submitted: "
                    + e.getMessage());
        }
    }

    /** A job failed or cancelled while its stage was being entered gets no further submissions. */
    private static boolean stopped(Job job, PluginKind kind) {
        if (!job.getStatus().isTerminal()) {
            return false;
        }
        log.info("Job {} is {}; remaining {} submissions dropped", job.getId(), job.getStatus(), kind.getPluralKey());
        return true;
    }

    /**
     * Requested plugins of the kind, or every registered one when none were requested.
     *
     * @param warnUnknown record a warning for requested names that are not registered
     */
    private List<PluginConfiguration> selectPlugins(Job job, PluginKind kind, boolean warnUnknown) {
        Set<String> requested = job.getRequestedPlugins(kind);
        if (requested.isEmpty()) {
            return registry.all(kind);
        }
        List<PluginConfiguration> selected = new ArrayList<>();
        for (String name : requested) {
            Optional<PluginConfiguration> plugin = registry.get(name).filter(p -> p.getKind() == kind);
            if (plugin.isPresent()) {
                selected.add(plugin.get());
            } else if (warnUnknown) {
                skip(job, RejectionReason.of(PluginRef.of(kind, name), RejectionReason.Cause.NOT_REGISTERED,
                        "no " + kind.name().toLowerCase() + " named " + name));
            }
        }
        return selected;
    }

    /** Builds the plugin's task, or records why it is skipped. */
    private Optional<TaskDescriptor> buildTask(Job job, PluginConfiguration plugin) {
        if (plugin.getKind() == PluginKind.ANALYZER && !supports(plugin.getAnalyzerAttributes(), job.getObservable())) {
            skip(job, RejectionReason.of(plugin.getRef(), RejectionReason.Cause.UNSUPPORTED_OBSERVABLE,
                    "analyzer does not support " + job.getObservable()));
            return Optional.empty();
        }
        RunnabilityCheck check = registry.checkRunnable(plugin, job.getUser());
        if (!check.isRunnable()) {
            skip(job, check.getRejection());
            return Optional.empty();
        }
        try {
            Map<Parameter, Object> params = resolver.readParams(plugin, job);
            return Optional.of(signatures.build(plugin, job, params));
        } catch (ParameterNotConfiguredException e) {
            skip(job, new RejectionReason(plugin.getRef(), e.getParameter().getName(),
                    RejectionReason.Cause.PARAMETER_NOT_CONFIGURED, e.getMessage()));
        } catch (PluginNotRunnableException e) {
            skip(job, e.getReason());
        }
        return Optional.empty();
    }

    private static boolean supports(AnalyzerAttributes attributes, Observable observable) {
        if (attributes == null) return true;
        return observable.isFile()
                ? attributes.supportsFile(observable.getMimeType())
                : attributes.supportsObservable(observable.getClassification());
    }

    private boolean submit(Job job, StageProgress stage, TaskDescriptor d) {
        stage.expect(d.getToken(), d.getPluginName());
        try {
            submitter.submit(d);
            metrics.taskSubmitted(stage.getKind());
            return true;
        } catch (RuntimeException e) {
            stage.forget(d.getToken());
            metrics.submitFailed(stage.getKind());
            log.error("Job {}: submission of {} failed: {}", job.getId(), d.getPluginName(), e.getMessage(), e);
            job.addWarning(RejectionReason.of(PluginRef.of(stage.getKind(), d.getPluginName()),
                    RejectionReason.Cause.SUBMISSION_FAILED, "task could not be submitted"));
            return false;
        }
    }

    /**
     * Submits pivots related to the plugins that succeeded in the finished stage. Nothing depends on them;
     * failures are warnings.
     */
    private void submitPivots(Job job, PluginKind finishedKind) {
        StageProgress finished = stageOf(job.getId(), finishedKind);
        Set<String> succeeded = finished.getSucceededPlugins();
        StageProgress pivots = stageOf(job.getId(), PluginKind.PIVOT);
        Set<String> dispatched = pivots.getDispatchedPlugins();
        boolean firstTrigger = finishedKind == PluginKind.ANALYZER;
        for (PluginConfiguration pivot : selectPlugins(job, PluginKind.PIVOT, firstTrigger)) {
            if (dispatched.contains(pivot.getName())) continue;
            boolean triggered = succeeded.stream().anyMatch(pivot.getPivotAttributes()::isTriggeredBy);
            if (!triggered) continue;
            buildTask(job, pivot).ifPresent(d -> submit(job, pivots, d));
        }
    }

    private void skip(Job job, RejectionReason reason) {
        job.addWarning(reason);
        metrics.pluginSkipped(reason.getPlugin().getKind(), reason.getCause());
        log.info("Job {}: skipping {}", job.getId(), reason);
    }

    private void failJob(Job job, String detail) {
        String correlationId = UUID.randomUUID().toString();
        if (job.fail(DISPATCH_FAILURE_REASON, correlationId)) {
            log.error("Job {} failed (correlationId={}): {}", job.getId(), correlationId, detail);
            release(job.getId());
        }
    }

    /** Drops the progress of a job that reached a terminal status. Later outcomes for it are ignored. */
    private void release(String jobId) {
        if (progressByJob.remove(jobId) != null) {
            log.debug("Job {}: stage progress released", jobId);
        }
    }

    private StageProgress stageOf(String jobId, PluginKind kind) {
        return progressByJob
                .computeIfAbsent(jobId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(kind, StageProgress::new);
    }
}
