package com.tio.pipeline;

import com.tio.config.QueueSettings;
import com.tio.dispatch.TaskDescriptor;
import com.tio.dispatch.TaskOutcome;
import com.tio.dispatch.TaskSignatureBuilder;
import com.tio.dispatch.TaskType;
import com.tio.identity.OrganizationDirectory;
import com.tio.identity.User;
import com.tio.job.InMemoryJobStore;
import com.tio.job.Job;
import com.tio.job.JobStatus;
import com.tio.job.Observable;
import com.tio.job.RejectionReason;
import com.tio.job.StatusChange;
import com.tio.parameters.InMemoryParameterStore;
import com.tio.parameters.ParameterResolver;
import com.tio.plugin.PluginHandlerRegistry;
import com.tio.pluginconfig.AnalyzerAttributes;
import com.tio.pluginconfig.ObservableClassification;
import com.tio.pluginconfig.ParameterType;
import com.tio.pluginconfig.PivotAttributes;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginKind;
import com.tio.registry.PluginConfigRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobPipelineCoordinatorTest {

    private static final User ALICE = User.of("alice");

    private PluginHandlerRegistry handlers;
    private PluginConfigRegistry registry;
    private RecordingSubmitter submitter;
    private SimpleMeterRegistry meters;
    private InMemoryJobStore jobs;
    private JobPipelineCoordinator coordinator;

    @BeforeEach
    void setUp() {
        handlers = new PluginHandlerRegistry();
        registry = new PluginConfigRegistry(handlers,
                new ParameterResolver(new InMemoryParameterStore(), OrganizationDirectory.NONE),
                QueueSettings.defaults());
        submitter = new RecordingSubmitter();
        meters = new SimpleMeterRegistry();
        jobs = new InMemoryJobStore();
        coordinator = new JobPipelineCoordinator(jobs, registry, new TaskSignatureBuilder(registry, 10), submitter,
                new DispatchMetrics(meters));
    }

    private void plugin(PluginKind kind, String name) {
        plugin(PluginConfiguration.builder(kind, name).entryPoint("test." + name));
    }

    private void plugin(PluginConfiguration.Builder builder) {
        PluginConfiguration config = builder.build();
        handlers.register(config.getEntryPoint(), config.getKind(), "1.0", invocation -> Map.of());
        registry.registerOrThrow(config);
    }

    private static Job domainJob() {
        return Job.builder()
                .user(ALICE)
                .observable(Observable.of("example.com", ObservableClassification.DOMAIN))
                .build();
    }

    private void finishAll(Job job, PluginKind kind, boolean succeeded) {
        for (String token : coordinator.progress(job.getId(), kind).orElseThrow().getSubmittedTokens()) {
            TaskDescriptor d = submitter.submitted.stream().filter(s -> s.getToken().equals(token)).findFirst().orElseThrow();
            coordinator.onTaskFinished(succeeded ? TaskOutcome.success(d) : TaskOutcome.failure(d, "boom"));
        }
    }

    @Test
    void start_transitionDependsOnEveryStageTask() {
        plugin(PluginKind.ANALYZER, "A1");
        plugin(PluginKind.ANALYZER, "A2");
        plugin(PluginKind.ANALYZER, "A3");

        Job job = coordinator.start(domainJob());

        assertEquals(JobStatus.ANALYZERS_RUNNING, job.getStatus());
        List<TaskDescriptor> runs = submitter.ofType(TaskType.PLUGIN_RUN);
        assertEquals(3, runs.size());
        TaskDescriptor transition = submitter.lastTransition();
        assertEquals(JobStatus.ANALYZERS_COMPLETED, transition.getTargetStatus());
        assertEquals(runs.stream().map(TaskDescriptor::getToken).collect(Collectors.toSet()),
                transition.getDependencies());
        assertEquals(4, submitter.submitted.size());
        assertEquals(TaskType.STAGE_TRANSITION, submitter.submitted.get(3).getType());
    }

    @Test
    void start_nonRunnablePluginsBecomeWarnings() {
        plugin(PluginKind.ANALYZER, "Ready");
        plugin(PluginConfiguration.builder(PluginKind.ANALYZER, "NeedsKey").entryPoint("test.NeedsKey")
                .parameter("api_key", ParameterType.STRING, true, true));
        plugin(PluginConfiguration.builder(PluginKind.ANALYZER, "Off").entryPoint("test.Off").disabled(true));

        Job job = coordinator.start(domainJob());

        assertEquals(1, submitter.ofType(TaskType.PLUGIN_RUN).size());
        assertEquals(Set.of(submitter.forPlugin("Ready").getToken()), submitter.lastTransition().getDependencies());
        Set<RejectionReason.Cause> causes = job.getWarnings().stream().map(RejectionReason::getCause)
                .collect(Collectors.toSet());
        assertEquals(Set.of(RejectionReason.Cause.PARAMETER_NOT_CONFIGURED, RejectionReason.Cause.DISABLED), causes);
        assertEquals(2.0, meters.get(DispatchMetrics.PLUGINS_SKIPPED).counters().stream()
                .mapToDouble(c -> c.count()).sum());
    }

    @Test
    void start_unsupportedObservableIsSkipped() {
        plugin(PluginConfiguration.builder(PluginKind.ANALYZER, "IpOnly").entryPoint("test.IpOnly")
                .analyzerAttributes(new AnalyzerAttributes(AnalyzerAttributes.AnalyzerType.OBSERVABLE,
                        Set.of(ObservableClassification.IP), Set.of(), Set.of())));

        Job job = coordinator.start(domainJob());

        assertTrue(submitter.ofType(TaskType.PLUGIN_RUN).isEmpty());
        assertEquals(RejectionReason.Cause.UNSUPPORTED_OBSERVABLE, job.getWarnings().get(0).getCause());
        assertTrue(submitter.lastTransition().getDependencies().isEmpty());
    }

    @Test
    void start_onlyRequestedPluginsRunAndUnknownNamesAreReported() {
        plugin(PluginKind.ANALYZER, "A1");
        plugin(PluginKind.ANALYZER, "A2");
        Job job = Job.builder()
                .user(ALICE)
                .observable(Observable.of("example.com", ObservableClassification.DOMAIN))
                .requestPlugins(PluginKind.ANALYZER, "A2", "Nope")
                .build();

        coordinator.start(job);

        assertEquals(List.of("A2"), submitter.ofType(TaskType.PLUGIN_RUN).stream()
                .map(TaskDescriptor::getPluginName).collect(Collectors.toList()));
        assertEquals(RejectionReason.Cause.NOT_REGISTERED, job.getWarnings().get(0).getCause());
    }

    @Test
    void start_twiceThrows() {
        Job job = coordinator.start(domainJob());

        assertThrows(IllegalStateException.class, () -> coordinator.start(job));
    }

    @Test
    void advance_runsEveryStageToCompletion() {
        plugin(PluginKind.ANALYZER, "A1");
        plugin(PluginKind.CONNECTOR, "C1");
        plugin(PluginKind.VISUALIZER, "V1");
        Job job = coordinator.start(domainJob());

        finishAll(job, PluginKind.ANALYZER, true);
        assertTrue(coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED));
        assertEquals(JobStatus.CONNECTORS_RUNNING, job.getStatus());
        assertEquals(JobStatus.CONNECTORS_COMPLETED, submitter.lastTransition().getTargetStatus());

        finishAll(job, PluginKind.CONNECTOR, true);
        assertTrue(coordinator.advance(job.getId(), JobStatus.CONNECTORS_COMPLETED));
        assertEquals(JobStatus.VISUALIZERS_RUNNING, job.getStatus());

        finishAll(job, PluginKind.VISUALIZER, true);
        assertTrue(coordinator.advance(job.getId(), JobStatus.VISUALIZERS_COMPLETED));

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(List.of(JobStatus.PENDING, JobStatus.ANALYZERS_RUNNING, JobStatus.ANALYZERS_COMPLETED,
                        JobStatus.CONNECTORS_RUNNING, JobStatus.CONNECTORS_COMPLETED, JobStatus.VISUALIZERS_RUNNING,
                        JobStatus.VISUALIZERS_COMPLETED, JobStatus.COMPLETED),
                job.getHistory().stream().map(StatusChange::getTo).collect(Collectors.toList()));
        assertEquals(3, submitter.ofType(TaskType.PLUGIN_RUN).size());
        assertEquals(3, submitter.ofType(TaskType.STAGE_TRANSITION).size());
    }

    @Test
    void advance_duplicateDeliveryIsIgnored() {
        plugin(PluginKind.CONNECTOR, "C1");
        Job job = coordinator.start(domainJob());

        assertTrue(coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED));
        int afterFirst = submitter.submitted.size();
        assertFalse(coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED));

        assertEquals(afterFirst, submitter.submitted.size());
        assertEquals(JobStatus.CONNECTORS_RUNNING, job.getStatus());
    }

    @Test
    void advance_emptyStagesStillAdvance() {
        Job job = coordinator.start(domainJob());

        coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED);
        coordinator.advance(job.getId(), JobStatus.CONNECTORS_COMPLETED);
        coordinator.advance(job.getId(), JobStatus.VISUALIZERS_COMPLETED);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertTrue(submitter.ofType(TaskType.STAGE_TRANSITION).stream().allMatch(d -> d.getDependencies().isEmpty()));
    }

    @Test
    void advance_rejectsNonCompletionTarget() {
        Job job = coordinator.start(domainJob());

        assertThrows(IllegalArgumentException.class, () -> coordinator.advance(job.getId(), JobStatus.COMPLETED));
        assertFalse(coordinator.advance("missing", JobStatus.ANALYZERS_COMPLETED));
    }

    @Test
    void onTaskFinished_failureIsNotFatal() {
        plugin(PluginKind.ANALYZER, "A1");
        plugin(PluginKind.ANALYZER, "A2");
        Job job = coordinator.start(domainJob());

        coordinator.onTaskFinished(TaskOutcome.failure(submitter.forPlugin("A1"), "timeout"));
        coordinator.onTaskFinished(TaskOutcome.success(submitter.forPlugin("A2")));
        coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED);

        StageProgress analyzers = coordinator.progress(job.getId(), PluginKind.ANALYZER).orElseThrow();
        assertEquals(Map.of("A1", "timeout"), analyzers.getFailedPlugins());
        assertEquals(Set.of("A2"), analyzers.getSucceededPlugins());
        assertEquals(0, analyzers.getPendingCount());
        assertEquals(JobStatus.CONNECTORS_RUNNING, job.getStatus());
    }

    @Test
    void submission_partialFailureRecordedAndExcludedFromDependencies() {
        plugin(PluginKind.ANALYZER, "A1");
        plugin(PluginKind.ANALYZER, "A2");
        submitter.failWhen = d -> "A1".equals(d.getPluginName());

        Job job = coordinator.start(domainJob());

        assertEquals(JobStatus.ANALYZERS_RUNNING, job.getStatus());
        assertEquals(Set.of(submitter.forPlugin("A2").getToken()), submitter.lastTransition().getDependencies());
        assertEquals(RejectionReason.Cause.SUBMISSION_FAILED, job.getWarnings().get(0).getCause());
        assertEquals(1.0, meters.get(DispatchMetrics.SUBMIT_FAILURES).counter().count());
    }

    @Test
    void submission_everyTaskFailingFailsTheJob() {
        plugin(PluginKind.ANALYZER, "A1");
        submitter.failWhen = d -> d.getType() == TaskType.PLUGIN_RUN;

        Job job = coordinator.start(domainJob());

        assertEquals(JobStatus.FAILED, job.getStatus());
        assertNotNull(job.getFailure().getCorrelationId());
        assertEquals(JobPipelineCoordinator.DISPATCH_FAILURE_REASON, job.getFailure().getReason());
        assertNull(submitter.lastTransition());
    }

    @Test
    void submission_transitionFailureFailsTheJob() {
        plugin(PluginKind.ANALYZER, "A1");
        submitter.failWhen = d -> d.getType() == TaskType.STAGE_TRANSITION;

        Job job = coordinator.start(domainJob());

        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(1, submitter.ofType(TaskType.PLUGIN_RUN).size());
    }

    @Test
    void cancel_stopsFurtherStages() {
        plugin(PluginKind.CONNECTOR, "C1");
        Job job = coordinator.start(domainJob());

        assertTrue(coordinator.cancel(job.getId()));
        assertFalse(coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED));

        assertEquals(JobStatus.FAILED, job.getStatus());
        assertTrue(submitter.ofType(TaskType.PLUGIN_RUN).isEmpty());
        assertFalse(coordinator.cancel(job.getId()));
    }

    @Test
    void cancel_duringStageSubmissionStopsRemainingTasks() {
        plugin(PluginKind.ANALYZER, "A1");
        plugin(PluginKind.ANALYZER, "A2");
        plugin(PluginKind.ANALYZER, "A3");
        Job job = domainJob();
        submitter.afterSubmit = d -> coordinator.cancel(job.getId());

        coordinator.start(job);

        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(JobPipelineCoordinator.CANCELLED_REASON, job.getFailure().getReason());
        assertEquals(1, submitter.submitted.size());
        assertNull(submitter.lastTransition());
    }

    @Test
    void progress_releasedOnceJobCompletes() {
        plugin(PluginKind.ANALYZER, "A1");
        Job job = coordinator.start(domainJob());
        finishAll(job, PluginKind.ANALYZER, true);

        coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED);
        coordinator.advance(job.getId(), JobStatus.CONNECTORS_COMPLETED);
        assertTrue(coordinator.progress(job.getId(), PluginKind.ANALYZER).isPresent());
        coordinator.advance(job.getId(), JobStatus.VISUALIZERS_COMPLETED);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        for (PluginKind kind : PluginKind.values()) {
            assertTrue(coordinator.progress(job.getId(), kind).isEmpty(), kind.name());
        }
        coordinator.onTaskFinished(TaskOutcome.success(submitter.forPlugin("A1")));
        assertTrue(coordinator.progress(job.getId(), PluginKind.ANALYZER).isEmpty());
    }

    @Test
    void progress_releasedOnFailureAndCancel() {
        plugin(PluginKind.ANALYZER, "A1");
        submitter.failWhen = d -> d.getType() == TaskType.PLUGIN_RUN;
        Job failed = coordinator.start(domainJob());

        submitter.failWhen = d -> false;
        Job cancelled = coordinator.start(domainJob());
        coordinator.cancel(cancelled.getId());

        assertTrue(coordinator.progress(failed.getId(), PluginKind.ANALYZER).isEmpty());
        assertTrue(coordinator.progress(cancelled.getId(), PluginKind.ANALYZER).isEmpty());
    }

    @Test
    void pivots_followSuccessfulRelatedPluginOutsideDependencies() {
        plugin(PluginKind.ANALYZER, "Validin");
        plugin(PluginKind.CONNECTOR, "C1");
        plugin(PluginConfiguration.builder(PluginKind.PIVOT, "ResolveDomain").entryPoint("test.ResolveDomain")
                .pivotAttributes(new PivotAttributes(Set.of("Validin"))));
        Job job = coordinator.start(domainJob());

        finishAll(job, PluginKind.ANALYZER, true);
        coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED);

        TaskDescriptor pivot = submitter.forPlugin("ResolveDomain");
        assertNotNull(pivot);
        assertNull(pivot.getStageKind());
        assertFalse(submitter.lastTransition().getDependencies().contains(pivot.getToken()));
        assertEquals(Set.of("ResolveDomain"),
                coordinator.progress(job.getId(), PluginKind.PIVOT).orElseThrow().getDispatchedPlugins());

        finishAll(job, PluginKind.CONNECTOR, true);
        coordinator.advance(job.getId(), JobStatus.CONNECTORS_COMPLETED);
        assertEquals(1, submitter.submitted.stream().filter(d -> "ResolveDomain".equals(d.getPluginName())).count());
    }

    @Test
    void pivots_notTriggeredWhenRelatedPluginFailed() {
        plugin(PluginKind.ANALYZER, "Validin");
        plugin(PluginConfiguration.builder(PluginKind.PIVOT, "ResolveDomain").entryPoint("test.ResolveDomain")
                .pivotAttributes(new PivotAttributes(Set.of("Validin"))));
        Job job = coordinator.start(domainJob());

        finishAll(job, PluginKind.ANALYZER, false);
        coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED);

        assertNull(submitter.forPlugin("ResolveDomain"));
    }

    @Test
    void metrics_countSubmissionsAndTransitions() {
        plugin(PluginKind.ANALYZER, "A1");
        plugin(PluginKind.ANALYZER, "A2");
        Job job = coordinator.start(domainJob());
        coordinator.advance(job.getId(), JobStatus.ANALYZERS_COMPLETED);

        assertEquals(2.0, meters.get(DispatchMetrics.TASKS_SUBMITTED).tag("kind", "analyzer").counter().count());
        assertEquals(1.0, meters.get(DispatchMetrics.STAGE_TRANSITIONS).tag("target", "analyzers_completed")
                .counter().count());
    }
}
