package com.tio.worker.local;

import com.tio.config.QueueSettings;
import com.tio.dispatch.TaskDescriptor;
import com.tio.dispatch.TaskSignatureBuilder;
import com.tio.dispatch.TaskSubmissionException;
import com.tio.dispatch.TaskType;
import com.tio.identity.OrganizationDirectory;
import com.tio.identity.User;
import com.tio.job.InMemoryJobStore;
import com.tio.job.Job;
import com.tio.job.JobStatus;
import com.tio.job.Observable;
import com.tio.parameters.InMemoryParameterStore;
import com.tio.parameters.ParameterResolver;
import com.tio.pipeline.DispatchMetrics;
import com.tio.pipeline.JobPipelineCoordinator;
import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginHandlerRegistry;
import com.tio.pluginconfig.ObservableClassification;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginSettings;
import com.tio.registry.PluginConfigRegistry;
import com.tio.report.InMemoryReportStore;
import com.tio.report.PluginReport;
import com.tio.report.ReportStatus;
import com.tio.worker.TaskExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalWorkerPoolTest {

    private PluginHandlerRegistry handlers;
    private PluginConfigRegistry registry;
    private InMemoryJobStore jobs;
    private InMemoryReportStore reports;
    private LocalWorkerPool pool;
    private JobPipelineCoordinator coordinator;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        handlers = new PluginHandlerRegistry();
        registry = new PluginConfigRegistry(handlers,
                new ParameterResolver(new InMemoryParameterStore(), OrganizationDirectory.NONE),
                QueueSettings.defaults());
        jobs = new InMemoryJobStore();
        reports = new InMemoryReportStore();
        pool = new LocalWorkerPool(4);
        coordinator = new JobPipelineCoordinator(jobs, registry, new TaskSignatureBuilder(registry, 10), pool,
                new DispatchMetrics(new SimpleMeterRegistry()));
        pool.attach(new TaskExecutor(handlers, jobs, reports, coordinator));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        pool.close();
    }

    private void plugin(PluginKind kind, String name, int softTimeLimitSeconds, PluginHandler handler) {
        PluginConfiguration config = PluginConfiguration.builder(kind, name)
                .entryPoint("test." + name)
                .settings(new PluginSettings(PluginSettings.DEFAULT_QUEUE, softTimeLimitSeconds))
                .build();
        handlers.register(config.getEntryPoint(), kind, "1.0", handler);
        registry.registerOrThrow(config);
    }

    private Job startJob() {
        return coordinator.start(Job.builder()
                .user(User.of("alice"))
                .observable(Observable.of("example.com", ObservableClassification.DOMAIN))
                .build());
    }

    private static TaskDescriptor transition(String token, Set<String> dependencies) {
        return new TaskDescriptor(TaskType.STAGE_TRANSITION, "no-such-job", TaskDescriptor.PIPELINE_ENTRY_POINT, null,
                List.of(), Map.of(), "default", 5, token, dependencies, PluginKind.ANALYZER,
                JobStatus.ANALYZERS_COMPLETED);
    }

    @Test
    void submit_nextStageStartsAfterStageTasksFinish() throws Exception {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        plugin(PluginKind.ANALYZER, "SlowAnalyzer", 30, invocation -> {
            Thread.sleep(150);
            order.add("analyzer");
            return Map.of();
        });
        plugin(PluginKind.CONNECTOR, "Export", 30, invocation -> {
            order.add("connector");
            return Map.of();
        });
        plugin(PluginKind.VISUALIZER, "Page", 30, invocation -> {
            order.add("visualizer");
            return Map.of();
        });

        Job job = startJob();

        assertTrue(pool.awaitIdle(Duration.ofSeconds(10)));
        assertEquals(List.of("analyzer", "connector", "visualizer"), order);
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        for (PluginReport report : reports.forJob(job.getId())) {
            assertEquals(ReportStatus.SUCCESS, report.getStatus(), report.toString());
        }
        assertEquals(3, reports.forJob(job.getId()).size());
    }

    @Test
    void submit_softTimeLimitFailsTaskAndPipelineContinues() throws Exception {
        plugin(PluginKind.ANALYZER, "Hang", 1, invocation -> {
            release.await(30, TimeUnit.SECONDS);
            return Map.of("late", true);
        });

        Job job = startJob();

        assertTrue(pool.awaitIdle(Duration.ofSeconds(10)));
        PluginReport report = reports.find(job.getId(), "Hang").orElseThrow();
        assertEquals(ReportStatus.FAILED, report.getStatus());
        assertEquals(List.of("soft time limit of 1s exceeded"), report.getErrors());
        assertEquals(JobStatus.COMPLETED, job.getStatus());
    }

    @Test
    void submit_handlersHungOnEveryThreadDoNotStallPipeline() throws Exception {
        LocalWorkerPool small = new LocalWorkerPool(2);
        try {
            JobPipelineCoordinator smallCoordinator = new JobPipelineCoordinator(jobs, registry,
                    new TaskSignatureBuilder(registry, 10), small, new DispatchMetrics(new SimpleMeterRegistry()));
            small.attach(new TaskExecutor(handlers, jobs, reports, smallCoordinator));
            plugin(PluginKind.ANALYZER, "HangA", 1, invocation -> {
                release.await(30, TimeUnit.SECONDS);
                return Map.of();
            });
            plugin(PluginKind.ANALYZER, "HangB", 1, invocation -> {
                release.await(30, TimeUnit.SECONDS);
                return Map.of();
            });
            plugin(PluginKind.CONNECTOR, "Export", 30, invocation -> Map.of());

            Job job = smallCoordinator.start(Job.builder()
                    .user(User.of("alice"))
                    .observable(Observable.of("example.com", ObservableClassification.DOMAIN))
                    .build());

            assertTrue(small.awaitIdle(Duration.ofSeconds(10)));
            assertEquals(JobStatus.COMPLETED, job.getStatus());
            assertEquals(ReportStatus.FAILED, reports.find(job.getId(), "HangA").orElseThrow().getStatus());
            assertEquals(ReportStatus.FAILED, reports.find(job.getId(), "HangB").orElseThrow().getStatus());
            assertEquals(ReportStatus.SUCCESS, reports.find(job.getId(), "Export").orElseThrow().getStatus());
        } finally {
            release.countDown();
            small.close();
        }
    }

    @Test
    void submit_finishedTasksReleasedOnceJobCompletes() throws Exception {
        plugin(PluginKind.ANALYZER, "Echo", 30, invocation -> Map.of());
        plugin(PluginKind.CONNECTOR, "Export", 30, invocation -> Map.of());

        Job job = startJob();

        assertTrue(pool.awaitIdle(Duration.ofSeconds(10)));
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(0, pool.getTrackedTaskCount());
    }

    @Test
    void submit_unknownDependencyIsRejected() {
        assertThrows(TaskSubmissionException.class, () -> pool.submit(transition("t-1", Set.of("ghost"))));
    }

    @Test
    void submit_duplicateTokenRunsOnce() throws Exception {
        TaskDescriptor descriptor = transition("t-dup", Set.of());

        pool.submit(descriptor);
        pool.submit(descriptor);

        assertTrue(pool.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(1, pool.getExecutionCount());
    }

    @Test
    void submit_withoutExecutorOrAfterCloseThrows() {
        LocalWorkerPool detached = new LocalWorkerPool(1);
        try {
            assertThrows(TaskSubmissionException.class, () -> detached.submit(transition("t-2", Set.of())));
        } finally {
            detached.close();
        }

        pool.close();
        assertThrows(TaskSubmissionException.class, () -> pool.submit(transition("t-3", Set.of())));
    }

    @Test
    void constructor_rejectsNonPositiveThreads() {
        assertThrows(IllegalArgumentException.class, () -> new LocalWorkerPool(0));
    }
}
