package com.tio.worker;

import com.tio.config.TioConfig;
import com.tio.worker.temporal.TaskActivitiesImpl;
import com.tio.worker.temporal.TaskWorkflowImpl;
import com.tio.worker.temporal.TemporalTaskSubmitter;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * TIO Temporal worker entry point. Polls every valid queue (with TIO_QUEUE_PREFIX applied).
 * <p>
 * WorkerFactory.start() returns immediately; the main thread is blocked so the JVM stays alive.
 * Shutdown hook and InterruptedException handle graceful shutdown (e.g. Ctrl+C).
 */
public final class TioWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(TioWorkerApplication.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private TioWorkerApplication() {
    }

    public static void main(String[] args) {
        TioConfig config = TioConfig.fromEnvironment();

        WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getTemporalTarget())
                        .build()
        );
        WorkflowClient client = WorkflowClient.newInstance(
                service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getTemporalNamespace())
                        .build()
        );

        WorkerContext ctx = TioBootstrap.initialize(config, new TemporalTaskSubmitter(client));

        WorkerFactory factory = WorkerFactory.newInstance(client);
        WorkerOptions workerOptions = WorkerOptions.newBuilder()
                .setMaxConcurrentActivityExecutionSize(10)
                .setMaxConcurrentWorkflowTaskExecutionSize(10)
                .build();
        TaskActivitiesImpl activities = new TaskActivitiesImpl(ctx.getExecutor(), client);

        List<String> taskQueues = config.getQueueSettings().qualifiedQueueNames();
        for (String taskQueue : taskQueues) {
            Worker worker = factory.newWorker(taskQueue, workerOptions);
            worker.registerWorkflowImplementationTypes(TaskWorkflowImpl.class);
            worker.registerActivitiesImplementations(activities);
            log.info("Registered worker for task queue: {}", taskQueue);
        }
        log.info("Starting worker | Temporal: {} | namespace: {} | queues: {} | parameter store: {}",
                config.getTemporalTarget(), config.getTemporalNamespace(), taskQueues, config.getParameterStore());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down worker...");
            shutdown(factory);
        }));

        factory.start();

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down worker...");
            shutdown(factory);
        }
    }

    private static void shutdown(WorkerFactory factory) {
        factory.shutdown();
        try {
            factory.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            log.error("Error during worker shutdown: {}", e.getMessage());
        }
    }
}
