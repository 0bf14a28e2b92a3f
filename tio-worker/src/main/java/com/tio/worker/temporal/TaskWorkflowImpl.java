package com.tio.worker.temporal;

import com.tio.dispatch.TaskDescriptor;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.failure.ActivityFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;

/**
 * Waits for the dependency workflows, then runs the execute activity with start-to-close equal to the
 * task's soft time limit and a single attempt. A failed or timed-out attempt is recorded as a FAILED task.
 */
public class TaskWorkflowImpl implements TaskWorkflow {

    static final String SUCCESS = "SUCCESS";
    static final String FAILED = "FAILED";

    private static final Logger log = Workflow.getLogger(TaskWorkflowImpl.class);
    private static final Duration AWAIT_TIMEOUT = Duration.ofHours(24);
    private static final Duration BOOKKEEPING_TIMEOUT = Duration.ofMinutes(1);

    @Override
    public String run(String descriptorJson) {
        TaskDescriptor descriptor = TaskDescriptor.fromJson(descriptorJson);

        if (!descriptor.getDependencies().isEmpty()) {
            TaskActivities waiter = Workflow.newActivityStub(TaskActivities.class,
                    ActivityOptions.newBuilder()
                            .setStartToCloseTimeout(AWAIT_TIMEOUT)
                            .build());
            waiter.awaitTasks(new ArrayList<>(descriptor.getDependencies()));
        }

        TaskActivities executor = Workflow.newActivityStub(TaskActivities.class,
                ActivityOptions.newBuilder()
                        .setStartToCloseTimeout(Duration.ofSeconds(descriptor.getSoftTimeLimitSeconds()))
                        .setRetryOptions(RetryOptions.newBuilder().setMaximumAttempts(1).build())
                        .build());
        try {
            return executor.execute(descriptorJson);
        } catch (ActivityFailure e) {
            String error = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            log.warn("Task {} failed in activity: {}", descriptor.getToken(), error);
            TaskActivities bookkeeping = Workflow.newActivityStub(TaskActivities.class,
                    ActivityOptions.newBuilder()
                            .setStartToCloseTimeout(BOOKKEEPING_TIMEOUT)
                            .build());
            bookkeeping.recordFailure(descriptorJson, error);
            return FAILED;
        }
    }
}
