package com.tio.worker.temporal;

import com.tio.dispatch.TaskDescriptor;
import com.tio.dispatch.TaskOutcome;
import com.tio.worker.TaskExecutor;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowException;
import io.temporal.client.WorkflowStub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Activity implementation: delegates execution to the {@link TaskExecutor} and waits on dependency
 * workflows through the {@link WorkflowClient}.
 */
public final class TaskActivitiesImpl implements TaskActivities {

    private static final Logger log = LoggerFactory.getLogger(TaskActivitiesImpl.class);

    private final TaskExecutor executor;
    private final WorkflowClient client;

    public TaskActivitiesImpl(TaskExecutor executor, WorkflowClient client) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public void awaitTasks(List<String> tokens) {
        for (String token : tokens) {
            WorkflowStub stub = client.newUntypedWorkflowStub(token, Optional.empty(), Optional.empty());
            try {
                stub.getResult(String.class);
            } catch (WorkflowException e) {
                log.debug("Dependency {} closed without success: {}", token, e.getMessage());
            }
        }
    }

    @Override
    public String execute(String descriptorJson) {
        TaskOutcome outcome = executor.execute(TaskDescriptor.fromJson(descriptorJson));
        return outcome.isSucceeded() ? TaskWorkflowImpl.SUCCESS : TaskWorkflowImpl.FAILED;
    }

    @Override
    public void recordFailure(String descriptorJson, String error) {
        executor.fail(TaskDescriptor.fromJson(descriptorJson), error);
    }
}
