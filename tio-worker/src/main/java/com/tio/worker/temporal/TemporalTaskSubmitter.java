package com.tio.worker.temporal;

import com.tio.dispatch.TaskDescriptor;
import com.tio.dispatch.TaskSubmissionException;
import com.tio.dispatch.TaskSubmitter;
import io.temporal.api.enums.v1.WorkflowIdReusePolicy;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowExecutionAlreadyStarted;
import io.temporal.client.WorkflowOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Submits each task as a {@link TaskWorkflow} execution: workflow id = idempotency token,
 * task queue = the descriptor's (already prefixed) queue. Starting a token twice is a no-op.
 */
public final class TemporalTaskSubmitter implements TaskSubmitter {

    private static final Logger log = LoggerFactory.getLogger(TemporalTaskSubmitter.class);

    private final WorkflowClient client;

    public TemporalTaskSubmitter(WorkflowClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public void submit(TaskDescriptor descriptor) {
        TaskWorkflow workflow = client.newWorkflowStub(TaskWorkflow.class, optionsFor(descriptor));
        try {
            WorkflowClient.start(workflow::run, descriptor.toJson());
            log.debug("Started workflow {} on {}", descriptor.getToken(), descriptor.getQueue());
        } catch (WorkflowExecutionAlreadyStarted e) {
            log.debug("Workflow {} already started; ignoring duplicate submission", descriptor.getToken());
        } catch (RuntimeException e) {
            throw new TaskSubmissionException(descriptor.getToken(),
                    "could not start workflow on " + descriptor.getQueue() + ": " + e.getMessage(), e);
        }
    }

    static WorkflowOptions optionsFor(TaskDescriptor descriptor) {
        return WorkflowOptions.newBuilder()
                .setWorkflowId(descriptor.getToken())
                .setTaskQueue(descriptor.getQueue())
                .setWorkflowIdReusePolicy(WorkflowIdReusePolicy.WORKFLOW_ID_REUSE_POLICY_REJECT_DUPLICATE)
                .build();
    }
}
