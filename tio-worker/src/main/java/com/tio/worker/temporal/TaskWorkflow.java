package com.tio.worker.temporal;

import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * One workflow per submitted task; the workflow id is the task's idempotency token.
 */
@WorkflowInterface
public interface TaskWorkflow {

    /**
     * Waits for the task's dependencies, then executes it.
     *
     * @param descriptorJson task descriptor as JSON
     * @return final task status ({@code SUCCESS} or {@code FAILED})
     */
    @WorkflowMethod
    String run(String descriptorJson);
}
