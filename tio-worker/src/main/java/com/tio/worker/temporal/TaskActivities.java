package com.tio.worker.temporal;

import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

import java.util.List;

/** Activities behind {@link TaskWorkflow}. */
@ActivityInterface
public interface TaskActivities {

    /** Blocks until every workflow in {@code tokens} has closed, whatever its result. */
    @ActivityMethod
    void awaitTasks(List<String> tokens);

    /**
     * Executes the task on this worker.
     *
     * @return {@code SUCCESS} or {@code FAILED}
     */
    @ActivityMethod
    String execute(String descriptorJson);

    /** Completes the task as FAILED without running it (e.g. the execute activity timed out). */
    @ActivityMethod
    void recordFailure(String descriptorJson, String error);
}
