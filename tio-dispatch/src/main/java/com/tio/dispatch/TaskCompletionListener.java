package com.tio.dispatch;

/** Receives completion of plugin tasks from the worker pool. */
public interface TaskCompletionListener {

    void onTaskFinished(TaskOutcome outcome);
}
