package com.tio.dispatch;

/** Hands task descriptors to the worker pool. */
public interface TaskSubmitter {

    /**
     * Enqueues the descriptor on its queue. The pool runs it after every dependency has finished.
     *
     * @throws TaskSubmissionException if the pool cannot accept the task
     */
    void submit(TaskDescriptor descriptor);
}
