package com.tio.dispatch;

/** The worker pool could not accept a task. */
public class TaskSubmissionException extends RuntimeException {

    private final String token;

    public TaskSubmissionException(String token, String message) {
        super(message);
        this.token = token;
    }

    public TaskSubmissionException(String token, String message, Throwable cause) {
        super(message, cause);
        this.token = token;
    }

    /** Token of the descriptor that was rejected. */
    public String getToken() {
        return token;
    }
}
