package com.tio.registry;

import com.tio.job.RejectionReason;

import java.util.Objects;

/** Whether a plugin is runnable for a user and, if not, the first reason it is not. */
public final class RunnabilityCheck {

    private static final RunnabilityCheck RUNNABLE = new RunnabilityCheck(null);

    private final RejectionReason rejection;

    private RunnabilityCheck(RejectionReason rejection) {
        this.rejection = rejection;
    }

    public static RunnabilityCheck runnable() {
        return RUNNABLE;
    }

    public static RunnabilityCheck rejected(RejectionReason reason) {
        return new RunnabilityCheck(Objects.requireNonNull(reason, "reason"));
    }

    public boolean isRunnable() {
        return rejection == null;
    }

    /** Null when runnable. */
    public RejectionReason getRejection() {
        return rejection;
    }

    @Override
    public String toString() {
        return isRunnable() ? "runnable" : "not runnable: " + rejection;
    }
}
