package com.tio.job;

import java.time.Instant;
import java.util.Objects;

/** One entry of a job's append-only status history. */
public final class StatusChange {

    private final JobStatus from;
    private final JobStatus to;
    private final Instant at;

    public StatusChange(JobStatus from, JobStatus to, Instant at) {
        this.from = from;
        this.to = Objects.requireNonNull(to, "to");
        this.at = at != null ? at : Instant.now();
    }

    /** Previous status; null for the initial PENDING entry. */
    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }

    public Instant getAt() {
        return at;
    }

    @Override
    public String toString() {
        return from + " -> " + to + " @ " + at;
    }
}
