package com.tio.job;

import java.time.Instant;
import java.util.Objects;

/**
 * Why a job failed. The reason is a generic message safe to show to users; details are logged
 * under the correlation id.
 */
public final class JobFailure {

    private final String reason;
    private final String correlationId;
    private final Instant at;

    public JobFailure(String reason, String correlationId, Instant at) {
        this.reason = Objects.requireNonNull(reason, "reason");
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.at = at != null ? at : Instant.now();
    }

    public String getReason() {
        return reason;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getAt() {
        return at;
    }

    @Override
    public String toString() {
        return reason + " (correlationId=" + correlationId + ")";
    }
}
