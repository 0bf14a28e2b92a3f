package com.tio.report;

/** Lifecycle of one plugin execution report. */
public enum ReportStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isFinal() {
        return this == SUCCESS || this == FAILED;
    }
}
