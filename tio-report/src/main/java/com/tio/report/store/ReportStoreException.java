package com.tio.report.store;

/** A report could not be read from the database. */
public class ReportStoreException extends RuntimeException {

    public ReportStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
