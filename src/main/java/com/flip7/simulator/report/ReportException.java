package com.flip7.simulator.report;

/**
 * Exception thrown when a report cannot be written or read back.
 */
public class ReportException extends Exception {
    public ReportException(String message) {
        super(message);
    }

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
