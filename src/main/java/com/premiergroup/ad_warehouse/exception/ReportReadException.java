package com.premiergroup.ad_warehouse.exception;

/**
 * The report cannot be read or is missing required columns. Aborts the whole run.
 */
public class ReportReadException extends Exception {

    public ReportReadException(String message) {
        super(message);
    }

    public ReportReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
