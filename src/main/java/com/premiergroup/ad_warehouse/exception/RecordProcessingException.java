package com.premiergroup.ad_warehouse.exception;

import org.springframework.core.NestedExceptionUtils;

/**
 * Failure confined to a single record. The record's transaction is rolled
 * back and the run moves on to the next record.
 */
public abstract class RecordProcessingException extends RuntimeException {

    protected RecordProcessingException(String message) {
        super(message);
    }

    protected RecordProcessingException(String message, Throwable cause) {
        super(message + ": " + NestedExceptionUtils.getMostSpecificCause(cause).getMessage(), cause);
    }
}
