package com.premiergroup.ad_warehouse.exception;

/**
 * The warehouse cannot be reached. Aborts the whole run.
 */
public class WarehouseUnavailableException extends RuntimeException {

    public WarehouseUnavailableException(String message) {
        super(message);
    }

    public WarehouseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
