package com.cellar.readiness.exception;

/**
 * Row storage could not be read. Aborts the current backfill step.
 */
public class FatalStorageException extends RuntimeException {

    public FatalStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
