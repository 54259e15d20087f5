package com.cellar.readiness.exception;

/**
 * Thrown when a backfill is started while another job holds the running lock.
 */
public class JobAlreadyRunningException extends RuntimeException {

    public JobAlreadyRunningException(String message) {
        super(message);
    }
}
