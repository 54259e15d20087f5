package com.cellar.readiness.exception;

/**
 * Thrown when a step is requested for a job that another caller is already stepping.
 */
public class StepInProgressException extends RuntimeException {

    public StepInProgressException(long jobId) {
        super("Backfill job " + jobId + " is already processing a batch");
    }
}
