package com.cellar.readiness.exception;

import com.cellar.readiness.domain.BackfillStatus;

public class InvalidJobStateException extends RuntimeException {

    public InvalidJobStateException(Long jobId, BackfillStatus status, String action) {
        super(String.format("Cannot %s job %d in status %s", action, jobId, status.getValue()));
    }
}
