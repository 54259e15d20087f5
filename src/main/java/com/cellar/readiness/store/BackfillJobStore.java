package com.cellar.readiness.store;

import com.cellar.readiness.entity.BackfillJob;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for backfill jobs and the single-writer lock.
 */
public interface BackfillJobStore {

    /**
     * Atomically takes the lock and inserts the job as its holder.
     * Empty when another job holds the lock; nothing is inserted in that case.
     */
    Optional<BackfillJob> createHoldingLock(BackfillJob job);

    /**
     * Takes the free lock for an existing job. False when another job holds it.
     */
    boolean reacquireLock(long jobId);

    void releaseLock(long jobId);

    Optional<BackfillJob> findById(long jobId);

    /**
     * Persists progress. Never overwrites the cancel flag.
     */
    BackfillJob save(BackfillJob job);

    /**
     * Raises the cancel flag of a running job. False when the job is not running.
     */
    boolean requestCancel(long jobId);

    boolean isCancelRequested(long jobId);

    void clearCancelRequest(long jobId);

    /**
     * Claims a running job for a single step. False when the job is not running or another
     * step holds a claim taken at or after {@code staleBefore}.
     */
    boolean tryClaimStep(long jobId, LocalDateTime now, LocalDateTime staleBefore);

    void releaseStep(long jobId);

    List<BackfillJob> findRecent();
}
