package com.cellar.readiness.service;

import com.cellar.readiness.config.BackfillProperties;
import com.cellar.readiness.domain.BackfillFilter;
import com.cellar.readiness.domain.BackfillMode;
import com.cellar.readiness.domain.BackfillStatus;
import com.cellar.readiness.domain.ReadinessResult;
import com.cellar.readiness.domain.WinePage;
import com.cellar.readiness.domain.WineRecord;
import com.cellar.readiness.entity.BackfillFailure;
import com.cellar.readiness.entity.BackfillJob;
import com.cellar.readiness.exception.FatalStorageException;
import com.cellar.readiness.exception.InvalidJobStateException;
import com.cellar.readiness.exception.JobAlreadyRunningException;
import com.cellar.readiness.exception.StepInProgressException;
import com.cellar.readiness.store.BackfillJobStore;
import com.cellar.readiness.store.ReadinessResultStore;
import com.cellar.readiness.store.WineStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Resumable readiness backfill.
 *
 * <p>Each call to {@link #step(long)} handles one bounded batch and persists everything the
 * next step needs (cursor, counters, failures) on the job row. Nothing survives in memory
 * between steps, so a job interrupted by a restart continues with {@link #resume(long)}.
 * Only one job may run at a time; the lock row is taken when the job is created and
 * released on every terminal transition. Within a job, steps are serialized by a claim
 * on the job row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackfillOrchestrator {

    private final WineStore wineStore;
    private final ReadinessResultStore resultStore;
    private final BackfillJobStore jobStore;
    private final ReadinessService readinessService;
    private final BackfillProperties properties;
    private final Clock clock;

    /**
     * Create a running job holding the single-writer lock.
     *
     * @param batchSize rows per step, null for the configured default; bounded to 1..maxBatchSize
     * @throws JobAlreadyRunningException when another job holds the lock (no job is created)
     */
    public BackfillJob start(BackfillMode mode, Integer batchSize) {
        BackfillMode jobMode = mode != null ? mode : BackfillMode.MISSING_ONLY;
        int version = readinessService.algorithmVersion();
        int size = resolveBatchSize(batchSize);
        long estimatedTotal = wineStore.countWines(new BackfillFilter(jobMode, version));

        LocalDateTime now = LocalDateTime.now(clock);
        BackfillJob job = BackfillJob.builder()
                .mode(jobMode)
                .batchSize(size)
                .algorithmVersionAtStart(version)
                .status(BackfillStatus.RUNNING)
                .estimatedTotal(estimatedTotal)
                .createdDate(now)
                .startedAt(now)
                .build();

        BackfillJob created = jobStore.createHoldingLock(job)
                .orElseThrow(() -> new JobAlreadyRunningException(
                        "A readiness backfill is already running; wait for it or cancel it first"));

        log.info("Started backfill job {} (mode {}, batch size {}, algorithm v{}, ~{} rows)",
                created.getId(), jobMode.getValue(), size, version, estimatedTotal);
        return created;
    }

    /**
     * Process one batch of a running job. The job is claimed for the duration of the step,
     * so overlapping calls for the same job (API, scheduler, resume) never share a batch.
     *
     * @throws IllegalArgumentException when the job does not exist
     * @throws InvalidJobStateException when the job is not running
     * @throws StepInProgressException when another step on this job has not finished
     */
    public BackfillJob step(long jobId) {
        BackfillJob job = getJobStatus(jobId);
        if (job.getStatus() != BackfillStatus.RUNNING) {
            throw new InvalidJobStateException(jobId, job.getStatus(), "step");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime staleBefore = now.minus(Duration.ofMillis(properties.getStepClaimTimeoutMs()));
        if (!jobStore.tryClaimStep(jobId, now, staleBefore)) {
            BackfillJob current = getJobStatus(jobId);
            if (current.getStatus() != BackfillStatus.RUNNING) {
                throw new InvalidJobStateException(jobId, current.getStatus(), "step");
            }
            log.info("Backfill job {} is already processing a batch, step rejected", jobId);
            throw new StepInProgressException(jobId);
        }

        try {
            // re-read under the claim: a step that finished meanwhile may have moved the cursor
            BackfillJob claimed = getJobStatus(jobId);
            if (claimed.getStatus() != BackfillStatus.RUNNING) {
                throw new InvalidJobStateException(jobId, claimed.getStatus(), "step");
            }
            return runBatch(claimed);
        } finally {
            jobStore.releaseStep(jobId);
        }
    }

    private BackfillJob runBatch(BackfillJob job) {
        long jobId = job.getId();
        if (jobStore.isCancelRequested(jobId)) {
            log.info("Backfill job {} cancelled before next batch at cursor {}", jobId, job.getCursor());
            return finish(job, BackfillStatus.CANCELLED);
        }

        BackfillFilter filter = new BackfillFilter(job.getMode(), job.getAlgorithmVersionAtStart());
        WinePage page;
        try {
            page = wineStore.listWines(filter, job.getCursor(), job.getBatchSize());
        } catch (FatalStorageException e) {
            log.error("Backfill job {} failed reading wines after cursor {}: {}",
                    jobId, job.getCursor(), e.getMessage(), e);
            job.setErrorDetails(describe(e));
            return finish(job, BackfillStatus.FAILED);
        }

        List<RowOutcome> outcomes = processBatch(page.getRows(), job.getAlgorithmVersionAtStart());
        applyOutcomes(job, outcomes);

        if (page.getNextCursor() != null
                && (job.getCursor() == null || page.getNextCursor() > job.getCursor())) {
            job.setCursor(page.getNextCursor());
        }

        log.info("Backfill job {} batch committed: {} rows, cursor {} (processed {}, updated {}, skipped {}, failed {})",
                jobId, page.getRows().size(), job.getCursor(),
                job.getProcessed(), job.getUpdated(), job.getSkipped(), job.getFailed());

        if (page.getRows().size() < job.getBatchSize()) {
            return finish(job, BackfillStatus.COMPLETED);
        }
        if (jobStore.isCancelRequested(jobId)) {
            log.info("Backfill job {} cancelled after batch ending at cursor {}", jobId, job.getCursor());
            return finish(job, BackfillStatus.CANCELLED);
        }
        return jobStore.save(job);
    }

    /**
     * Continue a job from its persisted cursor. A running job is presumed interrupted;
     * a failed job is re-queued and must win the lock again.
     */
    public BackfillJob resume(long jobId) {
        BackfillJob job = getJobStatus(jobId);
        if (job.getStatus() == BackfillStatus.FAILED) {
            if (!jobStore.reacquireLock(jobId)) {
                throw new JobAlreadyRunningException(
                        "Cannot re-queue job " + jobId + " while another backfill is running");
            }
            // a cancel raised just before the failure must not stop the re-queued job
            jobStore.clearCancelRequest(jobId);
            log.info("Re-queued failed backfill job {} at cursor {}", jobId, job.getCursor());
            job.setStatus(BackfillStatus.RUNNING);
            job.setErrorDetails(null);
            job.setFinishedAt(null);
            job = jobStore.save(job);
        } else if (job.getStatus() != BackfillStatus.RUNNING) {
            throw new InvalidJobStateException(jobId, job.getStatus(), "resume");
        }
        return step(jobId);
    }

    /**
     * Ask a running job to stop. The flag is honored at the next batch boundary.
     * Jobs that are not running are left untouched.
     */
    public BackfillJob cancel(long jobId) {
        BackfillJob job = getJobStatus(jobId);
        if (!jobStore.requestCancel(jobId)) {
            log.info("Backfill job {} is {}, nothing to cancel", jobId, job.getStatus().getValue());
            return job;
        }
        log.info("Cancel requested for backfill job {}", jobId);
        return getJobStatus(jobId);
    }

    public BackfillJob getJobStatus(long jobId) {
        return jobStore.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
    }

    public List<BackfillJob> listRecent() {
        return jobStore.findRecent();
    }

    /**
     * The newest running job, if any. Used by the scheduler to drive stepping.
     */
    public Optional<BackfillJob> findRunning() {
        return jobStore.findRecent().stream()
                .filter(job -> job.getStatus() == BackfillStatus.RUNNING)
                .findFirst();
    }

    int resolveBatchSize(Integer requested) {
        int size = requested != null ? requested : properties.getBatchSize();
        return Math.max(1, Math.min(properties.getMaxBatchSize(), size));
    }

    private List<RowOutcome> processBatch(List<WineRecord> rows, int algorithmVersion) {
        if (rows.isEmpty()) {
            return List.of();
        }
        List<Callable<RowOutcome>> tasks = new ArrayList<>(rows.size());
        for (WineRecord row : rows) {
            tasks.add(() -> processRow(row, algorithmVersion));
        }

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.max(1, Math.min(properties.getWorkerPoolSize(), rows.size())));
        try {
            List<Future<RowOutcome>> futures = pool.invokeAll(tasks);
            List<RowOutcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    outcomes.add(RowOutcome.failed(rows.get(i).getId(), describe(e.getCause())));
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // cursor is not advanced; the job stays running and can be resumed
            throw new IllegalStateException("Backfill batch interrupted", e);
        } finally {
            pool.shutdown();
        }
    }

    private RowOutcome processRow(WineRecord wine, int algorithmVersion) {
        try {
            ReadinessResult result = readinessService.computeFor(wine, algorithmVersion);
            Optional<ReadinessResult> stored = resultStore.find(wine.getId());
            if (stored.isPresent() && stored.get().equals(result)) {
                log.debug("Wine {} unchanged, skipping write", wine.getId());
                return RowOutcome.SKIPPED;
            }
            resultStore.save(wine.getId(), result);
            log.debug("Wine {} -> {} {}", wine.getId(), result.getStatus().getLabel(), result.getScore());
            return RowOutcome.UPDATED;
        } catch (Exception e) {
            log.warn("Backfill failed for wine {}: {}", wine.getId(), e.getMessage());
            return RowOutcome.failed(wine.getId(), describe(e));
        }
    }

    private void applyOutcomes(BackfillJob job, List<RowOutcome> outcomes) {
        List<BackfillFailure> failures = new ArrayList<>(
                job.getFailures() != null ? job.getFailures() : List.of());
        for (RowOutcome outcome : outcomes) {
            job.setProcessed(job.getProcessed() + 1);
            switch (outcome.kind) {
                case UPDATED:
                    job.setUpdated(job.getUpdated() + 1);
                    break;
                case SKIPPED:
                    job.setSkipped(job.getSkipped() + 1);
                    break;
                case FAILED:
                default:
                    job.setFailed(job.getFailed() + 1);
                    failures.add(new BackfillFailure(outcome.rowId, outcome.error));
                    break;
            }
        }
        int max = properties.getMaxRecordedFailures();
        if (failures.size() > max) {
            failures = new ArrayList<>(failures.subList(failures.size() - max, failures.size()));
        }
        job.setFailures(failures);
    }

    private BackfillJob finish(BackfillJob job, BackfillStatus status) {
        job.setStatus(status);
        job.setFinishedAt(LocalDateTime.now(clock));
        BackfillJob saved = jobStore.save(job);
        jobStore.releaseLock(job.getId());
        log.info("Backfill job {} {}: processed {}, updated {}, skipped {}, failed {}",
                job.getId(), status.getValue(), job.getProcessed(), job.getUpdated(),
                job.getSkipped(), job.getFailed());
        return saved;
    }

    private static String describe(Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private enum Kind { UPDATED, SKIPPED, FAILED }

    private static final class RowOutcome {
        static final RowOutcome UPDATED = new RowOutcome(Kind.UPDATED, null, null);
        static final RowOutcome SKIPPED = new RowOutcome(Kind.SKIPPED, null, null);

        final Kind kind;
        final Long rowId;
        final String error;

        private RowOutcome(Kind kind, Long rowId, String error) {
            this.kind = kind;
            this.rowId = rowId;
            this.error = error;
        }

        static RowOutcome failed(Long rowId, String error) {
            return new RowOutcome(Kind.FAILED, rowId, error);
        }
    }
}
