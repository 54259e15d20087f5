package com.cellar.readiness.store;

import com.cellar.readiness.config.BackfillProperties;
import com.cellar.readiness.domain.BackfillStatus;
import com.cellar.readiness.entity.BackfillJob;
import com.cellar.readiness.repository.BackfillJobRepository;
import com.cellar.readiness.repository.BackfillLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Job rows plus the lock row. The lock is taken with a conditional UPDATE in the same
 * transaction as the job insert, so a lost race leaves no job behind.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaBackfillJobStore implements BackfillJobStore {

    private final BackfillJobRepository jobRepository;
    private final BackfillLockRepository lockRepository;
    private final BackfillProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<BackfillJob> createHoldingLock(BackfillJob job) {
        String lockName = properties.getLockName();
        if (lockRepository.tryAcquire(lockName, LocalDateTime.now(clock)) == 0) {
            log.info("Backfill lock '{}' is held by another job", lockName);
            return Optional.empty();
        }
        BackfillJob saved = jobRepository.save(job);
        lockRepository.bindHolder(lockName, saved.getId());
        return Optional.of(saved);
    }

    @Override
    @Transactional
    public boolean reacquireLock(long jobId) {
        String lockName = properties.getLockName();
        if (lockRepository.tryAcquire(lockName, LocalDateTime.now(clock)) == 0) {
            return false;
        }
        lockRepository.bindHolder(lockName, jobId);
        return true;
    }

    @Override
    @Transactional
    public void releaseLock(long jobId) {
        int released = lockRepository.release(properties.getLockName(), jobId);
        if (released == 0) {
            log.warn("Job {} released lock '{}' it did not hold", jobId, properties.getLockName());
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BackfillJob> findById(long jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional
    public BackfillJob save(BackfillJob job) {
        return jobRepository.save(job);
    }

    @Override
    @Transactional
    public boolean requestCancel(long jobId) {
        return jobRepository.requestCancel(jobId, BackfillStatus.RUNNING) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isCancelRequested(long jobId) {
        return Boolean.TRUE.equals(jobRepository.findCancelRequested(jobId));
    }

    @Override
    @Transactional
    public void clearCancelRequest(long jobId) {
        jobRepository.clearCancel(jobId);
    }

    @Override
    @Transactional
    public boolean tryClaimStep(long jobId, LocalDateTime now, LocalDateTime staleBefore) {
        return jobRepository.claimStep(jobId, BackfillStatus.RUNNING, now, staleBefore) > 0;
    }

    @Override
    @Transactional
    public void releaseStep(long jobId) {
        jobRepository.releaseStep(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BackfillJob> findRecent() {
        return jobRepository.findTop20ByOrderByIdDesc();
    }
}
