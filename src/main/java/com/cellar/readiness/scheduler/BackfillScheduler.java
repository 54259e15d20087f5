package com.cellar.readiness.scheduler;

import com.cellar.readiness.entity.BackfillJob;
import com.cellar.readiness.exception.StepInProgressException;
import com.cellar.readiness.service.BackfillOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Drives a running backfill without an external caller: one bounded step per tick.
 * Off unless cellar.backfill.scheduler-enabled=true.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "cellar.backfill", name = "scheduler-enabled", havingValue = "true")
public class BackfillScheduler {

    private final BackfillOrchestrator orchestrator;

    @Scheduled(fixedDelayString = "${cellar.backfill.scheduler-delay-ms:30000}")
    public void stepRunningJob() {
        Optional<BackfillJob> running = orchestrator.findRunning();
        if (running.isEmpty()) {
            return;
        }
        Long jobId = running.get().getId();
        try {
            BackfillJob job = orchestrator.step(jobId);
            if (job.getStatus().isTerminal()) {
                log.info("=== Scheduled backfill job {} finished: {} ===", jobId, job.getStatus().getValue());
            }
        } catch (StepInProgressException e) {
            log.info("Scheduled step skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("=== Scheduled backfill step for job {} failed: {} ===", jobId, e.getMessage(), e);
        }
    }
}
