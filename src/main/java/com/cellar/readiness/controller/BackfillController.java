package com.cellar.readiness.controller;

import com.cellar.readiness.domain.BackfillMode;
import com.cellar.readiness.entity.BackfillJob;
import com.cellar.readiness.exception.InvalidJobStateException;
import com.cellar.readiness.exception.JobAlreadyRunningException;
import com.cellar.readiness.exception.StepInProgressException;
import com.cellar.readiness.service.BackfillOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.function.Supplier;

/**
 * Admin API for the readiness backfill. Each step call processes one batch;
 * the caller (or the scheduler) keeps stepping until the job is terminal.
 */
@RestController
@RequestMapping("/api/admin/backfill")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Readiness Backfill", description = "Resumable recomputation of readiness for all wines")
public class BackfillController {

    private final BackfillOrchestrator orchestrator;

    @Operation(
        summary = "Start a backfill job",
        description = "Creates a running job for the given mode (missing_only, stale_or_missing, force_all). " +
                "Fails with 409 while another job is running."
    )
    @PostMapping("/start")
    public ResponseEntity<?> start(@RequestBody(required = false) StartBackfillRequest request) {
        BackfillMode mode;
        try {
            mode = BackfillMode.fromString(request != null ? request.mode() : null);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        }
        Integer batchSize = request != null ? request.batchSize() : null;
        log.info("Backfill start requested via API (mode {}, batch size {})", mode.getValue(), batchSize);
        return handle(() -> orchestrator.start(mode, batchSize));
    }

    @Operation(summary = "Process one batch", description = "Runs a single bounded batch of a running job")
    @PostMapping("/jobs/{jobId}/step")
    public ResponseEntity<?> step(@Parameter(description = "Job ID") @PathVariable Long jobId) {
        return handle(() -> orchestrator.step(jobId));
    }

    @Operation(
        summary = "Resume a job",
        description = "Continues an interrupted running job, or re-queues a failed one, from its persisted cursor"
    )
    @PostMapping("/jobs/{jobId}/resume")
    public ResponseEntity<?> resume(@Parameter(description = "Job ID") @PathVariable Long jobId) {
        log.info("Resume requested for backfill job {}", jobId);
        return handle(() -> orchestrator.resume(jobId));
    }

    @Operation(summary = "Cancel a job", description = "The job stops at the next batch boundary")
    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<?> cancel(@Parameter(description = "Job ID") @PathVariable Long jobId) {
        return handle(() -> orchestrator.cancel(jobId));
    }

    @Operation(summary = "Get job status")
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getJob(@Parameter(description = "Job ID") @PathVariable Long jobId) {
        return handle(() -> orchestrator.getJobStatus(jobId));
    }

    @Operation(summary = "List recent jobs", description = "The 20 most recent jobs, newest first")
    @GetMapping("/jobs")
    public List<BackfillJob> listJobs() {
        return orchestrator.listRecent();
    }

    private ResponseEntity<?> handle(Supplier<BackfillJob> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (JobAlreadyRunningException | InvalidJobStateException | StepInProgressException e) {
            log.warn("Backfill request rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Unexpected backfill error: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("Unexpected error: " + e.getMessage()));
        }
    }

    public record StartBackfillRequest(String mode, Integer batchSize) {}

    public record ErrorResponse(String message) {}
}
