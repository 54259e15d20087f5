package com.cellar.readiness.service;

import com.cellar.readiness.config.BackfillProperties;
import com.cellar.readiness.config.ReadinessProperties;
import com.cellar.readiness.domain.BackfillMode;
import com.cellar.readiness.domain.BackfillStatus;
import com.cellar.readiness.domain.Confidence;
import com.cellar.readiness.domain.ReadinessResult;
import com.cellar.readiness.domain.ReadinessStatus;
import com.cellar.readiness.domain.WineColor;
import com.cellar.readiness.domain.WineRecord;
import com.cellar.readiness.engine.ReadinessCalculator;
import com.cellar.readiness.entity.BackfillFailure;
import com.cellar.readiness.entity.BackfillJob;
import com.cellar.readiness.exception.InvalidJobStateException;
import com.cellar.readiness.exception.JobAlreadyRunningException;
import com.cellar.readiness.exception.StepInProgressException;
import com.cellar.readiness.profile.ProfileSource;
import com.cellar.readiness.store.InMemoryBackfillJobStore;
import com.cellar.readiness.store.InMemoryReadinessResultStore;
import com.cellar.readiness.store.InMemoryWineStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongConsumer;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BackfillOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
    private static final List<String> GRAPES = List.of("Nebbiolo", "Pinot Noir", "Merlot", "Syrah", "Gamay");
    private static final WineColor[] COLORS = WineColor.values();

    private InMemoryReadinessResultStore resultStore;
    private InMemoryWineStore wineStore;
    private InMemoryBackfillJobStore jobStore;
    private BackfillProperties backfillProperties;
    private ReadinessProperties readinessProperties;

    /** How many times each wine went through the calculator. */
    private Map<Long, AtomicInteger> computations;
    private volatile LongConsumer onProfileLookup;

    @BeforeEach
    void setUp() {
        resultStore = new InMemoryReadinessResultStore();
        wineStore = new InMemoryWineStore(resultStore);
        jobStore = new InMemoryBackfillJobStore();
        backfillProperties = new BackfillProperties();
        backfillProperties.setBatchSize(3);
        readinessProperties = new ReadinessProperties();
        readinessProperties.setAlgorithmVersion(2);
        computations = new ConcurrentHashMap<>();
        onProfileLookup = wineId -> { };
    }

    @Test
    void testSecondStartWhileRunningIsRejectedWithoutNewJob() {
        seedWines(5);
        BackfillOrchestrator orchestrator = newOrchestrator();

        BackfillJob first = orchestrator.start(BackfillMode.FORCE_ALL, null);

        assertThrows(JobAlreadyRunningException.class, () -> orchestrator.start(BackfillMode.MISSING_ONLY, null));
        assertEquals(1, jobStore.count());
        assertEquals(BackfillStatus.RUNNING, orchestrator.getJobStatus(first.getId()).getStatus());
    }

    @Test
    void testStartRecordsJobSettings() {
        seedWines(7);
        BackfillOrchestrator orchestrator = newOrchestrator();

        BackfillJob job = orchestrator.start(BackfillMode.STALE_OR_MISSING, null);

        assertNull(job.getCursor());
        assertEquals(2, job.getAlgorithmVersionAtStart());
        assertEquals(3, job.getBatchSize());
        assertEquals(7L, job.getEstimatedTotal());
        assertEquals(BackfillStatus.RUNNING, job.getStatus());
        assertNotNull(job.getStartedAt());
    }

    @Test
    void testRequestedBatchSizeIsBounded() {
        BackfillOrchestrator orchestrator = newOrchestrator();

        assertEquals(1000, orchestrator.resolveBatchSize(5000));
        assertEquals(1, orchestrator.resolveBatchSize(0));
        assertEquals(50, orchestrator.resolveBatchSize(50));
        assertEquals(3, orchestrator.resolveBatchSize(null));
    }

    @Test
    void testStepsRunToCompletionAndReleaseTheLock() {
        seedWines(7);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);

        BackfillJob afterFirst = orchestrator.step(job.getId());
        assertEquals(BackfillStatus.RUNNING, afterFirst.getStatus());
        assertEquals(3, afterFirst.getProcessed());
        assertEquals(3L, afterFirst.getCursor());

        BackfillJob done = runToEnd(orchestrator, job.getId());

        assertEquals(BackfillStatus.COMPLETED, done.getStatus());
        assertEquals(7, done.getProcessed());
        assertEquals(7, done.getUpdated());
        assertEquals(0, done.getFailed());
        assertEquals(7L, done.getCursor());
        assertNotNull(done.getFinishedAt());
        assertFalse(jobStore.isLocked());
        assertEquals(7, resultStore.snapshot().size());
    }

    @Test
    void testExactMultipleOfBatchSizeCompletesOnEmptyPage() {
        seedWines(6);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);

        orchestrator.step(job.getId());
        BackfillJob second = orchestrator.step(job.getId());
        assertEquals(BackfillStatus.RUNNING, second.getStatus());

        BackfillJob third = orchestrator.step(job.getId());
        assertEquals(BackfillStatus.COMPLETED, third.getStatus());
        assertEquals(6, third.getProcessed());
        assertEquals(6L, third.getCursor());
    }

    @Test
    void testResumeAfterInterruptionProcessesEveryRowExactlyOnce() {
        seedWines(10);
        backfillProperties.setBatchSize(4);
        BackfillJob job = newOrchestrator().start(BackfillMode.FORCE_ALL, null);
        newOrchestrator().step(job.getId());

        // process restarts: fresh orchestrator, only persisted state survives
        BackfillOrchestrator restarted = newOrchestrator();
        BackfillJob resumed = restarted.resume(job.getId());
        BackfillJob done = resumed.getStatus().isTerminal() ? resumed : runToEnd(restarted, job.getId());

        assertEquals(BackfillStatus.COMPLETED, done.getStatus());
        assertEquals(10, done.getProcessed());
        assertEquals(allWineIds(10), computations.keySet().stream().sorted().collect(Collectors.toList()));
        computations.forEach((wineId, count) -> assertEquals(1, count.get(), "wine " + wineId));
    }

    @Test
    void testForceAllTwiceIsIdempotent() {
        seedWines(9);
        BackfillOrchestrator orchestrator = newOrchestrator();

        BackfillJob first = runToEnd(orchestrator, orchestrator.start(BackfillMode.FORCE_ALL, null).getId());
        Map<Long, ReadinessResult> afterFirst = resultStore.snapshot();
        int writesAfterFirst = resultStore.getWrites();

        BackfillJob second = runToEnd(orchestrator, orchestrator.start(BackfillMode.FORCE_ALL, null).getId());

        assertEquals(9, first.getUpdated());
        assertEquals(afterFirst, resultStore.snapshot());
        assertEquals(0, second.getUpdated());
        assertEquals(9, second.getSkipped());
        assertEquals(writesAfterFirst, resultStore.getWrites());
    }

    @Test
    void testCursorNeverMovesBackwards() {
        seedWines(11);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, 2);

        long previous = 0;
        BackfillJob current = job;
        while (!current.getStatus().isTerminal()) {
            current = orchestrator.step(job.getId());
            long cursor = current.getCursor() != null ? current.getCursor() : 0;
            assertTrue(cursor >= previous, "cursor went from " + previous + " to " + cursor);
            previous = cursor;
        }
        assertEquals(11L, previous);
    }

    @Test
    void testRowFailureIsRecordedAndBatchContinues() {
        seedWines(5);
        resultStore.failOn(2L);
        BackfillOrchestrator orchestrator = newOrchestrator();

        BackfillJob done = runToEnd(orchestrator, orchestrator.start(BackfillMode.FORCE_ALL, null).getId());

        assertEquals(BackfillStatus.COMPLETED, done.getStatus());
        assertEquals(5, done.getProcessed());
        assertEquals(4, done.getUpdated());
        assertEquals(1, done.getFailed());
        assertEquals(1, done.getFailures().size());
        BackfillFailure failure = done.getFailures().get(0);
        assertEquals(2L, failure.getRowId());
        assertTrue(failure.getError().contains("constraint violation"));
    }

    @Test
    void testOnlyMostRecentFailuresAreKept() {
        seedWines(6);
        backfillProperties.setMaxRecordedFailures(2);
        for (long id = 1; id <= 4; id++) {
            resultStore.failOn(id);
        }
        BackfillOrchestrator orchestrator = newOrchestrator();

        BackfillJob done = runToEnd(orchestrator, orchestrator.start(BackfillMode.FORCE_ALL, null).getId());

        assertEquals(4, done.getFailed());
        assertEquals(List.of(3L, 4L),
                done.getFailures().stream().map(BackfillFailure::getRowId).collect(Collectors.toList()));
    }

    @Test
    void testFatalStorageErrorFailsJobAndKeepsCursor() {
        seedWines(8);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        orchestrator.step(job.getId());

        wineStore.setUnreachable(true);
        BackfillJob failed = orchestrator.step(job.getId());

        assertEquals(BackfillStatus.FAILED, failed.getStatus());
        assertEquals(3L, failed.getCursor());
        assertEquals(3, failed.getProcessed());
        assertTrue(failed.getErrorDetails().contains("Connection refused"));
        assertFalse(jobStore.isLocked());

        wineStore.setUnreachable(false);
        BackfillJob resumed = orchestrator.resume(job.getId());
        assertEquals(BackfillStatus.RUNNING, resumed.getStatus());
        assertNull(resumed.getErrorDetails());

        BackfillJob done = runToEnd(orchestrator, job.getId());
        assertEquals(BackfillStatus.COMPLETED, done.getStatus());
        assertEquals(8, done.getProcessed());
        computations.forEach((wineId, count) -> assertEquals(1, count.get(), "wine " + wineId));
    }

    @Test
    void testFailedJobCannotBeRequeuedWhileAnotherRuns() {
        seedWines(8);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        wineStore.setUnreachable(true);
        orchestrator.step(job.getId());
        wineStore.setUnreachable(false);
        orchestrator.start(BackfillMode.MISSING_ONLY, null);

        assertThrows(JobAlreadyRunningException.class, () -> orchestrator.resume(job.getId()));
        assertEquals(BackfillStatus.FAILED, orchestrator.getJobStatus(job.getId()).getStatus());
    }

    @Test
    void testOverlappingStepOnSameJobIsRejected() throws Exception {
        seedWines(6);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        CountDownLatch inBatch = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean held = new AtomicBoolean();
        onProfileLookup = wineId -> {
            if (wineId == 1L && held.compareAndSet(false, true)) {
                inBatch.countDown();
                await(release);
            }
        };

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<BackfillJob> first = caller.submit(() -> orchestrator.step(job.getId()));
            assertTrue(inBatch.await(5, TimeUnit.SECONDS), "first step never reached its batch");

            assertThrows(StepInProgressException.class, () -> orchestrator.step(job.getId()));
            assertThrows(StepInProgressException.class, () -> orchestrator.resume(job.getId()));

            release.countDown();
            BackfillJob afterFirst = first.get(5, TimeUnit.SECONDS);
            assertEquals(3, afterFirst.getProcessed());
            assertEquals(3L, afterFirst.getCursor());
        } finally {
            release.countDown();
            caller.shutdownNow();
        }

        assertFalse(jobStore.isStepClaimed(job.getId()));
        BackfillJob done = runToEnd(orchestrator, job.getId());
        assertEquals(BackfillStatus.COMPLETED, done.getStatus());
        assertEquals(6, done.getProcessed());
        assertEquals(allWineIds(6), computations.keySet().stream().sorted().collect(Collectors.toList()));
        computations.forEach((wineId, count) -> assertEquals(1, count.get(), "wine " + wineId));
    }

    @Test
    void testRecentStepClaimBlocksStep() {
        seedWines(2);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        LocalDateTime now = LocalDateTime.now(CLOCK);
        assertTrue(jobStore.tryClaimStep(job.getId(), now.minusMinutes(1), now.minusMinutes(10)));

        assertThrows(StepInProgressException.class, () -> orchestrator.step(job.getId()));

        assertTrue(computations.isEmpty());
        assertEquals(BackfillStatus.RUNNING, orchestrator.getJobStatus(job.getId()).getStatus());
    }

    @Test
    void testAbandonedStepClaimIsTakenOver() {
        seedWines(2);
        backfillProperties.setStepClaimTimeoutMs(600000);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        LocalDateTime now = LocalDateTime.now(CLOCK);
        // claim left behind by a process that died mid-step half an hour ago
        assertTrue(jobStore.tryClaimStep(job.getId(), now.minusMinutes(30), now.minusMinutes(40)));

        BackfillJob done = orchestrator.step(job.getId());

        assertEquals(BackfillStatus.COMPLETED, done.getStatus());
        assertEquals(2, done.getProcessed());
        assertFalse(jobStore.isStepClaimed(job.getId()));
    }

    @Test
    void testStepClaimIsReleasedWhenBatchIsInterrupted() {
        seedWines(4);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        AtomicBoolean held = new AtomicBoolean();
        onProfileLookup = wineId -> {
            if (wineId == 1L && held.compareAndSet(false, true)) {
                await(new CountDownLatch(1));
            }
        };

        Thread.currentThread().interrupt();
        try {
            assertThrows(IllegalStateException.class, () -> orchestrator.step(job.getId()));
        } finally {
            Thread.interrupted();
        }

        assertFalse(jobStore.isStepClaimed(job.getId()));
        BackfillJob resumed = orchestrator.resume(job.getId());
        assertEquals(3, resumed.getProcessed());
    }

    @Test
    void testRequeuedJobIgnoresCancelRaisedBeforeTheFailure() {
        seedWines(5);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        wineStore.setOnListWines(() -> jobStore.requestCancel(job.getId()));
        wineStore.setUnreachable(true);

        BackfillJob failed = orchestrator.step(job.getId());
        assertEquals(BackfillStatus.FAILED, failed.getStatus());
        assertTrue(jobStore.isCancelRequested(job.getId()));

        wineStore.setOnListWines(() -> { });
        wineStore.setUnreachable(false);
        BackfillJob resumed = orchestrator.resume(job.getId());

        assertEquals(BackfillStatus.RUNNING, resumed.getStatus());
        assertEquals(3, resumed.getProcessed());
        assertFalse(jobStore.isCancelRequested(job.getId()));
        assertEquals(BackfillStatus.COMPLETED, runToEnd(orchestrator, job.getId()).getStatus());
    }

    @Test
    void testCancelStopsBeforeNextBatch() {
        seedWines(9);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        orchestrator.step(job.getId());

        BackfillJob flagged = orchestrator.cancel(job.getId());
        assertTrue(flagged.isCancelRequested());

        BackfillJob cancelled = orchestrator.step(job.getId());

        assertEquals(BackfillStatus.CANCELLED, cancelled.getStatus());
        assertEquals(3, cancelled.getProcessed());
        assertEquals(3L, cancelled.getCursor());
        assertFalse(jobStore.isLocked());
        assertThrows(InvalidJobStateException.class, () -> orchestrator.step(job.getId()));
    }

    @Test
    void testCancelDuringBatchTakesEffectAfterCommit() {
        seedWines(9);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        onProfileLookup = wineId -> {
            if (wineId == 2L) {
                jobStore.requestCancel(job.getId());
            }
        };

        BackfillJob result = orchestrator.step(job.getId());

        assertEquals(BackfillStatus.CANCELLED, result.getStatus());
        assertEquals(3, result.getProcessed());
        assertEquals(3L, result.getCursor());
        assertEquals(3, resultStore.snapshot().size());
    }

    @Test
    void testCancelOfFinishedJobLeavesItUntouched() {
        seedWines(2);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob done = runToEnd(orchestrator, orchestrator.start(BackfillMode.FORCE_ALL, null).getId());

        BackfillJob afterCancel = orchestrator.cancel(done.getId());

        assertEquals(BackfillStatus.COMPLETED, afterCancel.getStatus());
        assertFalse(jobStore.isCancelRequested(done.getId()));
    }

    @Test
    void testResumeOfCompletedJobIsInvalid() {
        seedWines(2);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob done = runToEnd(orchestrator, orchestrator.start(BackfillMode.FORCE_ALL, null).getId());

        assertThrows(InvalidJobStateException.class, () -> orchestrator.resume(done.getId()));
    }

    @Test
    void testUnknownJobIsReported() {
        BackfillOrchestrator orchestrator = newOrchestrator();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> orchestrator.step(42L));
        assertEquals("Job not found: 42", e.getMessage());
    }

    @Test
    void testMissingOnlySkipsWinesThatHaveResults() {
        seedWines(6);
        resultStore.save(2L, storedResult(2));
        resultStore.save(5L, storedResult(2));
        BackfillOrchestrator orchestrator = newOrchestrator();

        BackfillJob done = runToEnd(orchestrator, orchestrator.start(BackfillMode.MISSING_ONLY, null).getId());

        assertEquals(4, done.getProcessed());
        assertFalse(computations.containsKey(2L));
        assertFalse(computations.containsKey(5L));
    }

    @Test
    void testStaleOrMissingPicksUpOldAlgorithmVersions() {
        seedWines(4);
        resultStore.save(1L, storedResult(1));
        resultStore.save(2L, storedResult(2));
        resultStore.save(3L, storedResult(2));
        BackfillOrchestrator orchestrator = newOrchestrator();

        BackfillJob done = runToEnd(orchestrator, orchestrator.start(BackfillMode.STALE_OR_MISSING, null).getId());

        assertEquals(2, done.getProcessed());
        assertEquals(List.of(1L, 4L), computations.keySet().stream().sorted().collect(Collectors.toList()));
        assertEquals(2, resultStore.find(1L).orElseThrow().getAlgorithmVersion());
    }

    @Test
    void testJobKeepsTheVersionItStartedWith() {
        seedWines(4);
        BackfillOrchestrator orchestrator = newOrchestrator();
        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);

        readinessProperties.setAlgorithmVersion(3);
        runToEnd(orchestrator, job.getId());

        resultStore.snapshot().values().forEach(result -> assertEquals(2, result.getAlgorithmVersion()));
    }

    @Test
    void testFindRunningReturnsOnlyRunningJob() {
        seedWines(2);
        BackfillOrchestrator orchestrator = newOrchestrator();
        assertTrue(orchestrator.findRunning().isEmpty());

        BackfillJob job = orchestrator.start(BackfillMode.FORCE_ALL, null);
        assertEquals(job.getId(), orchestrator.findRunning().orElseThrow().getId());

        runToEnd(orchestrator, job.getId());
        assertTrue(orchestrator.findRunning().isEmpty());
        assertEquals(1, orchestrator.listRecent().size());
    }

    private BackfillOrchestrator newOrchestrator() {
        ProfileSource profileSource = wineId -> {
            computations.computeIfAbsent(wineId, id -> new AtomicInteger()).incrementAndGet();
            onProfileLookup.accept(wineId);
            return Optional.empty();
        };
        ReadinessService readinessService = new ReadinessService(wineStore, resultStore, profileSource,
                new ReadinessCalculator(), readinessProperties, CLOCK);
        return new BackfillOrchestrator(wineStore, resultStore, jobStore, readinessService, backfillProperties, CLOCK);
    }

    private static BackfillJob runToEnd(BackfillOrchestrator orchestrator, long jobId) {
        BackfillJob job = orchestrator.getJobStatus(jobId);
        int guard = 0;
        while (!job.getStatus().isTerminal()) {
            job = orchestrator.step(jobId);
            assertTrue(++guard < 100, "job did not terminate");
        }
        return job;
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private void seedWines(int count) {
        for (long id = 1; id <= count; id++) {
            int index = (int) id;
            wineStore.add(WineRecord.builder()
                    .id(id)
                    .wineName("Wine " + id)
                    .producer("Producer " + (id % 3))
                    .vintageYear(2000 + index * 2)
                    .color(COLORS[index % COLORS.length])
                    .grape(GRAPES.get(index % GRAPES.size()))
                    .region(index % 2 == 0 ? "Burgundy" : "Piedmont Barolo")
                    .build());
        }
    }

    private static List<Long> allWineIds(int count) {
        List<Long> ids = new ArrayList<>();
        for (long id = 1; id <= count; id++) {
            ids.add(id);
        }
        return ids;
    }

    private static ReadinessResult storedResult(int version) {
        return ReadinessResult.builder()
                .score(70)
                .status(ReadinessStatus.IN_WINDOW)
                .drinkWindowStart(2018)
                .drinkWindowEnd(2030)
                .confidence(Confidence.MED)
                .reason("stored earlier")
                .algorithmVersion(version)
                .build();
    }
}
