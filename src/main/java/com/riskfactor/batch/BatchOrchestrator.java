package com.riskfactor.batch;

import com.riskfactor.config.BatchProperties;
import com.riskfactor.domain.enums.BatchPhase;
import com.riskfactor.domain.enums.PhaseStatus;
import com.riskfactor.domain.enums.RunOutcome;
import com.riskfactor.domain.model.BatchRun;
import com.riskfactor.domain.model.PortfolioPhaseResult;
import com.riskfactor.domain.model.PortfolioScope;
import com.riskfactor.domain.model.RunResult;
import com.riskfactor.exception.AlreadyRunningException;
import com.riskfactor.exception.BaseException;
import com.riskfactor.exception.BatchExecutionException;
import com.riskfactor.exception.ErrorCode;
import com.riskfactor.observability.BatchMetricsService;
import com.riskfactor.portfolio.PortfolioDirectory;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the daily batch for one calculation date across a portfolio scope.
 *
 * <p>Run lifecycle: IDLE -> STARTING -> RUNNING(phase n) -> COMPLETED | FAILED. STARTING fails
 * with {@link AlreadyRunningException} (REJECTED) while another run is active; argument errors
 * are raised before the run tracker is touched.
 *
 * <p>Phases run in {@link BatchPhase} order. Within a phase every portfolio is an independent
 * unit on the batch executor; the phase is a barrier, so phase n+1 never starts for a portfolio
 * before phase n has finished for it. Each unit reports a {@link PortfolioPhaseResult} and never
 * lets an exception escape:
 * <ul>
 *   <li>a failed unit marks only that portfolio FAILED; its siblings carry on</li>
 *   <li>a portfolio that failed a critical phase is SKIPPED in the later phases</li>
 *   <li>deadline expiry or interruption cancels unfinished units (FAILED), skips the remaining
 *       phases and fails the run</li>
 * </ul>
 *
 * <p>Cancelled units are interrupted, and the run waits up to {@code unit-stop-timeout} for them
 * to leave their handler before the tracker is released. A unit queued behind the deadline never
 * starts. Units are never run on the orchestrating thread, so the deadline covers all of them.
 *
 * <p>The run tracker is completed in a {@code finally} block, whatever happens in between.
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final BatchRunTracker batchRunTracker;
    private final BatchActivityLog batchActivityLog;
    private final BatchArgumentValidator batchArgumentValidator;
    private final PortfolioDirectory portfolioDirectory;
    private final List<BatchPhaseHandler> phaseHandlers;
    private final BatchMetricsService batchMetricsService;
    private final Executor batchExecutor;
    private final Duration unitStopTimeout;

    public BatchOrchestrator(
            BatchRunTracker batchRunTracker,
            BatchActivityLog batchActivityLog,
            BatchArgumentValidator batchArgumentValidator,
            PortfolioDirectory portfolioDirectory,
            List<BatchPhaseHandler> phaseHandlers,
            BatchMetricsService batchMetricsService,
            @Qualifier("batchExecutor") Executor batchExecutor,
            BatchProperties batchProperties) {
        this.batchRunTracker = batchRunTracker;
        this.batchActivityLog = batchActivityLog;
        this.batchArgumentValidator = batchArgumentValidator;
        this.portfolioDirectory = portfolioDirectory;
        this.phaseHandlers = phaseHandlers.stream()
                .sorted(Comparator.comparingInt(h -> h.phase().getOrder()))
                .toList();
        this.batchMetricsService = batchMetricsService;
        this.batchExecutor = batchExecutor;
        this.unitStopTimeout = batchProperties.getUnitStopTimeout();
    }

    /**
     * Runs the full batch synchronously.
     *
     * @param portfolioIds null for all active portfolios, otherwise a non-empty list
     */
    public RunResult runDailyBatchSequence(LocalDate calculationDate, List<UUID> portfolioIds) {
        return runDailyBatchSequence(calculationDate, portfolioIds, "system", null);
    }

    /**
     * @param deadline optional; null or non-positive means none
     */
    public RunResult runDailyBatchSequence(
            LocalDate calculationDate, List<UUID> portfolioIds, String triggeredBy, Duration deadline) {
        BatchRun run = register(calculationDate, portfolioIds, triggeredBy);
        return execute(run, deadline);
    }

    /**
     * Validates the arguments and registers the run with the tracker. The returned run must be
     * passed to {@link #execute}, which completes it.
     */
    public BatchRun register(LocalDate calculationDate, List<UUID> portfolioIds, String triggeredBy) {
        batchArgumentValidator.validate(calculationDate, portfolioIds);
        try {
            return batchRunTracker.startRun(calculationDate, PortfolioScope.of(portfolioIds), triggeredBy);
        } catch (AlreadyRunningException e) {
            batchMetricsService.recordRun(RunOutcome.REJECTED, null);
            throw e;
        }
    }

    public RunResult execute(BatchRun run, Duration deadline) {
        String runId = run.getRunId();
        Instant startedAt = Instant.now();
        Instant deadlineAt = deadline != null && !deadline.isNegative() && !deadline.isZero()
                ? startedAt.plus(deadline)
                : null;

        RunResult result = RunResult.builder()
                .runId(runId)
                .calculationDate(run.getCalculationDate())
                .triggeredBy(run.getTriggeredBy())
                .startedAt(startedAt)
                .outcome(RunOutcome.FAILED)
                .build();
        boolean success = false;

        try {
            List<UUID> portfolios = resolveScope(run.getPortfolioScope());
            List<BatchPhase> phases = phaseHandlers.stream().map(BatchPhaseHandler::phase).toList();
            batchActivityLog.reset(runId, phases, portfolios.size());
            batchActivityLog.info("Batch run started for " + run.getCalculationDate() + ": " + portfolios.size()
                    + " portfolio(s), " + phases.size() + " phase(s)");
            log.info("Batch run {} executing for {}: {} portfolios, phases {}", runId, run.getCalculationDate(),
                    portfolios.size(), phases);

            for (UUID portfolioId : portfolios) {
                result.getPortfolioResults().put(portfolioId, new EnumMap<>(BatchPhase.class));
            }

            Set<UUID> blocked = new HashSet<>();
            String abortReason = null;
            for (BatchPhaseHandler handler : phaseHandlers) {
                if (abortReason != null) {
                    skipPhase(handler.phase(), portfolios, result, "Run aborted: " + abortReason);
                    continue;
                }
                abortReason = runPhase(run, handler, portfolios, blocked, result, deadlineAt);
                if (abortReason != null) {
                    result.getErrors().add(abortReason);
                }
            }

            tally(result);
            result.setOutcome(abortReason == null ? RunOutcome.COMPLETED : RunOutcome.FAILED);
            success = result.isSuccess();
            return result;
        } catch (RuntimeException e) {
            log.error("Batch run {} failed outside the phase units: {}", runId, e.getMessage(), e);
            result.getErrors().add(e.getMessage());
            batchActivityLog.error("Batch run failed: " + e.getMessage());
            throw e;
        } finally {
            result.setFinishedAt(Instant.now());
            batchRunTracker.complete(runId, success);
            batchMetricsService.recordRun(result.getOutcome(), result.getDuration());
            batchActivityLog.info("Batch run " + result.getOutcome() + ": " + result.getSucceededPortfolios()
                    + " succeeded, " + result.getFailedPortfolios() + " failed");
            log.info("Batch run {} finished: outcome {}, {} succeeded, {} failed, {}ms", runId, result.getOutcome(),
                    result.getSucceededPortfolios(), result.getFailedPortfolios(), result.getDuration().toMillis());
        }
    }

    private List<UUID> resolveScope(PortfolioScope scope) {
        if (!scope.isAll()) {
            return scope.getPortfolioIds();
        }
        List<UUID> ids = portfolioDirectory.getActivePortfolioIds();
        return ids != null ? ids : List.of();
    }

    /**
     * Runs one phase over all portfolios and waits for every unit.
     *
     * @return null when the phase ran to completion, otherwise why the run has to stop
     */
    private String runPhase(
            BatchRun run,
            BatchPhaseHandler handler,
            List<UUID> portfolios,
            Set<UUID> blocked,
            RunResult result,
            Instant deadlineAt) {
        BatchPhase phase = handler.phase();
        batchActivityLog.phaseStarted(phase);
        batchActivityLog.info("Phase " + phase.getOrder() + " (" + phase.getDisplayName() + ") started");
        long phaseStart = System.currentTimeMillis();

        Map<UUID, UnitTask> tasks = new LinkedHashMap<>();
        Map<UUID, PortfolioPhaseResult> rejected = new LinkedHashMap<>();
        for (UUID portfolioId : portfolios) {
            if (blocked.contains(portfolioId)) {
                recordUnit(result,
                        PortfolioPhaseResult.skipped(portfolioId, phase, "Skipped after a failed critical phase"));
                batchActivityLog.portfolioProcessed(phase);
                continue;
            }
            UnitTask task = new UnitTask(() -> runUnit(handler, portfolioId, run.getCalculationDate()));
            try {
                batchExecutor.execute(task);
                tasks.put(portfolioId, task);
            } catch (RejectedExecutionException e) {
                log.error("Batch executor rejected {} unit for portfolio {}: {}", phase, portfolioId, e.getMessage());
                rejected.put(portfolioId, PortfolioPhaseResult.failed(portfolioId, phase,
                        ErrorCode.INTERNAL_ERROR.getCode() + ": batch executor rejected the unit", 0L));
                batchActivityLog.portfolioProcessed(phase);
            }
        }

        String abortReason = awaitPhase(phase, tasks.values(), deadlineAt);

        List<UnitTask> abandoned = new ArrayList<>();
        Map<UUID, PortfolioPhaseResult> unitResults = new LinkedHashMap<>(rejected);
        for (Map.Entry<UUID, UnitTask> entry : tasks.entrySet()) {
            UUID portfolioId = entry.getKey();
            UnitTask task = entry.getValue();
            PortfolioPhaseResult unitResult = task.completedResult();
            if (unitResult == null) {
                if (task.abandon()) {
                    abandoned.add(task);
                }
                unitResult = PortfolioPhaseResult.failed(portfolioId, phase,
                        abortReason != null ? abortReason : "Unit did not complete", 0L);
            }
            unitResults.put(portfolioId, unitResult);
        }
        if (!abandoned.isEmpty()) {
            awaitAbandoned(phase, abandoned);
        }

        List<String> failed = new ArrayList<>();
        for (PortfolioPhaseResult unitResult : unitResults.values()) {
            UUID portfolioId = unitResult.getPortfolioId();
            recordUnit(result, unitResult);
            if (unitResult.isFailed()) {
                failed.add(portfolioId.toString());
                batchMetricsService.recordPortfolioFailure();
                batchActivityLog.error("Portfolio " + portfolioId + " failed " + phase.getDisplayName() + ": "
                        + unitResult.getMessage());
                if (phase.isCritical()) {
                    blocked.add(portfolioId);
                }
            }
        }

        PhaseStatus phaseStatus = abortReason != null ? PhaseStatus.FAILED : PhaseStatus.COMPLETED;
        batchActivityLog.phaseFinished(phase, phaseStatus);
        if (failed.isEmpty()) {
            batchActivityLog.info("Phase " + phase.getOrder() + " completed");
        } else {
            batchActivityLog.warning("Phase " + phase.getOrder() + " completed with " + failed.size()
                    + " failed portfolio(s)");
        }
        log.info("Batch run {} phase {} {} in {}ms ({} units, {} failed)", run.getRunId(), phase, phaseStatus,
                System.currentTimeMillis() - phaseStart, unitResults.size(), failed.size());
        return abortReason;
    }

    private String awaitPhase(BatchPhase phase, Collection<UnitTask> tasks, Instant deadlineAt) {
        try {
            for (UnitTask task : tasks) {
                try {
                    if (deadlineAt == null) {
                        task.get();
                    } else {
                        long remaining = Math.max(0, Duration.between(Instant.now(), deadlineAt).toMillis());
                        task.get(remaining, TimeUnit.MILLISECONDS);
                    }
                } catch (ExecutionException e) {
                    // Units catch their own exceptions; whatever escapes is reported per portfolio
                    log.error("Unit of phase {} completed exceptionally: {}", phase, e.getMessage(), e);
                }
            }
            return null;
        } catch (TimeoutException e) {
            BatchExecutionException deadline = new BatchExecutionException(
                    ErrorCode.BATCH_DEADLINE_EXCEEDED, "Deadline exceeded during phase " + phase);
            log.error("{}: cancelling unfinished units", deadline.getMessage());
            batchActivityLog.error(deadline.getMessage());
            return deadline.getErrorCode().getCode() + ": " + deadline.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch run interrupted during phase {}, cancelling unfinished units", phase);
            batchActivityLog.error("Batch run interrupted during phase " + phase);
            return ErrorCode.BATCH_CANCELLED.getCode() + ": interrupted during phase " + phase;
        }
    }

    /**
     * Waits for interrupted units to leave their handler, so that the tracker is not released
     * while they can still write. The wait ignores interrupts and restores the flag afterwards.
     */
    private void awaitAbandoned(BatchPhase phase, List<UnitTask> abandoned) {
        boolean interrupted = Thread.interrupted();
        long deadline = System.nanoTime() + unitStopTimeout.toNanos();
        int stillRunning = 0;
        try {
            for (UnitTask task : abandoned) {
                while (true) {
                    try {
                        long remaining = deadline - System.nanoTime();
                        if (!task.awaitExit(Math.max(0, remaining))) {
                            stillRunning++;
                        }
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        if (stillRunning > 0) {
            log.error("{} unit(s) of phase {} ignored cancellation for {}ms and are still running", stillRunning,
                    phase, unitStopTimeout.toMillis());
            batchActivityLog.error(stillRunning + " cancelled unit(s) of phase " + phase + " did not stop in time");
        } else {
            log.info("{} cancelled unit(s) of phase {} stopped", abandoned.size(), phase);
        }
    }

    private PortfolioPhaseResult runUnit(BatchPhaseHandler handler, UUID portfolioId, LocalDate calculationDate) {
        BatchPhase phase = handler.phase();
        long start = System.currentTimeMillis();
        try {
            String summary = handler.execute(portfolioId, calculationDate);
            long duration = System.currentTimeMillis() - start;
            log.debug("Portfolio {} {} succeeded in {}ms: {}", portfolioId, phase, duration, summary);
            return PortfolioPhaseResult.succeeded(portfolioId, phase, summary, duration);
        } catch (BaseException e) {
            log.warn("Portfolio {} {} failed [{}]: {}", portfolioId, phase, e.getErrorCode().getCode(),
                    e.getMessage());
            return PortfolioPhaseResult.failed(portfolioId, phase, e.getErrorCode().getCode() + ": " + e.getMessage(),
                    System.currentTimeMillis() - start);
        } catch (Exception e) {
            log.error("Portfolio {} {} failed unexpectedly: {}", portfolioId, phase, e.getMessage(), e);
            return PortfolioPhaseResult.failed(portfolioId, phase,
                    ErrorCode.INTERNAL_ERROR.getCode() + ": " + e.getMessage(), System.currentTimeMillis() - start);
        } finally {
            batchActivityLog.portfolioProcessed(phase);
        }
    }

    private void skipPhase(BatchPhase phase, List<UUID> portfolios, RunResult result, String reason) {
        for (UUID portfolioId : portfolios) {
            recordUnit(result, PortfolioPhaseResult.skipped(portfolioId, phase, reason));
        }
        batchActivityLog.phaseFinished(phase, PhaseStatus.SKIPPED);
        batchActivityLog.warning("Phase " + phase.getOrder() + " skipped: " + reason);
    }

    private static void recordUnit(RunResult result, PortfolioPhaseResult unitResult) {
        result.getPortfolioResults()
                .computeIfAbsent(unitResult.getPortfolioId(), k -> new EnumMap<>(BatchPhase.class))
                .put(unitResult.getPhase(), unitResult);
    }

    private static void tally(RunResult result) {
        int succeeded = 0;
        int failed = 0;
        for (Map<BatchPhase, PortfolioPhaseResult> phases : result.getPortfolioResults().values()) {
            if (phases.values().stream().anyMatch(PortfolioPhaseResult::isFailed)) {
                failed++;
            } else {
                succeeded++;
            }
        }
        result.setSucceededPortfolios(succeeded);
        result.setFailedPortfolios(failed);
    }

    /**
     * A phase unit that can be interrupted once abandoned. Tracks whether its handler started
     * and when it returned, since {@link FutureTask#cancel} reports done before the handler
     * has actually stopped.
     */
    private static final class UnitTask extends FutureTask<PortfolioPhaseResult> {

        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CountDownLatch exited = new CountDownLatch(1);

        UnitTask(Callable<PortfolioPhaseResult> unit) {
            super(unit);
        }

        @Override
        public void run() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                super.run();
            } finally {
                exited.countDown();
            }
        }

        /** The unit's own result, or null if it has not finished normally. */
        PortfolioPhaseResult completedResult() {
            if (!isDone() || isCancelled()) {
                return null;
            }
            try {
                return get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            } catch (ExecutionException e) {
                return null;
            }
        }

        /**
         * Cancels the unit, interrupting it if it runs.
         *
         * @return true if the handler had already started and may still be running
         */
        boolean abandon() {
            cancel(true);
            return !claimed.compareAndSet(false, true);
        }

        boolean awaitExit(long timeoutNanos) throws InterruptedException {
            return exited.await(timeoutNanos, TimeUnit.NANOSECONDS);
        }
    }
}
