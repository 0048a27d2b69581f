package com.riskfactor.batch;

import com.riskfactor.config.BatchProperties;
import com.riskfactor.domain.model.BatchRun;
import com.riskfactor.domain.model.RunResult;
import com.riskfactor.exception.BatchExecutionException;
import com.riskfactor.exception.ErrorCode;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Out-of-band trigger for the daily batch: the caller gets a run id back immediately and polls
 * {@link BatchStatusService} for progress.
 *
 * <p>Registration happens on the caller's thread, so argument errors and already-running
 * rejections reach the caller synchronously. Execution happens on the {@code batchRunExecutor}.
 * If the executor refuses the run, or the run is cancelled before it starts, the tracker is
 * completed here so the gate never stays closed. Once started, the orchestrator owns the
 * tracker until its units have stopped.
 */
@Service
public class BatchRunLauncher {

    private static final Logger log = LoggerFactory.getLogger(BatchRunLauncher.class);

    private final BatchOrchestrator batchOrchestrator;
    private final BatchRunTracker batchRunTracker;
    private final BatchArgumentValidator batchArgumentValidator;
    private final BatchProperties batchProperties;
    private final AsyncTaskExecutor batchRunExecutor;

    private final Map<String, LaunchedRun> activeRuns = new ConcurrentHashMap<>();
    private final AtomicReference<RunResult> lastResult = new AtomicReference<>();

    public BatchRunLauncher(
            BatchOrchestrator batchOrchestrator,
            BatchRunTracker batchRunTracker,
            BatchArgumentValidator batchArgumentValidator,
            BatchProperties batchProperties,
            @Qualifier("batchRunExecutor") AsyncTaskExecutor batchRunExecutor) {
        this.batchOrchestrator = batchOrchestrator;
        this.batchRunTracker = batchRunTracker;
        this.batchArgumentValidator = batchArgumentValidator;
        this.batchProperties = batchProperties;
        this.batchRunExecutor = batchRunExecutor;
    }

    /**
     * Trigger entry point for loosely typed callers (admin tooling, scripts). Uses the
     * configured default deadline.
     *
     * @throws com.riskfactor.exception.InvalidArgumentsException for a bare id or a non-date
     */
    public String launch(Object calculationDate, Object portfolioIds, String triggeredBy) {
        BatchArgumentValidator.BatchArguments arguments = batchArgumentValidator.validate(calculationDate, portfolioIds);
        return launch(arguments.calculationDate(), arguments.portfolioIds(), triggeredBy,
                batchProperties.getDefaultDeadline());
    }

    /**
     * @return the id of the registered run
     * @throws com.riskfactor.exception.AlreadyRunningException if another run is active
     */
    public String launch(LocalDate calculationDate, List<UUID> portfolioIds, String triggeredBy, Duration deadline) {
        BatchRun run = batchOrchestrator.register(calculationDate, portfolioIds, triggeredBy);
        String runId = run.getRunId();

        // Registered before submission so the task's own cleanup always finds its entry
        LaunchedRun launched = new LaunchedRun();
        activeRuns.put(runId, launched);
        try {
            launched.future = batchRunExecutor.submit(() -> {
                try {
                    if (!launched.started.compareAndSet(false, true)) {
                        return null;
                    }
                    RunResult result = batchOrchestrator.execute(run, deadline);
                    lastResult.set(result);
                    return result;
                } finally {
                    activeRuns.remove(runId, launched);
                }
            });
        } catch (TaskRejectedException e) {
            activeRuns.remove(runId, launched);
            batchRunTracker.complete(runId, false);
            log.error("Batch run {} could not be scheduled: {}", runId, e.getMessage());
            throw new BatchExecutionException(ErrorCode.INTERNAL_ERROR, "Batch executor rejected run " + runId, e);
        }
        if (launched.cancelRequested) {
            launched.future.cancel(true);
        }

        log.info("Batch run {} launched for {} by {}", runId, calculationDate, triggeredBy);
        return runId;
    }

    /**
     * Cancels a launched run. A queued run is dropped and the tracker released here. A run that
     * already executes is interrupted; it stops its units and releases the tracker itself, so a
     * new run cannot start while cancelled units may still write.
     *
     * @return true if a running or queued run with this id was found
     */
    public boolean cancel(String runId) {
        LaunchedRun launched = activeRuns.get(runId);
        if (launched == null) {
            return false;
        }
        launched.cancelRequested = true;
        if (launched.started.compareAndSet(false, true)) {
            activeRuns.remove(runId, launched);
            Future<RunResult> future = launched.future;
            if (future != null) {
                future.cancel(false);
            }
            batchRunTracker.complete(runId, false);
            log.warn("Batch run {} cancelled before it started", runId);
        } else {
            Future<RunResult> future = launched.future;
            if (future != null) {
                future.cancel(true);
            }
            log.warn("Batch run {} cancelled, waiting for its units to stop", runId);
        }
        return true;
    }

    /** Ids of runs launched here that are queued or executing. */
    public Set<String> getActiveRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    public Optional<RunResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    private static final class LaunchedRun {

        /** Claimed by whichever comes first: the executing task or a cancel. */
        private final AtomicBoolean started = new AtomicBoolean();

        private volatile Future<RunResult> future;

        /** Set by a cancel that may have raced the assignment of {@link #future}. */
        private volatile boolean cancelRequested;
    }
}
