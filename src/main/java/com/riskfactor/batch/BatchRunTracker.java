package com.riskfactor.batch;

import com.riskfactor.config.BatchProperties;
import com.riskfactor.domain.enums.BatchRunState;
import com.riskfactor.domain.model.BatchRun;
import com.riskfactor.domain.model.BatchRunStatus;
import com.riskfactor.domain.model.PortfolioScope;
import com.riskfactor.exception.AlreadyRunningException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide gate allowing at most one batch run at a time.
 *
 * <p>{@link #start} and {@link #complete} are the only mutators. Both are single atomic
 * operations on an {@link AtomicReference}, so status reads never block and never observe a
 * half-written run.
 *
 * <p>{@code complete} must be reached on every exit path of a run (normal, failed, cancelled).
 * It clears the tracker only when the run id matches the active run, which makes repeated or
 * late calls harmless.
 *
 * <p>After a run ends, its status stays visible as COMPLETED for
 * {@code riskfactor.batch.completed-status-ttl} so that pollers see how it ended; after that,
 * or as soon as a new run starts, the tracker reports IDLE.
 */
@Component
public class BatchRunTracker {

    private static final Logger log = LoggerFactory.getLogger(BatchRunTracker.class);

    private final AtomicReference<BatchRun> activeRun = new AtomicReference<>();
    private final AtomicReference<CompletedRun> lastCompleted = new AtomicReference<>();
    private final Duration completedStatusTtl;
    private final Clock clock;

    @Autowired
    public BatchRunTracker(BatchProperties batchProperties) {
        this(batchProperties.getCompletedStatusTtl(), Clock.systemUTC());
    }

    public BatchRunTracker(Duration completedStatusTtl, Clock clock) {
        this.completedStatusTtl = completedStatusTtl != null ? completedStatusTtl : Duration.ZERO;
        this.clock = clock;
    }

    /**
     * Registers a new run.
     *
     * @return the new run id
     * @throws AlreadyRunningException if a run is active; the active run is left untouched
     */
    public String start(LocalDate calculationDate, PortfolioScope portfolioScope, String triggeredBy) {
        return startRun(calculationDate, portfolioScope, triggeredBy).getRunId();
    }

    /** Same as {@link #start} but returns the registered run. */
    public BatchRun startRun(LocalDate calculationDate, PortfolioScope portfolioScope, String triggeredBy) {
        BatchRun run = BatchRun.builder()
                .runId(UUID.randomUUID().toString())
                .calculationDate(calculationDate)
                .portfolioScope(portfolioScope)
                .startedAt(clock.instant())
                .triggeredBy(triggeredBy)
                .build();

        if (!activeRun.compareAndSet(null, run)) {
            BatchRun current = activeRun.get();
            String activeRunId = current != null ? current.getRunId() : "unknown";
            log.warn("Batch run for {} rejected, run {} is still active", calculationDate, activeRunId);
            throw new AlreadyRunningException(activeRunId);
        }

        lastCompleted.set(null);
        log.info("Batch run {} started for {} (scope: {}, triggered by: {})",
                run.getRunId(), calculationDate, portfolioScope, triggeredBy);
        return run;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    public Optional<BatchRun> current() {
        return Optional.ofNullable(activeRun.get());
    }

    public boolean complete(String runId) {
        return complete(runId, true);
    }

    /**
     * Clears the tracker if {@code runId} is the active run.
     *
     * @return true if this call cleared the run, false for a mismatched or repeated call
     */
    public boolean complete(String runId, boolean success) {
        BatchRun current = activeRun.get();
        if (current == null || !current.getRunId().equals(runId)) {
            log.debug("complete({}) ignored, active run is {}", runId, current != null ? current.getRunId() : "none");
            return false;
        }

        Instant completedAt = clock.instant();
        // Publish the terminal status before releasing the gate so pollers never see IDLE in between
        lastCompleted.set(new CompletedRun(current, completedAt, success));
        if (!activeRun.compareAndSet(current, null)) {
            return false;
        }

        log.info("Batch run {} completed (success: {}) after {}s",
                runId, success, Duration.between(current.getStartedAt(), completedAt).toSeconds());
        return true;
    }

    public BatchRunStatus getStatus() {
        Instant now = clock.instant();
        BatchRun current = activeRun.get();
        if (current != null) {
            return BatchRunStatus.builder()
                    .state(BatchRunState.RUNNING)
                    .runId(current.getRunId())
                    .calculationDate(current.getCalculationDate())
                    .triggeredBy(current.getTriggeredBy())
                    .startedAt(current.getStartedAt())
                    .elapsedSeconds(Duration.between(current.getStartedAt(), now).toSeconds())
                    .build();
        }

        CompletedRun completed = lastCompleted.get();
        if (completed != null && now.isBefore(completed.completedAt().plus(completedStatusTtl))) {
            BatchRun run = completed.run();
            return BatchRunStatus.builder()
                    .state(BatchRunState.COMPLETED)
                    .runId(run.getRunId())
                    .calculationDate(run.getCalculationDate())
                    .triggeredBy(run.getTriggeredBy())
                    .startedAt(run.getStartedAt())
                    .completedAt(completed.completedAt())
                    .elapsedSeconds(Duration.between(run.getStartedAt(), completed.completedAt()).toSeconds())
                    .success(completed.success())
                    .build();
        }
        return BatchRunStatus.idle();
    }

    private record CompletedRun(BatchRun run, Instant completedAt, boolean success) {}
}
