package com.riskfactor.observability;

import com.riskfactor.batch.BatchRunTracker;
import com.riskfactor.domain.enums.RunOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the Micrometer metrics of the daily batch.
 *
 * <ul>
 *   <li><b>batch.runs</b> (counter, tag outcome): runs that completed, failed or were rejected</li>
 *   <li><b>batch.portfolio.failures</b> (counter): portfolio phase units that failed</li>
 *   <li><b>batch.run.duration</b> (timer): wall time of a run from start to tracker cleanup</li>
 *   <li><b>batch.running</b> (gauge 0/1): whether the run tracker currently holds a run</li>
 *   <li><b>factor.regressions.computed</b> / <b>factor.regressions.skipped</b> (counters)</li>
 *   <li><b>factor.exposures.fallback</b> (counter): portfolio exposures written as FALLBACK</li>
 * </ul>
 *
 * <p>The running gauge is evaluated lazily by Micrometer on scrape.
 */
@Service
public class BatchMetricsService {

    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter runsRejectedCounter;
    private final Counter portfolioFailureCounter;
    private final Counter regressionsComputedCounter;
    private final Counter regressionsSkippedCounter;
    private final Counter fallbackExposureCounter;
    private final Timer runDurationTimer;

    public BatchMetricsService(MeterRegistry meterRegistry, BatchRunTracker batchRunTracker) {
        this.runsCompletedCounter = runCounter(meterRegistry, RunOutcome.COMPLETED);
        this.runsFailedCounter = runCounter(meterRegistry, RunOutcome.FAILED);
        this.runsRejectedCounter = runCounter(meterRegistry, RunOutcome.REJECTED);

        this.portfolioFailureCounter = Counter.builder("batch.portfolio.failures")
                .description("Portfolio phase units that ended FAILED")
                .register(meterRegistry);

        this.regressionsComputedCounter = Counter.builder("factor.regressions.computed")
                .description("Position factor regressions that produced a beta")
                .register(meterRegistry);

        this.regressionsSkippedCounter = Counter.builder("factor.regressions.skipped")
                .description("Position factor regressions skipped for insufficient or degenerate data")
                .register(meterRegistry);

        this.fallbackExposureCounter = Counter.builder("factor.exposures.fallback")
                .description("Portfolio factor exposures computed from portfolio-level returns")
                .register(meterRegistry);

        this.runDurationTimer = Timer.builder("batch.run.duration")
                .description("Wall time of a batch run")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofHours(6))
                .register(meterRegistry);

        meterRegistry.gauge("batch.running", batchRunTracker, tracker -> tracker.isRunning() ? 1.0 : 0.0);
    }

    public void recordRun(RunOutcome outcome, Duration duration) {
        switch (outcome) {
            case COMPLETED -> runsCompletedCounter.increment();
            case FAILED -> runsFailedCounter.increment();
            case REJECTED -> runsRejectedCounter.increment();
        }
        if (duration != null && outcome != RunOutcome.REJECTED) {
            runDurationTimer.record(duration);
        }
    }

    public void recordPortfolioFailure() {
        portfolioFailureCounter.increment();
    }

    public void recordRegressions(int computed, int skipped) {
        if (computed > 0) {
            regressionsComputedCounter.increment(computed);
        }
        if (skipped > 0) {
            regressionsSkippedCounter.increment(skipped);
        }
    }

    public void recordFallbackExposure() {
        fallbackExposureCounter.increment();
    }

    private static Counter runCounter(MeterRegistry meterRegistry, RunOutcome outcome) {
        return Counter.builder("batch.runs")
                .description("Batch runs by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry);
    }
}
