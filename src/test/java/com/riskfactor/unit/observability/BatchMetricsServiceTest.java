package com.riskfactor.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskfactor.batch.BatchRunTracker;
import com.riskfactor.domain.enums.RunOutcome;
import com.riskfactor.domain.model.PortfolioScope;
import com.riskfactor.observability.BatchMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for BatchMetricsService using a SimpleMeterRegistry.
 */
class BatchMetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private BatchRunTracker tracker;
    private BatchMetricsService metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        tracker = new BatchRunTracker(Duration.ZERO, Clock.systemUTC());
        metrics = new BatchMetricsService(meterRegistry, tracker);
    }

    @Test
    @DisplayName("Run outcomes are counted by tag; rejected runs are not timed")
    void runOutcomes() {
        metrics.recordRun(RunOutcome.COMPLETED, Duration.ofMinutes(3));
        metrics.recordRun(RunOutcome.FAILED, Duration.ofMinutes(1));
        metrics.recordRun(RunOutcome.REJECTED, null);
        metrics.recordRun(RunOutcome.REJECTED, Duration.ofSeconds(1));

        assertThat(meterRegistry.get("batch.runs").tag("outcome", "completed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("batch.runs").tag("outcome", "failed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("batch.runs").tag("outcome", "rejected").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("batch.run.duration").timer().count()).isEqualTo(2);
        assertThat(meterRegistry.get("batch.run.duration").timer().totalTime(TimeUnit.SECONDS)).isEqualTo(240.0);
    }

    @Test
    @DisplayName("Regression counters accumulate computed and skipped counts")
    void regressions() {
        metrics.recordRegressions(19, 3);
        metrics.recordRegressions(0, 11);
        metrics.recordFallbackExposure();
        metrics.recordPortfolioFailure();

        assertThat(meterRegistry.get("factor.regressions.computed").counter().count()).isEqualTo(19.0);
        assertThat(meterRegistry.get("factor.regressions.skipped").counter().count()).isEqualTo(14.0);
        assertThat(meterRegistry.get("factor.exposures.fallback").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("batch.portfolio.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Running gauge follows the tracker")
    void runningGauge() {
        assertThat(meterRegistry.get("batch.running").gauge().value()).isEqualTo(0.0);

        String runId = tracker.start(LocalDate.of(2025, 6, 16), PortfolioScope.all(), "ops");
        assertThat(meterRegistry.get("batch.running").gauge().value()).isEqualTo(1.0);

        tracker.complete(runId);
        assertThat(meterRegistry.get("batch.running").gauge().value()).isEqualTo(0.0);
    }
}
