package com.riskfactor.batch;

import com.riskfactor.calendar.TradingCalendarService;
import com.riskfactor.config.BatchProperties;
import com.riskfactor.exception.AlreadyRunningException;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Launches the nightly batch for all active portfolios.
 *
 * <p>The calculation date is the latest date with complete closing prices (see
 * {@link TradingCalendarService#resolveCalculationDate}). A trigger that finds a run still
 * active is logged and dropped; the next schedule tick tries again.
 */
@Component
@ConditionalOnProperty(prefix = "riskfactor.batch", name = "schedule-enabled", havingValue = "true",
        matchIfMissing = true)
public class DailyBatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyBatchScheduler.class);

    static final String TRIGGERED_BY = "scheduler";

    private final BatchRunLauncher batchRunLauncher;
    private final TradingCalendarService tradingCalendarService;
    private final BatchProperties batchProperties;

    public DailyBatchScheduler(
            BatchRunLauncher batchRunLauncher,
            TradingCalendarService tradingCalendarService,
            BatchProperties batchProperties) {
        this.batchRunLauncher = batchRunLauncher;
        this.tradingCalendarService = tradingCalendarService;
        this.batchProperties = batchProperties;
    }

    @Scheduled(cron = "${riskfactor.batch.schedule-cron:0 30 18 * * MON-FRI}", zone = "America/New_York")
    public void runScheduledBatch() {
        trigger(ZonedDateTime.now(tradingCalendarService.getZone()));
    }

    /** Launches a run for the calculation date effective at {@code now}; empty when rejected. */
    public Optional<String> trigger(ZonedDateTime now) {
        LocalDate calculationDate = tradingCalendarService.resolveCalculationDate(now);
        try {
            String runId = batchRunLauncher.launch(
                    calculationDate, null, TRIGGERED_BY, batchProperties.getDefaultDeadline());
            log.info("Scheduled batch run {} launched for {}", runId, calculationDate);
            return Optional.of(runId);
        } catch (AlreadyRunningException e) {
            log.warn("Scheduled batch for {} skipped: run {} still active", calculationDate, e.getActiveRunId());
            return Optional.empty();
        }
    }
}
