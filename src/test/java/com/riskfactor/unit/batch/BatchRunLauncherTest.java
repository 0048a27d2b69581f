package com.riskfactor.unit.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.riskfactor.batch.BatchActivityLog;
import com.riskfactor.batch.BatchArgumentValidator;
import com.riskfactor.batch.BatchOrchestrator;
import com.riskfactor.batch.BatchRunLauncher;
import com.riskfactor.batch.BatchRunTracker;
import com.riskfactor.calendar.HolidayCalendarConfig;
import com.riskfactor.calendar.TradingCalendarService;
import com.riskfactor.config.BatchProperties;
import com.riskfactor.domain.enums.BatchPhase;
import com.riskfactor.domain.enums.BatchRunState;
import com.riskfactor.domain.enums.RunOutcome;
import com.riskfactor.domain.model.BatchRun;
import com.riskfactor.domain.model.RunResult;
import com.riskfactor.exception.AlreadyRunningException;
import com.riskfactor.exception.BatchExecutionException;
import com.riskfactor.exception.InvalidArgumentsException;
import com.riskfactor.observability.BatchMetricsService;
import com.riskfactor.portfolio.PortfolioDirectory;
import com.riskfactor.support.ScriptedPhaseHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Unit tests for BatchRunLauncher: synchronous registration, asynchronous execution, and
 * tracker release when the run cannot be scheduled or is cancelled, and interruption of a
 * cancelled run that is already executing.
 */
class BatchRunLauncherTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 16);

    private final UUID portfolio = UUID.randomUUID();

    private ExecutorService unitExecutor;
    private ThreadPoolTaskExecutor runExecutor;
    private BatchRunTracker tracker;
    private BatchArgumentValidator validator;
    private BatchProperties properties;
    private ScriptedPhaseHandler coverage;
    private BatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        unitExecutor = Executors.newFixedThreadPool(2);
        runExecutor = new ThreadPoolTaskExecutor();
        runExecutor.setCorePoolSize(1);
        runExecutor.setMaxPoolSize(1);
        runExecutor.setQueueCapacity(1);
        runExecutor.setThreadNamePrefix("batch-run-test-");
        runExecutor.initialize();

        tracker = new BatchRunTracker(Duration.ofHours(2), Clock.systemUTC());
        validator = new BatchArgumentValidator(new TradingCalendarService(new HolidayCalendarConfig()));
        properties = new BatchProperties();
        coverage = new ScriptedPhaseHandler(BatchPhase.MARKET_DATA_COVERAGE, new CopyOnWriteArrayList<>());

        PortfolioDirectory directory = mock(PortfolioDirectory.class);
        when(directory.getActivePortfolioIds()).thenReturn(List.of(portfolio));

        orchestrator = new BatchOrchestrator(
                tracker,
                new BatchActivityLog(100, Clock.systemUTC()),
                validator,
                directory,
                List.of(coverage),
                new BatchMetricsService(new SimpleMeterRegistry(), tracker),
                unitExecutor,
                properties);
    }

    @AfterEach
    void tearDown() {
        runExecutor.shutdown();
        unitExecutor.shutdownNow();
    }

    private BatchRunLauncher launcher(AsyncTaskExecutor executor) {
        return new BatchRunLauncher(orchestrator, tracker, validator, properties, executor);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }

    // ==============================
    // LAUNCH
    // ==============================

    @Nested
    @DisplayName("Launch")
    class Launch {

        @Test
        @DisplayName("Returns the run id immediately and executes in the background")
        void launchesAsynchronously() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            coverage.when(portfolio, (id, date) -> {
                release.await(5, TimeUnit.SECONDS);
                return "ok";
            });
            BatchRunLauncher launcher = launcher(runExecutor);

            String runId = launcher.launch(DATE, null, "ops", Duration.ofMinutes(1));

            assertThat(tracker.getStatus().getState()).isEqualTo(BatchRunState.RUNNING);
            assertThat(tracker.getStatus().getRunId()).isEqualTo(runId);
            assertThat(launcher.getLastResult()).isEmpty();

            release.countDown();
            waitUntil(() -> launcher.getLastResult().isPresent());

            RunResult result = launcher.getLastResult().orElseThrow();
            assertThat(result.getRunId()).isEqualTo(runId);
            assertThat(result.getOutcome()).isEqualTo(RunOutcome.COMPLETED);
            waitUntil(() -> !tracker.isRunning());
            assertThat(tracker.getStatus().getState()).isEqualTo(BatchRunState.COMPLETED);
        }

        @Test
        @DisplayName("Second launch while the first runs is rejected synchronously")
        void secondLaunchRejected() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            coverage.when(portfolio, (id, date) -> {
                release.await(5, TimeUnit.SECONDS);
                return "ok";
            });
            BatchRunLauncher launcher = launcher(runExecutor);

            try {
                String first = launcher.launch(DATE, null, "ops", null);

                assertThatThrownBy(() -> launcher.launch(DATE, List.of(portfolio), "ops", null))
                        .isInstanceOf(AlreadyRunningException.class);
                assertThat(tracker.current()).map(BatchRun::getRunId).contains(first);
            } finally {
                release.countDown();
            }
            waitUntil(() -> !tracker.isRunning());
        }

        @Test
        @DisplayName("Bare portfolio id from a loosely typed caller is rejected before anything runs")
        void bareIdRejected() {
            AsyncTaskExecutor executor = mock(AsyncTaskExecutor.class);
            BatchRunLauncher launcher = launcher(executor);

            assertThatThrownBy(() -> launcher.launch(DATE, portfolio.toString(), "script"))
                    .isInstanceOf(InvalidArgumentsException.class);

            assertThat(tracker.getStatus().getState()).isEqualTo(BatchRunState.IDLE);
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("Run finishing inside submit leaves no stale entry behind")
        void inlineExecutorLeavesNoEntry() {
            BatchRunLauncher launcher = launcher(new TaskExecutorAdapter(Runnable::run));

            String first = launcher.launch(DATE, null, "ops", null);

            assertThat(launcher.getLastResult()).map(RunResult::getRunId).contains(first);
            assertThat(launcher.getActiveRunIds()).isEmpty();
            assertThat(tracker.isRunning()).isFalse();
            assertThat(launcher.cancel(first)).isFalse();

            String second = launcher.launch(DATE, List.of(portfolio), "ops", null);
            assertThat(second).isNotEqualTo(first);
            assertThat(launcher.getActiveRunIds()).isEmpty();
        }
    }

    // ==============================
    // RELEASE ON FAILURE TO RUN
    // ==============================

    @Nested
    @DisplayName("Tracker Release")
    class TrackerRelease {

        @Test
        @DisplayName("Executor rejection releases the tracker and surfaces an error")
        void executorRejects() {
            AsyncTaskExecutor executor = mock(AsyncTaskExecutor.class);
            when(executor.submit(any(Callable.class))).thenThrow(new TaskRejectedException("queue full"));
            BatchRunLauncher launcher = launcher(executor);

            assertThatThrownBy(() -> launcher.launch(DATE, null, "ops", null))
                    .isInstanceOf(BatchExecutionException.class);

            assertThat(tracker.isRunning()).isFalse();
            assertThat(tracker.getStatus().getSuccess()).isFalse();
        }

        @Test
        @DisplayName("Cancelling a queued run releases the tracker")
        void cancelQueuedRun() {
            AsyncTaskExecutor executor = mock(AsyncTaskExecutor.class);
            doReturn(new CompletableFuture<RunResult>()).when(executor).submit(any(Callable.class));
            BatchRunLauncher launcher = launcher(executor);

            String runId = launcher.launch(DATE, null, "ops", null);
            assertThat(tracker.isRunning()).isTrue();

            assertThat(launcher.cancel(runId)).isTrue();

            assertThat(tracker.isRunning()).isFalse();
            assertThat(launcher.cancel(runId)).isFalse();
            assertThat(coverage.getInvoked()).isEmpty();
        }

        @Test
        @DisplayName("Cancelling an executing run interrupts its units before the tracker is released")
        void cancelExecutingRun() throws Exception {
            CountDownLatch unitStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicBoolean unitInterrupted = new AtomicBoolean();
            coverage.when(portfolio, (id, date) -> {
                unitStarted.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                    return "ok";
                } catch (InterruptedException e) {
                    unitInterrupted.set(true);
                    throw e;
                }
            });
            BatchRunLauncher launcher = launcher(runExecutor);

            try {
                String runId = launcher.launch(DATE, null, "ops", Duration.ofMinutes(1));
                assertThat(unitStarted.await(5, TimeUnit.SECONDS)).isTrue();

                assertThat(launcher.cancel(runId)).isTrue();

                waitUntil(() -> !tracker.isRunning());
                assertThat(unitInterrupted).isTrue();
                assertThat(tracker.getStatus().getSuccess()).isFalse();
                waitUntil(() -> launcher.getActiveRunIds().isEmpty());
            } finally {
                release.countDown();
            }
        }
    }
}
