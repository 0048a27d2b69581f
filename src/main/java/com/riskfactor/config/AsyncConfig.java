package com.riskfactor.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for the batch.
 *
 * <ul>
 *   <li>{@code batchRunExecutor}: the single background thread a launched run executes on</li>
 *   <li>{@code batchExecutor}: the per-portfolio units of each phase</li>
 *   <li>{@code factorExecutor}: per-position regressions inside the factor exposure engine</li>
 * </ul>
 *
 * <p>The pools are separate so that a run never waits on units queued behind itself, and so
 * that regression fan-out from one portfolio cannot starve the phase units of its siblings.
 *
 * <p>The phase unit pool has a fixed size and an unbounded queue. A unit must never run on the
 * orchestrating thread, where neither the deadline nor cancellation could reach it, so the pool
 * only rejects once it is shut down. The regression pool falls back to the caller thread when
 * saturated; that caller is itself a phase unit and stays interruptible. The run pool aborts,
 * so a launch against a shut-down pool is reported rather than silently dropped; its one-slot
 * queue only covers the hand-over between a finishing run and the next.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${riskfactor.async.batch-pool-size:8}")
    private int batchPoolSize;

    @Value("${riskfactor.async.factor-core-pool-size:4}")
    private int factorCorePoolSize;

    @Value("${riskfactor.async.factor-max-pool-size:8}")
    private int factorMaxPoolSize;

    @Value("${riskfactor.async.factor-queue-capacity:500}")
    private int factorQueueCapacity;

    @Bean("batchRunExecutor")
    public ThreadPoolTaskExecutor batchRunExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("batch-run-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("batchExecutor")
    @Primary
    public ThreadPoolTaskExecutor batchExecutor() {
        ThreadPoolTaskExecutor executor = buildExecutor(batchPoolSize, batchPoolSize, Integer.MAX_VALUE, "batch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        return executor;
    }

    @Bean("factorExecutor")
    public ThreadPoolTaskExecutor factorExecutor() {
        return buildExecutor(factorCorePoolSize, factorMaxPoolSize, factorQueueCapacity, "factor-");
    }

    @Override
    public Executor getAsyncExecutor() {
        return batchExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }

    private ThreadPoolTaskExecutor buildExecutor(int corePoolSize, int maxPoolSize, int queueCapacity, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
