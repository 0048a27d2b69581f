package com.riskfactor.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch orchestration, status retention and the daily schedule.
 */
@Configuration
@ConfigurationProperties(prefix = "riskfactor.batch")
@Validated
@Getter
@Setter
public class BatchProperties {

    /** How long pollers keep seeing COMPLETED after a run ends before the tracker reports IDLE. */
    @NotNull
    private Duration completedStatusTtl = Duration.ofHours(2);

    /** Activity entries returned by the status poll. */
    @Positive
    private int recentActivityLimit = 50;

    /** Upper bound on activity entries kept for the full log of a run. */
    @Positive
    private int fullActivityLimit = 5000;

    /** Cron for the daily run, evaluated in America/New_York. Weekdays after the US close by default. */
    @NotBlank
    private String scheduleCron = "0 30 18 * * MON-FRI";

    private boolean scheduleEnabled = true;

    /** Deadline applied to scheduled runs. Null or zero means no deadline. */
    private Duration defaultDeadline = Duration.ofHours(4);

    /**
     * How long a run waits for cancelled units to leave their handler before it releases the
     * tracker anyway.
     */
    @NotNull
    private Duration unitStopTimeout = Duration.ofSeconds(30);
}
