package com.riskfactor.calendar;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the US equity trading calendar, loaded from application.yml via
 * the {@code trading-calendar} prefix.
 *
 * <p>The holiday list is maintained annually from the published NYSE schedule. It decides which
 * dates carry closing prices, and therefore which calculation date a scheduled batch run uses.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String exchange = "NYSE";
    private String timezone = "America/New_York";

    /** Closing prices for a day are considered complete after this time. */
    private LocalTime dataCutoff = LocalTime.of(16, 30);

    /** Cut-off used instead of {@code dataCutoff} on early-close days. */
    private LocalTime earlyCloseDataCutoff = LocalTime.of(13, 30);

    private List<Holiday> holidays = new ArrayList<>();

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public LocalTime getDataCutoff() {
        return dataCutoff;
    }

    public void setDataCutoff(LocalTime dataCutoff) {
        this.dataCutoff = dataCutoff;
    }

    public LocalTime getEarlyCloseDataCutoff() {
        return earlyCloseDataCutoff;
    }

    public void setEarlyCloseDataCutoff(LocalTime earlyCloseDataCutoff) {
        this.earlyCloseDataCutoff = earlyCloseDataCutoff;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    /**
     * A single entry on the trading calendar.
     */
    public static class Holiday {

        private LocalDate date;
        private String name;
        private HolidayType type = HolidayType.FULL_HOLIDAY;

        public Holiday() {}

        public Holiday(LocalDate date, String name, HolidayType type) {
            this.date = date;
            this.name = name;
            this.type = type;
        }

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HolidayType getType() {
            return type;
        }

        public void setType(HolidayType type) {
            this.type = type;
        }
    }
}
