package com.riskfactor.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Trading-day arithmetic for the US equity calendar.
 *
 * <p>Used by:
 * <ul>
 *   <li>DailyBatchScheduler: to pick the calculation date of the nightly run</li>
 *   <li>MarketDataCoveragePhaseHandler: to judge whether a symbol's latest return is stale</li>
 * </ul>
 *
 * <p>Holiday data is loaded from YAML configuration via {@link HolidayCalendarConfig}.
 */
@Service
public class TradingCalendarService {

    private static final Logger log = LoggerFactory.getLogger(TradingCalendarService.class);

    private final HolidayCalendarConfig holidayCalendarConfig;

    public TradingCalendarService(HolidayCalendarConfig holidayCalendarConfig) {
        this.holidayCalendarConfig = holidayCalendarConfig;
    }

    public ZoneId getZone() {
        return ZoneId.of(holidayCalendarConfig.getTimezone());
    }

    /**
     * Checks if a date is a non-trading day (weekend or full holiday).
     * Weekends (Saturday/Sunday) are always holidays.
     */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.FULL_HOLIDAY);
    }

    public boolean isEarlyClose(LocalDate date) {
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.EARLY_CLOSE);
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date);
    }

    /** Returns the next trading day after the given date. */
    public LocalDate getNextTradingDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isTradingDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /** Returns the previous trading day before the given date. */
    public LocalDate getPreviousTradingDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isTradingDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    /** Trading days in {@code [from, to]}, both inclusive, oldest first. */
    public List<LocalDate> getTradingDaysBetween(LocalDate from, LocalDate to) {
        List<LocalDate> days = new ArrayList<>();
        LocalDate current = from;
        while (!current.isAfter(to)) {
            if (isTradingDay(current)) {
                days.add(current);
            }
            current = current.plusDays(1);
        }
        return days;
    }

    /**
     * Latest date whose closing prices are complete as of the given instant.
     *
     * <p>Today qualifies only if it is a trading day and the data cut-off (16:30 New York, or the
     * early-close cut-off) has passed; otherwise the previous trading day is used.
     */
    public LocalDate resolveCalculationDate(ZonedDateTime now) {
        ZonedDateTime local = now.withZoneSameInstant(getZone());
        LocalDate today = local.toLocalDate();
        if (isTradingDay(today)) {
            LocalTime cutoff = isEarlyClose(today)
                    ? holidayCalendarConfig.getEarlyCloseDataCutoff()
                    : holidayCalendarConfig.getDataCutoff();
            if (!local.toLocalTime().isBefore(cutoff)) {
                return today;
            }
        }
        LocalDate resolved = getPreviousTradingDay(today);
        log.debug("Calculation date for {} resolved to previous trading day {}", local, resolved);
        return resolved;
    }
}
