package com.riskfactor.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskfactor.calendar.HolidayCalendarConfig;
import com.riskfactor.calendar.HolidayCalendarConfig.Holiday;
import com.riskfactor.calendar.HolidayType;
import com.riskfactor.calendar.TradingCalendarService;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TradingCalendarService covering weekends, full holidays, early closes and
 * calculation date resolution around the data cut-off.
 */
class TradingCalendarServiceTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private TradingCalendarService service;

    @BeforeEach
    void setUp() {
        HolidayCalendarConfig config = new HolidayCalendarConfig();
        config.setHolidays(List.of(
                new Holiday(LocalDate.of(2025, 7, 4), "Independence Day", HolidayType.FULL_HOLIDAY),
                new Holiday(LocalDate.of(2025, 7, 3), "Independence Day Eve", HolidayType.EARLY_CLOSE),
                new Holiday(LocalDate.of(2025, 12, 25), "Christmas Day", HolidayType.FULL_HOLIDAY)));
        service = new TradingCalendarService(config);
    }

    // ==============================
    // TRADING DAYS
    // ==============================

    @Nested
    @DisplayName("Trading Days")
    class TradingDays {

        @Test
        @DisplayName("Weekends and full holidays are not trading days; early closes are")
        void holidays() {
            assertThat(service.isTradingDay(LocalDate.of(2025, 6, 14))).isFalse();
            assertThat(service.isTradingDay(LocalDate.of(2025, 7, 4))).isFalse();
            assertThat(service.isTradingDay(LocalDate.of(2025, 7, 3))).isTrue();
            assertThat(service.isEarlyClose(LocalDate.of(2025, 7, 3))).isTrue();
            assertThat(service.isTradingDay(LocalDate.of(2025, 6, 16))).isTrue();
        }

        @Test
        @DisplayName("Previous and next trading day skip weekends and holidays")
        void navigation() {
            assertThat(service.getPreviousTradingDay(LocalDate.of(2025, 7, 7))).isEqualTo(LocalDate.of(2025, 7, 3));
            assertThat(service.getNextTradingDay(LocalDate.of(2025, 7, 3))).isEqualTo(LocalDate.of(2025, 7, 7));
            assertThat(service.getPreviousTradingDay(LocalDate.of(2025, 6, 16))).isEqualTo(LocalDate.of(2025, 6, 13));
        }

        @Test
        @DisplayName("Trading days between two dates are inclusive and exclude holidays")
        void between() {
            List<LocalDate> days = service.getTradingDaysBetween(LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 8));

            assertThat(days).containsExactly(
                    LocalDate.of(2025, 7, 1),
                    LocalDate.of(2025, 7, 2),
                    LocalDate.of(2025, 7, 3),
                    LocalDate.of(2025, 7, 7),
                    LocalDate.of(2025, 7, 8));
        }
    }

    // ==============================
    // CALCULATION DATE
    // ==============================

    @Nested
    @DisplayName("Calculation Date")
    class CalculationDate {

        @Test
        @DisplayName("After the cut-off on a trading day, today is used")
        void afterCutoff() {
            assertThat(service.resolveCalculationDate(ZonedDateTime.of(2025, 6, 17, 16, 30, 0, 0, NEW_YORK)))
                    .isEqualTo(LocalDate.of(2025, 6, 17));
        }

        @Test
        @DisplayName("Before the cut-off, the previous trading day is used")
        void beforeCutoff() {
            assertThat(service.resolveCalculationDate(ZonedDateTime.of(2025, 6, 17, 16, 29, 0, 0, NEW_YORK)))
                    .isEqualTo(LocalDate.of(2025, 6, 16));
            assertThat(service.resolveCalculationDate(ZonedDateTime.of(2025, 6, 16, 9, 0, 0, 0, NEW_YORK)))
                    .isEqualTo(LocalDate.of(2025, 6, 13));
        }

        @Test
        @DisplayName("Early close moves the cut-off earlier")
        void earlyClose() {
            assertThat(service.resolveCalculationDate(ZonedDateTime.of(2025, 7, 3, 14, 0, 0, 0, NEW_YORK)))
                    .isEqualTo(LocalDate.of(2025, 7, 3));
        }

        @Test
        @DisplayName("Weekends and holidays resolve to the last trading day")
        void nonTradingDays() {
            assertThat(service.resolveCalculationDate(ZonedDateTime.of(2025, 6, 21, 20, 0, 0, 0, NEW_YORK)))
                    .isEqualTo(LocalDate.of(2025, 6, 20));
            assertThat(service.resolveCalculationDate(ZonedDateTime.of(2025, 12, 25, 20, 0, 0, 0, NEW_YORK)))
                    .isEqualTo(LocalDate.of(2025, 12, 24));
        }

        @Test
        @DisplayName("Instants in other zones are converted to New York time first")
        void otherZone() {
            // 2025-06-17 01:00 UTC is 21:00 on the 16th in New York
            assertThat(service.resolveCalculationDate(ZonedDateTime.of(2025, 6, 17, 1, 0, 0, 0, ZoneId.of("UTC"))))
                    .isEqualTo(LocalDate.of(2025, 6, 16));
        }
    }
}
