package com.riskfactor.calendar;

/**
 * Classifies a date on the US equity trading calendar.
 *
 * <p>FULL_HOLIDAY means no session and no closing prices. EARLY_CLOSE (e.g. the day after
 * Thanksgiving) is a trading day whose session ends at 13:00 New York time.
 */
public enum HolidayType {

    /** Exchange closed all day. */
    FULL_HOLIDAY,

    /** Shortened session; still a trading day. */
    EARLY_CLOSE
}
