package com.riskfactor.batch;

import com.riskfactor.calendar.TradingCalendarService;
import com.riskfactor.exception.InvalidArgumentsException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Validates batch trigger arguments before the run tracker is touched.
 *
 * <p>Trigger callers (admin endpoints, scripts, schedulers) have been observed passing a
 * portfolio id where the calculation date belongs, and a bare portfolio id where a list
 * belongs. {@link #validate(Object, Object)} accepts loosely typed input and rejects both
 * shapes with {@link InvalidArgumentsException}:
 * <ul>
 *   <li>calculation date: a {@link LocalDate} or an ISO-8601 date string</li>
 *   <li>portfolio ids: null (all active portfolios) or a collection of {@link UUID}s or UUID
 *       strings. A single id, string or UUID, is rejected.</li>
 * </ul>
 */
@Component
public class BatchArgumentValidator {

    private final TradingCalendarService tradingCalendarService;

    public BatchArgumentValidator(TradingCalendarService tradingCalendarService) {
        this.tradingCalendarService = tradingCalendarService;
    }

    /** Calculation date and scope after validation. A null list means all active portfolios. */
    public record BatchArguments(LocalDate calculationDate, List<UUID> portfolioIds) {}

    public BatchArguments validate(Object calculationDate, Object portfolioIds) {
        LocalDate date = toDate(calculationDate);
        List<UUID> ids = toPortfolioIds(portfolioIds);
        validate(date, ids);
        return new BatchArguments(date, ids);
    }

    /**
     * Typed checks: date present and not in the future; ids null, or non-empty without nulls
     * or duplicates.
     */
    public void validate(LocalDate calculationDate, List<UUID> portfolioIds) {
        if (calculationDate == null) {
            throw new InvalidArgumentsException("calculationDate is required");
        }
        LocalDate today = LocalDate.now(tradingCalendarService.getZone());
        if (calculationDate.isAfter(today)) {
            throw new InvalidArgumentsException(
                    "calculationDate " + calculationDate + " is in the future",
                    Map.of("calculationDate", calculationDate.toString(), "today", today.toString()));
        }
        if (portfolioIds == null) {
            return;
        }
        if (portfolioIds.isEmpty()) {
            throw new InvalidArgumentsException("portfolioIds must be null (all portfolios) or a non-empty list");
        }
        Set<UUID> seen = new HashSet<>();
        for (UUID id : portfolioIds) {
            if (id == null) {
                throw new InvalidArgumentsException("portfolioIds must not contain null entries");
            }
            if (!seen.add(id)) {
                throw new InvalidArgumentsException(
                        "portfolioIds contains duplicate id " + id, Map.of("portfolioId", id.toString()));
            }
        }
    }

    private static LocalDate toDate(Object value) {
        if (value == null) {
            throw new InvalidArgumentsException("calculationDate is required");
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof UUID) {
            throw new InvalidArgumentsException(
                    "calculationDate must be a date, got a portfolio id: " + value,
                    Map.of("calculationDate", value.toString()));
        }
        if (value instanceof CharSequence text) {
            String s = text.toString().trim();
            if (isUuid(s)) {
                throw new InvalidArgumentsException(
                        "calculationDate must be a date, got a portfolio id: " + s, Map.of("calculationDate", s));
            }
            try {
                return LocalDate.parse(s);
            } catch (DateTimeParseException e) {
                throw new InvalidArgumentsException(
                        "calculationDate must be an ISO date (yyyy-MM-dd): " + s, Map.of("calculationDate", s));
            }
        }
        throw new InvalidArgumentsException(
                "calculationDate must be a LocalDate or ISO date string, got " + value.getClass().getSimpleName());
    }

    private static List<UUID> toPortfolioIds(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof UUID || value instanceof CharSequence) {
            throw new InvalidArgumentsException(
                    "portfolioIds must be a list; wrap a single portfolio id in a one-element list",
                    Map.of("portfolioIds", value.toString()));
        }
        if (!(value instanceof Collection<?> collection)) {
            throw new InvalidArgumentsException(
                    "portfolioIds must be a list of portfolio ids, got " + value.getClass().getSimpleName());
        }
        List<UUID> ids = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (element == null) {
                ids.add(null);
            } else if (element instanceof UUID id) {
                ids.add(id);
            } else if (element instanceof CharSequence text && isUuid(text.toString().trim())) {
                ids.add(UUID.fromString(text.toString().trim()));
            } else {
                throw new InvalidArgumentsException(
                        "portfolioIds entry is not a portfolio id: " + element, Map.of("entry", element.toString()));
            }
        }
        return ids;
    }

    private static boolean isUuid(String s) {
        if (s.length() != 36) {
            return false;
        }
        try {
            UUID.fromString(s);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
