package com.riskfactor.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable date-indexed series of periodic returns for one symbol.
 *
 * <p>Non-finite values are dropped on construction, so every date present carries a usable
 * return. Series may be shorter than the range they were requested for (partial history).
 */
public final class ReturnSeries {

    private final String symbol;
    private final NavigableMap<LocalDate, Double> returns;

    private ReturnSeries(String symbol, NavigableMap<LocalDate, Double> returns) {
        this.symbol = symbol;
        this.returns = Collections.unmodifiableNavigableMap(returns);
    }

    public static ReturnSeries of(String symbol, Map<LocalDate, Double> returns) {
        TreeMap<LocalDate, Double> sorted = new TreeMap<>();
        if (returns != null) {
            returns.forEach((date, value) -> {
                if (date != null && value != null && Double.isFinite(value)) {
                    sorted.put(date, value);
                }
            });
        }
        return new ReturnSeries(symbol, sorted);
    }

    public static ReturnSeries empty(String symbol) {
        return new ReturnSeries(symbol, new TreeMap<>());
    }

    public String getSymbol() {
        return symbol;
    }

    public NavigableMap<LocalDate, Double> asMap() {
        return returns;
    }

    public int size() {
        return returns.size();
    }

    public boolean isEmpty() {
        return returns.isEmpty();
    }

    public Double get(LocalDate date) {
        return returns.get(date);
    }

    /**
     * Inner join on the date index: only dates present in both series are kept.
     * The result is ordered by date, oldest first.
     */
    public AlignedReturns alignWith(ReturnSeries factor) {
        List<LocalDate> dates = new ArrayList<>();
        List<Double> dependent = new ArrayList<>();
        List<Double> independent = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> entry : returns.entrySet()) {
            Double factorReturn = factor.returns.get(entry.getKey());
            if (factorReturn != null) {
                dates.add(entry.getKey());
                dependent.add(entry.getValue());
                independent.add(factorReturn);
            }
        }
        return AlignedReturns.of(dates, dependent, independent);
    }

    /** Long minus short, computed on the dates both series share. */
    public ReturnSeries minus(ReturnSeries shortLeg, String spreadName) {
        TreeMap<LocalDate, Double> spread = new TreeMap<>();
        for (Map.Entry<LocalDate, Double> entry : returns.entrySet()) {
            Double other = shortLeg.returns.get(entry.getKey());
            if (other != null) {
                spread.put(entry.getKey(), entry.getValue() - other);
            }
        }
        return new ReturnSeries(spreadName, spread);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReturnSeries that)) {
            return false;
        }
        return Objects.equals(symbol, that.symbol) && returns.equals(that.returns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, returns);
    }

    @Override
    public String toString() {
        return "ReturnSeries{symbol=" + symbol + ", size=" + returns.size() + "}";
    }
}
