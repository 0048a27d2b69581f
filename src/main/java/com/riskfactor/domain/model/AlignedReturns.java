package com.riskfactor.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Two return series joined on their common dates, oldest first.
 * {@code dependent} is the position (or portfolio) series, {@code independent} the factor series.
 */
public record AlignedReturns(List<LocalDate> dates, double[] dependent, double[] independent) {

    public static AlignedReturns of(List<LocalDate> dates, List<Double> dependent, List<Double> independent) {
        return new AlignedReturns(
                List.copyOf(dates),
                dependent.stream().mapToDouble(Double::doubleValue).toArray(),
                independent.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public int size() {
        return dates.size();
    }

    /** Keeps only the most recent {@code observations} rows. */
    public AlignedReturns mostRecent(int observations) {
        int size = size();
        if (observations <= 0 || observations >= size) {
            return this;
        }
        int from = size - observations;
        double[] y = new double[observations];
        double[] x = new double[observations];
        System.arraycopy(dependent, from, y, 0, observations);
        System.arraycopy(independent, from, x, 0, observations);
        return new AlignedReturns(List.copyOf(dates.subList(from, size)), y, x);
    }
}
