package com.riskfactor.factor;

import com.riskfactor.domain.model.Position;
import com.riskfactor.domain.model.ReturnSeries;
import java.time.LocalDate;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconstructs a portfolio's daily return series from its positions, for the fallback regression.
 *
 * <p>Each position's current signed market value is rolled back through its own returns:
 * value(t-1) = value(t) / (1 + r(t)). A position with no return on a date (PRIVATE holdings,
 * or a date outside the position's history) keeps a constant value across it.
 *
 * <p>Portfolio return(t) = sum(value_i(t-1) * r_i(t)) / sum(|value_i(t-1)|) over all positions,
 * on the union of the dates any position has a return for. Statically valued holdings sit in
 * the denominator only, which is the dilution that makes fallback betas lower confidence.
 */
@Component
public class PortfolioReturnBuilder {

    private static final Logger log = LoggerFactory.getLogger(PortfolioReturnBuilder.class);

    /** Returns at or below -100% cannot be rolled back and are treated as missing. */
    private static final double MIN_GROSS_RETURN = 1e-9;

    public ReturnSeries build(UUID portfolioId, Iterable<Position> positions, Map<UUID, ReturnSeries> positionReturns) {
        NavigableSet<LocalDate> dates = new TreeSet<>();
        positionReturns.values().forEach(series -> dates.addAll(series.asMap().keySet()));

        Map<LocalDate, Double> weightedReturns = new TreeMap<>();
        Map<LocalDate, Double> grossValues = new TreeMap<>();

        for (Position position : positions) {
            double value = position.getSignedMarketValue().doubleValue();
            if (value == 0.0) {
                continue;
            }
            ReturnSeries series = positionReturns.get(position.getId());

            // Walk back from the most recent date; value holds value_i(t) on entry.
            for (LocalDate date : dates.descendingSet()) {
                Double r = series != null ? series.get(date) : null;
                double previousValue = value;
                double contribution = 0.0;
                if (r != null && 1.0 + r > MIN_GROSS_RETURN) {
                    previousValue = value / (1.0 + r);
                    contribution = previousValue * r;
                }
                weightedReturns.merge(date, contribution, Double::sum);
                grossValues.merge(date, Math.abs(previousValue), Double::sum);
                value = previousValue;
            }
        }

        Map<LocalDate, Double> portfolioReturns = new TreeMap<>();
        for (LocalDate date : dates) {
            double gross = grossValues.getOrDefault(date, 0.0);
            if (gross > 0.0) {
                portfolioReturns.put(date, weightedReturns.getOrDefault(date, 0.0) / gross);
            }
        }

        log.debug("Reconstructed {} portfolio returns for {} from {} position series",
                portfolioReturns.size(), portfolioId, positionReturns.size());
        return ReturnSeries.of("PORTFOLIO:" + portfolioId, portfolioReturns);
    }
}
