package com.riskfactor.batch;

import com.riskfactor.calendar.TradingCalendarService;
import com.riskfactor.config.FactorProperties;
import com.riskfactor.domain.enums.BatchPhase;
import com.riskfactor.domain.model.Position;
import com.riskfactor.domain.model.ReturnSeries;
import com.riskfactor.exception.NoReturnDataAvailableException;
import com.riskfactor.factor.FactorDefinitionRegistry;
import com.riskfactor.marketdata.ReturnSeriesAccessor;
import com.riskfactor.portfolio.PositionStore;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Critical first phase: checks that the inputs of the calculation phases are available for a
 * portfolio before any of them runs.
 *
 * <ul>
 *   <li>the position store answers for the portfolio (an outage fails the unit)</li>
 *   <li>every benchmark series of the factor catalogue is non-empty over the widest fetch window
 *       (a missing benchmark fails the unit with {@link NoReturnDataAvailableException})</li>
 *   <li>position coverage: how many eligible positions have any return history. Low coverage is
 *       reported, not failed; the engine handles it through skips and the fallback.</li>
 * </ul>
 *
 * <p>A portfolio failing here is skipped in every later phase.
 */
@Component
public class MarketDataCoveragePhaseHandler implements BatchPhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(MarketDataCoveragePhaseHandler.class);

    private final PositionStore positionStore;
    private final ReturnSeriesAccessor returnSeriesAccessor;
    private final FactorDefinitionRegistry factorDefinitionRegistry;
    private final TradingCalendarService tradingCalendarService;
    private final int fetchBufferDays;

    public MarketDataCoveragePhaseHandler(
            PositionStore positionStore,
            ReturnSeriesAccessor returnSeriesAccessor,
            FactorDefinitionRegistry factorDefinitionRegistry,
            TradingCalendarService tradingCalendarService,
            FactorProperties factorProperties) {
        this.positionStore = positionStore;
        this.returnSeriesAccessor = returnSeriesAccessor;
        this.factorDefinitionRegistry = factorDefinitionRegistry;
        this.tradingCalendarService = tradingCalendarService;
        this.fetchBufferDays = factorProperties.getFetchBufferDays();
    }

    @Override
    public BatchPhase phase() {
        return BatchPhase.MARKET_DATA_COVERAGE;
    }

    @Override
    public String execute(UUID portfolioId, LocalDate calculationDate) {
        List<Position> positions = positionStore.getPositions(portfolioId, calculationDate);
        LocalDate from = calculationDate.minusDays((long) factorDefinitionRegistry.getMaxLookbackDays() + fetchBufferDays);

        // Closing prices of the day before the calculation date must be in, at the latest
        LocalDate oldestAcceptable = tradingCalendarService.getPreviousTradingDay(calculationDate);
        List<String> staleBenchmarks = new ArrayList<>();
        for (String symbol : factorDefinitionRegistry.getBenchmarkSymbols()) {
            ReturnSeries series = fetch(symbol, from, calculationDate);
            if (series.isEmpty()) {
                throw new NoReturnDataAvailableException(
                        symbol, "No returns for benchmark " + symbol + " between " + from + " and " + calculationDate);
            }
            if (series.asMap().lastKey().isBefore(oldestAcceptable)) {
                staleBenchmarks.add(symbol);
            }
        }
        if (!staleBenchmarks.isEmpty()) {
            log.warn("Portfolio {}: benchmark returns older than {} for {}", portfolioId, oldestAcceptable,
                    staleBenchmarks);
        }

        Set<String> symbols = new LinkedHashSet<>();
        positions.stream()
                .filter(Position::isRegressionEligible)
                .forEach(p -> symbols.add(p.getReturnSymbol()));
        int covered = 0;
        for (String symbol : symbols) {
            try {
                if (!returnSeriesAccessor.getReturns(symbol, from, calculationDate).isEmpty()) {
                    covered++;
                }
            } catch (NoReturnDataAvailableException e) {
                log.debug("No return history for position symbol {}: {}", symbol, e.getMessage());
            }
        }
        if (!symbols.isEmpty() && covered == 0) {
            log.warn("Portfolio {}: none of {} position symbols has return history, exposures will rely on"
                    + " the fallback", portfolioId, symbols.size());
        }

        String summary = String.format("%d positions, %d/%d position symbols with returns", positions.size(),
                covered, symbols.size());
        if (!staleBenchmarks.isEmpty()) {
            summary += ", stale benchmarks " + staleBenchmarks;
        }
        return summary;
    }

    private ReturnSeries fetch(String symbol, LocalDate from, LocalDate to) {
        try {
            return returnSeriesAccessor.getReturns(symbol, from, to);
        } catch (NoReturnDataAvailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NoReturnDataAvailableException(symbol, "Return series unavailable for benchmark " + symbol, e);
        }
    }
}
