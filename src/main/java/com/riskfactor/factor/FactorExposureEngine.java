package com.riskfactor.factor;

import com.riskfactor.config.FactorProperties;
import com.riskfactor.domain.model.AlignedReturns;
import com.riskfactor.domain.model.FactorDefinition;
import com.riskfactor.domain.model.PortfolioFactorExposure;
import com.riskfactor.domain.model.Position;
import com.riskfactor.domain.model.PositionFactorExposure;
import com.riskfactor.domain.model.RegressionResult;
import com.riskfactor.domain.model.ReturnSeries;
import com.riskfactor.exception.BaseException;
import com.riskfactor.exception.BatchExecutionException;
import com.riskfactor.exception.ErrorCode;
import com.riskfactor.exception.NoReturnDataAvailableException;
import com.riskfactor.marketdata.ReturnSeriesAccessor;
import com.riskfactor.observability.BatchMetricsService;
import com.riskfactor.portfolio.PositionStore;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Computes and persists the factor exposures of one portfolio as of one calculation date.
 *
 * <p>Per invocation:
 * <ol>
 *   <li>Load the portfolio's positions; PUBLIC and OPTIONS positions with a non-zero quantity
 *       are eligible for regression.</li>
 *   <li>Load every factor series over its fetch window (lookback plus a calendar-day buffer).
 *       Spread factors are long minus short, date-aligned first. An empty benchmark series is
 *       fatal for this portfolio: {@link NoReturnDataAvailableException}.</li>
 *   <li>Regress each eligible position on every factor, in parallel on the factor executor.
 *       Position and factor returns are inner-joined on date and the most recent
 *       {@code lookbackWindowDays} observations are kept. Fewer than {@code minRequiredDays}
 *       aligned observations, or a degenerate series, skips that single regression and writes
 *       no row.</li>
 *   <li>Aggregate each factor to the portfolio ({@link ExposureAggregator}); a factor with no
 *       contributing position falls back to a regression of the reconstructed portfolio return
 *       series ({@link PortfolioReturnBuilder}) on the factor.</li>
 *   <li>Replace the (portfolio, date) exposure rows in one transaction.</li>
 * </ol>
 *
 * <p>Regression work is side-effect free; the persistence write at the end is the only
 * mutation, so a failure before it leaves the previous rows for the date intact.
 */
@Service
public class FactorExposureEngine {

    private static final Logger log = LoggerFactory.getLogger(FactorExposureEngine.class);

    private final PositionStore positionStore;
    private final ReturnSeriesAccessor returnSeriesAccessor;
    private final FactorDefinitionRegistry factorDefinitionRegistry;
    private final OlsRegressionCalculator olsRegressionCalculator;
    private final ExposureAggregator exposureAggregator;
    private final PortfolioReturnBuilder portfolioReturnBuilder;
    private final FactorExposurePersistenceService persistenceService;
    private final BatchMetricsService batchMetricsService;
    private final Executor factorExecutor;
    private final int fetchBufferDays;

    public FactorExposureEngine(
            PositionStore positionStore,
            ReturnSeriesAccessor returnSeriesAccessor,
            FactorDefinitionRegistry factorDefinitionRegistry,
            OlsRegressionCalculator olsRegressionCalculator,
            ExposureAggregator exposureAggregator,
            PortfolioReturnBuilder portfolioReturnBuilder,
            FactorExposurePersistenceService persistenceService,
            BatchMetricsService batchMetricsService,
            @Qualifier("factorExecutor") Executor factorExecutor,
            FactorProperties factorProperties) {
        this.positionStore = positionStore;
        this.returnSeriesAccessor = returnSeriesAccessor;
        this.factorDefinitionRegistry = factorDefinitionRegistry;
        this.olsRegressionCalculator = olsRegressionCalculator;
        this.exposureAggregator = exposureAggregator;
        this.portfolioReturnBuilder = portfolioReturnBuilder;
        this.persistenceService = persistenceService;
        this.batchMetricsService = batchMetricsService;
        this.factorExecutor = factorExecutor;
        this.fetchBufferDays = factorProperties.getFetchBufferDays();
    }

    public FactorExposureResult calculate(UUID portfolioId, LocalDate calculationDate) {
        long start = System.currentTimeMillis();
        List<Position> positions = positionStore.getPositions(portfolioId, calculationDate);
        List<Position> eligible = positions.stream()
                .filter(Position::isRegressionEligible)
                .toList();
        List<FactorDefinition> factors = factorDefinitionRegistry.getAll();

        log.info("Factor exposure for portfolio {} on {}: {} positions, {} eligible, {} factors",
                portfolioId, calculationDate, positions.size(), eligible.size(), factors.size());

        Map<String, ReturnSeries> factorSeries = loadFactorSeries(factors, calculationDate);
        Map<UUID, ReturnSeries> positionSeries = loadPositionSeries(eligible, calculationDate);

        // Per-position regressions, one task per position covering every factor
        List<CompletableFuture<List<PositionFactorExposure>>> futures = eligible.stream()
                .map(position -> CompletableFuture.supplyAsync(
                        () -> regressPosition(position, positionSeries.get(position.getId()), factors,
                                factorSeries, calculationDate),
                        factorExecutor))
                .toList();

        List<PositionFactorExposure> positionExposures = new ArrayList<>();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
            futures.forEach(f -> positionExposures.addAll(f.join()));
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw cancelled(portfolioId, calculationDate);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause(), portfolioId);
        } catch (CompletionException e) {
            throw unwrap(e.getCause(), portfolioId);
        }

        int computed = positionExposures.size();
        int skipped = eligible.size() * factors.size() - computed;
        batchMetricsService.recordRegressions(computed, skipped);

        // Aggregation per factor
        Map<String, Map<UUID, Double>> betasByFactor = new HashMap<>();
        for (PositionFactorExposure exposure : positionExposures) {
            betasByFactor
                    .computeIfAbsent(exposure.getFactorCode(), k -> new HashMap<>())
                    .put(exposure.getPositionId(), exposure.getBeta());
        }

        Supplier<ReturnSeries> portfolioSeries = memoize(
                () -> portfolioReturnBuilder.build(portfolioId, positions, positionSeries));

        List<AggregatedExposure> aggregated = new ArrayList<>();
        List<String> withoutExposure = new ArrayList<>();
        for (FactorDefinition factor : factors) {
            Optional<AggregatedExposure> exposure = exposureAggregator.aggregate(
                    factor.getCode(),
                    positions,
                    betasByFactor.getOrDefault(factor.getCode(), Map.of()),
                    () -> regress(portfolioSeries.get(), factorSeries.get(factor.getCode()), factor));
            if (exposure.isPresent()) {
                aggregated.add(exposure.get());
                if (exposure.get() instanceof AggregatedExposure.Fallback fallback) {
                    batchMetricsService.recordFallbackExposure();
                    log.warn("Portfolio {} factor {}: no position betas, using FALLBACK beta {} ({} observations)."
                                    + " Lower confidence than position-level aggregation",
                            portfolioId, factor.getCode(), fallback.beta(), fallback.regression().getObservations());
                }
            } else {
                withoutExposure.add(factor.getCode());
                log.warn("Portfolio {} factor {}: insufficient data for position and fallback regressions,"
                        + " no exposure written", portfolioId, factor.getCode());
            }
        }

        List<PortfolioFactorExposure> portfolioExposures = aggregated.stream()
                .map(a -> toPortfolioExposure(portfolioId, calculationDate, a))
                .toList();

        // An abandoned unit must not overwrite rows of the run that replaced it
        if (Thread.currentThread().isInterrupted()) {
            throw cancelled(portfolioId, calculationDate);
        }
        persistenceService.replaceExposures(portfolioId, calculationDate, positionExposures, portfolioExposures);

        log.info("Factor exposure for portfolio {} done in {}ms: {} regressions computed, {} skipped,"
                        + " {} portfolio exposures, {} without exposure",
                portfolioId, System.currentTimeMillis() - start, computed, skipped,
                portfolioExposures.size(), withoutExposure.size());

        return FactorExposureResult.builder()
                .portfolioId(portfolioId)
                .calculationDate(calculationDate)
                .totalPositions(positions.size())
                .eligiblePositions(eligible.size())
                .regressionsComputed(computed)
                .regressionsSkipped(skipped)
                .positionExposures(List.copyOf(positionExposures))
                .portfolioExposures(portfolioExposures)
                .aggregatedExposures(List.copyOf(aggregated))
                .factorsWithoutExposure(List.copyOf(withoutExposure))
                .build();
    }

    /** First date of the window fetched for a factor: lookback plus the calendar-day buffer. */
    public LocalDate fetchStart(FactorDefinition factor, LocalDate calculationDate) {
        return calculationDate.minusDays((long) factor.getLookbackWindowDays() + fetchBufferDays);
    }

    private Map<String, ReturnSeries> loadFactorSeries(List<FactorDefinition> factors, LocalDate calculationDate) {
        Map<String, ReturnSeries> benchmarkCache = new HashMap<>();
        Map<String, ReturnSeries> result = new LinkedHashMap<>();
        for (FactorDefinition factor : factors) {
            LocalDate from = fetchStart(factor, calculationDate);
            ReturnSeries longLeg = loadBenchmark(factor.getLongSymbol(), from, calculationDate, benchmarkCache);
            if (factor.isSpread()) {
                ReturnSeries shortLeg = loadBenchmark(factor.getShortSymbol(), from, calculationDate, benchmarkCache);
                result.put(factor.getCode(), longLeg.minus(shortLeg, factor.getCode()));
            } else {
                result.put(factor.getCode(), longLeg);
            }
        }
        return result;
    }

    private ReturnSeries loadBenchmark(
            String symbol, LocalDate from, LocalDate to, Map<String, ReturnSeries> benchmarkCache) {
        String key = symbol + ":" + from;
        ReturnSeries cached = benchmarkCache.get(key);
        if (cached != null) {
            return cached;
        }
        ReturnSeries series;
        try {
            series = returnSeriesAccessor.getReturns(symbol, from, to);
        } catch (NoReturnDataAvailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NoReturnDataAvailableException(symbol, "Return series unavailable for benchmark " + symbol, e);
        }
        if (series == null || series.isEmpty()) {
            throw new NoReturnDataAvailableException(
                    symbol, "No returns for benchmark " + symbol + " between " + from + " and " + to);
        }
        benchmarkCache.put(key, series);
        return series;
    }

    /**
     * One fetch per position over the widest factor window. Factor series are already bounded to
     * their own window, so alignment trims position returns per factor.
     */
    private Map<UUID, ReturnSeries> loadPositionSeries(List<Position> eligible, LocalDate calculationDate) {
        int widestLookback = factorDefinitionRegistry.getMaxLookbackDays();
        LocalDate from = calculationDate.minusDays((long) widestLookback + fetchBufferDays);
        Map<String, ReturnSeries> bySymbol = new HashMap<>();
        Map<UUID, ReturnSeries> result = new HashMap<>();
        for (Position position : eligible) {
            String symbol = position.getReturnSymbol();
            ReturnSeries series = bySymbol.computeIfAbsent(symbol, s -> loadPositionReturns(s, from, calculationDate));
            result.put(position.getId(), series);
        }
        return result;
    }

    private ReturnSeries loadPositionReturns(String symbol, LocalDate from, LocalDate to) {
        try {
            ReturnSeries series = returnSeriesAccessor.getReturns(symbol, from, to);
            if (series == null || series.isEmpty()) {
                log.debug("No returns for position symbol {}, its regressions will be skipped", symbol);
                return ReturnSeries.empty(symbol);
            }
            return series;
        } catch (NoReturnDataAvailableException e) {
            log.warn("Returns unavailable for position symbol {}, treating as insufficient data: {}",
                    symbol, e.getMessage());
            return ReturnSeries.empty(symbol);
        }
    }

    private List<PositionFactorExposure> regressPosition(
            Position position,
            ReturnSeries positionReturns,
            List<FactorDefinition> factors,
            Map<String, ReturnSeries> factorSeries,
            LocalDate calculationDate) {
        List<PositionFactorExposure> exposures = new ArrayList<>();
        if (positionReturns == null || positionReturns.isEmpty()) {
            return exposures;
        }
        for (FactorDefinition factor : factors) {
            regress(positionReturns, factorSeries.get(factor.getCode()), factor)
                    .ifPresent(result -> exposures.add(PositionFactorExposure.builder()
                            .positionId(position.getId())
                            .portfolioId(position.getPortfolioId())
                            .symbol(position.getSymbol())
                            .factorCode(factor.getCode())
                            .calculationDate(calculationDate)
                            .beta(result.getBeta())
                            .observations(result.getObservations())
                            .rSquared(result.getRSquared())
                            .capped(result.isCapped())
                            .build()));
        }
        return exposures;
    }

    private Optional<RegressionResult> regress(ReturnSeries dependent, ReturnSeries factor, FactorDefinition definition) {
        AlignedReturns aligned = dependent.alignWith(factor).mostRecent(definition.getLookbackWindowDays());
        return olsRegressionCalculator.regress(aligned, definition.getMinRequiredDays());
    }

    private static PortfolioFactorExposure toPortfolioExposure(
            UUID portfolioId, LocalDate calculationDate, AggregatedExposure exposure) {
        return PortfolioFactorExposure.builder()
                .portfolioId(portfolioId)
                .factorCode(exposure.factorCode())
                .calculationDate(calculationDate)
                .beta(exposure.beta())
                .dollarExposure(exposure.dollarExposure())
                .completeness(exposure.completeness())
                .contributingPositions(exposure.contributingPositions())
                .eligiblePositions(exposure.eligiblePositions())
                .build();
    }

    private static BatchExecutionException cancelled(UUID portfolioId, LocalDate calculationDate) {
        log.warn("Factor exposure for portfolio {} on {} cancelled, nothing persisted", portfolioId, calculationDate);
        return new BatchExecutionException(ErrorCode.BATCH_CANCELLED,
                "Factor exposure for portfolio " + portfolioId + " on " + calculationDate + " cancelled");
    }

    private static RuntimeException unwrap(Throwable cause, UUID portfolioId) {
        if (cause instanceof BaseException base) {
            return base;
        }
        return new BatchExecutionException(
                ErrorCode.INTERNAL_ERROR, "Position regression failed for portfolio " + portfolioId, cause);
    }

    private static <T> Supplier<T> memoize(Supplier<T> supplier) {
        return new Supplier<>() {
            private T value;

            @Override
            public T get() {
                if (value == null) {
                    value = supplier.get();
                }
                return value;
            }
        };
    }
}
