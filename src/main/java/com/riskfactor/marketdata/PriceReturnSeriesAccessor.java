package com.riskfactor.marketdata;

import com.riskfactor.domain.model.ReturnSeries;
import com.riskfactor.entity.DailyPriceEntity;
import com.riskfactor.exception.NoReturnDataAvailableException;
import com.riskfactor.repository.jpa.DailyPriceJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Derives simple daily returns from the daily_prices table.
 *
 * <p>The return on date t is close_t / close_{t-1} - 1 where t-1 is the previous stored close.
 * Both closes must lie inside the requested range, so the first stored date in the range
 * never carries a return. Non-positive closes break the chain and are skipped.
 */
@Component
public class PriceReturnSeriesAccessor implements ReturnSeriesAccessor {

    private static final Logger log = LoggerFactory.getLogger(PriceReturnSeriesAccessor.class);

    private final DailyPriceJpaRepository dailyPriceJpaRepository;

    public PriceReturnSeriesAccessor(DailyPriceJpaRepository dailyPriceJpaRepository) {
        this.dailyPriceJpaRepository = dailyPriceJpaRepository;
    }

    @Override
    public ReturnSeries getReturns(String symbol, LocalDate startDate, LocalDate endDate) {
        List<DailyPriceEntity> prices;
        try {
            prices = dailyPriceJpaRepository.findBySymbolAndDateRange(symbol, startDate, endDate);
        } catch (DataAccessException e) {
            throw new NoReturnDataAvailableException(symbol, "Price store unavailable for " + symbol, e);
        }

        Map<LocalDate, Double> returns = new TreeMap<>();
        BigDecimal previousClose = null;
        for (DailyPriceEntity price : prices) {
            BigDecimal close = price.getClosePrice();
            if (close == null || close.signum() <= 0) {
                previousClose = null;
                continue;
            }
            if (previousClose != null) {
                returns.put(price.getPriceDate(), close.doubleValue() / previousClose.doubleValue() - 1.0);
            }
            previousClose = close;
        }

        log.debug("Loaded {} returns for {} between {} and {}", returns.size(), symbol, startDate, endDate);
        return ReturnSeries.of(symbol, returns);
    }
}
