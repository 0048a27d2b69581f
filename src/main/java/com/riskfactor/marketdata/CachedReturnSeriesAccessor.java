package com.riskfactor.marketdata;

import com.riskfactor.config.RedisConfig;
import com.riskfactor.domain.model.ReturnSeries;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis read-through cache in front of {@link PriceReturnSeriesAccessor}.
 *
 * <p>A batch run asks for the same benchmark series once per portfolio and per factor, so
 * caching by (symbol, start, end) removes almost all repeated price reads. Entries are stored
 * as ISO date string to return maps and expire after {@code riskfactor.cache.returns-ttl}.
 *
 * <p>Redis is optional for correctness: any Redis failure is logged and the request is served
 * from the delegate. Empty series are not cached, so prices loaded later become visible at once.
 */
@Component
@Primary
public class CachedReturnSeriesAccessor implements ReturnSeriesAccessor {

    private static final Logger log = LoggerFactory.getLogger(CachedReturnSeriesAccessor.class);

    private final PriceReturnSeriesAccessor delegate;
    private final RedisTemplate<String, Object> redisTemplate;
    private final Duration ttl;

    public CachedReturnSeriesAccessor(
            PriceReturnSeriesAccessor delegate,
            RedisTemplate<String, Object> redisTemplate,
            @Value("${riskfactor.cache.returns-ttl:PT12H}") Duration ttl) {
        this.delegate = delegate;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public ReturnSeries getReturns(String symbol, LocalDate startDate, LocalDate endDate) {
        String key = cacheKey(symbol, startDate, endDate);

        ReturnSeries cached = readCache(key, symbol);
        if (cached != null) {
            return cached;
        }

        ReturnSeries series = delegate.getReturns(symbol, startDate, endDate);
        if (!series.isEmpty()) {
            writeCache(key, series);
        }
        return series;
    }

    static String cacheKey(String symbol, LocalDate startDate, LocalDate endDate) {
        return RedisConfig.KEY_PREFIX_RETURNS + symbol + ":" + startDate + ":" + endDate;
    }

    private ReturnSeries readCache(String key, String symbol) {
        try {
            Object value = redisTemplate.opsForValue().get(key);
            if (value instanceof Map<?, ?> raw) {
                Map<LocalDate, Double> returns = new TreeMap<>();
                raw.forEach((date, r) -> {
                    if (r instanceof Number number) {
                        returns.put(LocalDate.parse(date.toString()), number.doubleValue());
                    }
                });
                return ReturnSeries.of(symbol, returns);
            }
        } catch (RuntimeException e) {
            log.warn("Return cache read failed for {}, falling back to price store: {}", key, e.getMessage());
        }
        return null;
    }

    private void writeCache(String key, ReturnSeries series) {
        Map<String, Double> payload = new LinkedHashMap<>();
        series.asMap().forEach((date, r) -> payload.put(date.toString(), r));
        try {
            redisTemplate.opsForValue().set(key, payload, ttl);
        } catch (RuntimeException e) {
            log.warn("Return cache write failed for {}: {}", key, e.getMessage());
        }
    }
}
