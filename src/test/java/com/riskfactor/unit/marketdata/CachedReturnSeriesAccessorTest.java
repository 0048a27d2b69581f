package com.riskfactor.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.riskfactor.domain.model.ReturnSeries;
import com.riskfactor.marketdata.CachedReturnSeriesAccessor;
import com.riskfactor.marketdata.PriceReturnSeriesAccessor;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

/**
 * Unit tests for CachedReturnSeriesAccessor: cache hits, misses with write-back, and Redis
 * outages that must fall back to the price store.
 */
@ExtendWith(MockitoExtension.class)
class CachedReturnSeriesAccessorTest {

    private static final LocalDate FROM = LocalDate.of(2025, 3, 1);
    private static final LocalDate TO = LocalDate.of(2025, 6, 16);
    private static final String KEY = "riskfactor:returns:SPY:2025-03-01:2025-06-16";

    @Mock
    private PriceReturnSeriesAccessor delegate;

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    private CachedReturnSeriesAccessor accessor;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        accessor = new CachedReturnSeriesAccessor(delegate, redisTemplate, Duration.ofHours(12));
    }

    @Test
    @DisplayName("Cache hit is served without touching the price store")
    void cacheHit() {
        Map<String, Object> cached = new LinkedHashMap<>();
        cached.put("2025-06-13", 0.01);
        cached.put("2025-06-16", -0.005);
        when(valueOperations.get(KEY)).thenReturn(cached);

        ReturnSeries series = accessor.getReturns("SPY", FROM, TO);

        assertThat(series.getSymbol()).isEqualTo("SPY");
        assertThat(series.get(LocalDate.of(2025, 6, 13))).isEqualTo(0.01);
        assertThat(series.get(LocalDate.of(2025, 6, 16))).isEqualTo(-0.005);
        verifyNoInteractions(delegate);
    }

    @Test
    @DisplayName("Cache miss loads from the price store and writes back with the TTL")
    void cacheMiss() {
        ReturnSeries loaded = ReturnSeries.of("SPY", Map.of(LocalDate.of(2025, 6, 16), 0.02));
        when(delegate.getReturns("SPY", FROM, TO)).thenReturn(loaded);

        ReturnSeries series = accessor.getReturns("SPY", FROM, TO);

        assertThat(series).isEqualTo(loaded);
        verify(valueOperations).set(eq(KEY), eq(Map.of("2025-06-16", 0.02)), eq(Duration.ofHours(12)));
    }

    @Test
    @DisplayName("Empty series are not cached")
    void emptyNotCached() {
        when(delegate.getReturns("SPY", FROM, TO)).thenReturn(ReturnSeries.empty("SPY"));

        assertThat(accessor.getReturns("SPY", FROM, TO).isEmpty()).isTrue();

        verify(valueOperations, never()).set(anyString(), any(), any(Duration.class));
    }

    @Test
    @DisplayName("Redis outage on read and write falls back to the price store")
    void redisDown() {
        ReturnSeries loaded = ReturnSeries.of("SPY", Map.of(LocalDate.of(2025, 6, 16), 0.02));
        when(valueOperations.get(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(valueOperations).set(anyString(), any(), any(Duration.class));
        when(delegate.getReturns("SPY", FROM, TO)).thenReturn(loaded);

        assertThat(accessor.getReturns("SPY", FROM, TO)).isEqualTo(loaded);
    }
}
