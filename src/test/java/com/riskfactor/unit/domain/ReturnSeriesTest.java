package com.riskfactor.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.riskfactor.domain.model.AlignedReturns;
import com.riskfactor.domain.model.ReturnSeries;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReturnSeriesTest {

    private static final LocalDate D1 = LocalDate.of(2025, 6, 11);
    private static final LocalDate D2 = LocalDate.of(2025, 6, 12);
    private static final LocalDate D3 = LocalDate.of(2025, 6, 13);
    private static final LocalDate D4 = LocalDate.of(2025, 6, 16);

    @Test
    @DisplayName("Non-finite values are dropped on construction")
    void dropsNonFinite() {
        Map<LocalDate, Double> raw = new HashMap<>();
        raw.put(D1, 0.01);
        raw.put(D2, Double.NaN);
        raw.put(D3, Double.POSITIVE_INFINITY);
        raw.put(D4, null);

        ReturnSeries series = ReturnSeries.of("X", raw);

        assertThat(series.asMap().keySet()).containsExactly(D1);
    }

    @Test
    @DisplayName("Alignment keeps only shared dates, in date order")
    void alignInnerJoin() {
        ReturnSeries position = ReturnSeries.of("AAPL", Map.of(D1, 0.01, D2, 0.02, D4, 0.04));
        ReturnSeries factor = ReturnSeries.of("SPY", Map.of(D2, 0.2, D3, 0.3, D4, 0.4));

        AlignedReturns aligned = position.alignWith(factor);

        assertThat(aligned.dates()).containsExactly(D2, D4);
        assertThat(aligned.dependent()).containsExactly(0.02, 0.04);
        assertThat(aligned.independent()).containsExactly(0.2, 0.4);
    }

    @Test
    @DisplayName("mostRecent keeps the trailing observations only")
    void mostRecent() {
        ReturnSeries position = ReturnSeries.of("AAPL", Map.of(D1, 0.01, D2, 0.02, D3, 0.03, D4, 0.04));

        AlignedReturns aligned = position.alignWith(position).mostRecent(2);

        assertThat(aligned.dates()).containsExactly(D3, D4);
        assertThat(aligned.dependent()).containsExactly(0.03, 0.04);
        assertThat(position.alignWith(position).mostRecent(10).size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Spread is long minus short on shared dates")
    void spread() {
        ReturnSeries growth = ReturnSeries.of("VUG", Map.of(D1, 0.03, D2, 0.01));
        ReturnSeries value = ReturnSeries.of("VTV", Map.of(D2, 0.02, D3, 0.01));

        ReturnSeries spread = growth.minus(value, "GROWTH_VALUE_SPREAD");

        assertThat(spread.getSymbol()).isEqualTo("GROWTH_VALUE_SPREAD");
        assertThat(spread.asMap().keySet()).containsExactly(D2);
        assertThat(spread.get(D2)).isCloseTo(-0.01, within(1e-12));
    }
}
