package com.riskfactor.unit.factor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.riskfactor.config.FactorProperties;
import com.riskfactor.domain.enums.RSquaredQuality;
import com.riskfactor.domain.model.AlignedReturns;
import com.riskfactor.domain.model.RegressionResult;
import com.riskfactor.domain.model.ReturnSeries;
import com.riskfactor.factor.OlsRegressionCalculator;
import com.riskfactor.support.ReturnFixtures;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OlsRegressionCalculator covering slope recovery, insufficient and degenerate
 * samples, and the beta cap.
 */
class OlsRegressionCalculatorTest {

    private static final LocalDate END = LocalDate.of(2025, 6, 16);

    private OlsRegressionCalculator calculator;
    private List<LocalDate> dates;
    private ReturnSeries factor;

    @BeforeEach
    void setUp() {
        calculator = new OlsRegressionCalculator(new FactorProperties());
        dates = ReturnFixtures.weekdays(END, 90);
        factor = ReturnFixtures.noise("SPY", dates, 7L, 0.01);
    }

    private AlignedReturns linear(double beta, double alpha, double noise) {
        return ReturnFixtures.linear("AAPL", factor, dates, beta, alpha, 11L, noise).alignWith(factor);
    }

    // ==============================
    // ESTIMATION
    // ==============================

    @Nested
    @DisplayName("Estimation")
    class Estimation {

        @Test
        @DisplayName("Exact linear relation recovers beta and alpha with R-squared 1")
        void exactRelation() {
            RegressionResult result = calculator.regress(linear(1.5, 0.0002, 0.0), 60).orElseThrow();

            assertThat(result.getBeta()).isCloseTo(1.5, within(1e-9));
            assertThat(result.getAlpha()).isCloseTo(0.0002, within(1e-9));
            assertThat(result.getRSquared()).isCloseTo(1.0, within(1e-9));
            assertThat(result.getObservations()).isEqualTo(90);
            assertThat(result.isCapped()).isFalse();
            assertThat(result.getQuality()).isEqualTo(RSquaredQuality.EXCELLENT);
        }

        @Test
        @DisplayName("Noisy relation estimates beta close to the true slope and is significant")
        void noisyRelation() {
            RegressionResult result = calculator.regress(linear(0.8, 0.0, 0.004), 60).orElseThrow();

            assertThat(result.getBeta()).isCloseTo(0.8, within(0.15));
            assertThat(result.getRSquared()).isBetween(0.0, 1.0);
            assertThat(result.getPValue()).isLessThan(0.05);
            assertThat(result.isSignificant(true)).isTrue();
            assertThat(result.getStandardError()).isPositive();
        }

        @Test
        @DisplayName("Negative relation yields a negative beta")
        void negativeBeta() {
            RegressionResult result = calculator.regress(linear(-1.2, 0.0, 0.0), 60).orElseThrow();

            assertThat(result.getBeta()).isCloseTo(-1.2, within(1e-9));
        }
    }

    // ==============================
    // INSUFFICIENT OR DEGENERATE DATA
    // ==============================

    @Nested
    @DisplayName("Insufficient or Degenerate Data")
    class Degenerate {

        @Test
        @DisplayName("Fewer observations than the minimum yields no result")
        void belowMinimum() {
            AlignedReturns aligned = linear(1.0, 0.0, 0.001).mostRecent(59);

            assertThat(calculator.regress(aligned, 60)).isEmpty();
            assertThat(calculator.regress(aligned, 59)).isPresent();
        }

        @Test
        @DisplayName("Fewer than three observations never regresses, whatever the minimum")
        void belowThree() {
            AlignedReturns aligned = linear(1.0, 0.0, 0.001).mostRecent(2);

            assertThat(calculator.regress(aligned, 1)).isEmpty();
        }

        @Test
        @DisplayName("Constant dependent series yields no result")
        void constantDependent() {
            Map<LocalDate, Double> flat = new TreeMap<>();
            dates.forEach(d -> flat.put(d, 0.001));
            AlignedReturns aligned = ReturnSeries.of("CASHLIKE", flat).alignWith(factor);

            assertThat(calculator.regress(aligned, 60)).isEmpty();
        }

        @Test
        @DisplayName("Constant factor series yields no result")
        void constantFactor() {
            Map<LocalDate, Double> flat = new TreeMap<>();
            dates.forEach(d -> flat.put(d, 0.0));
            AlignedReturns aligned = ReturnFixtures.noise("AAPL", dates, 3L, 0.01)
                    .alignWith(ReturnSeries.of("FLAT", flat));

            assertThat(calculator.regress(aligned, 60)).isEmpty();
        }
    }

    // ==============================
    // CAP
    // ==============================

    @Nested
    @DisplayName("Beta Cap")
    class Cap {

        @Test
        @DisplayName("Betas beyond the cap are clamped and flagged, keeping the raw slope")
        void capped() {
            Optional<RegressionResult> up = calculator.regress(linear(8.0, 0.0, 0.0), 60);
            Optional<RegressionResult> down = calculator.regress(linear(-8.0, 0.0, 0.0), 60);

            assertThat(up).get().satisfies(r -> {
                assertThat(r.getBeta()).isEqualTo(5.0);
                assertThat(r.getRawBeta()).isCloseTo(8.0, within(1e-9));
                assertThat(r.isCapped()).isTrue();
            });
            assertThat(down).get().satisfies(r -> assertThat(r.getBeta()).isEqualTo(-5.0));
        }

        @Test
        @DisplayName("Non-positive cap setting disables clamping")
        void capDisabled() {
            FactorProperties properties = new FactorProperties();
            properties.setBetaCap(0);
            OlsRegressionCalculator uncapped = new OlsRegressionCalculator(properties);

            RegressionResult result = uncapped.regress(linear(8.0, 0.0, 0.0), 60).orElseThrow();

            assertThat(result.getBeta()).isCloseTo(8.0, within(1e-9));
            assertThat(result.isCapped()).isFalse();
        }
    }
}
