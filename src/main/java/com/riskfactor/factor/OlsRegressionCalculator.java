package com.riskfactor.factor;

import com.riskfactor.config.FactorProperties;
import com.riskfactor.domain.model.AlignedReturns;
import com.riskfactor.domain.model.RegressionResult;
import java.util.Optional;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single-factor ordinary least squares: y = alpha + beta * x + e.
 *
 * <p>Returns an empty result, never an exception, when the regression cannot produce a usable
 * beta:
 * <ul>
 *   <li>fewer aligned observations than the factor's minimum</li>
 *   <li>zero variance in either series over the window</li>
 *   <li>non-finite coefficients</li>
 * </ul>
 * Betas beyond the configured cap are clamped; the unclamped slope stays available as
 * {@code rawBeta}.
 */
@Component
public class OlsRegressionCalculator {

    private static final Logger log = LoggerFactory.getLogger(OlsRegressionCalculator.class);

    /** Below this sample variance a return series is treated as constant. */
    static final double ZERO_VARIANCE_THRESHOLD = 1e-14;

    private final double betaCap;

    public OlsRegressionCalculator(FactorProperties factorProperties) {
        this.betaCap = factorProperties.getBetaCap();
    }

    public Optional<RegressionResult> regress(AlignedReturns aligned, int minObservations) {
        int n = aligned.size();
        if (n < Math.max(minObservations, 3)) {
            return Optional.empty();
        }

        double[] y = aligned.dependent();
        double[] x = aligned.independent();
        if (StatUtils.variance(x) <= ZERO_VARIANCE_THRESHOLD || StatUtils.variance(y) <= ZERO_VARIANCE_THRESHOLD) {
            return Optional.empty();
        }

        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < n; i++) {
            regression.addData(x[i], y[i]);
        }

        double rawBeta = regression.getSlope();
        double alpha = regression.getIntercept();
        if (!Double.isFinite(rawBeta) || !Double.isFinite(alpha)) {
            return Optional.empty();
        }

        double rSquared = regression.getRSquare();
        double standardError = regression.getSlopeStdErr();
        double pValue;
        try {
            pValue = regression.getSignificance();
        } catch (MathIllegalArgumentException | MaxCountExceededException e) {
            log.debug("Significance not computable for {} observations: {}", n, e.getMessage());
            pValue = Double.NaN;
        }

        boolean capped = betaCap > 0 && Math.abs(rawBeta) > betaCap;
        double beta = capped ? Math.copySign(betaCap, rawBeta) : rawBeta;
        if (capped) {
            log.debug("Beta capped: {} -> {}", rawBeta, beta);
        }

        return Optional.of(RegressionResult.builder()
                .beta(beta)
                .rawBeta(rawBeta)
                .alpha(alpha)
                .rSquared(Double.isFinite(rSquared) ? rSquared : 0.0)
                .standardError(standardError)
                .pValue(pValue)
                .observations(n)
                .capped(capped)
                .build());
    }
}
