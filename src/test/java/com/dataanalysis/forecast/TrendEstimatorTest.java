package com.dataanalysis.forecast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TrendEstimatorTest {

    private final TrendEstimator estimator = new TrendEstimator();

    @Test
    void fit_exactLine_recoversCoefficients() {
        LinearFit fit = estimator.fit(SeriesFixtures.line(20, 3, 5));

        assertThat(fit.slope()).isCloseTo(3.0, within(1e-9));
        assertThat(fit.intercept()).isCloseTo(5.0, within(1e-9));
        assertThat(fit.rSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(fit.slopeStdErr()).isCloseTo(0.0, within(1e-6));
        assertThat(fit.predict(20)).isCloseTo(65.0, within(1e-9));
    }

    @Test
    void fit_noisyData_matchesHandComputedStatistics() {
        LinearFit fit = estimator.fit(new double[] {1, 2, 2, 3, 5});

        assertThat(fit.slope()).isCloseTo(0.9, within(1e-9));
        assertThat(fit.intercept()).isCloseTo(0.8, within(1e-9));
        assertThat(fit.rSquared()).isCloseTo(81.0 / 92.0, within(1e-9));
        assertThat(fit.slopeStdErr()).isCloseTo(Math.sqrt(0.11 / 3), within(1e-9));
    }

    @Test
    void fit_constantSeries_hasZeroSlopeAndCorrelation() {
        LinearFit fit = estimator.fit(new double[] {4, 4, 4, 4, 4, 4});

        assertThat(fit.slope()).isZero();
        assertThat(fit.intercept()).isEqualTo(4.0);
        assertThat(fit.rSquared()).isZero();
        assertThat(fit.predictionStdErr(10)).isZero();
    }

    @Test
    void fit_singlePoint_isFlatLine() {
        LinearFit fit = estimator.fit(new double[] {7});

        assertThat(fit.slope()).isZero();
        assertThat(fit.predict(3)).isEqualTo(7.0);
    }

    @Test
    void fit_emptySeries_isRejected() {
        assertThatThrownBy(() -> estimator.fit(new double[0]))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
