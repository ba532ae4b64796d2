package com.dataanalysis.forecast;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;

/**
 * Re-forecasts the last {@value #HOLDOUT} observations from the points before
 * them. Only the linear family is re-fitted; every other method is scored
 * against a carry-forward of the last training value.
 */
@Component
@RequiredArgsConstructor
public class AccuracyBacktester {

    static final int HOLDOUT = 5;

    private final TrendEstimator trendEstimator;

    public Optional<AccuracyMetrics> backtest(TimeSeries series, ForecastMethod method) {
        int n = series.size();
        if (n <= HOLDOUT) {
            return Optional.empty();
        }
        int trainSize = n - HOLDOUT;
        double[] predicted = new double[HOLDOUT];
        if (method == ForecastMethod.LINEAR) {
            LinearFit fit = trendEstimator.fit(series.head(trainSize));
            for (int i = 0; i < HOLDOUT; i++) {
                predicted[i] = fit.predict(trainSize + i);
            }
        } else {
            Arrays.fill(predicted, series.get(trainSize - 1));
        }

        double sqError = 0.0;
        double ape = 0.0;
        int apeCount = 0;
        for (int i = 0; i < HOLDOUT; i++) {
            double actual = series.get(trainSize + i);
            double err = actual - predicted[i];
            sqError += err * err;
            if (actual != 0.0d) {
                ape += Math.abs(err / actual);
                apeCount++;
            }
        }
        Double mape = apeCount > 0 ? (ape / apeCount) * 100.0 : null;
        return Optional.of(new AccuracyMetrics(mape, Math.sqrt(sqError / HOLDOUT)));
    }
}
