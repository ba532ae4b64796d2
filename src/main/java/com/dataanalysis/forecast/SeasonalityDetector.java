package com.dataanalysis.forecast;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Looks for a repeating period through the autocorrelation function. The
 * first lag that is a strict local maximum above {@link #PEAK_THRESHOLD}
 * wins, even when a later lag correlates more strongly.
 */
@Component
public class SeasonalityDetector {

    static final int MIN_POINTS_EXCLUSIVE = 20;
    static final int MIN_LAG = 2;
    static final double PEAK_THRESHOLD = 0.3;

    public Optional<SeasonalityProfile> detect(TimeSeries series) {
        int n = series.size();
        if (n <= MIN_POINTS_EXCLUSIVE) {
            return Optional.empty();
        }
        double[] acf = autocorrelation(series);
        if (acf.length == 0) {
            return Optional.empty();
        }
        int upper = Math.min(acf.length - 1, n / 2);
        for (int lag = MIN_LAG; lag < upper; lag++) {
            if (acf[lag] > acf[lag - 1] && acf[lag] > acf[lag + 1] && acf[lag] > PEAK_THRESHOLD) {
                return Optional.of(SeasonalityProfile.of(series, lag));
            }
        }
        return Optional.empty();
    }

    /**
     * Autocorrelation of the mean-centred series for lags 0..n-1, scaled so the
     * lag-0 value is 1. Empty when the series has no variance.
     */
    public double[] autocorrelation(TimeSeries series) {
        int n = series.size();
        double[] centred = new double[n];
        for (int i = 0; i < n; i++) {
            centred[i] = series.get(i) - series.mean();
        }
        double[] acf = new double[n];
        for (int lag = 0; lag < n; lag++) {
            double sum = 0.0;
            for (int t = 0; t + lag < n; t++) {
                sum += centred[t] * centred[t + lag];
            }
            acf[lag] = sum;
        }
        if (acf[0] == 0.0) {
            return new double[0];
        }
        double base = acf[0];
        for (int lag = 0; lag < n; lag++) {
            acf[lag] /= base;
        }
        return acf;
    }
}
