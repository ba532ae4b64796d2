package com.dataanalysis.forecast;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

@Component
public class TrendEstimator {

    public LinearFit fit(TimeSeries series) {
        return fit(series.toArray());
    }

    public LinearFit fit(double[] y) {
        int n = y.length;
        if (n == 0) {
            throw new IllegalArgumentException("cannot fit a trend to an empty series");
        }
        if (n == 1) {
            return new LinearFit(0.0, y[0], 0.0, 0.0, 1, 0.0, 0.0);
        }

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, y[i]);
        }

        // a flat series has no defined correlation; report it as r = 0
        double rSquared = regression.getTotalSumSquares() > 0 ? regression.getRSquare() : 0.0;
        double stdErr = n > 2 ? regression.getSlopeStdErr() : 0.0;
        return new LinearFit(
            regression.getSlope(),
            regression.getIntercept(),
            rSquared,
            Double.isFinite(stdErr) ? stdErr : 0.0,
            n,
            (n - 1) / 2.0,
            regression.getXSumSquares());
    }
}
