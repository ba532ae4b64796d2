package com.dataanalysis.forecast;

/**
 * Ordinary least squares fit of value against position.
 *
 * @param slopeStdErr standard error of the slope estimate
 * @param xMean       mean of the fitted positions
 * @param sxx         sum of squared deviations of the fitted positions
 */
public record LinearFit(double slope, double intercept, double rSquared, double slopeStdErr,
                        int n, double xMean, double sxx) {

    public double predict(double x) {
        return intercept + slope * x;
    }

    public double predictionStdErr(double x) {
        double leverage = sxx > 0 ? (x - xMean) * (x - xMean) / sxx : 0.0;
        return slopeStdErr * Math.sqrt(1.0 + 1.0 / n + leverage);
    }
}
