package com.dataanalysis.forecast;

/**
 * @param mape mean absolute percentage error, {@code null} when every held-out actual is zero
 */
public record AccuracyMetrics(Double mape, double rmse) {
}
