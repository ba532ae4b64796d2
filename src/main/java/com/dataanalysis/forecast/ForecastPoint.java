package com.dataanalysis.forecast;

public record ForecastPoint(int index, double value, double lower, double upper) {

    public ForecastPoint {
        if (lower > value || value > upper) {
            throw new IllegalArgumentException(
                "confidence interval [" + lower + ", " + upper + "] does not contain " + value);
        }
    }

    public static ForecastPoint withHalfWidth(int index, double value, double halfWidth) {
        double width = Math.abs(halfWidth);
        return new ForecastPoint(index, value, value - width, value + width);
    }

    public double halfWidth() {
        return (upper - lower) / 2.0;
    }
}
