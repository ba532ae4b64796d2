package com.dataanalysis.forecast;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Ordered, gap-free sequence of finite values indexed 0..n-1. Calendar
 * information is not carried: position is the only notion of time.
 */
public final class TimeSeries {

    private final double[] values;
    private final double mean;
    private final double std;

    public TimeSeries(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("time series must contain at least one value");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("time series values must be finite, got " + v);
            }
        }
        this.values = values.clone();
        this.mean = new Mean().evaluate(this.values);
        this.std = new StandardDeviation(false).evaluate(this.values);
    }

    public static TimeSeries of(double... values) {
        return new TimeSeries(values);
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double first() {
        return values[0];
    }

    public double last() {
        return values[values.length - 1];
    }

    public double mean() {
        return mean;
    }

    /** Population standard deviation (divides by n). */
    public double std() {
        return std;
    }

    /** Average change per position between the first and last value. */
    public double trend() {
        return values.length > 1 ? (last() - first()) / values.length : 0.0;
    }

    public TimeSeries head(int count) {
        return new TimeSeries(Arrays.copyOf(values, count));
    }

    public double[] toArray() {
        return values.clone();
    }
}
