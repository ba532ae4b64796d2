package com.dataanalysis.forecast;

import java.util.Arrays;

public final class SeasonalityProfile {

    private final int period;
    private final double[] components;

    private SeasonalityProfile(int period, double[] components) {
        this.period = period;
        this.components = components;
    }

    /**
     * Builds the per-phase offsets: the mean of every value sharing a phase,
     * minus the mean of the whole series.
     */
    public static SeasonalityProfile of(TimeSeries series, int period) {
        if (period < 2 || period > series.size()) {
            throw new IllegalArgumentException("period must be in [2, " + series.size() + "], got " + period);
        }
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < series.size(); i++) {
            sums[i % period] += series.get(i);
            counts[i % period]++;
        }
        double[] components = new double[period];
        for (int p = 0; p < period; p++) {
            components[p] = sums[p] / counts[p] - series.mean();
        }
        return new SeasonalityProfile(period, components);
    }

    public int period() {
        return period;
    }

    public double componentAt(int index) {
        return components[Math.floorMod(index, period)];
    }

    public double[] components() {
        return components.clone();
    }

    public double[] deseasonalize(TimeSeries series) {
        double[] out = new double[series.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = series.get(i) - componentAt(i);
        }
        return out;
    }

    @Override
    public String toString() {
        return "SeasonalityProfile{period=" + period + ", components=" + Arrays.toString(components) + "}";
    }
}
