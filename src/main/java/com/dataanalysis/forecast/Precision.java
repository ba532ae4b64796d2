package com.dataanalysis.forecast;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Four-decimal rounding applied to every number leaving the engine. */
public final class Precision {

    private static final int SCALE = 4;

    private Precision() {
    }

    public static double round(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    public static Double round(Double value) {
        return value == null ? null : round(value.doubleValue());
    }
}
