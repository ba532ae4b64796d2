package com.dataanalysis.forecast;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private static final double THRESHOLD_PCT = 2.0;

    @JsonValue
    private final String label;

    public static TrendDirection fromChangePct(double changePct) {
        if (changePct > THRESHOLD_PCT) {
            return INCREASING;
        }
        if (changePct < -THRESHOLD_PCT) {
            return DECREASING;
        }
        return STABLE;
    }
}
