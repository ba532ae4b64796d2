package com.dataanalysis.forecast;

import com.dataanalysis.exception.InvalidForecastRequestException;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ForecastMethod {
    AUTO("auto"),
    LINEAR("linear"),
    SEASONAL("seasonal"),
    MOVING_AVERAGE("moving_average");

    @JsonValue
    private final String value;

    public static ForecastMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        for (ForecastMethod method : values()) {
            if (method.value.equalsIgnoreCase(value.trim())) {
                return method;
            }
        }
        throw new InvalidForecastRequestException("Unsupported forecasting method '" + value
            + "'. Expected one of: auto, linear, seasonal, moving_average");
    }
}
