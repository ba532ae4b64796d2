package com.dataanalysis.forecast;

import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class MethodSelector {

    static final double TREND_TO_STD_RATIO = 0.1;

    public ForecastMethod select(ForecastMethod requested, TimeSeries series,
                                 Optional<SeasonalityProfile> seasonality) {
        ForecastMethod method = requested != null ? requested : ForecastMethod.AUTO;
        if (method == ForecastMethod.AUTO) {
            if (seasonality.isPresent()) {
                method = ForecastMethod.SEASONAL;
            } else if (Math.abs(series.trend()) > TREND_TO_STD_RATIO * series.std()) {
                method = ForecastMethod.LINEAR;
            } else {
                method = ForecastMethod.MOVING_AVERAGE;
            }
        }
        if (method == ForecastMethod.SEASONAL && seasonality.isEmpty()) {
            return ForecastMethod.MOVING_AVERAGE;
        }
        return method;
    }
}
