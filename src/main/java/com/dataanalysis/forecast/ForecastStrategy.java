package com.dataanalysis.forecast;

public interface ForecastStrategy {

    double Z_95 = 1.96;

    ForecastMethod method();

    /**
     * @param seasonality detected profile, or {@code null} when none was found
     */
    StrategyForecast forecast(TimeSeries series, SeasonalityProfile seasonality, int periods);
}
