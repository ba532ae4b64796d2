package com.dataanalysis.forecast;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Additive decomposition: per-phase seasonal offsets plus a linear trend fitted
 * on the deseasonalized values. The interval width is a constant
 * {@code 1.96 * std(series)} at every step.
 */
@Component
@RequiredArgsConstructor
public class SeasonalDecompositionStrategy implements ForecastStrategy {

    private final TrendEstimator trendEstimator;

    @Override
    public ForecastMethod method() {
        return ForecastMethod.SEASONAL;
    }

    @Override
    public StrategyForecast forecast(TimeSeries series, SeasonalityProfile seasonality, int periods) {
        if (seasonality == null) {
            throw new IllegalStateException("seasonal forecasting requires a detected seasonality period");
        }
        int n = series.size();
        LinearFit trend = trendEstimator.fit(seasonality.deseasonalize(series));
        double halfWidth = Z_95 * series.std();

        List<ForecastPoint> points = new ArrayList<>(periods);
        for (int i = 0; i < periods; i++) {
            int x = n + i;
            double estimate = trend.predict(x) + seasonality.componentAt(x);
            points.add(ForecastPoint.withHalfWidth(x, estimate, halfWidth));
        }

        Map<String, Object> modelInfo = new LinkedHashMap<>();
        modelInfo.put("method", "seasonal_decomposition");
        modelInfo.put("seasonality_period", seasonality.period());
        modelInfo.put("trend_slope", Precision.round(trend.slope()));
        return new StrategyForecast(method(), points, modelInfo);
    }
}
