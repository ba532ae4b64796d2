package com.dataanalysis.forecast;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class MovingAverageStrategy implements ForecastStrategy {

    static final double ALPHA = 0.3;
    static final int TREND_WINDOW = 5;
    static final double SPREAD_FACTOR = 0.5;

    @Override
    public ForecastMethod method() {
        return ForecastMethod.MOVING_AVERAGE;
    }

    @Override
    public StrategyForecast forecast(TimeSeries series, SeasonalityProfile seasonality, int periods) {
        int n = series.size();
        double ema = series.first();
        for (int i = 1; i < n; i++) {
            ema = ALPHA * series.get(i) + (1 - ALPHA) * ema;
        }

        int window = Math.min(TREND_WINDOW, n);
        double recentTrend = (series.last() - series.get(Math.max(0, n - TREND_WINDOW))) / window;

        List<ForecastPoint> points = new ArrayList<>(periods);
        for (int i = 0; i < periods; i++) {
            double estimate = ema + recentTrend * (i + 1);
            double spread = series.std() * Math.sqrt(i + 1) * SPREAD_FACTOR;
            points.add(ForecastPoint.withHalfWidth(n + i, estimate, Z_95 * spread));
        }

        Map<String, Object> modelInfo = new LinkedHashMap<>();
        modelInfo.put("method", "exponential_moving_average");
        modelInfo.put("alpha", ALPHA);
        modelInfo.put("recent_trend", Precision.round(recentTrend));
        return new StrategyForecast(method(), points, modelInfo);
    }
}
