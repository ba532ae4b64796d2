package com.dataanalysis.forecast;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class LinearTrendStrategy implements ForecastStrategy {

    private final TrendEstimator trendEstimator;

    @Override
    public ForecastMethod method() {
        return ForecastMethod.LINEAR;
    }

    @Override
    public StrategyForecast forecast(TimeSeries series, SeasonalityProfile seasonality, int periods) {
        int n = series.size();
        LinearFit fit = trendEstimator.fit(series);

        List<ForecastPoint> points = new ArrayList<>(periods);
        for (int i = 0; i < periods; i++) {
            int x = n + i;
            double estimate = fit.predict(x);
            points.add(ForecastPoint.withHalfWidth(x, estimate, Z_95 * fit.predictionStdErr(x)));
        }

        Map<String, Object> modelInfo = new LinkedHashMap<>();
        modelInfo.put("method", "linear_regression");
        modelInfo.put("slope", Precision.round(fit.slope()));
        modelInfo.put("intercept", Precision.round(fit.intercept()));
        modelInfo.put("r_squared", Precision.round(fit.rSquared()));
        return new StrategyForecast(method(), points, modelInfo);
    }
}
