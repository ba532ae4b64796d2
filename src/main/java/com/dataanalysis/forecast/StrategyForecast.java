package com.dataanalysis.forecast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record StrategyForecast(ForecastMethod method, List<ForecastPoint> points, Map<String, Object> modelInfo) {

    public StrategyForecast {
        points = List.copyOf(points);
        modelInfo = Collections.unmodifiableMap(new LinkedHashMap<>(modelInfo));
    }

    public ForecastPoint lastPoint() {
        return points.get(points.size() - 1);
    }
}
