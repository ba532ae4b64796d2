package com.dataanalysis.dto;

import com.dataanalysis.forecast.TrendDirection;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ForecastResponse {
    boolean success;
    String column;
    Integer periods;
    Map<String, Object> modelInfo;
    AccuracyMetrics accuracyMetrics;
    List<HistoricalPoint> historicalData;
    List<ForecastDataPoint> forecastData;
    Summary summary;
    String errorCode;
    String error;

    public static ForecastResponse failure(String errorCode, String error) {
        return ForecastResponse.builder()
            .success(false)
            .errorCode(errorCode)
            .error(error)
            .build();
    }

    @Value
    @Builder
    public static class AccuracyMetrics {
        Double mape;
        Double rmse;
    }

    @Value
    @Builder
    public static class HistoricalPoint {
        int index;
        double value;
        @Builder.Default
        String type = "historical";
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ForecastDataPoint {
        int index;
        double value;
        @Builder.Default
        String type = "forecast";
        double ciLower;
        double ciUpper;
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Summary {
        double currentValue;
        double forecastedEndValue;
        double forecastChangePct;
        TrendDirection trendDirection;
        boolean seasonalityDetected;
        Integer seasonalityPeriod;
    }
}
