package com.dataanalysis.dto;

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
public class MultiForecastResponse {
    boolean success;
    Integer periods;
    List<ColumnForecast> forecasts;
    Integer columnsProcessed;
    String errorCode;
    String error;

    public static MultiForecastResponse failure(String errorCode, String error) {
        return MultiForecastResponse.builder()
            .success(false)
            .errorCode(errorCode)
            .error(error)
            .build();
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ColumnForecast {
        String column;
        ForecastResponse.Summary summary;
        Map<String, Object> modelInfo;
        List<ForecastResponse.ForecastDataPoint> forecastData;
    }
}
