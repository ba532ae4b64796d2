package com.dataanalysis.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotNull(message = "rows is required")
    @JsonAlias("data")
    List<Map<String, Object>> rows;

    @NotBlank(message = "value_column is required")
    @JsonProperty("value_column")
    String valueColumn;

    @JsonProperty("date_column")
    String dateColumn;

    @Min(value = 1, message = "periods must be >= 1")
    @Builder.Default
    int periods = 10;

    @Pattern(regexp = "auto|linear|seasonal|moving_average",
             message = "method must be one of: auto, linear, seasonal, moving_average")
    @Builder.Default
    String method = "auto";
}
