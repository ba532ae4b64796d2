package com.dataanalysis.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class MultiForecastRequest {

    @NotNull(message = "rows is required")
    @JsonAlias("data")
    List<Map<String, Object>> rows;

    @NotEmpty(message = "columns must contain at least one column name")
    List<String> columns;

    @Min(value = 1, message = "periods must be >= 1")
    @Builder.Default
    int periods = 10;
}
