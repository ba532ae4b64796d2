package com.dataanalysis.exception;

public class InvalidForecastRequestException extends DataAnalysisException {
    public InvalidForecastRequestException(String message) {
        super("INVALID_FORECAST_REQUEST", message);
    }
}
