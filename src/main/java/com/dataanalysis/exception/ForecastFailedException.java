package com.dataanalysis.exception;

public class ForecastFailedException extends DataAnalysisException {
    public ForecastFailedException(String errorCode, String message) {
        super(errorCode != null ? errorCode : "FORECAST_FAILED", message);
    }
}
