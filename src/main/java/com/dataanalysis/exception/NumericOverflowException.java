package com.dataanalysis.exception;

public class NumericOverflowException extends DataAnalysisException {
    public NumericOverflowException(String column) {
        super("NUMERIC_OVERFLOW",
              "Forecast for column '" + column + "' exceeds the representable numeric range");
    }
}
