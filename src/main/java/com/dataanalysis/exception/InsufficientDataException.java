package com.dataanalysis.exception;

public class InsufficientDataException extends DataAnalysisException {
    public InsufficientDataException(String column, int available, int required) {
        super("INSUFFICIENT_DATA",
              "Need at least " + required + " data points for forecasting, column '"
                  + column + "' has " + available);
    }
}
