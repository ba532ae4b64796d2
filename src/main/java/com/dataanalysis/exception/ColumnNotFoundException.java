package com.dataanalysis.exception;

public class ColumnNotFoundException extends DataAnalysisException {
    public ColumnNotFoundException(String column) {
        super("COLUMN_NOT_FOUND", "Column '" + column + "' not found");
    }
}
