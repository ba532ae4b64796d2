package com.dataanalysis.exception;

import lombok.Getter;

/** Engine failure carrying the code that is reported to the client. */
@Getter
public abstract class DataAnalysisException extends RuntimeException {
    private final String errorCode;

    protected DataAnalysisException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
