package com.dataanalysis.exception;

import com.dataanalysis.config.RequestGuardFilter;
import com.dataanalysis.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", null, request, fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request",
                     "Request body could not be parsed", null, request, null);
    }

    @ExceptionHandler(ForecastFailedException.class)
    public ResponseEntity<ApiError> handleForecastFailed(
            ForecastFailedException ex, HttpServletRequest request) {
        log.warn("Forecast failed | code={} | message={}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Forecast Failed", ex.getMessage(),
                     ex.getErrorCode(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", "INTERNAL_ERROR", request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message, String code,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors) {

        Object attribute = request.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE);
        String requestId = attribute != null ? attribute.toString()
                : request.getHeader(RequestGuardFilter.REQUEST_ID_HEADER);

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .code(code)
            .path(request.getRequestURI())
            .requestId(requestId)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
