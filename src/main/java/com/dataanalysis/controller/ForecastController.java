package com.dataanalysis.controller;

import com.dataanalysis.dto.ForecastRequest;
import com.dataanalysis.dto.ForecastResponse;
import com.dataanalysis.dto.MultiForecastRequest;
import com.dataanalysis.dto.MultiForecastResponse;
import com.dataanalysis.exception.ForecastFailedException;
import com.dataanalysis.service.ForecastingService;
import com.dataanalysis.service.MultiSeriesForecastService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/forecast")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastingService         forecastingService;
    private final MultiSeriesForecastService multiSeriesForecastService;

    @PostMapping("/single")
    public ResponseEntity<ForecastResponse> forecastSingle(@Valid @RequestBody ForecastRequest request) {
        log.info("POST /forecast/single | column={} | rows={} | periods={} | method={}",
                 request.getValueColumn(), request.getRows().size(), request.getPeriods(), request.getMethod());
        ForecastResponse result = forecastingService.forecast(request);
        if (!result.isSuccess()) {
            throw new ForecastFailedException(result.getErrorCode(), result.getError());
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/multi")
    public Mono<ResponseEntity<MultiForecastResponse>> forecastMultiple(
            @Valid @RequestBody MultiForecastRequest request) {
        log.info("POST /forecast/multi | columns={} | rows={} | periods={}",
                 request.getColumns(), request.getRows().size(), request.getPeriods());
        return multiSeriesForecastService.forecast(request)
            .map(result -> {
                if (!result.isSuccess()) {
                    throw new ForecastFailedException(result.getErrorCode(), result.getError());
                }
                return ResponseEntity.ok(result);
            });
    }
}
