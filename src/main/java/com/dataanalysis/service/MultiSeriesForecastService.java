package com.dataanalysis.service;

import com.dataanalysis.dto.ForecastResponse;
import com.dataanalysis.dto.MultiForecastRequest;
import com.dataanalysis.dto.MultiForecastResponse;
import com.dataanalysis.exception.DataAnalysisException;
import com.dataanalysis.forecast.ForecastMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MultiSeriesForecastService {

    static final String NO_COLUMNS_CODE = "NO_FORECASTABLE_COLUMNS";

    private final ForecastingService forecastingService;

    @Value("${forecast.multi.max-columns:5}")
    private int maxColumns;

    @Value("${forecast.multi.concurrency:4}")
    private int concurrency;

    public Mono<MultiForecastResponse> forecast(MultiForecastRequest request) {
        try {
            forecastingService.checkHorizon(request.getPeriods());
        } catch (DataAnalysisException ex) {
            log.warn("Multi-series forecast rejected | code={} | reason={}", ex.getErrorCode(), ex.getMessage());
            return Mono.just(MultiForecastResponse.failure(ex.getErrorCode(), ex.getMessage()));
        }
        Map<String, String> logContext = MDC.getCopyOfContextMap();
        List<String> columns = request.getColumns().stream().limit(maxColumns).toList();
        if (request.getColumns().size() > columns.size()) {
            log.info("Multi-series forecast capped | requested={} | processed={}",
                     request.getColumns().size(), columns.size());
        }
        return Flux.fromIterable(columns)
            .flatMapSequential(column -> Mono.fromCallable(() -> forecastColumn(request, column, logContext))
                .subscribeOn(Schedulers.parallel()), Math.max(1, concurrency))
            .filter(ForecastResponse::isSuccess)
            .map(this::toColumnForecast)
            .collectList()
            .map(forecasts -> {
                if (forecasts.isEmpty()) {
                    return MultiForecastResponse.failure(NO_COLUMNS_CODE, "No columns could be forecasted");
                }
                log.info("Multi-series forecast complete | columns={} | forecasted={} | periods={}",
                         columns.size(), forecasts.size(), request.getPeriods());
                return MultiForecastResponse.builder()
                    .success(true)
                    .periods(request.getPeriods())
                    .forecasts(forecasts)
                    .columnsProcessed(forecasts.size())
                    .build();
            });
    }

    private ForecastResponse forecastColumn(MultiForecastRequest request, String column,
                                            Map<String, String> logContext) {
        if (logContext != null) {
            MDC.setContextMap(logContext);
        }
        try {
            ForecastResponse result = forecastingService.forecast(
                request.getRows(), column, request.getPeriods(), ForecastMethod.AUTO.getValue());
            if (!result.isSuccess()) {
                log.warn("Column dropped from multi-series forecast | column={} | code={}",
                         column, result.getErrorCode());
            }
            return result;
        } finally {
            MDC.clear();
        }
    }

    private MultiForecastResponse.ColumnForecast toColumnForecast(ForecastResponse result) {
        return MultiForecastResponse.ColumnForecast.builder()
            .column(result.getColumn())
            .summary(result.getSummary())
            .modelInfo(result.getModelInfo())
            .forecastData(result.getForecastData())
            .build();
    }
}
