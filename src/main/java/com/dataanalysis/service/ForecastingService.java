package com.dataanalysis.service;

import com.dataanalysis.dto.ForecastRequest;
import com.dataanalysis.dto.ForecastResponse;
import com.dataanalysis.exception.DataAnalysisException;
import com.dataanalysis.exception.InvalidForecastRequestException;
import com.dataanalysis.exception.NumericOverflowException;
import com.dataanalysis.forecast.AccuracyBacktester;
import com.dataanalysis.forecast.AccuracyMetrics;
import com.dataanalysis.forecast.ForecastMethod;
import com.dataanalysis.forecast.ForecastPoint;
import com.dataanalysis.forecast.ForecastStrategy;
import com.dataanalysis.forecast.MethodSelector;
import com.dataanalysis.forecast.Precision;
import com.dataanalysis.forecast.SeasonalityDetector;
import com.dataanalysis.forecast.SeasonalityProfile;
import com.dataanalysis.forecast.SeriesExtractor;
import com.dataanalysis.forecast.StrategyForecast;
import com.dataanalysis.forecast.TimeSeries;
import com.dataanalysis.forecast.TrendDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

@Slf4j
@Service
public class ForecastingService {

    private final SeriesExtractor     seriesExtractor;
    private final SeasonalityDetector seasonalityDetector;
    private final MethodSelector      methodSelector;
    private final AccuracyBacktester  accuracyBacktester;
    private final Map<ForecastMethod, ForecastStrategy> strategies = new EnumMap<>(ForecastMethod.class);

    @Value("${forecast.max-periods:365}")
    private int maxPeriods;

    public ForecastingService(SeriesExtractor seriesExtractor,
                              SeasonalityDetector seasonalityDetector,
                              MethodSelector methodSelector,
                              AccuracyBacktester accuracyBacktester,
                              List<ForecastStrategy> strategies) {
        this.seriesExtractor = seriesExtractor;
        this.seasonalityDetector = seasonalityDetector;
        this.methodSelector = methodSelector;
        this.accuracyBacktester = accuracyBacktester;
        strategies.forEach(s -> this.strategies.put(s.method(), s));
    }

    public ForecastResponse forecast(ForecastRequest request) {
        return forecast(request.getRows(), request.getValueColumn(), request.getPeriods(), request.getMethod());
    }

    public ForecastResponse forecast(List<Map<String, Object>> rows, String column, int periods, String method) {
        try {
            return run(rows, column, periods, ForecastMethod.fromValue(method));
        } catch (DataAnalysisException ex) {
            log.warn("Forecast rejected | column={} | code={} | reason={}", column, ex.getErrorCode(), ex.getMessage());
            return ForecastResponse.failure(ex.getErrorCode(), ex.getMessage());
        }
    }

    /** Rejects a horizon outside 1..forecast.max-periods. */
    public void checkHorizon(int periods) {
        if (periods < 1 || periods > maxPeriods) {
            throw new InvalidForecastRequestException(
                "periods must be between 1 and " + maxPeriods + ", got " + periods);
        }
    }

    private ForecastResponse run(List<Map<String, Object>> rows, String column, int periods, ForecastMethod requested) {
        checkHorizon(periods);
        TimeSeries series = seriesExtractor.extract(rows, column);
        Optional<SeasonalityProfile> seasonality = seasonalityDetector.detect(series);
        ForecastMethod method = methodSelector.select(requested, series, seasonality);

        StrategyForecast forecast = strategyFor(method).forecast(series, seasonality.orElse(null), periods);
        Optional<AccuracyMetrics> accuracy = accuracyBacktester.backtest(series, method);
        if (!isFinite(forecast) || !accuracy.map(ForecastingService::isFinite).orElse(true)) {
            throw new NumericOverflowException(column);
        }

        log.info("Forecast complete | column={} | points={} | requested={} | method={} | periods={} | seasonalityPeriod={}",
                 column, series.size(), requested.getValue(), method.getValue(), periods,
                 seasonality.map(SeasonalityProfile::period).orElse(null));

        return ForecastResponse.builder()
            .success(true)
            .column(column)
            .periods(periods)
            .modelInfo(forecast.modelInfo())
            .accuracyMetrics(toAccuracy(accuracy))
            .historicalData(historical(series))
            .forecastData(forecast.points().stream().map(this::toDataPoint).toList())
            .summary(summarize(column, series, forecast, seasonality))
            .build();
    }

    private ForecastStrategy strategyFor(ForecastMethod method) {
        ForecastStrategy strategy = strategies.get(method);
        if (strategy == null) {
            throw new IllegalStateException("No forecasting strategy registered for " + method);
        }
        return strategy;
    }

    private static boolean isFinite(StrategyForecast forecast) {
        return forecast.points().stream().allMatch(p ->
            Double.isFinite(p.value()) && Double.isFinite(p.lower()) && Double.isFinite(p.upper()));
    }

    private static boolean isFinite(AccuracyMetrics accuracy) {
        return Double.isFinite(accuracy.rmse()) && (accuracy.mape() == null || Double.isFinite(accuracy.mape()));
    }

    private ForecastResponse.AccuracyMetrics toAccuracy(Optional<AccuracyMetrics> accuracy) {
        return ForecastResponse.AccuracyMetrics.builder()
            .mape(accuracy.map(AccuracyMetrics::mape).map(Precision::round).orElse(null))
            .rmse(accuracy.map(a -> Precision.round(a.rmse())).orElse(null))
            .build();
    }

    private List<ForecastResponse.HistoricalPoint> historical(TimeSeries series) {
        return IntStream.range(0, series.size())
            .mapToObj(i -> ForecastResponse.HistoricalPoint.builder()
                .index(i)
                .value(Precision.round(series.get(i)))
                .build())
            .toList();
    }

    private ForecastResponse.ForecastDataPoint toDataPoint(ForecastPoint point) {
        return ForecastResponse.ForecastDataPoint.builder()
            .index(point.index())
            .value(Precision.round(point.value()))
            .ciLower(Precision.round(point.lower()))
            .ciUpper(Precision.round(point.upper()))
            .build();
    }

    private ForecastResponse.Summary summarize(String column, TimeSeries series, StrategyForecast forecast,
                                               Optional<SeasonalityProfile> seasonality) {
        double current = series.last();
        double end = forecast.lastPoint().value();
        double changePct = current != 0.0d ? (end - current) / current * 100.0 : 0.0;
        if (!Double.isFinite(changePct)) {
            throw new NumericOverflowException(column);
        }
        return ForecastResponse.Summary.builder()
            .currentValue(Precision.round(current))
            .forecastedEndValue(Precision.round(end))
            .forecastChangePct(Precision.round(changePct))
            .trendDirection(TrendDirection.fromChangePct(changePct))
            .seasonalityDetected(seasonality.isPresent())
            .seasonalityPeriod(seasonality.map(SeasonalityProfile::period).orElse(null))
            .build();
    }
}
