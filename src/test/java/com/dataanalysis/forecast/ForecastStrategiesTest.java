package com.dataanalysis.forecast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ForecastStrategiesTest {

    private final TrendEstimator trendEstimator = new TrendEstimator();
    private final LinearTrendStrategy linear = new LinearTrendStrategy(trendEstimator);
    private final SeasonalDecompositionStrategy seasonal = new SeasonalDecompositionStrategy(trendEstimator);
    private final MovingAverageStrategy movingAverage = new MovingAverageStrategy();

    @Test
    void linear_exactLine_continuesTheLine() {
        StrategyForecast forecast = linear.forecast(TimeSeries.of(SeriesFixtures.line(20, 3, 5)), null, 5);

        assertThat(forecast.points()).hasSize(5);
        assertThat(forecast.points().get(0).index()).isEqualTo(20);
        assertThat(forecast.points().get(0).value()).isCloseTo(65.0, within(1e-9));
        assertThat(forecast.lastPoint().value()).isCloseTo(77.0, within(1e-9));
        assertThat(forecast.modelInfo())
            .containsEntry("method", "linear_regression")
            .containsEntry("slope", 3.0)
            .containsEntry("intercept", 5.0)
            .containsEntry("r_squared", 1.0);
    }

    @Test
    void linear_intervalWidensAwayFromTheData() {
        List<ForecastPoint> points = linear.forecast(TimeSeries.of(SeriesFixtures.noisyTrend()), null, 6).points();

        for (int i = 1; i < points.size(); i++) {
            assertThat(points.get(i).halfWidth()).isGreaterThan(points.get(i - 1).halfWidth());
        }
    }

    @Test
    void seasonal_weeklySine_reproducesTheCycle() {
        TimeSeries series = TimeSeries.of(SeriesFixtures.weekly(40));
        StrategyForecast forecast = seasonal.forecast(series, SeasonalityProfile.of(series, 7), 14);

        assertThat(forecast.points()).hasSize(14);
        for (ForecastPoint point : forecast.points()) {
            assertThat(point.value()).isCloseTo(Math.sin(2 * Math.PI * point.index() / 7.0), within(1e-6));
            assertThat(point.halfWidth()).isCloseTo(1.96 * series.std(), within(1e-9));
        }
        assertThat(forecast.modelInfo())
            .containsEntry("method", "seasonal_decomposition")
            .containsEntry("seasonality_period", 7)
            .containsEntry("trend_slope", 0.0);
    }

    @Test
    void seasonal_withoutProfile_isRejected() {
        TimeSeries series = TimeSeries.of(SeriesFixtures.noisyTrend());

        assertThatThrownBy(() -> seasonal.forecast(series, null, 3))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void movingAverage_extrapolatesFromSmoothedLevel() {
        StrategyForecast forecast = movingAverage.forecast(TimeSeries.of(SeriesFixtures.line(10, 1, 1)), null, 3);

        assertThat(forecast.points().get(0).value()).isCloseTo(7.760825083 + 0.8, within(1e-6));
        assertThat(forecast.points().get(2).value()).isCloseTo(7.760825083 + 2.4, within(1e-6));
        assertThat(forecast.modelInfo())
            .containsEntry("method", "exponential_moving_average")
            .containsEntry("alpha", 0.3)
            .containsEntry("recent_trend", 0.8);
    }

    @Test
    void movingAverage_intervalGrowsEveryStep() {
        List<ForecastPoint> points = movingAverage.forecast(TimeSeries.of(SeriesFixtures.noisyTrend()), null, 8).points();

        for (int i = 1; i < points.size(); i++) {
            assertThat(points.get(i).halfWidth()).isGreaterThan(points.get(i - 1).halfWidth());
        }
    }

    @Test
    void movingAverage_constantSeries_collapsesInterval() {
        List<ForecastPoint> points = movingAverage.forecast(TimeSeries.of(SeriesFixtures.generate(12, t -> 5)), null, 4).points();

        assertThat(points).allSatisfy(p -> {
            assertThat(p.value()).isEqualTo(5.0);
            assertThat(p.lower()).isEqualTo(5.0);
            assertThat(p.upper()).isEqualTo(5.0);
        });
    }
}
