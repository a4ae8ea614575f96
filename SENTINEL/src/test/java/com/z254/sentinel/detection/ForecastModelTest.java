package com.z254.sentinel.detection;

import org.junit.jupiter.api.Test;

import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ForecastModelTest {

    @Test
    void projectsLinearTrendFromLastValue() {
        double[] line = IntStream.rangeClosed(1, 30).mapToDouble(i -> i).toArray();
        ForecastModel model = new ForecastModel(line);

        Forecast forecast = model.predict(3);

        assertThat(model.slope()).isCloseTo(1.0, within(1e-9));
        assertThat(forecast.values()).hasSize(3);
        assertThat(forecast.values().get(0)).isCloseTo(31.0, within(1e-9));
        assertThat(forecast.values().get(2)).isCloseTo(33.0, within(1e-9));
        assertThat(forecast.horizon()).isEqualTo(3);
        // moving average lags a ramp by 3, relative error 3 / value
        assertThat(forecast.confidence()).isBetween(0.75, 0.85);
    }

    @Test
    void flatSeriesForecastsItselfWithFullConfidence() {
        ForecastModel model = new ForecastModel(DoubleStream.generate(() -> 10).limit(50).toArray());

        Forecast forecast = model.predict(5);

        assertThat(forecast.values()).containsOnly(10.0);
        assertThat(forecast.confidence()).isEqualTo(1.0);
    }

    @Test
    void fewerThanTenSamplesGiveEmptyForecast() {
        ForecastModel model = new ForecastModel(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9});

        Forecast forecast = model.predict(5);

        assertThat(forecast.isEmpty()).isTrue();
        assertThat(forecast.confidence()).isZero();
        assertThat(model.confidence()).isZero();
    }
}
