package com.z254.sentinel.detection;

import java.util.List;

/**
 * Projected values with the backtested confidence of the model that produced them.
 */
public record Forecast(List<Double> values, int horizon, double confidence) {

    public static Forecast empty(int horizon) {
        return new Forecast(List.of(), horizon, 0.0);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
