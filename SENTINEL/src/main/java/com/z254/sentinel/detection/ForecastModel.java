package com.z254.sentinel.detection;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear trend forecaster.
 * <p>
 * Projects {@code last + slope * i} from the least-squares slope of the last 20 training values.
 * Confidence is {@code 1 - meanRelativeError} of a five-point moving average backtested over
 * the training series, floored at zero.
 */
public final class ForecastModel {

    static final int MIN_SAMPLES = 10;
    static final int TREND_WINDOW = 20;
    static final int BACKTEST_WINDOW = 5;

    private final double[] values;
    private final double slope;
    private final double confidence;

    public ForecastModel(double[] values) {
        this.values = values.clone();
        this.slope = StatsEngine.slope(StatsEngine.tail(values, TREND_WINDOW));
        this.confidence = backtest(values);
    }

    public double slope() {
        return slope;
    }

    public double confidence() {
        return values.length < MIN_SAMPLES ? 0.0 : confidence;
    }

    public Forecast predict(int horizon) {
        if (values.length < MIN_SAMPLES || horizon <= 0) {
            return Forecast.empty(Math.max(horizon, 0));
        }
        double last = values[values.length - 1];
        List<Double> projected = new ArrayList<>(horizon);
        for (int i = 1; i <= horizon; i++) {
            projected.add(last + slope * i);
        }
        return new Forecast(projected, horizon, confidence);
    }

    private static double backtest(double[] values) {
        if (values.length <= BACKTEST_WINDOW) {
            return 0.0;
        }
        double totalError = 0;
        int count = 0;
        for (int i = BACKTEST_WINDOW; i < values.length; i++) {
            double predicted = 0;
            for (int j = i - BACKTEST_WINDOW; j < i; j++) {
                predicted += values[j];
            }
            predicted /= BACKTEST_WINDOW;
            totalError += Math.abs(values[i] - predicted) / Math.max(values[i], 1.0);
            count++;
        }
        return Math.max(0.0, 1.0 - totalError / count);
    }
}
