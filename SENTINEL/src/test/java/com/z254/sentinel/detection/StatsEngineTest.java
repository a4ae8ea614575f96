package com.z254.sentinel.detection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatsEngineTest {

    @Test
    void computeUsesPopulationVarianceAndIndexQuartiles() {
        double[] values = {1, 2, 3, 4, 5, 6, 7, 8};

        Statistics stats = StatsEngine.compute(values).orElseThrow();

        assertThat(stats.count()).isEqualTo(8);
        assertThat(stats.mean()).isEqualTo(4.5);
        assertThat(stats.stdDev()).isCloseTo(Math.sqrt(5.25), within(1e-12));
        assertThat(stats.min()).isEqualTo(1);
        assertThat(stats.max()).isEqualTo(8);
        // sorted[2], sorted[4], sorted[6]
        assertThat(stats.q1()).isEqualTo(3);
        assertThat(stats.median()).isEqualTo(5);
        assertThat(stats.q3()).isEqualTo(7);
        assertThat(stats.iqr()).isEqualTo(4);
    }

    @Test
    void computeDoesNotReorderInput() {
        double[] values = {9, 1, 5};

        StatsEngine.compute(values);

        assertThat(values).containsExactly(9, 1, 5);
    }

    @Test
    void emptyWindowIsNotTrained() {
        assertThat(StatsEngine.compute(new double[0])).isEmpty();
    }

    @Test
    void medianAbsoluteDeviationTakesMiddleOfSortedDeviations() {
        double[] values = {1, 1, 2, 2, 4, 6, 9};

        // deviations from 2: 1,1,0,0,2,4,7 -> sorted 0,0,1,1,2,4,7 -> index 3
        assertThat(StatsEngine.medianAbsoluteDeviation(values, 2)).isEqualTo(1);
    }

    @Test
    void slopeIsLeastSquaresOverIndex() {
        assertThat(StatsEngine.slope(new double[]{1, 3, 5, 7})).isCloseTo(2.0, within(1e-12));
        assertThat(StatsEngine.slope(new double[]{4, 4, 4})).isZero();
        assertThat(StatsEngine.slope(new double[]{4})).isZero();
    }

    @Test
    void tailReturnsAtMostCountValues() {
        assertThat(StatsEngine.tail(new double[]{1, 2, 3, 4}, 2)).containsExactly(3, 4);
        assertThat(StatsEngine.tail(new double[]{1, 2}, 5)).containsExactly(1, 2);
    }
}
