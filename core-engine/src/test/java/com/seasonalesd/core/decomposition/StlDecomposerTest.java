package com.seasonalesd.core.decomposition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StlDecomposer}.
 */
class StlDecomposerTest {

    private final StlDecomposer decomposer = new StlDecomposer();

    @Test
    @DisplayName("Seasonal plus trend reconstructs a periodic signal up to its noise")
    void shouldReconstructPeriodicSignal() {
        int period = 12;
        double[] series = new double[period * 8];
        for (int i = 0; i < series.length; i++) {
            series[i] = 50 + 10 * Math.sin(2 * Math.PI * i / period) + ((i * 7) % 9 - 4) * 0.1;
        }

        Decomposition decomposition = decomposer.decompose(series, period);

        assertThat(decomposition.length()).isEqualTo(series.length);
        for (int i = 0; i < series.length; i++) {
            assertThat(decomposition.seasonal(i) + decomposition.trend(i))
                    .as("index %d", i)
                    .isCloseTo(series[i], within(1.0));
        }
        // the level lives in the trend, the oscillation in the seasonal part
        assertThat(decomposition.trend(period * 4)).isCloseTo(50, within(1.5));
        assertThat(decomposition.seasonal(3)).isCloseTo(10, within(1.5));
    }

    @Test
    @DisplayName("Should not modify the input series")
    void shouldNotModifyInput() {
        double[] series = { 1, 5, 2, 1, 6, 2, 1, 5, 3, 1, 6, 2 };
        double[] copy = series.clone();

        decomposer.decompose(series, 3);

        assertThat(series).containsExactly(copy);
    }

    @Test
    @DisplayName("Should reject a period below two")
    void shouldRejectShortPeriod() {
        assertThatThrownBy(() -> decomposer.decompose(new double[] { 1, 2, 3, 4 }, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("period");
    }

    @Test
    @DisplayName("Components are copied on construction")
    void shouldCopyComponents() {
        double[] seasonal = { 1, 2 };
        Decomposition decomposition = new Decomposition(seasonal, new double[] { 3, 4 });
        seasonal[0] = 99;

        assertThat(decomposition.seasonal(0)).isEqualTo(1);
        assertThatThrownBy(() -> new Decomposition(new double[1], new double[2]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
