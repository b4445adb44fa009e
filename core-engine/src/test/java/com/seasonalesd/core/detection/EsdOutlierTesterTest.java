package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.Direction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EsdOutlierTester}.
 */
class EsdOutlierTesterTest {

    private EsdOutlierTester esd;

    @BeforeEach
    void setUp() {
        esd = new EsdOutlierTester(LoggerFactory.getLogger(EsdOutlierTesterTest.class));
    }

    @Test
    @DisplayName("Should find nothing when all residuals are equal (MAD = 0)")
    void shouldStopOnZeroMad() {
        double[] residuals = new double[20];
        Arrays.fill(residuals, 5.0);

        assertThat(esd.test(residuals, 5, 0.05, Direction.BOTH)).isEmpty();
    }

    @Test
    @DisplayName("Should find a single spike and stop at the noise")
    void shouldFindSingleSpike() {
        double[] residuals = noise(20);
        residuals[12] = 50;

        assertThat(esd.test(residuals, 3, 0.05, Direction.BOTH)).containsExactly(12);
    }

    @Test
    @DisplayName("Should report outliers from most to least extreme")
    void shouldReportInRemovalOrder() {
        double[] residuals = twoSpikes();

        assertThat(esd.test(residuals, 5, 0.05, Direction.BOTH)).containsExactly(15, 3);
    }

    @Test
    @DisplayName("Should honour the positive direction")
    void shouldOnlyFindPositiveSpike() {
        assertThat(esd.test(twoSpikes(), 5, 0.05, Direction.POS)).containsExactly(15);
    }

    @Test
    @DisplayName("Should honour the negative direction")
    void shouldOnlyFindNegativeSpike() {
        assertThat(esd.test(twoSpikes(), 5, 0.05, Direction.NEG)).containsExactly(3);
    }

    @Test
    @DisplayName("Should never return more than maxOutliers indices")
    void shouldCapAtMaxOutliers() {
        assertThat(esd.test(twoSpikes(), 1, 0.05, Direction.BOTH)).containsExactly(15);
    }

    @Test
    @DisplayName("Should break ties on the first index")
    void shouldBreakTiesOnFirstIndex() {
        double[] residuals = noise(20);
        residuals[5] = 30;
        residuals[14] = 30;

        assertThat(esd.test(residuals, 4, 0.05, Direction.BOTH)).containsExactly(5, 14);
    }

    @Test
    @DisplayName("Should stop without error when the t quantile has no degrees of freedom")
    void shouldStopWithoutDegreesOfFreedom() {
        assertThat(esd.test(new double[] { 0, 10 }, 1, 0.05, Direction.BOTH)).isEmpty();
    }

    @Test
    @DisplayName("Should not modify the residuals")
    void shouldNotModifyInput() {
        double[] residuals = twoSpikes();
        double[] copy = residuals.clone();

        esd.test(residuals, 5, 0.05, Direction.BOTH);

        assertThat(residuals).containsExactly(copy);
    }

    @Test
    @DisplayName("Scores follow the direction formulas")
    void shouldScoreByDirection() {
        assertThat(EsdOutlierTester.score(7, 10, 2, Direction.BOTH)).isEqualTo(1.5);
        assertThat(EsdOutlierTester.score(7, 10, 2, Direction.POS)).isEqualTo(-1.5);
        assertThat(EsdOutlierTester.score(7, 10, 2, Direction.NEG)).isEqualTo(1.5);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Deterministic values spread evenly over [-4, 4]. */
    static double[] noise(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = (i * 7) % 9 - 4;
        }
        return values;
    }

    private static double[] twoSpikes() {
        double[] residuals = noise(20);
        residuals[3] = -40;
        residuals[15] = 60;
        return residuals;
    }
}
