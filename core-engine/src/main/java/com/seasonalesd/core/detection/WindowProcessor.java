package com.seasonalesd.core.detection;

import com.seasonalesd.core.decomposition.Decomposition;
import com.seasonalesd.core.decomposition.SeasonalDecomposer;
import com.seasonalesd.core.model.DetectionProfile;
import com.seasonalesd.core.model.Window;
import org.slf4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs decomposition, baseline estimation and the ESD test over one window.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Decompose the window with the profile's period.</li>
 * <li>Record {@code floor(seasonal + trend)} as the expected value of every
 * index not yet recorded by an earlier window.</li>
 * <li>Compute residuals as observation minus seasonal minus baseline. The
 * baseline comes from the {@link TrendEstimator}; the STL trend is used for
 * expected values only.</li>
 * <li>Test the residuals with at most
 * {@code max(1, floor(length * maxAnoms))} outliers.</li>
 * </ol>
 *
 * @since 1.0.0
 */
class WindowProcessor {

    private final SeasonalDecomposer decomposer;
    private final EsdOutlierTester esd;
    private final Logger log;

    WindowProcessor(SeasonalDecomposer decomposer, EsdOutlierTester esd, Logger log) {
        this.decomposer = Objects.requireNonNull(decomposer, "SeasonalDecomposer must not be null");
        this.esd = Objects.requireNonNull(esd, "EsdOutlierTester must not be null");
        this.log = Objects.requireNonNull(log, "Logger must not be null");
    }

    /**
     * @param series         full series
     * @param window         range to process
     * @param profile        detection parameters
     * @param trendEstimator baseline strategy
     * @param expectedValues table to populate, or {@code null} when expected
     *                       values were not requested
     * @return global indices of the anomalies found in {@code window}
     */
    Set<Integer> process(double[] series, Window window, DetectionProfile profile,
            TrendEstimator trendEstimator, ExpectedValueTable expectedValues) {
        int start = window.getStart();
        double[] values = Arrays.copyOfRange(series, start, window.getEnd());
        int n = values.length;

        Decomposition decomposition = decomposer.decompose(values, profile.getPeriod());
        if (decomposition.length() != n) {
            throw new IllegalStateException("Decomposer returned " + decomposition.length()
                    + " observations for a window of length " + n);
        }

        if (expectedValues != null) {
            for (int i = 0; i < n; i++) {
                expectedValues.putIfAbsent(start + i,
                        Math.floor(decomposition.seasonal(i) + decomposition.trend(i)));
            }
        }

        double[] baseline = trendEstimator.estimate(values);
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = values[i] - decomposition.seasonal(i) - baseline[i];
        }

        int maxOutliers = maxOutliers(n, profile.getMaxAnoms());
        List<Integer> local = esd.test(residuals, maxOutliers, profile.getAlpha(), profile.direction());
        log.debug("Window {}: {} outlier(s) of at most {}", window, local.size(), maxOutliers);

        Set<Integer> global = new TreeSet<>();
        for (int offset : local) {
            global.add(start + offset);
        }
        return global;
    }

    static int maxOutliers(int windowLength, double maxAnoms) {
        return Math.max(1, (int) (windowLength * maxAnoms));
    }
}
