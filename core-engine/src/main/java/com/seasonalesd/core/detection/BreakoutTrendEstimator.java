package com.seasonalesd.core.detection;

import com.seasonalesd.core.breakout.BreakoutDetector;
import com.seasonalesd.core.model.BreakoutConfig;
import com.seasonalesd.core.stats.RobustStatistics;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Piecewise-flat baseline: the window is cut at the boundaries reported by a
 * {@link BreakoutDetector} and every segment gets its own median.
 *
 * <p>
 * A level shift inside the window therefore moves the baseline with it
 * instead of showing up as a run of large residuals.
 * </p>
 *
 * @since 1.0.0
 */
public class BreakoutTrendEstimator implements TrendEstimator {

    private final BreakoutDetector detector;
    private final BreakoutConfig config;
    private final Logger log;

    /**
     * @param detector change-point oracle
     * @param config   parameters passed to {@code detector}
     * @param log      diagnostic sink
     */
    public BreakoutTrendEstimator(BreakoutDetector detector, BreakoutConfig config, Logger log) {
        this.detector = Objects.requireNonNull(detector, "BreakoutDetector must not be null");
        this.config = Objects.requireNonNull(config, "BreakoutConfig must not be null");
        this.log = Objects.requireNonNull(log, "Logger must not be null");
    }

    /**
     * @throws IllegalStateException if the detector returns boundaries that
     *                               are not strictly ascending within
     *                               {@code (0, window.length]}
     */
    @Override
    public double[] estimate(double[] window) {
        List<Integer> reported = detector.detect(window.clone(), config);
        log.debug("Breakout boundaries: {}", reported);

        List<Integer> boundaries = new ArrayList<>(reported != null ? reported : List.of());
        if (!boundaries.contains(window.length)) {
            boundaries.add(window.length);
        }

        double[] baseline = new double[window.length];
        int previous = 0;
        for (Integer boundary : boundaries) {
            if (boundary == null || boundary <= previous || boundary > window.length) {
                throw new IllegalStateException("Breakout detector returned invalid boundaries "
                        + reported + " for a window of length " + window.length);
            }
            double median = RobustStatistics.median(window, previous, boundary);
            Arrays.fill(baseline, previous, boundary, median);
            previous = boundary;
        }
        return baseline;
    }
}
