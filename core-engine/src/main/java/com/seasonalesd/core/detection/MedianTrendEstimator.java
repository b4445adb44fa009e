package com.seasonalesd.core.detection;

import com.seasonalesd.core.stats.RobustStatistics;

import java.util.Arrays;

/**
 * Flat baseline: the median of the whole window at every position.
 *
 * @since 1.0.0
 */
public class MedianTrendEstimator implements TrendEstimator {

    @Override
    public double[] estimate(double[] window) {
        double[] baseline = new double[window.length];
        Arrays.fill(baseline, RobustStatistics.median(window));
        return baseline;
    }
}
