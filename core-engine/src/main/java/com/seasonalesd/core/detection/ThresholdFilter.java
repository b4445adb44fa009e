package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.ThresholdMode;
import com.seasonalesd.core.model.Window;
import com.seasonalesd.core.stats.RobustStatistics;
import org.slf4j.Logger;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Drops anomalies whose observed value is below a robust magnitude threshold.
 *
 * <p>
 * The window is cut into period-length chunks (the last one may be shorter),
 * the maximum of every chunk is taken, and the threshold is the median, 95th
 * or 99th percentile of those maxima. Only candidates whose raw value is at
 * least the threshold survive, so the filter keeps high-going anomalies only.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdFilter {

    private final Logger log;

    public ThresholdFilter(Logger log) {
        this.log = Objects.requireNonNull(log, "Logger must not be null");
    }

    /**
     * @param series     full series
     * @param window     window the candidates were found in
     * @param period     chunk length
     * @param mode       statistic over the chunk maxima
     * @param candidates global indices inside {@code window}
     * @return the surviving global indices
     */
    public Set<Integer> apply(double[] series, Window window, int period, ThresholdMode mode,
            Set<Integer> candidates) {
        double threshold = threshold(series, window, period, mode);
        log.debug("Threshold {} for window {}: {}", mode.key(), window, threshold);

        Set<Integer> kept = new TreeSet<>();
        for (int index : candidates) {
            if (series[index] >= threshold) {
                kept.add(index);
            }
        }
        return kept;
    }

    /**
     * @return the threshold the candidates of {@code window} are held to
     */
    static double threshold(double[] series, Window window, int period, ThresholdMode mode) {
        int chunks = (window.length() + period - 1) / period;
        double[] maxima = new double[chunks];
        for (int c = 0; c < chunks; c++) {
            int from = window.getStart() + c * period;
            int to = Math.min(window.getEnd(), from + period);
            double max = Double.NEGATIVE_INFINITY;
            for (int i = from; i < to; i++) {
                max = Math.max(max, series[i]);
            }
            maxima[c] = max;
        }
        return RobustStatistics.percentile(maxima, mode.percentile());
    }
}
