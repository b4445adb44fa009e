package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.Direction;
import com.seasonalesd.core.stats.RobustStatistics;
import org.apache.commons.math3.distribution.TDistribution;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generalized Extreme Studentized Deviate test with a robust statistic.
 *
 * <p>
 * Each iteration centers the remaining values on their median, scales by the
 * MAD, and compares the most extreme score against the critical value
 * &lambda;<sub>i</sub> derived from Student's t distribution. The most
 * extreme value is removed while it exceeds &lambda;<sub>i</sub>.
 * </p>
 *
 * <h3>Termination</h3>
 * <ul>
 * <li>{@code maxOutliers} values have been removed;</li>
 * <li>the most extreme score does not exceed &lambda;<sub>i</sub> (later
 * iterations cannot succeed either: scores shrink while &lambda; grows);</li>
 * <li>the MAD of the remaining values is zero;</li>
 * <li>the t quantile is undefined (fewer than one degree of freedom, or a
 * significance level outside (0, 1)).</li>
 * </ul>
 *
 * <p>
 * The working set is tracked with a removed-flag per index; each iteration
 * scans all {@code n} slots.
 * </p>
 *
 * @since 1.0.0
 */
public class EsdOutlierTester {

    private final Logger log;

    /**
     * @param log diagnostic sink for per-iteration state
     */
    public EsdOutlierTester(Logger log) {
        this.log = Objects.requireNonNull(log, "Logger must not be null");
    }

    /**
     * Run the test.
     *
     * @param residuals   values to test; not modified
     * @param maxOutliers upper bound on the number of removed values
     * @param alpha       significance level, {@code > 0}
     * @param direction   which deviations count as extreme
     * @return indices into {@code residuals} in removal order (most extreme
     *         first); between 0 and {@code maxOutliers} elements
     */
    public List<Integer> test(double[] residuals, int maxOutliers, double alpha, Direction direction) {
        Objects.requireNonNull(residuals, "residuals must not be null");
        Objects.requireNonNull(direction, "direction must not be null");

        int n = residuals.length;
        boolean[] removed = new boolean[n];
        int remaining = n;
        List<Integer> outliers = new ArrayList<>();

        for (int i = 1; i <= maxOutliers && remaining > 0; i++) {
            double[] active = activeValues(residuals, removed, remaining);
            double median = RobustStatistics.median(active);
            double mad = RobustStatistics.mad(active, median);
            if (mad == 0) {
                log.debug("ESD {}/{}: MAD is zero, stopping", i, maxOutliers);
                break;
            }

            int rIdx = -1;
            double r = Double.NEGATIVE_INFINITY;
            for (int j = 0; j < n; j++) {
                if (removed[j]) {
                    continue;
                }
                double score = score(residuals[j], median, mad, direction);
                // strict comparison keeps the first index on ties
                if (rIdx < 0 || score > r) {
                    r = score;
                    rIdx = j;
                }
            }

            int degreesOfFreedom = n - i - 1;
            double p = direction == Direction.BOTH
                    ? 1.0 - alpha / (2.0 * (n - i + 1))
                    : 1.0 - alpha / (n - i + 1);
            if (degreesOfFreedom < 1 || p <= 0 || p >= 1) {
                log.debug("ESD {}/{}: t quantile undefined (p={}, df={}), stopping",
                        i, maxOutliers, p, degreesOfFreedom);
                break;
            }

            double crit = new TDistribution(degreesOfFreedom).inverseCumulativeProbability(p);
            double lambda = (n - i) * crit / Math.sqrt((n - i - 1 + crit * crit) * (n - i + 1));

            log.debug("ESD {}/{}: median={} mad={} rIdx={} r={} crit={} lambda={}",
                    i, maxOutliers, median, mad, rIdx, r, crit, lambda);

            if (r > lambda) {
                outliers.add(rIdx);
                removed[rIdx] = true;
                remaining--;
            } else {
                break;
            }
        }
        return outliers;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static double score(double value, double median, double mad, Direction direction) {
        return switch (direction) {
            case BOTH -> Math.abs(value - median) / mad;
            case POS -> (value - median) / mad;
            case NEG -> (median - value) / mad;
        };
    }

    private static double[] activeValues(double[] values, boolean[] removed, int remaining) {
        double[] active = new double[remaining];
        int k = 0;
        for (int j = 0; j < values.length; j++) {
            if (!removed[j]) {
                active[k++] = values[j];
            }
        }
        return active;
    }
}
