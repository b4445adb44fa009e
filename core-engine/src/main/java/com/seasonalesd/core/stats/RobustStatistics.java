package com.seasonalesd.core.stats;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Objects;

/**
 * Order-statistic helpers shared by the trend estimators, the ESD test and
 * the threshold filter.
 *
 * <p>
 * Quantiles use linear interpolation between the closest ranks
 * ({@link Percentile.EstimationType#R_7}), so the median of an even-length
 * sample is the mean of its two middle values.
 * </p>
 *
 * @since 1.0.0
 */
public final class RobustStatistics {

    /** Scales the median absolute deviation to a standard deviation under normality. */
    public static final double MAD_SCALE = 1.4826;

    private RobustStatistics() {
        // utility class — not instantiable
    }

    /**
     * @param values sample; must not be {@code null} or empty
     * @return the median of {@code values}
     */
    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /**
     * Median of {@code values[from, to)}.
     *
     * @param values source array
     * @param from   first index, inclusive
     * @param to     last index, exclusive; must be greater than {@code from}
     * @return the median of the slice
     */
    public static double median(double[] values, int from, int to) {
        Objects.requireNonNull(values, "values must not be null");
        if (from < 0 || to > values.length || from >= to) {
            throw new IllegalArgumentException(
                    "Invalid slice [" + from + ", " + to + ") for length " + values.length);
        }
        return estimator().evaluate(values, from, to - from, 50.0);
    }

    /**
     * @param values sample; must not be {@code null} or empty
     * @param p      percentile in (0, 100]
     * @return the {@code p}-th percentile of {@code values}
     */
    public static double percentile(double[] values, double p) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of an empty sample");
        }
        return estimator().evaluate(values, p);
    }

    /**
     * Scaled median absolute deviation around a known center.
     *
     * @param values sample; must not be {@code null} or empty
     * @param center the sample median
     * @return {@code median(|v - center|) * }{@value #MAD_SCALE}
     */
    public static double mad(double[] values, double center) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return median(deviations) * MAD_SCALE;
    }

    private static Percentile estimator() {
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    }
}
