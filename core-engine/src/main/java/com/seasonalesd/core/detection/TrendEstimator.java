package com.seasonalesd.core.detection;

/**
 * Produces the per-observation baseline subtracted, together with the
 * seasonal component, to form the residuals of a window.
 *
 * @since 1.0.0
 */
public interface TrendEstimator {

    /**
     * @param window observations of one window; not modified
     * @return baseline of the same length as {@code window}
     */
    double[] estimate(double[] window);
}
