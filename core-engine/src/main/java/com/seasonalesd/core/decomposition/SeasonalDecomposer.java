package com.seasonalesd.core.decomposition;

/**
 * Splits a series into seasonal and trend components.
 *
 * <p>
 * Implementations must be deterministic: the same series and period always
 * yield the same decomposition. Both returned components have the length of
 * the input series.
 * </p>
 */
@FunctionalInterface
public interface SeasonalDecomposer {

    /**
     * Decompose {@code series}.
     *
     * @param series observations; not modified
     * @param period number of observations per seasonal cycle
     * @return seasonal and trend components
     */
    Decomposition decompose(double[] series, int period);
}
