package com.seasonalesd.core.breakout;

import com.seasonalesd.core.model.BreakoutConfig;

import java.util.List;

/**
 * Change-point detector that partitions a series into segments of roughly
 * constant level.
 *
 * <p>
 * Implementations are discovered through {@link java.util.ServiceLoader} when
 * none is supplied to
 * {@link com.seasonalesd.core.detection.SeasonalHybridEsd.Builder#breakoutDetector(BreakoutDetector)}.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface BreakoutDetector {

    /**
     * Locate level shifts in {@code series}.
     *
     * @param series observations; not modified
     * @param config segmentation parameters
     * @return ascending segment boundaries (exclusive segment ends) in
     *         {@code (0, series.length]}; the final {@code series.length}
     *         may be omitted
     */
    List<Integer> detect(double[] series, BreakoutConfig config);
}
