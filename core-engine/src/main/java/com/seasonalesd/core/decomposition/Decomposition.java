package com.seasonalesd.core.decomposition;

import java.util.Objects;

/**
 * Parallel seasonal and trend components of one window.
 *
 * @since 1.0.0
 */
public final class Decomposition {

    private final double[] seasonal;
    private final double[] trend;

    /**
     * @param seasonal seasonal component
     * @param trend    trend component; same length as {@code seasonal}
     * @throws IllegalArgumentException if the lengths differ
     */
    public Decomposition(double[] seasonal, double[] trend) {
        Objects.requireNonNull(seasonal, "seasonal must not be null");
        Objects.requireNonNull(trend, "trend must not be null");
        if (seasonal.length != trend.length) {
            throw new IllegalArgumentException("Component lengths differ: seasonal="
                    + seasonal.length + ", trend=" + trend.length);
        }
        this.seasonal = seasonal.clone();
        this.trend = trend.clone();
    }

    public int length() {
        return seasonal.length;
    }

    public double seasonal(int i) {
        return seasonal[i];
    }

    public double trend(int i) {
        return trend[i];
    }
}
