package com.seasonalesd.core.model;

import java.util.Locale;

/**
 * Statistic applied to the per-period maxima of a window to derive the
 * magnitude threshold that reported anomalies must reach.
 *
 * @since 1.0.0
 */
public enum ThresholdMode {

    /** Median of the per-period maxima. */
    MED_MAX("med_max", 50.0),

    /** 95th percentile of the per-period maxima. */
    P95("p95", 95.0),

    /** 99th percentile of the per-period maxima. */
    P99("p99", 99.0);

    private final String key;
    private final double percentile;

    ThresholdMode(String key, double percentile) {
        this.key = key;
        this.percentile = percentile;
    }

    public String key() {
        return key;
    }

    /**
     * @return the percentile (0-100] this mode selects
     */
    public double percentile() {
        return percentile;
    }

    /**
     * @param value configuration key, case-insensitive
     * @return the matching mode
     * @throws IllegalArgumentException if {@code value} is unknown
     */
    public static ThresholdMode fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ThresholdMode mode : values()) {
                if (mode.key.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown threshold: '" + value + "'. Supported: med_max, p95, p99");
    }
}
