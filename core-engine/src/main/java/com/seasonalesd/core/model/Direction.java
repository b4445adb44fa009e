package com.seasonalesd.core.model;

import java.util.Locale;

/**
 * Which side of the baseline an anomaly may fall on.
 *
 * @since 1.0.0
 */
public enum Direction {

    /** Report deviations on either side of the baseline. */
    BOTH("both"),

    /** Report only values above the baseline. */
    POS("pos"),

    /** Report only values below the baseline. */
    NEG("neg");

    private final String key;

    Direction(String key) {
        this.key = key;
    }

    /**
     * @return the configuration key ({@code both}, {@code pos} or {@code neg})
     */
    public String key() {
        return key;
    }

    /**
     * Resolve a direction from its configuration key, ignoring case.
     *
     * @param value configuration key
     * @return the matching direction
     * @throws IllegalArgumentException if {@code value} is unknown
     */
    public static Direction fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Direction direction : values()) {
                if (direction.key.equals(normalized)) {
                    return direction;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown direction: '" + value + "'. Supported: both, pos, neg");
    }
}
