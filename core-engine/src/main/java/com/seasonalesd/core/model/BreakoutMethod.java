package com.seasonalesd.core.model;

import java.util.Locale;

/**
 * Segmentation strategy requested from a breakout detector.
 *
 * @since 1.0.0
 */
public enum BreakoutMethod {

    /** At most one change. */
    AMOC("amoc"),

    /** Any number of changes, penalized by {@code beta} or {@code percent}. */
    MULTI("multi");

    private final String key;

    BreakoutMethod(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static BreakoutMethod fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (BreakoutMethod method : values()) {
                if (method.key.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown breakout method: '" + value + "'. Supported: amoc, multi");
    }
}
