package com.seasonalesd.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Full parameter set for one Seasonal Hybrid ESD run.
 *
 * <p>
 * Profiles are either built programmatically through the setters or loaded
 * from YAML by {@link com.seasonalesd.core.config.ProfilesLoader}. Defaults:
 * </p>
 * <ul>
 * <li>{@code maxAnoms} — 0.10 (at most 10% of a window is reported)</li>
 * <li>{@code alpha} — 0.05</li>
 * <li>{@code direction} — {@code both}</li>
 * <li>{@code longtermPeriod}, {@code onlyLast}, {@code threshold},
 * {@code breakout} — unset</li>
 * <li>{@code expectedValues} — {@code false}</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after deserialization. The detector re-checks the
 * statistical parameters itself and raises typed exceptions, so profiles built
 * in code do not need to be validated first.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_MAX_ANOMS = 0.10;
    public static final double DEFAULT_ALPHA = 0.05;

    /** Largest fraction of a window that may be reported as anomalous. */
    public static final double MAX_ANOMS_LIMIT = 0.49;

    /** Profile name used in reports and logs. */
    private String name;

    /** Number of observations per seasonal cycle. */
    private int period;

    private double maxAnoms = DEFAULT_MAX_ANOMS;

    private double alpha = DEFAULT_ALPHA;

    /** "both", "pos" or "neg". */
    private String direction = Direction.BOTH.key();

    /** Window size for long series; {@code null} means one window. */
    private Integer longtermPeriod;

    /** Report only anomalies within this many trailing observations. */
    private Integer onlyLast;

    /** "med_max", "p95", "p99" or {@code null}. */
    private String threshold;

    /** Whether expected values are reported next to the indices. */
    private boolean expectedValues;

    /** Breakout-segmented trend estimation; {@code null} means flat median. */
    private BreakoutConfig breakout;

    /**
     * Convenience factory for a profile with default parameters.
     *
     * @param period observations per seasonal cycle
     * @return a new profile
     */
    public static DetectionProfile forPeriod(int period) {
        DetectionProfile profile = new DetectionProfile();
        profile.setPeriod(period);
        return profile;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every field and report all problems at once.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Profile 'name' is required");
        }
        if (period < 2) {
            errors.add("Profile '" + name + "' requires 'period' >= 2");
        }
        if (maxAnoms <= 0 || maxAnoms > MAX_ANOMS_LIMIT) {
            errors.add("Profile '" + name + "' requires 'maxAnoms' in (0, " + MAX_ANOMS_LIMIT + "]");
        }
        if (alpha <= 0) {
            errors.add("Profile '" + name + "' requires 'alpha' > 0");
        }
        if (longtermPeriod != null && longtermPeriod <= 0) {
            errors.add("Profile '" + name + "' requires 'longtermPeriod' > 0 when set");
        }
        if (onlyLast != null && onlyLast <= 0) {
            errors.add("Profile '" + name + "' requires 'onlyLast' > 0 when set");
        }
        try {
            Direction.fromString(direction);
        } catch (IllegalArgumentException e) {
            errors.add("Profile '" + name + "': " + e.getMessage());
        }
        if (threshold != null) {
            try {
                ThresholdMode.fromString(threshold);
            } catch (IllegalArgumentException e) {
                errors.add("Profile '" + name + "': " + e.getMessage());
            }
        }
        if (breakout != null) {
            try {
                breakout.validate();
            } catch (IllegalStateException e) {
                errors.add("Profile '" + name + "': " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionProfile: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    /**
     * @return the parsed direction
     * @throws IllegalArgumentException if {@code direction} is unknown
     */
    public Direction direction() {
        return Direction.fromString(direction);
    }

    /**
     * @return the parsed threshold mode, or empty if no threshold is set
     * @throws IllegalArgumentException if {@code threshold} is unknown
     */
    public Optional<ThresholdMode> thresholdMode() {
        return threshold == null ? Optional.empty() : Optional.of(ThresholdMode.fromString(threshold));
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getPeriod() {
        return period;
    }

    public void setPeriod(int period) {
        this.period = period;
    }

    public double getMaxAnoms() {
        return maxAnoms;
    }

    public void setMaxAnoms(double maxAnoms) {
        this.maxAnoms = maxAnoms;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public String getDirection() {
        return direction;
    }

    /**
     * Set the direction, normalised to lowercase.
     *
     * @param direction "both", "pos" or "neg"
     */
    public void setDirection(String direction) {
        this.direction = direction != null ? direction.toLowerCase(Locale.ROOT) : null;
    }

    public Integer getLongtermPeriod() {
        return longtermPeriod;
    }

    public void setLongtermPeriod(Integer longtermPeriod) {
        this.longtermPeriod = longtermPeriod;
    }

    public Integer getOnlyLast() {
        return onlyLast;
    }

    public void setOnlyLast(Integer onlyLast) {
        this.onlyLast = onlyLast;
    }

    public String getThreshold() {
        return threshold;
    }

    public void setThreshold(String threshold) {
        this.threshold = threshold != null ? threshold.toLowerCase(Locale.ROOT) : null;
    }

    public boolean isExpectedValues() {
        return expectedValues;
    }

    public void setExpectedValues(boolean expectedValues) {
        this.expectedValues = expectedValues;
    }

    public BreakoutConfig getBreakout() {
        return breakout;
    }

    public void setBreakout(BreakoutConfig breakout) {
        this.breakout = breakout;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionProfile that))
            return false;
        return period == that.period
                && Double.compare(maxAnoms, that.maxAnoms) == 0
                && Double.compare(alpha, that.alpha) == 0
                && expectedValues == that.expectedValues
                && Objects.equals(name, that.name)
                && Objects.equals(direction, that.direction)
                && Objects.equals(longtermPeriod, that.longtermPeriod)
                && Objects.equals(onlyLast, that.onlyLast)
                && Objects.equals(threshold, that.threshold)
                && Objects.equals(breakout, that.breakout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, period, maxAnoms, alpha, direction, longtermPeriod, onlyLast,
                threshold, expectedValues, breakout);
    }

    @Override
    public String toString() {
        return "DetectionProfile{" +
                "name='" + name + '\'' +
                ", period=" + period +
                ", maxAnoms=" + maxAnoms +
                ", alpha=" + alpha +
                ", direction='" + direction + '\'' +
                ", longtermPeriod=" + longtermPeriod +
                ", onlyLast=" + onlyLast +
                ", threshold='" + threshold + '\'' +
                ", expectedValues=" + expectedValues +
                ", breakout=" + breakout +
                '}';
    }
}
