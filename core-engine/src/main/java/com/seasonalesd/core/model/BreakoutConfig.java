package com.seasonalesd.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parameters handed to a {@link com.seasonalesd.core.breakout.BreakoutDetector}
 * when the trend of a window is estimated by segmented medians.
 *
 * <p>
 * {@code minSize} applies to every method. {@code beta}, {@code percent} and
 * {@code degree} tune the {@code multi} method; {@code alpha} and
 * {@code exact} tune the {@code amoc} method. Detectors ignore parameters of
 * the method they are not running.
 * </p>
 *
 * @since 1.0.0
 */
public class BreakoutConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Minimum number of observations between two breakouts. */
    private int minSize = 30;

    /** Segmentation method: "amoc" or "multi". */
    private String method = BreakoutMethod.AMOC.key();

    // --- multi ---
    /** Penalty per additional breakout. */
    private double beta = 0.008;

    /** Minimum relative improvement per breakout; replaces {@code beta} when set. */
    private Double percent;

    /** Degree of the penalization polynomial (0, 1 or 2). */
    private int degree = 1;

    // --- amoc ---
    /** Exponent of the energy distance, in (0, 2]. */
    private double alpha = 2.0;

    /** Use exact medians rather than approximations. */
    private boolean exact = true;

    /**
     * @throws IllegalStateException if any parameter is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (minSize < 2) {
            errors.add("'minSize' must be >= 2, got: " + minSize);
        }
        try {
            BreakoutMethod.fromString(method);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (beta < 0) {
            errors.add("'beta' must be >= 0, got: " + beta);
        }
        if (percent != null && (percent <= 0 || percent >= 1)) {
            errors.add("'percent' must be in (0, 1), got: " + percent);
        }
        if (degree < 0 || degree > 2) {
            errors.add("'degree' must be 0, 1 or 2, got: " + degree);
        }
        if (alpha <= 0 || alpha > 2) {
            errors.add("'alpha' must be in (0, 2], got: " + alpha);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid BreakoutConfig: " + String.join("; ", errors));
        }
    }

    /**
     * @return the parsed segmentation method
     * @throws IllegalArgumentException if {@code method} is unknown
     */
    public BreakoutMethod breakoutMethod() {
        return BreakoutMethod.fromString(method);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getMinSize() {
        return minSize;
    }

    public void setMinSize(int minSize) {
        this.minSize = minSize;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method != null ? method.toLowerCase(Locale.ROOT) : null;
    }

    public double getBeta() {
        return beta;
    }

    public void setBeta(double beta) {
        this.beta = beta;
    }

    public Double getPercent() {
        return percent;
    }

    public void setPercent(Double percent) {
        this.percent = percent;
    }

    public int getDegree() {
        return degree;
    }

    public void setDegree(int degree) {
        this.degree = degree;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public boolean isExact() {
        return exact;
    }

    public void setExact(boolean exact) {
        this.exact = exact;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BreakoutConfig that))
            return false;
        return minSize == that.minSize
                && Double.compare(beta, that.beta) == 0
                && degree == that.degree
                && Double.compare(alpha, that.alpha) == 0
                && exact == that.exact
                && Objects.equals(method, that.method)
                && Objects.equals(percent, that.percent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minSize, method, beta, percent, degree, alpha, exact);
    }

    @Override
    public String toString() {
        return "BreakoutConfig{" +
                "minSize=" + minSize +
                ", method='" + method + '\'' +
                ", beta=" + beta +
                ", percent=" + percent +
                ", degree=" + degree +
                ", alpha=" + alpha +
                ", exact=" + exact +
                '}';
    }
}
