package com.seasonalesd.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one detection call.
 *
 * <p>
 * {@link #getIndices()} is sorted ascending. When expected values were
 * requested, {@link #getExpectedValues()} is a list of the same size whose
 * {@code i}-th element belongs to the {@code i}-th index; otherwise it is
 * empty.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final AnomalyResult EMPTY = new AnomalyResult(List.of(), List.of(), false);

    private final List<Integer> indices;
    private final List<Double> expectedValues;
    private final boolean withExpectedValues;

    private AnomalyResult(List<Integer> indices, List<Double> expectedValues, boolean withExpectedValues) {
        this.indices = List.copyOf(indices);
        this.expectedValues = List.copyOf(expectedValues);
        this.withExpectedValues = withExpectedValues;
    }

    /**
     * @return a result with no anomalies and no expected values
     */
    public static AnomalyResult empty() {
        return EMPTY;
    }

    /**
     * @param indices ascending anomaly indices
     * @return a result without expected values
     */
    public static AnomalyResult of(List<Integer> indices) {
        Objects.requireNonNull(indices, "indices must not be null");
        return new AnomalyResult(indices, List.of(), false);
    }

    /**
     * @param indices        ascending anomaly indices
     * @param expectedValues one expected value per index
     * @return a result carrying expected values
     * @throws IllegalArgumentException if the two lists differ in size
     */
    public static AnomalyResult withExpectedValues(List<Integer> indices, List<Double> expectedValues) {
        Objects.requireNonNull(indices, "indices must not be null");
        Objects.requireNonNull(expectedValues, "expectedValues must not be null");
        if (indices.size() != expectedValues.size()) {
            throw new IllegalArgumentException("Expected " + indices.size()
                    + " expected values, got: " + expectedValues.size());
        }
        return new AnomalyResult(indices, expectedValues, true);
    }

    /**
     * @return unmodifiable ascending list of anomaly indices
     */
    public List<Integer> getIndices() {
        return indices;
    }

    /**
     * @return unmodifiable list parallel to {@link #getIndices()}, or empty
     *         if expected values were not requested
     */
    public List<Double> getExpectedValues() {
        return expectedValues;
    }

    public boolean hasExpectedValues() {
        return withExpectedValues;
    }

    public int size() {
        return indices.size();
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyResult that))
            return false;
        return withExpectedValues == that.withExpectedValues
                && indices.equals(that.indices)
                && expectedValues.equals(that.expectedValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indices, expectedValues, withExpectedValues);
    }

    @Override
    public String toString() {
        return withExpectedValues
                ? "AnomalyResult{indices=" + indices + ", expectedValues=" + expectedValues + '}'
                : "AnomalyResult{indices=" + indices + '}';
    }
}
