package com.seasonalesd.core.detection;

/**
 * Expected value per series index, written at most once.
 *
 * <p>
 * Overlapping windows visit some indices twice; the first window to reach an
 * index keeps its value.
 * </p>
 *
 * @since 1.0.0
 */
final class ExpectedValueTable {

    private final double[] values;
    private final boolean[] present;

    ExpectedValueTable(int size) {
        this.values = new double[size];
        this.present = new boolean[size];
    }

    /**
     * @return {@code true} if the value was stored, {@code false} if the slot
     *         was already populated
     */
    boolean putIfAbsent(int index, double value) {
        if (present[index]) {
            return false;
        }
        values[index] = value;
        present[index] = true;
        return true;
    }

    double get(int index) {
        if (!present[index]) {
            throw new IllegalStateException("No expected value recorded for index " + index);
        }
        return values[index];
    }
}
