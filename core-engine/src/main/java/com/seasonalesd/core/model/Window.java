package com.seasonalesd.core.model;

import java.util.Objects;

/**
 * Half-open index range {@code [start, end)} over a series.
 *
 * @since 1.0.0
 */
public final class Window {

    private final int start;
    private final int end;

    /**
     * @param start first index, inclusive; must be {@code >= 0}
     * @param end   last index, exclusive; must be {@code > start}
     * @throws IllegalArgumentException if the bounds are invalid
     */
    public Window(int start, int end) {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException(
                    "Invalid window bounds [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    /**
     * @param index global index
     * @return {@code true} if {@code index} lies inside this window
     */
    public boolean contains(int index) {
        return index >= start && index < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Window that))
            return false;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
