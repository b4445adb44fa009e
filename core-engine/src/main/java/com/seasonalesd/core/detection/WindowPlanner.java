package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.Window;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a series into equally sized windows.
 *
 * <p>
 * Windows start at {@code 0, L, 2L, ...}. When the series length is not a
 * multiple of {@code L}, the last window is shifted left so that it still
 * spans {@code L} observations, overlapping its predecessor. Points in the
 * overlap are tested by both windows.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowPlanner {

    private WindowPlanner() {
        // utility class — not instantiable
    }

    /**
     * @param seriesLength   number of observations, {@code > 0}
     * @param longtermPeriod window size; values above {@code seriesLength} are
     *                       clamped to it
     * @return windows in ascending start order
     */
    public static List<Window> plan(int seriesLength, int longtermPeriod) {
        if (seriesLength <= 0) {
            throw new IllegalArgumentException("seriesLength must be > 0, got: " + seriesLength);
        }
        if (longtermPeriod <= 0) {
            throw new IllegalArgumentException("longtermPeriod must be > 0, got: " + longtermPeriod);
        }
        int size = Math.min(seriesLength, longtermPeriod);

        List<Window> windows = new ArrayList<>();
        for (int start = 0; start < seriesLength; start += size) {
            int end = Math.min(seriesLength, start + size);
            windows.add(new Window(end - size, end));
        }
        return windows;
    }
}
