package com.seasonalesd.core.detection;

import com.seasonalesd.core.decomposition.Decomposition;
import com.seasonalesd.core.decomposition.SeasonalDecomposer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Test decomposer with a zero seasonal component.
 *
 * <p>
 * The trend of the {@code k}-th call (1-based) is the constant
 * {@code k * 1000 + 1}, so expected values reveal which window wrote them.
 * Every decomposed window is recorded.
 * </p>
 */
class RecordingDecomposer implements SeasonalDecomposer {

    private final List<double[]> calls = new ArrayList<>();

    @Override
    public Decomposition decompose(double[] series, int period) {
        calls.add(series.clone());
        double[] trend = new double[series.length];
        Arrays.fill(trend, calls.size() * 1000 + 1);
        return new Decomposition(new double[series.length], trend);
    }

    int callCount() {
        return calls.size();
    }

    List<double[]> calls() {
        return calls;
    }
}
