package com.seasonalesd.core.decomposition;

import com.github.servicenow.ds.stats.stl.SeasonalTrendLoess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * STL (seasonal-trend decomposition by loess) backed by
 * {@code stl-decomp-4j}.
 *
 * <h3>Fixed parameters</h3>
 * <ul>
 * <li>seasonal period — the requested {@code period}</li>
 * <li>seasonal span — {@code 10 * n + 1}, which makes the seasonal component
 * effectively periodic</li>
 * <li>seasonal degree — 0</li>
 * <li>robust fitting — 1 inner and 15 outer iterations</li>
 * </ul>
 * <p>
 * Trend and low-pass smoothing use the library defaults derived from the
 * period.
 * </p>
 *
 * @since 1.0.0
 */
public class StlDecomposer implements SeasonalDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(StlDecomposer.class);

    static final int INNER_ITERATIONS = 1;
    static final int ROBUSTNESS_ITERATIONS = 15;

    @Override
    public Decomposition decompose(double[] series, int period) {
        Objects.requireNonNull(series, "series must not be null");
        if (period < 2) {
            throw new IllegalArgumentException("STL requires period >= 2, got: " + period);
        }

        int seasonalWidth = series.length * 10 + 1;
        LOG.trace("STL: n={} period={} seasonalWidth={}", series.length, period, seasonalWidth);

        SeasonalTrendLoess smoother = new SeasonalTrendLoess.Builder()
                .setPeriodLength(period)
                .setSeasonalWidth(seasonalWidth)
                .setSeasonalDegree(0)
                .setInnerIterations(INNER_ITERATIONS)
                .setRobustnessIterations(ROBUSTNESS_ITERATIONS)
                .buildSmoother(series);

        SeasonalTrendLoess.Decomposition stl = smoother.decompose();
        return new Decomposition(stl.getSeasonal(), stl.getTrend());
    }
}
