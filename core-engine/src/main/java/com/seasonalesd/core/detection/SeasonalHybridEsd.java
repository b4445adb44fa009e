package com.seasonalesd.core.detection;

import com.seasonalesd.core.breakout.BreakoutDetector;
import com.seasonalesd.core.decomposition.SeasonalDecomposer;
import com.seasonalesd.core.decomposition.StlDecomposer;
import com.seasonalesd.core.model.AnomalyResult;
import com.seasonalesd.core.model.DetectionProfile;
import com.seasonalesd.core.model.Direction;
import com.seasonalesd.core.model.ThresholdMode;
import com.seasonalesd.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

/**
 * Seasonal Hybrid ESD anomaly detector.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   series
 *     → validate parameters and data
 *     → split into equally sized windows (last one back-aligned)
 *     → per window: STL → baseline → residuals → ESD test
 *     → per window: optional magnitude threshold
 *     → union of global indices
 *     → optional recency filter
 *     → sorted indices (+ expected values)
 * </pre>
 *
 * <h3>Errors</h3>
 * <p>
 * Invalid input is rejected before any window is processed with an
 * {@link InvalidParameterException}, {@link InvalidDataException} or
 * {@link InsufficientDataException}. A zero MAD is not an error; it ends the
 * search in that window.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances hold only their collaborators and can be shared across threads
 * if those collaborators can. All per-call state lives inside
 * {@link #detect(double[], DetectionProfile)}. Windows are processed in
 * ascending order on the calling thread; its interrupt flag is checked
 * between windows.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalHybridEsd {

    private final SeasonalDecomposer decomposer;
    private final BreakoutDetector breakoutDetector;
    private final Logger log;

    private final WindowProcessor windowProcessor;
    private final ThresholdFilter thresholdFilter;
    private final RecencyFilter recencyFilter;

    private SeasonalHybridEsd(Builder builder) {
        this.decomposer = builder.decomposer != null ? builder.decomposer : new StlDecomposer();
        this.breakoutDetector = builder.breakoutDetector;
        this.log = builder.logger != null ? builder.logger : LoggerFactory.getLogger(SeasonalHybridEsd.class);

        this.windowProcessor = new WindowProcessor(decomposer, new EsdOutlierTester(log), log);
        this.thresholdFilter = new ThresholdFilter(log);
        this.recencyFilter = new RecencyFilter(log);
    }

    // ---------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------

    /**
     * @return a detector using STL decomposition and service-loaded breakout
     *         detection
     */
    public static SeasonalHybridEsd create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SeasonalHybridEsd}. Every collaborator is
     * optional.
     */
    public static class Builder {
        private SeasonalDecomposer decomposer;
        private BreakoutDetector breakoutDetector;
        private Logger logger;

        /**
         * @param decomposer seasonal decomposition; defaults to
         *                   {@link StlDecomposer}
         */
        public Builder decomposer(SeasonalDecomposer decomposer) {
            this.decomposer = decomposer;
            return this;
        }

        /**
         * @param breakoutDetector change-point oracle used when a profile
         *                         carries a breakout configuration; defaults to
         *                         the first {@link ServiceLoader} registration
         */
        public Builder breakoutDetector(BreakoutDetector breakoutDetector) {
            this.breakoutDetector = breakoutDetector;
            return this;
        }

        /**
         * @param logger diagnostic sink; defaults to this class's logger
         */
        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public SeasonalHybridEsd build() {
            return new SeasonalHybridEsd(this);
        }
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Detect anomalies with default parameters: {@code maxAnoms = 0.10},
     * {@code alpha = 0.05}, both directions, one window.
     *
     * @param series observations
     * @param period observations per seasonal cycle
     * @return sorted anomaly indices
     */
    public AnomalyResult detect(double[] series, int period) {
        return detect(series, DetectionProfile.forPeriod(period));
    }

    /**
     * Detect anomalies in {@code series}.
     *
     * @param series  observations; not modified
     * @param profile detection parameters
     * @return sorted anomaly indices, with expected values if
     *         {@link DetectionProfile#isExpectedValues()} is set
     * @throws InvalidParameterException     if a parameter is out of range
     * @throws InvalidDataException          if the series contains NaN
     * @throws InsufficientDataException     if a window is shorter than two
     *                                       periods
     * @throws IllegalStateException         if breakout detection is requested
     *                                       and no detector is available
     * @throws DetectionInterruptedException if the thread is interrupted
     *                                       between windows
     */
    public AnomalyResult detect(double[] series, DetectionProfile profile) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(profile, "DetectionProfile must not be null");

        Direction direction = validateParameters(profile);
        Optional<ThresholdMode> threshold = profile.thresholdMode();
        validateData(series);

        int n = series.length;
        int longtermPeriod = profile.getLongtermPeriod() != null ? profile.getLongtermPeriod() : n;
        int windowSize = Math.min(n, longtermPeriod);
        int period = profile.getPeriod();
        if ((long) period * 2 > windowSize) {
            throw new InsufficientDataException("Anomaly detection needs at least 2 periods worth of data: "
                    + "window length " + windowSize + " < 2 * period " + period);
        }

        TrendEstimator trendEstimator = trendEstimator(profile);
        ExpectedValueTable expectedValues = profile.isExpectedValues() ? new ExpectedValueTable(n) : null;

        List<Window> windows = WindowPlanner.plan(n, longtermPeriod);
        log.debug("Detecting anomalies: n={} period={} direction={} windows={}",
                n, period, direction.key(), windows.size());

        Set<Integer> anomalies = new TreeSet<>();
        for (Window window : windows) {
            if (Thread.currentThread().isInterrupted()) {
                throw new DetectionInterruptedException("Interrupted before window " + window);
            }
            log.debug("Processing window {}", window);

            Set<Integer> found = windowProcessor.process(series, window, profile, trendEstimator, expectedValues);
            if (threshold.isPresent()) {
                found = thresholdFilter.apply(series, window, period, threshold.get(), found);
            }
            anomalies.addAll(found);
        }

        if (profile.getOnlyLast() != null) {
            anomalies = recencyFilter.apply(n, profile.getOnlyLast(), anomalies);
        }

        List<Integer> indices = new ArrayList<>(anomalies);
        if (expectedValues == null) {
            return AnomalyResult.of(indices);
        }
        List<Double> expected = new ArrayList<>(indices.size());
        for (int index : indices) {
            expected.add(expectedValues.get(index));
        }
        return AnomalyResult.withExpectedValues(indices, expected);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Direction validateParameters(DetectionProfile profile) {
        double maxAnoms = profile.getMaxAnoms();
        if (!(maxAnoms > 0 && maxAnoms <= DetectionProfile.MAX_ANOMS_LIMIT)) {
            throw new InvalidParameterException(
                    "maxAnoms must be > 0 and <= " + DetectionProfile.MAX_ANOMS_LIMIT + ", got: " + maxAnoms);
        }
        if (!(profile.getAlpha() > 0)) {
            throw new InvalidParameterException("alpha must be > 0, got: " + profile.getAlpha());
        }
        if (profile.getPeriod() < 2) {
            throw new InvalidParameterException("period must be >= 2, got: " + profile.getPeriod());
        }
        if (profile.getLongtermPeriod() != null && profile.getLongtermPeriod() <= 0) {
            throw new InvalidParameterException(
                    "longtermPeriod must be > 0 when set, got: " + profile.getLongtermPeriod());
        }
        if (profile.getOnlyLast() != null && profile.getOnlyLast() <= 0) {
            throw new InvalidParameterException("onlyLast must be > 0 when set, got: " + profile.getOnlyLast());
        }
        try {
            profile.thresholdMode();
            return profile.direction();
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException(e.getMessage());
        }
    }

    private static void validateData(double[] series) {
        if (series.length == 0) {
            throw new InsufficientDataException("series is empty");
        }
        for (int i = 0; i < series.length; i++) {
            if (Double.isNaN(series[i])) {
                throw new InvalidDataException("data contains NaN value at index " + i);
            }
        }
    }

    private TrendEstimator trendEstimator(DetectionProfile profile) {
        if (profile.getBreakout() == null) {
            return new MedianTrendEstimator();
        }
        try {
            profile.getBreakout().validate();
        } catch (IllegalStateException e) {
            throw new InvalidParameterException(e.getMessage());
        }
        return new BreakoutTrendEstimator(resolveBreakoutDetector(), profile.getBreakout(), log);
    }

    private BreakoutDetector resolveBreakoutDetector() {
        if (breakoutDetector != null) {
            return breakoutDetector;
        }
        return ServiceLoader.load(BreakoutDetector.class).findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Breakout detection requested but no BreakoutDetector is configured or registered under "
                                + "META-INF/services/" + BreakoutDetector.class.getName()));
    }
}
