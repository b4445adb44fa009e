/**
 * Seasonal Hybrid ESD detection engine.
 *
 * <p>
 * {@link com.seasonalesd.core.detection.SeasonalHybridEsd} is the entry
 * point. It plans windows with
 * {@link com.seasonalesd.core.detection.WindowPlanner}, builds residuals per
 * window against a {@link com.seasonalesd.core.detection.TrendEstimator}
 * baseline, tests them with
 * {@link com.seasonalesd.core.detection.EsdOutlierTester}, and post-filters the
 * result with {@link com.seasonalesd.core.detection.ThresholdFilter} and
 * {@link com.seasonalesd.core.detection.RecencyFilter}.
 * </p>
 *
 * <h3>Baselines</h3>
 * <ul>
 * <li>{@link com.seasonalesd.core.detection.MedianTrendEstimator} — median of
 * the window</li>
 * <li>{@link com.seasonalesd.core.detection.BreakoutTrendEstimator} — median
 * per segment between breakouts</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.detection;
