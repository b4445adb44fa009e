/**
 * Domain model for Seasonal ESD.
 *
 * <ul>
 * <li>{@link com.seasonalesd.core.model.DetectionProfile} — parameters of one
 * detection run, loadable from YAML</li>
 * <li>{@link com.seasonalesd.core.model.BreakoutConfig} — parameters for
 * breakout-segmented trend estimation</li>
 * <li>{@link com.seasonalesd.core.model.AnomalyResult} — sorted anomaly
 * indices, optionally with expected values</li>
 * <li>{@link com.seasonalesd.core.model.Window} — index range processed as a
 * unit</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.model;
