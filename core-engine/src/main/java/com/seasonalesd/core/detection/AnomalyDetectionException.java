package com.seasonalesd.core.detection;

/**
 * Base type for input rejected by {@link SeasonalHybridEsd}.
 *
 * <p>
 * Every subclass is raised before any window is processed, so a failed call
 * never produces partial output.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public AnomalyDetectionException(String message) {
        super(message);
    }
}
