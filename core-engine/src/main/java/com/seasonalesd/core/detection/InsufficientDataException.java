package com.seasonalesd.core.detection;

/**
 * A window holds fewer than two full seasonal periods.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }
}
