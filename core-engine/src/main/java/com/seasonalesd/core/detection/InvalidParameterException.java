package com.seasonalesd.core.detection;

/**
 * A detection parameter is outside its legal range.
 *
 * @since 1.0.0
 */
public class InvalidParameterException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    public InvalidParameterException(String message) {
        super(message);
    }
}
