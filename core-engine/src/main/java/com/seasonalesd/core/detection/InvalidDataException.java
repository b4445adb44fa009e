package com.seasonalesd.core.detection;

/**
 * The series contains a value the test cannot handle (NaN).
 *
 * @since 1.0.0
 */
public class InvalidDataException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    public InvalidDataException(String message) {
        super(message);
    }
}
