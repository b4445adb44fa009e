package com.seasonalesd.core.detection;

/**
 * The calling thread was interrupted between two windows.
 *
 * <p>
 * The interrupt flag of the thread is left set.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DetectionInterruptedException(String message) {
        super(message);
    }
}
