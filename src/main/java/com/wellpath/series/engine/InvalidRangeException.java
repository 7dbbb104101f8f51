package com.wellpath.series.engine;

/**
 * Thrown when calendar arithmetic for a requested window cannot be represented.
 * Not retryable: the same inputs always fail the same way.
 */
public class InvalidRangeException extends RuntimeException {

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
