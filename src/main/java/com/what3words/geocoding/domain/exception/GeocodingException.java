package com.what3words.geocoding.domain.exception;

/**
 * Base type for failures of a remote geocoding call.
 */
public abstract class GeocodingException extends RuntimeException {

    protected GeocodingException(String message) {
        super(message);
    }

    protected GeocodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
