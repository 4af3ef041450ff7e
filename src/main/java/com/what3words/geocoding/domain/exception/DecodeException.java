package com.what3words.geocoding.domain.exception;

/**
 * A response body does not match the shape expected for the request, for
 * example a plain JSON address decoded as GeoJSON.
 */
public class DecodeException extends GeocodingException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
