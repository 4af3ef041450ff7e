package com.what3words.geocoding.domain.exception;

import java.util.OptionalInt;

/**
 * The request did not produce a usable HTTP exchange: connection failure,
 * timeout, or a non-2xx status whose body is not a service error.
 */
public class TransportException extends GeocodingException {

    private final Integer status;

    public TransportException(String message) {
        super(message);
        this.status = null;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = null;
    }

    public TransportException(String message, int status) {
        super(message);
        this.status = status;
    }

    public OptionalInt getStatus() {
        return status != null ? OptionalInt.of(status) : OptionalInt.empty();
    }
}
