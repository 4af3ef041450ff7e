package com.what3words.geocoding.domain.exception;

import com.what3words.geocoding.domain.model.result.ApiError;

/**
 * The service answered with an error body, e.g. {@code BadWords} or
 * {@code InvalidKey}.
 */
public class ApiErrorException extends GeocodingException {

    private final ApiError error;
    private final int status;

    public ApiErrorException(ApiError error, int status) {
        super("Service error " + error.getCode() + ": " + error.getMessage());
        this.error = error;
        this.status = status;
    }

    public ApiError getError() {
        return error;
    }

    public String getCode() {
        return error.getCode();
    }

    public int getStatus() {
        return status;
    }
}
