package com.what3words.geocoding.domain.model.result;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Error reported by the service in a non-2xx body:
 * {@code {"error": {"code": "...", "message": "..."}}}.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public class ApiError {
    private final String code;
    private final String message;
}
