package com.what3words.geocoding.application.port.out;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class TransportResponse {
    private final int status;
    private final String body;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
