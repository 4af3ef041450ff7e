package com.what3words.geocoding.domain.model;

/**
 * Response shape requested from the service. Travels with the request as the
 * {@code format} parameter and selects the decoder for the response body.
 */
public enum OutputFormat {
    PLAIN("json"),
    GEOJSON("geojson");

    private final String wireValue;

    OutputFormat(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Resolve a wire value ({@code json} / {@code geojson}), case-insensitive.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static OutputFormat fromWireValue(String value) {
        for (OutputFormat format : values()) {
            if (format.wireValue.equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported format: " + value);
    }
}
