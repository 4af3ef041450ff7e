package com.what3words.geocoding.domain.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.what3words.geocoding.domain.model.BoundingBox;
import com.what3words.geocoding.domain.model.Coordinates;
import com.what3words.geocoding.domain.model.OutputFormat;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Address in the flat {@code format=json} shape.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public class PlainAddress implements GeocodeResult {
    private final String country;
    private final BoundingBox square;
    private final String nearestPlace;
    private final Coordinates coordinates;
    private final String words;
    private final String language;

    @JsonProperty("map")
    private final String mapUrl;

    @Override
    @JsonIgnore
    public OutputFormat getFormat() {
        return OutputFormat.PLAIN;
    }
}
