package com.what3words.geocoding.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing a geographic coordinate pair in degrees.
 * Range checks belong to the boundary layer; this type accepts any value.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Coordinates {
    private final double lat;
    private final double lng;

    public Coordinates(double lat, double lng) {
        this.lat = lat;
        this.lng = lng;
    }

    /**
     * Wire form: {@code lat,lng}.
     */
    public String toQueryValue() {
        return QueryValues.number(lat) + "," + QueryValues.number(lng);
    }
}
