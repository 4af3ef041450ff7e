package com.what3words.geocoding.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public class Circle {
    private final Coordinates center;
    private final double radiusMeters;

    public Circle(Coordinates center, double radiusMeters) {
        this.center = center;
        this.radiusMeters = radiusMeters;
    }

    /**
     * Wire form: {@code lat,lng,radiusMeters}.
     */
    public String toQueryValue() {
        return center.toQueryValue() + "," + QueryValues.number(radiusMeters);
    }
}
