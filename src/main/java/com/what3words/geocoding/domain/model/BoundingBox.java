package com.what3words.geocoding.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Rectangle described by its south-west and north-east corners.
 * Also used for the 3m square an address resolves to.
 */
@Getter
@EqualsAndHashCode
@ToString
public class BoundingBox {
    private final Coordinates southwest;
    private final Coordinates northeast;

    public BoundingBox(Coordinates southwest, Coordinates northeast) {
        this.southwest = southwest;
        this.northeast = northeast;
    }

    public BoundingBox(double swLat, double swLng, double neLat, double neLng) {
        this(new Coordinates(swLat, swLng), new Coordinates(neLat, neLng));
    }

    /**
     * Wire form: {@code swLat,swLng,neLat,neLng}.
     */
    public String toQueryValue() {
        return southwest.toQueryValue() + "," + northeast.toQueryValue();
    }
}
