package com.what3words.geocoding.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered ring of vertices. Closure is implicit: the first vertex is not
 * repeated at the end, and no closing vertex is added on the wire.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Polygon {
    private final List<Coordinates> vertices;

    public Polygon(List<Coordinates> vertices) {
        this.vertices = List.copyOf(vertices);
    }

    public static Polygon of(Coordinates... vertices) {
        return new Polygon(Arrays.asList(vertices));
    }

    /**
     * Wire form: {@code lat1,lng1,lat2,lng2,...}.
     */
    public String toQueryValue() {
        return QueryValues.coordinates(vertices);
    }
}
