package com.what3words.geocoding.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Geographic filters restricting autosuggest candidates.
 *
 * The four dimensions are independent: any combination may be set on one
 * request and setting one never clears another. Which of them the service
 * honours when several are present is decided remotely.
 */
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClipPolicy {

    private static final ClipPolicy NONE = new ClipPolicy(null, null, null, null);

    private final List<String> countries;

    private final BoundingBox boundingBox;

    private final Circle circle;

    private final Polygon polygon;

    public static ClipPolicy none() {
        return NONE;
    }

    public ClipPolicy withCountries(String... countryCodes) {
        return withCountries(Arrays.asList(countryCodes));
    }

    public ClipPolicy withCountries(List<String> countryCodes) {
        return new ClipPolicy(List.copyOf(countryCodes), boundingBox, circle, polygon);
    }

    public ClipPolicy withBoundingBox(BoundingBox boundingBox) {
        return new ClipPolicy(countries, boundingBox, circle, polygon);
    }

    public ClipPolicy withCircle(Circle circle) {
        return new ClipPolicy(countries, boundingBox, circle, polygon);
    }

    public ClipPolicy withPolygon(Polygon polygon) {
        return new ClipPolicy(countries, boundingBox, circle, polygon);
    }

    public Optional<List<String>> getCountries() {
        return Optional.ofNullable(countries);
    }

    public Optional<BoundingBox> getBoundingBox() {
        return Optional.ofNullable(boundingBox);
    }

    public Optional<Circle> getCircle() {
        return Optional.ofNullable(circle);
    }

    public Optional<Polygon> getPolygon() {
        return Optional.ofNullable(polygon);
    }

    public boolean isEmpty() {
        return countries == null && boundingBox == null && circle == null && polygon == null;
    }

    /**
     * Query parameters for the set dimensions, in canonical key order.
     */
    public Map<String, String> toQueryParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        if (countries != null) {
            params.put("clip-to-country", String.join(",", countries));
        }
        if (boundingBox != null) {
            params.put("clip-to-bounding-box", boundingBox.toQueryValue());
        }
        if (circle != null) {
            params.put("clip-to-circle", circle.toQueryValue());
        }
        if (polygon != null) {
            params.put("clip-to-polygon", polygon.toQueryValue());
        }
        return params;
    }
}
