package com.what3words.geocoding.domain.model.result;

import com.what3words.geocoding.domain.model.BoundingBox;
import com.what3words.geocoding.domain.model.Coordinates;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One autosuggest candidate. {@code square}, {@code coordinates} and
 * {@code map} are only present on autosuggest-with-coordinates responses;
 * {@code distanceToFocusKm} only when a focus was given.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public class Suggestion {
    private final String country;
    private final String nearestPlace;
    private final String words;
    private final int rank;
    private final String language;
    private final Double distanceToFocusKm;
    private final BoundingBox square;
    private final Coordinates coordinates;
    private final String map;
}
