package com.what3words.geocoding.domain.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.what3words.geocoding.domain.model.BoundingBox;
import com.what3words.geocoding.domain.model.Coordinates;
import com.what3words.geocoding.domain.model.OutputFormat;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Address in the {@code format=geojson} shape: a FeatureCollection holding one
 * Point feature whose properties carry the address fields.
 *
 * The {@link GeocodeResult} accessors read through to the first feature.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GeoJsonAddress implements GeocodeResult {
    private final String type;
    private final List<AddressFeature> features;

    public GeoJsonAddress(String type, List<AddressFeature> features) {
        if (features.isEmpty()) {
            throw new IllegalArgumentException("GeoJSON address needs at least one feature");
        }
        this.type = type;
        this.features = List.copyOf(features);
    }

    private AddressFeature primary() {
        return features.get(0);
    }

    @Override
    @JsonIgnore
    public OutputFormat getFormat() {
        return OutputFormat.GEOJSON;
    }

    @Override
    @JsonIgnore
    public String getWords() {
        return primary().getProperties().getWords();
    }

    @Override
    @JsonIgnore
    public Coordinates getCoordinates() {
        return primary().getGeometry().getPoint();
    }

    @Override
    @JsonIgnore
    public BoundingBox getSquare() {
        return primary().getSquare();
    }

    @Override
    @JsonIgnore
    public String getNearestPlace() {
        return primary().getProperties().getNearestPlace();
    }

    @Override
    @JsonIgnore
    public String getCountry() {
        return primary().getProperties().getCountry();
    }

    @Override
    @JsonIgnore
    public String getLanguage() {
        return primary().getProperties().getLanguage();
    }

    @Override
    @JsonIgnore
    public String getMapUrl() {
        return primary().getProperties().getMap();
    }

    /**
     * One GeoJSON feature. {@code bbox} is {@code [west, south, east, north]}.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    public static class AddressFeature {
        private final String type;
        private final List<Double> bbox;
        private final PointGeometry geometry;
        private final AddressProperties properties;

        public AddressFeature(String type, List<Double> bbox, PointGeometry geometry, AddressProperties properties) {
            this.type = type;
            this.bbox = List.copyOf(bbox);
            this.geometry = geometry;
            this.properties = properties;
        }

        @JsonIgnore
        public BoundingBox getSquare() {
            return new BoundingBox(bbox.get(1), bbox.get(0), bbox.get(3), bbox.get(2));
        }
    }

    /**
     * GeoJSON Point. Serialized as {@code [lng, lat]} on the wire.
     */
    @EqualsAndHashCode
    @ToString
    public static class PointGeometry {
        private final String type;
        private final Coordinates point;

        public PointGeometry(String type, Coordinates point) {
            this.type = type;
            this.point = point;
        }

        public String getType() {
            return type;
        }

        @JsonIgnore
        public Coordinates getPoint() {
            return point;
        }

        @JsonProperty("coordinates")
        public List<Double> getCoordinates() {
            return List.of(point.getLng(), point.getLat());
        }
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    @lombok.AllArgsConstructor
    public static class AddressProperties {
        private final String country;
        private final String nearestPlace;
        private final String words;
        private final String language;
        private final String map;
    }
}
