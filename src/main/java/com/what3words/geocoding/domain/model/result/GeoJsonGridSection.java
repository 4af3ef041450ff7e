package com.what3words.geocoding.domain.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.what3words.geocoding.domain.model.OutputFormat;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Grid section as a FeatureCollection of MultiLineString features.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GeoJsonGridSection implements GridSection {
    private final String type;
    private final List<GridFeature> features;

    public GeoJsonGridSection(String type, List<GridFeature> features) {
        this.type = type;
        this.features = List.copyOf(features);
    }

    @Override
    @JsonIgnore
    public OutputFormat getFormat() {
        return OutputFormat.GEOJSON;
    }

    @Override
    @JsonIgnore
    public List<GridLine> getLines() {
        return features.stream()
            .flatMap(feature -> feature.getLines().stream())
            .toList();
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    public static class GridFeature {
        private final String type;
        private final String geometryType;
        private final List<GridLine> lines;

        public GridFeature(String type, String geometryType, List<GridLine> lines) {
            this.type = type;
            this.geometryType = geometryType;
            this.lines = List.copyOf(lines);
        }
    }
}
