package com.what3words.geocoding.application.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.what3words.geocoding.domain.exception.DecodeException;
import com.what3words.geocoding.domain.model.OutputFormat;
import com.what3words.geocoding.domain.model.result.GeoJsonAddress;
import com.what3words.geocoding.domain.model.result.GeoJsonGridSection;
import com.what3words.geocoding.domain.model.result.GeocodeResult;
import com.what3words.geocoding.domain.model.result.GridLine;
import com.what3words.geocoding.domain.model.result.GridSection;
import com.what3words.geocoding.domain.model.result.PlainAddress;
import com.what3words.geocoding.domain.model.result.PlainGridSection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.what3words.geocoding.application.mapper.JsonFields.coordinates;
import static com.what3words.geocoding.application.mapper.JsonFields.position;
import static com.what3words.geocoding.application.mapper.JsonFields.requireArray;
import static com.what3words.geocoding.application.mapper.JsonFields.requireObject;
import static com.what3words.geocoding.application.mapper.JsonFields.requireText;
import static com.what3words.geocoding.application.mapper.JsonFields.square;

/**
 * Decodes a response body into the model for the format the caller asked for.
 *
 * The format is never guessed from the payload. A body in the other shape
 * fails on its missing fields and is reported as a {@link DecodeException}.
 */
@Component
public class ResponseFormatDispatcher {

    private static final String FEATURE_COLLECTION = "FeatureCollection";

    private final ObjectMapper objectMapper;

    public ResponseFormatDispatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decode a convert-to-3wa / convert-to-coordinates body.
     *
     * @param format the format sent with the request
     * @param body raw response body
     * @return {@link PlainAddress} or {@link GeoJsonAddress}
     * @throws DecodeException if the body does not have the shape of {@code format}
     */
    public GeocodeResult decodeAddress(OutputFormat format, String body) {
        JsonNode root = JsonFields.parse(objectMapper, body);
        return switch (format) {
            case PLAIN -> plainAddress(root);
            case GEOJSON -> geoJsonAddress(root);
        };
    }

    /**
     * Decode a grid-section body.
     *
     * @throws DecodeException if the body does not have the shape of {@code format}
     */
    public GridSection decodeGridSection(OutputFormat format, String body) {
        JsonNode root = JsonFields.parse(objectMapper, body);
        return switch (format) {
            case PLAIN -> plainGridSection(root);
            case GEOJSON -> geoJsonGridSection(root);
        };
    }

    private PlainAddress plainAddress(JsonNode root) {
        return new PlainAddress(
            requireText(root, "country"),
            square(requireObject(root, "square")),
            requireText(root, "nearestPlace"),
            coordinates(requireObject(root, "coordinates")),
            requireText(root, "words"),
            requireText(root, "language"),
            requireText(root, "map"));
    }

    private GeoJsonAddress geoJsonAddress(JsonNode root) {
        String type = requireText(root, "type", FEATURE_COLLECTION);
        JsonNode features = requireArray(root, "features");
        if (features.isEmpty()) {
            throw new DecodeException("GeoJSON address has no features");
        }
        List<GeoJsonAddress.AddressFeature> decoded = new ArrayList<>();
        for (JsonNode feature : features) {
            decoded.add(addressFeature(feature));
        }
        return new GeoJsonAddress(type, decoded);
    }

    private GeoJsonAddress.AddressFeature addressFeature(JsonNode feature) {
        JsonNode bbox = requireArray(feature, "bbox");
        if (bbox.size() != 4) {
            throw new DecodeException("GeoJSON bbox must have 4 values, got " + bbox.size());
        }
        List<Double> bounds = new ArrayList<>();
        for (JsonNode value : bbox) {
            if (!value.isNumber()) {
                throw new DecodeException("GeoJSON bbox holds a non-numeric value: " + value);
            }
            bounds.add(value.asDouble());
        }

        JsonNode geometry = requireObject(feature, "geometry");
        GeoJsonAddress.PointGeometry point = new GeoJsonAddress.PointGeometry(
            requireText(geometry, "type", "Point"),
            position(geometry.get("coordinates")));

        JsonNode properties = requireObject(feature, "properties");
        GeoJsonAddress.AddressProperties addressProperties = new GeoJsonAddress.AddressProperties(
            requireText(properties, "country"),
            requireText(properties, "nearestPlace"),
            requireText(properties, "words"),
            requireText(properties, "language"),
            requireText(properties, "map"));

        return new GeoJsonAddress.AddressFeature(
            requireText(feature, "type", "Feature"), bounds, point, addressProperties);
    }

    private PlainGridSection plainGridSection(JsonNode root) {
        List<GridLine> lines = new ArrayList<>();
        for (JsonNode line : requireArray(root, "lines")) {
            lines.add(new GridLine(
                coordinates(requireObject(line, "start")),
                coordinates(requireObject(line, "end"))));
        }
        return new PlainGridSection(lines);
    }

    private GeoJsonGridSection geoJsonGridSection(JsonNode root) {
        String type = requireText(root, "type", FEATURE_COLLECTION);
        List<GeoJsonGridSection.GridFeature> features = new ArrayList<>();
        for (JsonNode feature : requireArray(root, "features")) {
            JsonNode geometry = requireObject(feature, "geometry");
            String geometryType = requireText(geometry, "type", "MultiLineString");
            List<GridLine> lines = new ArrayList<>();
            for (JsonNode lineString : requireArray(geometry, "coordinates")) {
                if (!lineString.isArray() || lineString.size() < 2) {
                    throw new DecodeException("GeoJSON line string needs at least 2 positions");
                }
                for (int i = 1; i < lineString.size(); i++) {
                    lines.add(new GridLine(position(lineString.get(i - 1)), position(lineString.get(i))));
                }
            }
            features.add(new GeoJsonGridSection.GridFeature(
                requireText(feature, "type", "Feature"), geometryType, lines));
        }
        return new GeoJsonGridSection(type, features);
    }
}
