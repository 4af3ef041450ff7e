package com.what3words.geocoding.module.test.support;

import com.what3words.geocoding.domain.model.Coordinates;
import com.what3words.geocoding.domain.model.result.Suggestion;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Test fixtures: recorded API payloads and common values.
 */
public class TestFixtures {

    private TestFixtures() {
        // Utility class
    }

    /**
     * Load a payload from {@code src/test/resources/fixtures}.
     */
    public static String payload(String name) {
        try (InputStream in = TestFixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture named " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Suggestion suggestion(String words, int rank) {
        return new Suggestion("GB", "Bayswater, London", words, rank, "en", null, null, null, null);
    }

    /**
     * Common test coordinates.
     */
    public static class Places {
        public static final double FILLED_COUNT_SOAP_LAT = 51.521251;
        public static final double FILLED_COUNT_SOAP_LNG = -0.203586;
        public static final Coordinates FILLED_COUNT_SOAP =
            new Coordinates(FILLED_COUNT_SOAP_LAT, FILLED_COUNT_SOAP_LNG);
    }

    /**
     * Common payload names.
     */
    public static class Payloads {
        public static final String ADDRESS_JSON = "convert-to-3wa.json";
        public static final String ADDRESS_GEOJSON = "convert-to-3wa.geojson.json";
        public static final String GRID_JSON = "grid-section.json";
        public static final String GRID_GEOJSON = "grid-section.geojson.json";
        public static final String AUTOSUGGEST = "autosuggest.json";
        public static final String AUTOSUGGEST_WITH_COORDINATES = "autosuggest-with-coordinates.json";
        public static final String LANGUAGES = "available-languages.json";
        public static final String ERROR_BAD_WORDS = "error-bad-words.json";
    }
}
