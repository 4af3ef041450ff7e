package com.what3words.geocoding.application.mapper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.what3words.geocoding.domain.exception.DecodeException;
import com.what3words.geocoding.domain.model.result.ApiError;
import com.what3words.geocoding.domain.model.result.AutosuggestResult;
import com.what3words.geocoding.domain.model.result.AvailableLanguages;
import com.what3words.geocoding.domain.model.result.Suggestion;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.what3words.geocoding.module.test.support.TestFixtures.Payloads;
import static com.what3words.geocoding.module.test.support.TestFixtures.Places;
import static com.what3words.geocoding.module.test.support.TestFixtures.payload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseDecoderTest {

    private final ResponseDecoder decoder = new ResponseDecoder(new ObjectMapper());

    @Test
    void testDecodeAutosuggest_OptionalFieldsAbsent_AreNull() {
        AutosuggestResult result = decoder.decodeAutosuggest(payload(Payloads.AUTOSUGGEST));

        assertThat(result.getSuggestions()).extracting(Suggestion::getWords)
            .containsExactly("filled.count.soap", "filled.count.soaps");
        Suggestion first = result.first().orElseThrow();
        assertThat(first.getRank()).isEqualTo(1);
        assertThat(first.getDistanceToFocusKm()).isNull();
        assertThat(first.getCoordinates()).isNull();
        assertThat(result.getSuggestions().get(1).getDistanceToFocusKm()).isEqualTo(7034.0);
    }

    @Test
    void testDecodeAutosuggest_WithCoordinates_ReadsSquareAndMap() {
        Suggestion suggestion = decoder.decodeAutosuggest(payload(Payloads.AUTOSUGGEST_WITH_COORDINATES))
            .first().orElseThrow();

        assertThat(suggestion.getCoordinates()).isEqualTo(Places.FILLED_COUNT_SOAP);
        assertThat(suggestion.getSquare()).isNotNull();
        assertThat(suggestion.getMap()).isEqualTo("https://w3w.co/filled.count.soap");
    }

    @Test
    void testDecodeAutosuggest_WrongPayload_ThrowsDecodeException() {
        assertThatThrownBy(() -> decoder.decodeAutosuggest(payload(Payloads.LANGUAGES)))
            .isInstanceOf(DecodeException.class)
            .hasMessageContaining("suggestions");
    }

    @Test
    void testDecodeLanguages_ReadsAllLanguages() {
        AvailableLanguages languages = decoder.decodeLanguages(payload(Payloads.LANGUAGES));

        assertThat(languages.getLanguages()).hasSize(2);
        assertThat(languages.getLanguages().get(0).getCode()).isEqualTo("en");
        assertThat(languages.getLanguages().get(1).getNativeName()).isEqualTo("Français");
    }

    @Test
    void testDecodeError_ServiceErrorBody_ReturnsError() {
        Optional<ApiError> error = decoder.decodeError(payload(Payloads.ERROR_BAD_WORDS));

        assertThat(error).isPresent();
        assertThat(error.get().getCode()).isEqualTo("BadWords");
    }

    @Test
    void testDecodeError_NotAServiceError_ReturnsEmpty() {
        assertThat(decoder.decodeError("<html>502 Bad Gateway</html>")).isEmpty();
        assertThat(decoder.decodeError("")).isEmpty();
        assertThat(decoder.decodeError("{\"message\": \"oops\"}")).isEmpty();
    }

    private static String suggestionWith(String extraField) {
        return "{\"suggestions\": [{\"country\": \"GB\", \"nearestPlace\": \"Bayswater, London\","
            + " \"words\": \"filled.count.soap\", \"rank\": 1, \"language\": \"en\", " + extraField + "}]}";
    }

    @Test
    void testDecodeAutosuggest_DistanceAsNumericText_IsRead() {
        Suggestion suggestion = decoder.decodeAutosuggest(suggestionWith("\"distanceToFocusKm\": \"12\""))
            .first().orElseThrow();

        assertThat(suggestion.getDistanceToFocusKm()).isEqualTo(12.0);
    }

    @Test
    void testDecodeAutosuggest_DistanceNotNumeric_ThrowsDecodeException() {
        assertThatThrownBy(() -> decoder.decodeAutosuggest(suggestionWith("\"distanceToFocusKm\": {\"km\": true}")))
            .isInstanceOf(DecodeException.class)
            .hasMessageContaining("distanceToFocusKm");
        assertThatThrownBy(() -> decoder.decodeAutosuggest(suggestionWith("\"distanceToFocusKm\": \"far\"")))
            .isInstanceOf(DecodeException.class)
            .hasMessageContaining("distanceToFocusKm");
    }

    @Test
    void testDecodeAutosuggest_MapNotText_ThrowsDecodeException() {
        assertThatThrownBy(() -> decoder.decodeAutosuggest(suggestionWith("\"map\": 42")))
            .isInstanceOf(DecodeException.class)
            .hasMessageContaining("map");
    }

    @Test
    void testDecodeAutosuggest_OptionalFieldsNull_AreNull() {
        Suggestion suggestion = decoder.decodeAutosuggest(
                suggestionWith("\"distanceToFocusKm\": null, \"map\": null"))
            .first().orElseThrow();

        assertThat(suggestion.getDistanceToFocusKm()).isNull();
        assertThat(suggestion.getMap()).isNull();
    }
}
