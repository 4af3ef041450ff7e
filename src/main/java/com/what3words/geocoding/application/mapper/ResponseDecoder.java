package com.what3words.geocoding.application.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.what3words.geocoding.domain.exception.DecodeException;
import com.what3words.geocoding.domain.model.result.ApiError;
import com.what3words.geocoding.domain.model.result.AutosuggestResult;
import com.what3words.geocoding.domain.model.result.AvailableLanguages;
import com.what3words.geocoding.domain.model.result.Language;
import com.what3words.geocoding.domain.model.result.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.what3words.geocoding.application.mapper.JsonFields.optional;
import static com.what3words.geocoding.application.mapper.JsonFields.optionalNumber;
import static com.what3words.geocoding.application.mapper.JsonFields.optionalText;
import static com.what3words.geocoding.application.mapper.JsonFields.requireArray;
import static com.what3words.geocoding.application.mapper.JsonFields.requireInt;
import static com.what3words.geocoding.application.mapper.JsonFields.requireObject;
import static com.what3words.geocoding.application.mapper.JsonFields.requireText;

/**
 * Decoder for the responses that only come in one shape.
 */
@Component
public class ResponseDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ResponseDecoder.class);

    private final ObjectMapper objectMapper;

    public ResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws DecodeException if the body is not an autosuggest response
     */
    public AutosuggestResult decodeAutosuggest(String body) {
        JsonNode root = JsonFields.parse(objectMapper, body);
        List<Suggestion> suggestions = new ArrayList<>();
        for (JsonNode suggestion : requireArray(root, "suggestions")) {
            suggestions.add(suggestion(suggestion));
        }
        return new AutosuggestResult(suggestions);
    }

    /**
     * @throws DecodeException if the body is not an available-languages response
     */
    public AvailableLanguages decodeLanguages(String body) {
        JsonNode root = JsonFields.parse(objectMapper, body);
        List<Language> languages = new ArrayList<>();
        for (JsonNode language : requireArray(root, "languages")) {
            languages.add(new Language(
                requireText(language, "code"),
                requireText(language, "name"),
                requireText(language, "nativeName")));
        }
        return new AvailableLanguages(languages);
    }

    /**
     * Read the service error from a non-2xx body.
     *
     * @return empty when the body is not a service error (e.g. a proxy's HTML page)
     */
    public Optional<ApiError> decodeError(String body) {
        try {
            JsonNode error = requireObject(JsonFields.parse(objectMapper, body), "error");
            return Optional.of(new ApiError(requireText(error, "code"), requireText(error, "message")));
        } catch (DecodeException e) {
            logger.debug("Error body is not a service error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Suggestion suggestion(JsonNode node) {
        return new Suggestion(
            requireText(node, "country"),
            requireText(node, "nearestPlace"),
            requireText(node, "words"),
            requireInt(node, "rank"),
            requireText(node, "language"),
            optionalNumber(node, "distanceToFocusKm").orElse(null),
            optional(node, "square").map(JsonFields::square).orElse(null),
            optional(node, "coordinates").map(JsonFields::coordinates).orElse(null),
            optionalText(node, "map").orElse(null));
    }
}
