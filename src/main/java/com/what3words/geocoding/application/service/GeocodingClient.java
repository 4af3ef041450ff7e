package com.what3words.geocoding.application.service;

import com.what3words.geocoding.application.mapper.ResponseDecoder;
import com.what3words.geocoding.application.mapper.ResponseFormatDispatcher;
import com.what3words.geocoding.application.port.in.AutosuggestUseCase;
import com.what3words.geocoding.application.port.in.GeocodingUseCase;
import com.what3words.geocoding.domain.exception.GeocodingException;
import com.what3words.geocoding.domain.model.BoundingBox;
import com.what3words.geocoding.domain.model.Coordinates;
import com.what3words.geocoding.domain.model.OutputFormat;
import com.what3words.geocoding.domain.model.RequestOptions;
import com.what3words.geocoding.domain.model.result.AvailableLanguages;
import com.what3words.geocoding.domain.model.result.GeocodeResult;
import com.what3words.geocoding.domain.model.result.GridSection;
import com.what3words.geocoding.domain.service.AddressPatternRecognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application service for coordinate/address conversion.
 * Builds the query from {@link RequestOptions}, runs it, and decodes the body
 * in the output format that was sent.
 */
@Service
public class GeocodingClient implements GeocodingUseCase {

    private static final Logger logger = LoggerFactory.getLogger(GeocodingClient.class);

    private final RemoteCallExecutor executor;
    private final ResponseFormatDispatcher dispatcher;
    private final ResponseDecoder responseDecoder;
    private final AddressPatternRecognizer recognizer;
    private final AutosuggestUseCase autosuggestUseCase;

    public GeocodingClient(
            RemoteCallExecutor executor,
            ResponseFormatDispatcher dispatcher,
            ResponseDecoder responseDecoder,
            AddressPatternRecognizer recognizer,
            AutosuggestUseCase autosuggestUseCase) {
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.responseDecoder = responseDecoder;
        this.recognizer = recognizer;
        this.autosuggestUseCase = autosuggestUseCase;
    }

    @Override
    public GeocodeResult convertTo3wa(Coordinates coordinates, RequestOptions options) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("coordinates", coordinates.toQueryValue());
        options.getLanguage().ifPresent(language -> params.put("language", language));
        options.getLocale().ifPresent(locale -> params.put("locale", locale));
        return convert("/convert-to-3wa", params, options.getOutputFormat());
    }

    @Override
    public GeocodeResult convertToCoordinates(String words, RequestOptions options) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("words", words);
        options.getLocale().ifPresent(locale -> params.put("locale", locale));
        return convert("/convert-to-coordinates", params, options.getOutputFormat());
    }

    @Override
    public GridSection gridSection(BoundingBox boundingBox, OutputFormat format) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("bounding-box", boundingBox.toQueryValue());
        params.put("format", format.getWireValue());
        String body = executor.call("/grid-section", params);
        return dispatcher.decodeGridSection(format, body);
    }

    @Override
    public AvailableLanguages availableLanguages() {
        return responseDecoder.decodeLanguages(executor.call("/available-languages", Map.of()));
    }

    @Override
    public boolean isValidAddress(String text) {
        if (!recognizer.isPossibleAddress(text)) {
            return false;
        }
        String words = text.strip();
        try {
            return autosuggestUseCase.autosuggest(words, RequestOptions.empty().nResults(1))
                .first()
                .map(suggestion -> suggestion.getWords().equals(words))
                .orElse(false);
        } catch (GeocodingException e) {
            logger.warn("Could not confirm address {}: {}", words, e.getMessage());
            return false;
        }
    }

    private GeocodeResult convert(String endpoint, Map<String, String> params, OutputFormat format) {
        params.put("format", format.getWireValue());
        String body = executor.call(endpoint, params);
        return dispatcher.decodeAddress(format, body);
    }
}
