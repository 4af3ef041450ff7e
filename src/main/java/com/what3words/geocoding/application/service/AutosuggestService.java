package com.what3words.geocoding.application.service;

import com.what3words.geocoding.application.mapper.ResponseDecoder;
import com.what3words.geocoding.application.port.in.AutosuggestUseCase;
import com.what3words.geocoding.domain.model.RequestOptions;
import com.what3words.geocoding.domain.model.result.AutosuggestResult;
import com.what3words.geocoding.domain.model.result.Suggestion;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application service for the autosuggest endpoints.
 * All of {@link RequestOptions} applies here except the output format,
 * which these endpoints do not take.
 */
@Service
public class AutosuggestService implements AutosuggestUseCase {

    private final RemoteCallExecutor executor;
    private final ResponseDecoder responseDecoder;

    public AutosuggestService(RemoteCallExecutor executor, ResponseDecoder responseDecoder) {
        this.executor = executor;
        this.responseDecoder = responseDecoder;
    }

    @Override
    public AutosuggestResult autosuggest(String input, RequestOptions options) {
        return suggest("/autosuggest", input, options);
    }

    @Override
    public AutosuggestResult autosuggestWithCoordinates(String input, RequestOptions options) {
        return suggest("/autosuggest-with-coordinates", input, options);
    }

    @Override
    public void autosuggestSelection(String rawInput, Suggestion selection, RequestOptions options) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("raw-input", rawInput);
        params.put("selection", selection.getWords());
        params.put("rank", Integer.toString(selection.getRank()));
        params.putAll(optionParameters(options));
        executor.call("/autosuggest-selection", params);
    }

    private AutosuggestResult suggest(String endpoint, String input, RequestOptions options) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("input", input);
        params.putAll(optionParameters(options));
        return responseDecoder.decodeAutosuggest(executor.call(endpoint, params));
    }

    private Map<String, String> optionParameters(RequestOptions options) {
        Map<String, String> params = new LinkedHashMap<>(options.toQueryParameters());
        params.remove("format");
        return params;
    }
}
