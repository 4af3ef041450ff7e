package com.what3words.geocoding.api.controller;

import com.what3words.geocoding.api.dto.AutosuggestQueryDto;
import com.what3words.geocoding.application.port.in.AutosuggestUseCase;
import com.what3words.geocoding.domain.model.Coordinates;
import com.what3words.geocoding.domain.model.RequestOptions;
import com.what3words.geocoding.domain.model.result.AutosuggestResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for autosuggest on partial or mistyped addresses.
 */
@RestController
@RequestMapping("/autosuggest")
public class AutosuggestController {

    private static final Logger logger = LoggerFactory.getLogger(AutosuggestController.class);

    private final AutosuggestUseCase autosuggestUseCase;

    public AutosuggestController(AutosuggestUseCase autosuggestUseCase) {
        this.autosuggestUseCase = autosuggestUseCase;
    }

    /**
     * GET /autosuggest?input=filled.count.so[&amp;focusLat=..&amp;focusLng=..][&amp;clipToCountry=GB]
     */
    @GetMapping
    public ResponseEntity<AutosuggestResult> autosuggest(@Valid @ModelAttribute AutosuggestQueryDto query) {
        logger.info("Autosuggest for input: {}", query.getInput());

        RequestOptions options = toOptions(query);
        AutosuggestResult result = query.isWithCoordinates()
                ? autosuggestUseCase.autosuggestWithCoordinates(query.getInput(), options)
                : autosuggestUseCase.autosuggest(query.getInput(), options);
        return ResponseEntity.ok(result);
    }

    private RequestOptions toOptions(AutosuggestQueryDto query) {
        RequestOptions options = RequestOptions.empty();
        if (query.getFocusLat() != null && query.getFocusLng() != null) {
            options = options.focus(new Coordinates(query.getFocusLat(), query.getFocusLng()));
        }
        if (query.getClipToCountry() != null && !query.getClipToCountry().isEmpty()) {
            options = options.clipToCountry(query.getClipToCountry());
        }
        if (query.getMaxResults() != null) {
            options = options.nResults(query.getMaxResults());
        }
        if (query.getLanguage() != null) {
            options = options.language(query.getLanguage());
        }
        return options;
    }
}
