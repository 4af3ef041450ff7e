package com.what3words.geocoding.api.controller;

import com.what3words.geocoding.api.dto.AddressCheckResponseDto;
import com.what3words.geocoding.api.dto.CoordinatesDto;
import com.what3words.geocoding.api.dto.FoundAddressesResponseDto;
import com.what3words.geocoding.api.dto.TextRequestDto;
import com.what3words.geocoding.application.port.in.GeocodingUseCase;
import com.what3words.geocoding.domain.model.Coordinates;
import com.what3words.geocoding.domain.model.OutputFormat;
import com.what3words.geocoding.domain.model.RequestOptions;
import com.what3words.geocoding.domain.model.result.GeocodeResult;
import com.what3words.geocoding.domain.service.AddressPatternRecognizer;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for address recognition and conversion.
 */
@RestController
@RequestMapping("/addresses")
public class AddressController {

    private static final Logger logger = LoggerFactory.getLogger(AddressController.class);

    private final AddressPatternRecognizer recognizer;
    private final GeocodingUseCase geocodingUseCase;

    public AddressController(AddressPatternRecognizer recognizer, GeocodingUseCase geocodingUseCase) {
        this.recognizer = recognizer;
        this.geocodingUseCase = geocodingUseCase;
    }

    /**
     * GET /addresses/possible?text=filled.count.soap
     */
    @GetMapping("/possible")
    public ResponseEntity<AddressCheckResponseDto> isPossible(@RequestParam String text) {
        return ResponseEntity.ok(new AddressCheckResponseDto(text, "possible", recognizer.isPossibleAddress(text)));
    }

    /**
     * GET /addresses/did-you-mean?text=filled count soap
     */
    @GetMapping("/did-you-mean")
    public ResponseEntity<AddressCheckResponseDto> didYouMean(@RequestParam String text) {
        return ResponseEntity.ok(new AddressCheckResponseDto(text, "didYouMean", recognizer.didYouMean(text)));
    }

    /**
     * POST /addresses/find
     *
     * Scans the body text for address-shaped tokens. Lexical only; nothing is
     * sent to the geocoding service.
     */
    @PostMapping("/find")
    public ResponseEntity<FoundAddressesResponseDto> find(@Valid @RequestBody TextRequestDto request) {
        List<String> addresses = recognizer.findPossibleAddresses(request.getText());
        logger.debug("Found {} possible addresses", addresses.size());
        return ResponseEntity.ok(new FoundAddressesResponseDto(addresses.size(), addresses));
    }

    /**
     * GET /addresses/valid?text=filled.count.soap
     *
     * Confirms existence with the service when the text is address-shaped.
     */
    @GetMapping("/valid")
    public ResponseEntity<AddressCheckResponseDto> isValid(@RequestParam String text) {
        logger.info("Validating address: {}", text);
        return ResponseEntity.ok(new AddressCheckResponseDto(text, "valid", geocodingUseCase.isValidAddress(text)));
    }

    /**
     * GET /addresses/convert-to-3wa?lat=X&amp;lng=Y[&amp;language=en][&amp;format=geojson]
     */
    @GetMapping("/convert-to-3wa")
    public ResponseEntity<GeocodeResult> convertTo3wa(
            @Valid @ModelAttribute CoordinatesDto coordinates,
            @RequestParam(required = false) String language,
            @RequestParam(defaultValue = "json") String format) {
        logger.info("Converting to 3wa: lat={}, lng={}", coordinates.getLat(), coordinates.getLng());

        RequestOptions options = RequestOptions.empty().outputFormat(OutputFormat.fromWireValue(format));
        if (language != null) {
            options = options.language(language);
        }
        GeocodeResult result = geocodingUseCase.convertTo3wa(
                new Coordinates(coordinates.getLat(), coordinates.getLng()), options);
        return ResponseEntity.ok(result);
    }

    /**
     * GET /addresses/convert-to-coordinates?words=a.b.c[&amp;format=geojson]
     */
    @GetMapping("/convert-to-coordinates")
    public ResponseEntity<GeocodeResult> convertToCoordinates(
            @RequestParam String words,
            @RequestParam(defaultValue = "json") String format) {
        logger.info("Converting to coordinates: {}", words);

        RequestOptions options = RequestOptions.empty().outputFormat(OutputFormat.fromWireValue(format));
        return ResponseEntity.ok(geocodingUseCase.convertToCoordinates(words, options));
    }
}
