package com.what3words.geocoding.api.controller;

import com.what3words.geocoding.api.dto.BoundingBoxDto;
import com.what3words.geocoding.application.port.in.GeocodingUseCase;
import com.what3words.geocoding.domain.model.BoundingBox;
import com.what3words.geocoding.domain.model.OutputFormat;
import com.what3words.geocoding.domain.model.result.AvailableLanguages;
import com.what3words.geocoding.domain.model.result.GridSection;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for reference data: supported languages and the 3m grid.
 */
@RestController
public class MapDataController {

    private final GeocodingUseCase geocodingUseCase;

    public MapDataController(GeocodingUseCase geocodingUseCase) {
        this.geocodingUseCase = geocodingUseCase;
    }

    @GetMapping("/languages")
    public ResponseEntity<AvailableLanguages> languages() {
        return ResponseEntity.ok(geocodingUseCase.availableLanguages());
    }

    /**
     * GET /grid-section?swLat=..&amp;swLng=..&amp;neLat=..&amp;neLng=..[&amp;format=geojson]
     */
    @GetMapping("/grid-section")
    public ResponseEntity<GridSection> gridSection(
            @Valid @ModelAttribute BoundingBoxDto box,
            @RequestParam(defaultValue = "json") String format) {
        BoundingBox boundingBox = new BoundingBox(box.getSwLat(), box.getSwLng(), box.getNeLat(), box.getNeLng());
        return ResponseEntity.ok(geocodingUseCase.gridSection(boundingBox, OutputFormat.fromWireValue(format)));
    }
}
