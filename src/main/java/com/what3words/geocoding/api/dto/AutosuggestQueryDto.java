package com.what3words.geocoding.api.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Query DTO for autosuggest. Focus is optional but needs both coordinates.
 */
@Getter
@Setter
@NoArgsConstructor
public class AutosuggestQueryDto {

    @NotBlank(message = "Input is required")
    private String input;

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double focusLat;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double focusLng;

    private List<String> clipToCountry;

    @Min(1)
    @Max(100)
    private Integer maxResults;

    private String language;

    private boolean withCoordinates;

    @AssertTrue(message = "focusLat and focusLng must be given together")
    public boolean isFocusComplete() {
        return (focusLat == null) == (focusLng == null);
    }
}
