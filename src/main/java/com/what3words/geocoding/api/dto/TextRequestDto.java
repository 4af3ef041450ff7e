package com.what3words.geocoding.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request body carrying free text to scan for addresses.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TextRequestDto {

    @NotNull(message = "Text is required")
    @JsonProperty("text")
    private String text;
}
