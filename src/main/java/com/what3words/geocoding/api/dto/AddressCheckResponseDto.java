package com.what3words.geocoding.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AddressCheckResponseDto {

    @JsonProperty("text")
    private String text;

    @JsonProperty("check")
    private String check;

    @JsonProperty("result")
    private boolean result;
}
