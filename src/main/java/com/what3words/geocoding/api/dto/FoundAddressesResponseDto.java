package com.what3words.geocoding.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FoundAddressesResponseDto {

    @JsonProperty("count")
    private int count;

    @JsonProperty("addresses")
    private List<String> addresses;
}
