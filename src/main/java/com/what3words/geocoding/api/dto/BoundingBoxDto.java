package com.what3words.geocoding.api.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBoxDto {

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double swLat;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double swLng;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double neLat;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double neLng;

    @AssertTrue(message = "South-west latitude must not exceed north-east latitude")
    public boolean isSouthOfNorth() {
        return swLat == null || neLat == null || swLat <= neLat;
    }
}
