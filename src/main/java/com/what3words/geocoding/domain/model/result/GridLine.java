package com.what3words.geocoding.domain.model.result;

import com.what3words.geocoding.domain.model.Coordinates;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public class GridLine {
    private final Coordinates start;
    private final Coordinates end;
}
