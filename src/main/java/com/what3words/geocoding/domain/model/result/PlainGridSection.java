package com.what3words.geocoding.domain.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.what3words.geocoding.domain.model.OutputFormat;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@EqualsAndHashCode
@ToString
public class PlainGridSection implements GridSection {
    private final List<GridLine> lines;

    public PlainGridSection(List<GridLine> lines) {
        this.lines = List.copyOf(lines);
    }

    @Override
    @JsonIgnore
    public OutputFormat getFormat() {
        return OutputFormat.PLAIN;
    }
}
