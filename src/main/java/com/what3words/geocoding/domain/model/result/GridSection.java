package com.what3words.geocoding.domain.model.result;

import com.what3words.geocoding.domain.model.OutputFormat;

import java.util.List;

/**
 * The 3m grid lines inside a bounding box, in either response shape.
 */
public interface GridSection {

    OutputFormat getFormat();

    List<GridLine> getLines();
}
