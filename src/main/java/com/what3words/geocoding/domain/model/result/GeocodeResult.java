package com.what3words.geocoding.domain.model.result;

import com.what3words.geocoding.domain.model.BoundingBox;
import com.what3words.geocoding.domain.model.Coordinates;
import com.what3words.geocoding.domain.model.OutputFormat;

/**
 * Result of a convert-to-3wa or convert-to-coordinates call.
 *
 * Both implementations carry the same semantic content in a different
 * serialization shape. Instances are only created by decoding a response
 * body; see {@link PlainAddress} and {@link GeoJsonAddress}.
 */
public interface GeocodeResult {

    OutputFormat getFormat();

    String getWords();

    Coordinates getCoordinates();

    /**
     * The 3m square the address identifies.
     */
    BoundingBox getSquare();

    String getNearestPlace();

    String getCountry();

    String getLanguage();

    String getMapUrl();
}
