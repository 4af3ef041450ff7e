package com.what3words.geocoding.application.port.in;

import com.what3words.geocoding.domain.model.BoundingBox;
import com.what3words.geocoding.domain.model.Coordinates;
import com.what3words.geocoding.domain.model.OutputFormat;
import com.what3words.geocoding.domain.model.RequestOptions;
import com.what3words.geocoding.domain.model.ThreeWordAddress;
import com.what3words.geocoding.domain.model.result.AvailableLanguages;
import com.what3words.geocoding.domain.model.result.GeocodeResult;
import com.what3words.geocoding.domain.model.result.GridSection;

/**
 * Input port for conversions between coordinates and three-word addresses.
 */
public interface GeocodingUseCase {

  /**
   * Convert a point to the address of the square containing it.
   * Uses the language, locale and output format of {@code options}.
   */
  GeocodeResult convertTo3wa(Coordinates coordinates, RequestOptions options);

  /**
   * Convert an address to the centre of its square.
   * Uses the locale and output format of {@code options}.
   */
  GeocodeResult convertToCoordinates(String words, RequestOptions options);

  default GeocodeResult convertToCoordinates(ThreeWordAddress address, RequestOptions options) {
    return convertToCoordinates(address.getWords(), options);
  }

  /**
   * Grid lines inside a bounding box.
   */
  GridSection gridSection(BoundingBox boundingBox, OutputFormat format);

  AvailableLanguages availableLanguages();

  /**
   * Whether the text is address-shaped and the service knows it as an address.
   * Never throws; remote failures count as "not valid".
   */
  boolean isValidAddress(String text);
}
