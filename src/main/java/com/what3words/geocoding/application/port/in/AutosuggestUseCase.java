package com.what3words.geocoding.application.port.in;

import com.what3words.geocoding.domain.model.RequestOptions;
import com.what3words.geocoding.domain.model.result.AutosuggestResult;
import com.what3words.geocoding.domain.model.result.Suggestion;

/**
 * Input port for autosuggest on partial or mistyped addresses.
 */
public interface AutosuggestUseCase {

  AutosuggestResult autosuggest(String input, RequestOptions options);

  /**
   * Same as {@link #autosuggest} but each suggestion carries coordinates,
   * square and map link.
   */
  AutosuggestResult autosuggestWithCoordinates(String input, RequestOptions options);

  /**
   * Report which suggestion the user picked for a given raw input.
   */
  void autosuggestSelection(String rawInput, Suggestion selection, RequestOptions options);
}
