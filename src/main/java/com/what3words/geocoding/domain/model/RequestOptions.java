package com.what3words.geocoding.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.With;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Optional query constraints for a geocoding or autosuggest request.
 *
 * Instances are immutable. Every fluent method returns a new value, so a
 * shared instance can be extended by several callers without interference:
 *
 * <pre>
 * RequestOptions base = RequestOptions.empty().language("en");
 * RequestOptions nearLondon = base.focus(new Coordinates(51.52, -0.19));
 * RequestOptions inGb = base.clipToCountry("GB");
 * </pre>
 *
 * Values are not validated here; a negative radius or an out-of-range
 * latitude is sent as given.
 */
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@With(AccessLevel.PRIVATE)
public class RequestOptions {

    private static final RequestOptions EMPTY =
        new RequestOptions(null, null, null, ClipPolicy.none(), null, null, null, null, null);

    private final Coordinates focus;
    private final Integer nResults;
    private final Integer nFocusResults;
    private final ClipPolicy clip;
    private final InputType inputType;
    private final String language;
    private final String locale;
    private final Boolean preferLand;
    private final OutputFormat outputFormat;

    public static RequestOptions empty() {
        return EMPTY;
    }

    public RequestOptions focus(Coordinates focus) {
        return withFocus(focus);
    }

    public RequestOptions nResults(int nResults) {
        return withNResults(nResults);
    }

    public RequestOptions nFocusResults(int nFocusResults) {
        return withNFocusResults(nFocusResults);
    }

    public RequestOptions clipToCountry(String... countryCodes) {
        return withClip(clip.withCountries(countryCodes));
    }

    public RequestOptions clipToCountry(List<String> countryCodes) {
        return withClip(clip.withCountries(countryCodes));
    }

    public RequestOptions clipToBoundingBox(BoundingBox boundingBox) {
        return withClip(clip.withBoundingBox(boundingBox));
    }

    public RequestOptions clipToCircle(Circle circle) {
        return withClip(clip.withCircle(circle));
    }

    public RequestOptions clipToPolygon(Polygon polygon) {
        return withClip(clip.withPolygon(polygon));
    }

    public RequestOptions inputType(InputType inputType) {
        return withInputType(inputType);
    }

    public RequestOptions language(String language) {
        return withLanguage(language);
    }

    public RequestOptions locale(String locale) {
        return withLocale(locale);
    }

    public RequestOptions preferLand(boolean preferLand) {
        return withPreferLand(preferLand);
    }

    public RequestOptions outputFormat(OutputFormat outputFormat) {
        return withOutputFormat(outputFormat);
    }

    public Optional<Coordinates> getFocus() {
        return Optional.ofNullable(focus);
    }

    public Optional<Integer> getNResults() {
        return Optional.ofNullable(nResults);
    }

    public Optional<Integer> getNFocusResults() {
        return Optional.ofNullable(nFocusResults);
    }

    public ClipPolicy getClip() {
        return clip;
    }

    public Optional<InputType> getInputType() {
        return Optional.ofNullable(inputType);
    }

    public Optional<String> getLanguage() {
        return Optional.ofNullable(language);
    }

    public Optional<String> getLocale() {
        return Optional.ofNullable(locale);
    }

    public Optional<Boolean> getPreferLand() {
        return Optional.ofNullable(preferLand);
    }

    /**
     * The requested response shape; {@link OutputFormat#PLAIN} when unset.
     */
    public OutputFormat getOutputFormat() {
        return outputFormat != null ? outputFormat : OutputFormat.PLAIN;
    }

    public boolean hasOutputFormat() {
        return outputFormat != null;
    }

    /**
     * Serialize to query parameters: one fixed key per set option, unset
     * options omitted. Iteration order is the canonical key order.
     */
    public Map<String, String> toQueryParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        if (focus != null) {
            params.put("focus", focus.toQueryValue());
        }
        if (nResults != null) {
            params.put("n-result", nResults.toString());
        }
        if (nFocusResults != null) {
            params.put("n-focus-result", nFocusResults.toString());
        }
        params.putAll(clip.toQueryParameters());
        if (inputType != null) {
            params.put("input-type", inputType.getWireValue());
        }
        if (language != null) {
            params.put("language", language);
        }
        if (locale != null) {
            params.put("locale", locale);
        }
        if (preferLand != null) {
            params.put("prefer-land", preferLand.toString());
        }
        if (outputFormat != null) {
            params.put("format", outputFormat.getWireValue());
        }
        return Collections.unmodifiableMap(params);
    }
}
