package com.what3words.geocoding.domain.model;

import com.what3words.geocoding.domain.service.AddressPatternRecognizer;
import lombok.EqualsAndHashCode;

import java.util.List;

/**
 * Value object for an address-shaped {@code word.word.word} string.
 * Casing is preserved; existence of the words is not checked.
 */
@EqualsAndHashCode
public class ThreeWordAddress {

    // Own instance so the value type works outside a Spring context; the recognizer is stateless.
    private static final AddressPatternRecognizer RECOGNIZER = new AddressPatternRecognizer();

    private final String words;

    private ThreeWordAddress(String words) {
        this.words = words;
    }

    /**
     * @throws IllegalArgumentException if the text is not a possible address
     */
    public static ThreeWordAddress of(String text) {
        if (!RECOGNIZER.isPossibleAddress(text)) {
            throw new IllegalArgumentException("Not a three-word address: " + text);
        }
        return new ThreeWordAddress(text.strip());
    }

    public List<String> getSegments() {
        return List.of(words.split("\\."));
    }

    public String getWords() {
        return words;
    }

    @Override
    public String toString() {
        return words;
    }
}
