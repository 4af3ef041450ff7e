package com.what3words.geocoding.domain.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Domain service deciding which text looks like a three-word address.
 *
 * Shape rule: three segments joined by exactly two {@code .} characters. A
 * segment starts with a Unicode letter and continues with letters or
 * combining marks, so accented Latin, Cyrillic, Greek, CJK and Indic words
 * all qualify while digits and symbols never do.
 *
 * Purely lexical: a match says nothing about whether the words exist. All
 * operations are total over their input and never touch the network.
 */
@Service
public class AddressPatternRecognizer {

    private static final String SEGMENT = "\\p{L}[\\p{L}\\p{M}]*";

    private static final Pattern POSSIBLE_ADDRESS =
        Pattern.compile(SEGMENT + "\\." + SEGMENT + "\\." + SEGMENT);

    /**
     * Group 2 is the separator; {@code \2} forces the second one to match it.
     */
    private static final Pattern DID_YOU_MEAN =
        Pattern.compile("(" + SEGMENT + ")([. \\-\\x{FF61}\\x{3002}])(" + SEGMENT + ")\\2(" + SEGMENT + ")");

    /**
     * Maximal run of letters, marks, digits and dots. Anything else (whitespace,
     * punctuation other than the dot) bounds a candidate.
     */
    private static final Pattern CANDIDATE = Pattern.compile("[\\p{L}\\p{M}\\p{N}.]+");

    /**
     * Whether the whole input, surrounding whitespace aside, is address-shaped.
     *
     * @param text arbitrary text, may be null
     * @return true for e.g. {@code filled.count.soap}; false for
     *         {@code not.a 3wa} or {@code 1.2.3}
     */
    public boolean isPossibleAddress(String text) {
        if (text == null) {
            return false;
        }
        return POSSIBLE_ADDRESS.matcher(text.strip()).matches();
    }

    /**
     * Extracts every address-shaped token from free text.
     *
     * Tokens keep their original casing and span. Dots at either end of a
     * token (a sentence full stop, an ellipsis) are not part of the match.
     * A dotted token with two or four-plus segments, or with digits in it,
     * yields nothing rather than a partial match.
     *
     * @param text arbitrary text, may be null
     * @return matches in order of appearance, empty if none
     */
    public List<String> findPossibleAddresses(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> matches = new ArrayList<>();
        Matcher candidates = CANDIDATE.matcher(text);
        while (candidates.find()) {
            int start = candidates.start();
            int end = candidates.end();
            while (start < end && text.charAt(start) == '.') {
                start++;
            }
            while (end > start && text.charAt(end - 1) == '.') {
                end--;
            }
            String token = text.substring(start, end);
            if (POSSIBLE_ADDRESS.matcher(token).matches()) {
                matches.add(token);
            }
        }
        return List.copyOf(matches);
    }

    /**
     * Looser check for input typed without the canonical delimiter.
     *
     * Accepts three segments separated by the same single separator twice:
     * a dot, a space, a hyphen or an ideographic full stop. Mixed separators
     * and run-together words are rejected.
     *
     * @param text arbitrary text, may be null
     * @return true for {@code filled count soap} or {@code filled-count-soap}
     */
    public boolean didYouMean(String text) {
        if (text == null) {
            return false;
        }
        return DID_YOU_MEAN.matcher(text.strip()).matches();
    }
}
