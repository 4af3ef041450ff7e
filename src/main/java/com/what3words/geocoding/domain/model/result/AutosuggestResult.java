package com.what3words.geocoding.domain.model.result;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

@Getter
@EqualsAndHashCode
@ToString
public class AutosuggestResult {
    private final List<Suggestion> suggestions;

    public AutosuggestResult(List<Suggestion> suggestions) {
        this.suggestions = List.copyOf(suggestions);
    }

    public Optional<Suggestion> first() {
        return suggestions.stream().findFirst();
    }
}
