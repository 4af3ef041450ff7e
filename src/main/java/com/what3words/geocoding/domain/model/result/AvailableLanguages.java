package com.what3words.geocoding.domain.model.result;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@EqualsAndHashCode
@ToString
public class AvailableLanguages {
    private final List<Language> languages;

    public AvailableLanguages(List<Language> languages) {
        this.languages = List.copyOf(languages);
    }
}
