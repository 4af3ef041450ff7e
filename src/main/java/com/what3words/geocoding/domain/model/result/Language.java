package com.what3words.geocoding.domain.model.result;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public class Language {
    private final String code;
    private final String name;
    private final String nativeName;
}
