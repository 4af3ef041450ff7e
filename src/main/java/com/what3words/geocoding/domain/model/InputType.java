package com.what3words.geocoding.domain.model;

/**
 * Source of autosuggest input. Voice types tell the service to expect
 * recogniser output rather than typed text.
 */
public enum InputType {
    TEXT("text"),
    VOCON_HYBRID("vocon-hybrid"),
    NMDP_ASR("nmdp-asr"),
    GENERIC_VOICE("generic-voice");

    private final String wireValue;

    InputType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }
}
