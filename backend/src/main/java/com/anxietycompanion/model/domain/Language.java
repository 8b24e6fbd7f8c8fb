package com.anxietycompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Language {
    EN("en"),
    ES("es");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Locale toLocale() {
        return Locale.forLanguageTag(code);
    }

    // Closed set; anything unrecognized is English.
    public static Language fromCode(String code) {
        if (code == null) {
            return EN;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("es") || normalized.equals("spanish") || normalized.equals("español")) {
            return ES;
        }
        return EN;
    }
}
