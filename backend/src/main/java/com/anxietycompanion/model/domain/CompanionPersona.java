package com.anxietycompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CompanionPersona {
    VANESSA("vanessa", "Vanessa", Language.EN),
    MONICA("monica", "Mónica", Language.ES);

    private final String code;
    private final String displayName;
    private final Language defaultLanguage;

    CompanionPersona(String code, String displayName, Language defaultLanguage) {
        this.code = code;
        this.displayName = displayName;
        this.defaultLanguage = defaultLanguage;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Language getDefaultLanguage() {
        return defaultLanguage;
    }

    public static CompanionPersona fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (CompanionPersona persona : values()) {
                if (persona.code.equals(normalized)) {
                    return persona;
                }
            }
        }
        return VANESSA;
    }
}
