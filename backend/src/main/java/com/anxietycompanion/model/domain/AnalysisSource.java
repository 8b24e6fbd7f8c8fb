package com.anxietycompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisSource {
    REMOTE("remote"),
    FALLBACK("fallback");

    private final String code;

    AnalysisSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AnalysisSource fromCode(String code) {
        for (AnalysisSource source : values()) {
            if (source.code.equalsIgnoreCase(code)) {
                return source;
            }
        }
        return FALLBACK;
    }
}
