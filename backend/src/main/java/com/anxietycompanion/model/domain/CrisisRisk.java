package com.anxietycompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CrisisRisk {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    CrisisRisk(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isSevere() {
        return this == HIGH || this == CRITICAL;
    }

    /**
     * Derive the tier from an anxiety level and whether the text carried an explicit
     * crisis or psychosis signal. HIGH and CRITICAL are only reachable with a level of
     * 9+ or a signal hit, so a lone level-8 reading stays MODERATE.
     */
    public static CrisisRisk derive(int anxietyLevel, boolean crisisSignal) {
        if (crisisSignal) {
            return CRITICAL;
        }
        if (anxietyLevel >= 9) {
            return HIGH;
        }
        if (anxietyLevel >= 7) {
            return MODERATE;
        }
        return LOW;
    }

    public static CrisisRisk fromCode(String code) {
        for (CrisisRisk risk : values()) {
            if (risk.code.equalsIgnoreCase(code)) {
                return risk;
            }
        }
        return LOW;
    }
}
