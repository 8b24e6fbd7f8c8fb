package com.anxietycompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Sender {
    USER("user"),
    ASSISTANT("assistant");

    private final String code;

    Sender(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Sender fromCode(String code) {
        return "user".equalsIgnoreCase(code) ? USER : ASSISTANT;
    }
}
