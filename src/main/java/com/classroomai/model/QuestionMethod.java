package com.classroomai.model;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a question was asked: typed text, or a reference to recorded audio.
 */
public enum QuestionMethod {

    TEXT("text"),
    AUDIO("audio");

    private final String wireName;

    QuestionMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<QuestionMethod> fromWire(String value) {
        for (QuestionMethod method : values()) {
            if (method.wireName.equalsIgnoreCase(value)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
