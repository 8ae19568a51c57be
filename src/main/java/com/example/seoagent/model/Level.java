package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Уровень high/medium/low: влияние, трудозатраты, приоритет кластера тем.
 */
public enum Level implements ValueEnum {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Level(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeastMedium() {
        return this == HIGH || this == MEDIUM;
    }
}
