package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority implements ValueEnum {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Priority(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }
}
