package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Статус агента или всего прогона анализа.
 */
public enum AnalysisStatus implements ValueEnum {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    AnalysisStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
