package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MilestoneStatus implements ValueEnum {
    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    DONE("done");

    private final String value;

    MilestoneStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }
}
