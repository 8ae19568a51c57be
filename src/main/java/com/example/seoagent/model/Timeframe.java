package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Срок выполнения пункта плана. Порядок констант задаёт порядок в сводке сроков.
 */
public enum Timeframe implements ValueEnum {
    IMMEDIATE("immediate", "immediate actions"),
    THIS_WEEK("this_week", "this week"),
    THIS_MONTH("this_month", "this month"),
    NEXT_QUARTER("next_quarter", "next quarter");

    private final String value;
    private final String label;

    Timeframe(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public boolean isNearTerm() {
        return this == IMMEDIATE || this == THIS_WEEK;
    }

    public boolean isLongTerm() {
        return this == THIS_MONTH || this == NEXT_QUARTER;
    }
}
