package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionCategory implements ValueEnum {
    TECHNICAL("technical"),
    CONTENT("content"),
    KEYWORDS("keywords"),
    COMPETITORS("competitors"),
    USER_EXPERIENCE("user_experience"),
    LOCAL_SEO("local_seo");

    private final String value;

    ActionCategory(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }
}
