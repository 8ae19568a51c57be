package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Тип агента анализа. Набор закрыт: ровно шесть агентов на прогон.
 */
public enum AgentType implements ValueEnum {
    TECHNICAL_SEO("technical_seo"),
    CONTENT_ANALYSIS("content_analysis"),
    COMPETITOR_INTELLIGENCE("competitor_intelligence"),
    KEYWORD_RESEARCH("keyword_research"),
    SERP_ANALYSIS("serp_analysis"),
    USER_EXPERIENCE("user_experience");

    private final String value;

    AgentType(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }
}
