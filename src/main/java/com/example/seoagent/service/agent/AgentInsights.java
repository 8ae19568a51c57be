package com.example.seoagent.service.agent;

import com.example.seoagent.service.insight.ExtractedInsights;

import java.util.ArrayList;
import java.util.List;

/**
 * Накопитель выводов и рекомендаций агента в порядке обнаружения.
 */
public class AgentInsights {
    private final List<String> findings = new ArrayList<>();
    private final List<String> recommendations = new ArrayList<>();

    public AgentInsights finding(String text) {
        findings.add(text);
        return this;
    }

    public AgentInsights recommendation(String text) {
        recommendations.add(text);
        return this;
    }

    public void addAll(ExtractedInsights insights) {
        findings.addAll(insights.getFindings());
        recommendations.addAll(insights.getRecommendations());
    }

    public List<String> getFindings() {
        return findings;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }
}
