package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BaselineMetrics.SerpFeature;
import com.example.seoagent.model.BaselineMetrics.SerpPresence;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.SerpData;
import com.example.seoagent.service.insight.ExtractedInsights;
import com.example.seoagent.service.insight.InsightVocabulary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Присутствие в выдаче: органические позиции, SERP-функции и локальная выдача.
 */
public final class SerpAnalysisAgent extends AbstractAnalysisAgent<SerpData> {

    private static final InsightVocabulary VOCABULARY =
            InsightVocabulary.of(List.of("finding", "positioning"), List.of("recommendation", "improve"));

    static final String FEATURED_SNIPPETS = "Featured Snippets";

    public SerpAnalysisAgent(BusinessContext context, BaselineMetrics baseline, AgentDependencies dependencies) {
        super(AgentType.SERP_ANALYSIS, context, baseline, dependencies);
    }

    @Override
    protected SerpData computeData() {
        SerpPresence presence = presence();
        int organic = presence.getOrganicResults() != null ? presence.getOrganicResults().size() : 0;
        List<String> missing = new ArrayList<>();
        int found = 0;
        for (Map.Entry<String, SerpFeature> feature : features(presence).entrySet()) {
            if (SerpFeature.present(feature.getValue())) {
                found++;
            } else {
                missing.add(feature.getKey());
            }
        }
        boolean local = SerpFeature.present(presence.getMapsResults());

        return SerpData.builder()
                .organicListings(organic)
                .serpFeatures(found)
                .localPresence(local)
                .missingFeatures(missing)
                .visibilityScore(visibilityScore(organic, found, local))
                .build();
    }

    static int visibilityScore(int organicListings, int serpFeatures, boolean localPresence) {
        int score = Math.min(organicListings, 5) * 10 + serpFeatures * 8 + (localPresence ? 10 : 0);
        return Math.min(score, 100);
    }

    private static Map<String, SerpFeature> features(SerpPresence presence) {
        Map<String, SerpFeature> features = new LinkedHashMap<>();
        features.put("Maps Results", presence.getMapsResults());
        features.put(FEATURED_SNIPPETS, presence.getFeaturedSnippets());
        features.put("Knowledge Panel", presence.getKnowledgePanel());
        features.put("News Results", presence.getNewsResults());
        features.put("Video Results", presence.getVideoResults());
        features.put("Image Results", presence.getImagesResults());
        return features;
    }

    @Override
    protected List<Stage<SerpData>> stages() {
        return List.of(
                stage("Counting organic listings", this::countOrganic),
                stage("Detecting SERP features", this::detectFeatures),
                stage("Checking local presence", this::checkLocal),
                stage("Scoring visibility", this::scoreVisibility)
        );
    }

    private void countOrganic(SerpData data, AgentInsights insights) {
        insights.finding(data.getOrganicListings() + " organic listings found");
        if (data.getOrganicListings() == 0) {
            insights.recommendation("Fix indexing so that core pages appear in organic results");
        }
    }

    private void detectFeatures(SerpData data, AgentInsights insights) {
        insights.finding(data.getSerpFeatures() + " of 6 SERP features present");
    }

    private void checkLocal(SerpData data, AgentInsights insights) {
        if (data.isLocalPresence()) {
            insights.finding("Listed in local map results");
        } else {
            insights.finding("Not listed in local map results");
            insights.recommendation("Claim and optimize the Google Business Profile to appear in map results");
        }
    }

    private void scoreVisibility(SerpData data, AgentInsights insights) {
        insights.finding("SERP visibility score " + data.getVisibilityScore() + "/100");
        if (data.getMissingFeatures().contains(FEATURED_SNIPPETS)) {
            insights.recommendation("Structure answers as concise FAQ content to target featured snippets");
        }
    }

    @Override
    protected String buildPrompt(SerpData data) {
        SerpPresence presence = presence();
        StringBuilder prompt = promptHeader("SERP positioning analysis");

        prompt.append("\nCurrent SERP Presence:\n");
        prompt.append("- Organic Results: ").append(data.getOrganicListings()).append(" listings\n");
        for (Map.Entry<String, SerpFeature> feature : features(presence).entrySet()) {
            prompt.append("- ").append(feature.getKey()).append(": ")
                  .append(SerpFeature.present(feature.getValue()) ? "Found" : "Not found").append("\n");
        }
        prompt.append("Visibility score: ").append(data.getVisibilityScore()).append("/100\n");

        appendAnswerFormat(prompt, "SERP positioning findings", "recommendations to improve SERP visibility");
        return prompt.toString();
    }

    @Override
    protected InsightVocabulary vocabulary() {
        return VOCABULARY;
    }

    @Override
    protected Optional<ExtractedInsights> fallbackInsights(SerpData data) {
        List<String> recommendations = new ArrayList<>();
        if (!data.getMissingFeatures().isEmpty()) {
            recommendations.add("Target missing SERP features: " + String.join(", ", data.getMissingFeatures()));
        }
        recommendations.add("Monitor search appearance in Google Search Console");
        return Optional.of(new ExtractedInsights(List.of(), recommendations));
    }

    private SerpPresence presence() {
        return baseline.getSerpPresence() != null ? baseline.getSerpPresence() : new SerpPresence();
    }
}
