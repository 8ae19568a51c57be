package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BaselineMetrics.KeywordMetric;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.ContentData;
import com.example.seoagent.service.insight.InsightVocabulary;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Контент: покрытие ключевых слов, описанность предложений и пробелы в темах.
 * Без ответа модели агент завершается с ошибкой.
 */
public final class ContentAnalysisAgent extends AbstractAnalysisAgent<ContentData> {

    private static final InsightVocabulary VOCABULARY =
            InsightVocabulary.of(List.of("gap", "finding"), List.of("recommendation", "optimization"));

    public ContentAnalysisAgent(BusinessContext context, BaselineMetrics baseline, AgentDependencies dependencies) {
        super(AgentType.CONTENT_ANALYSIS, context, baseline, dependencies);
    }

    @Override
    protected ContentData computeData() {
        int keywordCount = baseline.keywordsOrEmpty().size();
        int offerings = context.offeringsCount();
        return ContentData.builder()
                .contentScore(contentScore(keywordCount, offerings))
                .keywordCoverage(keywordCount)
                .offeringsCount(offerings)
                .uncoveredKeywords(uncoveredKeywords())
                .industry(context.getIndustry())
                .build();
    }

    static int contentScore(int keywordCount, int offerings) {
        int score = 60;
        score += Math.min(keywordCount * 5, 20);
        score += Math.min(offerings * 3, 15);
        return Math.min(score, 100);
    }

    private List<String> uncoveredKeywords() {
        Set<String> tracked = baseline.keywordsOrEmpty().stream()
                .map(KeywordMetric::getKeyword)
                .filter(keyword -> keyword != null)
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<String> wanted = context.getKeywords() != null ? context.getKeywords() : List.of();
        return wanted.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .filter(keyword -> !tracked.contains(keyword.trim().toLowerCase(Locale.ROOT)))
                .toList();
    }

    @Override
    protected List<Stage<ContentData>> stages() {
        return List.of(
                stage("Measuring keyword coverage", this::measureKeywordCoverage),
                stage("Reviewing products and services", this::reviewOfferings),
                stage("Scoring content", this::scoreContent),
                stage("Identifying topic gaps", this::identifyTopicGaps)
        );
    }

    private void measureKeywordCoverage(ContentData data, AgentInsights insights) {
        insights.finding("Content currently targets " + data.getKeywordCoverage() + " tracked keywords");
        if (data.getKeywordCoverage() < 10) {
            insights.recommendation("Expand site content to cover at least 10 target keywords");
        }
    }

    private void reviewOfferings(ContentData data, AgentInsights insights) {
        insights.finding(data.getOfferingsCount() + " products and services described");
        if (data.getOfferingsCount() == 0) {
            insights.recommendation("Create a dedicated page for each product and service");
        }
    }

    private void scoreContent(ContentData data, AgentInsights insights) {
        insights.finding("Content score " + data.getContentScore() + "/100");
    }

    private void identifyTopicGaps(ContentData data, AgentInsights insights) {
        List<String> uncovered = data.getUncoveredKeywords();
        uncovered.stream()
                .limit(3)
                .forEach(keyword -> insights.finding("No ranking content for \"" + keyword + "\""));
        if (!uncovered.isEmpty()) {
            insights.recommendation("Publish pages targeting uncovered keywords: "
                    + String.join(", ", uncovered.subList(0, Math.min(uncovered.size(), 3))));
        }
    }

    @Override
    protected String buildPrompt(ContentData data) {
        StringBuilder prompt = promptHeader("Analyze content strategy");
        prompt.append("- Products: ").append(joinOrDash(context.getProducts())).append("\n");
        prompt.append("- Services: ").append(joinOrDash(context.getServices())).append("\n");
        prompt.append("- Description: ").append(orDash(context.getDescription())).append("\n");

        List<String> keywords = baseline.keywordsOrEmpty().stream().map(KeywordMetric::getKeyword).toList();
        prompt.append("\nTarget Keywords: ").append(joinOrDash(keywords)).append("\n");
        prompt.append("Content score: ").append(data.getContentScore()).append("/100\n");
        prompt.append("Keywords without content: ").append(joinOrDash(data.getUncoveredKeywords())).append("\n");

        appendAnswerFormat(prompt, "content gaps that should be addressed",
                "content optimization recommendations");
        return prompt.toString();
    }

    @Override
    protected InsightVocabulary vocabulary() {
        return VOCABULARY;
    }
}
