package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BaselineMetrics.KeywordMetric;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.KeywordData;
import com.example.seoagent.service.insight.ExtractedInsights;
import com.example.seoagent.service.insight.InsightVocabulary;

import java.util.List;
import java.util.Optional;

/**
 * Ключевые слова: объём, сложность, низкоконкурентные возможности и длинный хвост.
 */
public final class KeywordResearchAgent extends AbstractAnalysisAgent<KeywordData> {

    private static final InsightVocabulary VOCABULARY =
            InsightVocabulary.of(List.of("finding", "strategy"), List.of("recommendation", "optimization"));

    static final int OPPORTUNITY_MIN_VOLUME = 100;
    static final int LONG_TAIL_MIN_WORDS = 3;

    public KeywordResearchAgent(BusinessContext context, BaselineMetrics baseline, AgentDependencies dependencies) {
        super(AgentType.KEYWORD_RESEARCH, context, baseline, dependencies);
    }

    @Override
    protected KeywordData computeData() {
        List<KeywordMetric> keywords = baseline.keywordsOrEmpty();
        return KeywordData.builder()
                .keywordCount(keywords.size())
                .averageVolume(keywords.stream().mapToInt(KeywordMetric::getVolume).average().orElse(0))
                .highDifficultyCount((int) keywords.stream().filter(k -> "high".equalsIgnoreCase(k.getDifficulty())).count())
                .opportunityKeywords(keywords.stream()
                        .filter(k -> "low".equalsIgnoreCase(k.getDifficulty()))
                        .filter(k -> k.getVolume() >= OPPORTUNITY_MIN_VOLUME)
                        .map(KeywordMetric::getKeyword)
                        .toList())
                .longTailCount((int) keywords.stream().filter(KeywordResearchAgent::isLongTail).count())
                .build();
    }

    static boolean isLongTail(KeywordMetric keyword) {
        return keyword.getKeyword() != null
                && keyword.getKeyword().trim().split("\\s+").length >= LONG_TAIL_MIN_WORDS;
    }

    @Override
    protected List<Stage<KeywordData>> stages() {
        return List.of(
                stage("Building keyword inventory", this::buildInventory),
                stage("Analyzing difficulty mix", this::analyzeDifficulty),
                stage("Finding keyword opportunities", this::findOpportunities),
                stage("Reviewing long-tail coverage", this::reviewLongTail)
        );
    }

    private void buildInventory(KeywordData data, AgentInsights insights) {
        insights.finding(data.getKeywordCount() + " keywords tracked with average monthly volume "
                + Math.round(data.getAverageVolume()));
    }

    private void analyzeDifficulty(KeywordData data, AgentInsights insights) {
        insights.finding(data.getHighDifficultyCount() + " high-difficulty keywords");
        if (data.getKeywordCount() > 0 && data.getHighDifficultyCount() * 2 > data.getKeywordCount()) {
            insights.recommendation("Balance the keyword portfolio with lower-difficulty terms");
        }
    }

    private void findOpportunities(KeywordData data, AgentInsights insights) {
        List<String> opportunities = data.getOpportunityKeywords();
        opportunities.stream()
                .limit(3)
                .forEach(keyword -> insights.finding("Low-difficulty opportunity: " + keyword));
        if (!opportunities.isEmpty()) {
            insights.recommendation("Prioritize content for low-difficulty keywords: "
                    + String.join(", ", opportunities.subList(0, Math.min(opportunities.size(), 3))));
        }
    }

    private void reviewLongTail(KeywordData data, AgentInsights insights) {
        insights.finding(data.getLongTailCount() + " long-tail keywords tracked");
        if (data.getLongTailCount() < 3) {
            insights.recommendation("Add long-tail keyword variations with location and service modifiers");
        }
    }

    @Override
    protected String buildPrompt(KeywordData data) {
        StringBuilder prompt = promptHeader("Advanced keyword strategy analysis");
        prompt.append("- Services: ").append(joinOrDash(context.getServices())).append("\n");

        prompt.append("\nCurrent Keywords:\n");
        for (KeywordMetric keyword : baseline.keywordsOrEmpty()) {
            prompt.append("- ").append(keyword.getKeyword())
                  .append(" (Volume: ").append(keyword.getVolume())
                  .append(", Difficulty: ").append(orDash(keyword.getDifficulty())).append(")\n");
        }
        prompt.append("\nLow-difficulty opportunities: ").append(joinOrDash(data.getOpportunityKeywords())).append("\n");

        appendAnswerFormat(prompt, "keyword strategy findings", "keyword optimization recommendations");
        return prompt.toString();
    }

    @Override
    protected InsightVocabulary vocabulary() {
        return VOCABULARY;
    }

    @Override
    protected Optional<ExtractedInsights> fallbackInsights(KeywordData data) {
        return Optional.of(new ExtractedInsights(
                List.of(),
                List.of("Research related keywords with Google Keyword Planner",
                        "Track rankings for every target keyword weekly")));
    }
}
