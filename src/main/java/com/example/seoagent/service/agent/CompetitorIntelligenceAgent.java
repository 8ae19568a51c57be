package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BaselineMetrics.Competitor;
import com.example.seoagent.model.BaselineMetrics.MarketPosition;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.CompetitorData;
import com.example.seoagent.service.insight.InsightVocabulary;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Конкуренты: рыночная позиция, сила относительно среднего и отставание от лидера.
 * Без ответа модели агент завершается с ошибкой.
 */
public final class CompetitorIntelligenceAgent extends AbstractAnalysisAgent<CompetitorData> {

    private static final InsightVocabulary VOCABULARY =
            InsightVocabulary.of(List.of("finding", "intelligence"), List.of("recommendation", "strategic"));

    static final String STRONG = "Strong";
    static final String COMPETITIVE = "Competitive";
    static final String NEEDS_IMPROVEMENT = "Needs Improvement";
    static final String UNKNOWN = "Unknown";

    public CompetitorIntelligenceAgent(BusinessContext context, BaselineMetrics baseline,
                                       AgentDependencies dependencies) {
        super(AgentType.COMPETITOR_INTELLIGENCE, context, baseline, dependencies);
    }

    @Override
    protected CompetitorData computeData() {
        List<Competitor> competitors = baseline.competitorsOrEmpty();
        MarketPosition position = marketPosition();
        double average = averageScore(competitors);
        int leaderGap = leader(competitors)
                .map(leader -> Math.max(0, leader.getScore() - baseline.getSeoScore()))
                .orElse(0);

        return CompetitorData.builder()
                .competitorCount(competitors.size())
                .averageCompetitorScore(average)
                .marketRank(position.getRank())
                .totalCompetitors(position.getTotalCompetitors())
                .estimatedMarketShare(estimatedMarketShare(position.getRank()))
                .competitiveStrength(competitiveStrength(baseline.getSeoScore(), competitors))
                .leaderGap(leaderGap)
                .build();
    }

    /**
     * Доля рынка в процентах по рангу; 0 при неизвестном ранге.
     */
    static int estimatedMarketShare(int rank) {
        if (rank <= 0) {
            return 0;
        }
        return (int) Math.round(Math.max(100.0 / (rank * 2.5), 1.0));
    }

    static String competitiveStrength(int seoScore, List<Competitor> competitors) {
        if (competitors.isEmpty()) {
            return UNKNOWN;
        }
        double average = averageScore(competitors);
        if (seoScore > average + 10) {
            return STRONG;
        }
        if (seoScore > average - 5) {
            return COMPETITIVE;
        }
        return NEEDS_IMPROVEMENT;
    }

    private static double averageScore(List<Competitor> competitors) {
        return competitors.stream().mapToInt(Competitor::getScore).average().orElse(0);
    }

    private static Optional<Competitor> leader(List<Competitor> competitors) {
        return competitors.stream().max(Comparator.comparingInt(Competitor::getScore));
    }

    @Override
    protected List<Stage<CompetitorData>> stages() {
        return List.of(
                stage("Mapping competitor set", this::mapCompetitors),
                stage("Estimating market position", this::estimatePosition),
                stage("Rating competitive strength", this::rateStrength),
                stage("Measuring leader gap", this::measureLeaderGap)
        );
    }

    private void mapCompetitors(CompetitorData data, AgentInsights insights) {
        if (data.getCompetitorCount() == 0) {
            insights.finding("No competitor data available");
            return;
        }
        insights.finding(data.getCompetitorCount() + " competitors tracked with average SEO score "
                + Math.round(data.getAverageCompetitorScore()));
    }

    private void estimatePosition(CompetitorData data, AgentInsights insights) {
        if (data.getMarketRank() > 0) {
            insights.finding("Market rank " + data.getMarketRank() + " of " + data.getTotalCompetitors()
                    + ", estimated market share " + data.getEstimatedMarketShare() + "%");
        }
    }

    private void rateStrength(CompetitorData data, AgentInsights insights) {
        insights.finding("Competitive strength: " + data.getCompetitiveStrength());
        if (NEEDS_IMPROVEMENT.equals(data.getCompetitiveStrength())) {
            insights.recommendation("Close the SEO score gap with competitors through technical and content improvements");
        }
    }

    private void measureLeaderGap(CompetitorData data, AgentInsights insights) {
        if (data.getLeaderGap() <= 0) {
            return;
        }
        leader(baseline.competitorsOrEmpty()).ifPresent(leader -> {
            insights.finding(leader.getName() + " leads by " + data.getLeaderGap() + " SEO points");
            insights.recommendation("Study the top pages and backlink profile of " + leader.getName());
        });
    }

    @Override
    protected String buildPrompt(CompetitorData data) {
        StringBuilder prompt = promptHeader("Deep competitive analysis");

        prompt.append("\nCurrent Competitors:\n");
        for (Competitor competitor : baseline.competitorsOrEmpty()) {
            prompt.append("- ").append(competitor.getName())
                  .append(" (Score: ").append(competitor.getScore())
                  .append(", Rank: ").append(competitor.getRanking()).append(")\n");
        }
        prompt.append("\nMarket Position: Rank ").append(data.getMarketRank())
              .append(" of ").append(data.getTotalCompetitors()).append("\n");
        prompt.append("Competitive strength: ").append(data.getCompetitiveStrength()).append("\n");

        appendAnswerFormat(prompt, "competitive intelligence findings",
                "strategic recommendations to outrank competitors");
        return prompt.toString();
    }

    @Override
    protected InsightVocabulary vocabulary() {
        return VOCABULARY;
    }

    private MarketPosition marketPosition() {
        return baseline.getMarketPosition() != null ? baseline.getMarketPosition() : new MarketPosition();
    }
}
