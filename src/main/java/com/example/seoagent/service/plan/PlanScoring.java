package com.example.seoagent.service.plan;

import com.example.seoagent.model.ActionItem;
import com.example.seoagent.model.AgentData;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.AnalysisStatus;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.CompetitiveIntelligence.BenchmarkScores;
import com.example.seoagent.model.ContentData;
import com.example.seoagent.model.Level;
import com.example.seoagent.model.SerpData;
import com.example.seoagent.model.TechnicalSeoData;
import com.example.seoagent.model.Timeframe;
import com.example.seoagent.model.UserExperienceData;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Детерминированная арифметика плана: оценки, сроки, быстрые победы и бенчмарки.
 */
public final class PlanScoring {

    static final int DEFAULT_BASE_SCORE = 60;
    static final int POTENTIAL_CAP = 95;
    static final int MAX_HIGHLIGHTS = 5;
    static final String DEFAULT_TIMELINE = "4-6 weeks for full implementation";

    private PlanScoring() {
    }

    /**
     * Базовая оценка; отсутствующая (нулевая) считается равной 60.
     */
    public static int baseScore(BaselineMetrics baseline) {
        return baseline != null && baseline.getSeoScore() > 0 ? baseline.getSeoScore() : DEFAULT_BASE_SCORE;
    }

    /**
     * Каждая положительная оценка завершённого агента усредняется с текущим значением,
     * поэтому результат зависит от порядка агентов.
     */
    public static int overallScore(BaselineMetrics baseline, List<AgentResult> results) {
        double score = baseScore(baseline);
        for (AgentResult result : results) {
            if (result.getStatus() != AnalysisStatus.COMPLETED || result.getData() == null) {
                continue;
            }
            OptionalInt agentScore = result.getData().planScore();
            if (agentScore.isPresent() && agentScore.getAsInt() > 0) {
                score = (score + agentScore.getAsInt()) / 2;
            }
        }
        return (int) Math.round(Math.max(Math.min(score, 100), 0));
    }

    /**
     * +5 за критическую проблему, +15 при покрытии меньше 10 ключевых слов,
     * +20 при мобильной оценке ниже 70. Не выше 95.
     */
    public static int potentialImprovement(int overallScore, BaselineMetrics baseline, List<AgentResult> results) {
        int criticalIssues = dataOf(results, AgentType.TECHNICAL_SEO, TechnicalSeoData.class)
                .map(TechnicalSeoData::getCriticalIssues)
                .orElseGet(() -> baseline != null ? baseline.criticalIssueCount() : 0);
        int keywordCoverage = dataOf(results, AgentType.CONTENT_ANALYSIS, ContentData.class)
                .map(ContentData::getKeywordCoverage)
                .orElseGet(() -> baseline != null ? baseline.keywordsOrEmpty().size() : 0);
        int mobileOptimization = dataOf(results, AgentType.USER_EXPERIENCE, UserExperienceData.class)
                .map(UserExperienceData::getMobileOptimization)
                .orElse(0);

        int gain = criticalIssues * 5;
        if (keywordCoverage < 10) {
            gain += 15;
        }
        if (mobileOptimization < 70) {
            gain += 20;
        }
        return Math.min(overallScore + gain, POTENTIAL_CAP);
    }

    /**
     * Например: "2 immediate actions, 3 this week, 1 next quarter".
     */
    public static String timeline(List<ActionItem> items) {
        Map<Timeframe, Integer> counts = new EnumMap<>(Timeframe.class);
        for (ActionItem item : items) {
            if (item.getTimeframe() != null) {
                counts.merge(item.getTimeframe(), 1, Integer::sum);
            }
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<Timeframe, Integer> entry : counts.entrySet()) {
            parts.add(entry.getValue() + " " + entry.getKey().getLabel());
        }
        return parts.isEmpty() ? DEFAULT_TIMELINE : String.join(", ", parts);
    }

    /**
     * Ближайшие пункты с низкими трудозатратами и влиянием не ниже среднего.
     */
    public static List<String> quickWins(List<ActionItem> items) {
        return items.stream()
                .filter(item -> item.getTimeframe() != null && item.getTimeframe().isNearTerm())
                .filter(item -> item.getEffort() == Level.LOW)
                .filter(item -> item.getImpact() != null && item.getImpact().isAtLeastMedium())
                .map(ActionItem::getTitle)
                .limit(MAX_HIGHLIGHTS)
                .toList();
    }

    /**
     * Долгосрочные пункты с высоким влиянием.
     */
    public static List<String> longTermGoals(List<ActionItem> items) {
        return items.stream()
                .filter(item -> item.getTimeframe() != null && item.getTimeframe().isLongTerm())
                .filter(item -> item.getImpact() == Level.HIGH)
                .map(ActionItem::getTitle)
                .limit(MAX_HIGHLIGHTS)
                .toList();
    }

    public static BenchmarkScores benchmarkScores(BaselineMetrics baseline, List<AgentResult> results) {
        int base = baseScore(baseline);
        int technicalBaseline = baseline != null && baseline.getTechnicalSeo() != null
                ? baseline.getTechnicalSeo().getScore() : 0;
        int content = dataOf(results, AgentType.CONTENT_ANALYSIS, ContentData.class)
                .map(ContentData::getContentScore)
                .filter(score -> score > 0)
                .orElse((int) Math.round(base * 0.85));
        int userExperience = dataOf(results, AgentType.USER_EXPERIENCE, UserExperienceData.class)
                .map(UserExperienceData::getUxScore)
                .filter(score -> score > 0)
                .orElse((int) Math.round(base * 0.8));
        int serpFeatures = dataOf(results, AgentType.SERP_ANALYSIS, SerpData.class)
                .map(SerpData::getSerpFeatures)
                .orElse(0);

        return BenchmarkScores.builder()
                .technical((int) Math.round((technicalBaseline > 0 ? technicalBaseline : base) * 0.9))
                .content(content)
                .userExperience(userExperience)
                .authority(Math.min(base + serpFeatures * 5, 90))
                .build();
    }

    /**
     * Данные агента указанного типа, если он их вычислил.
     */
    static <T extends AgentData> Optional<T> dataOf(List<AgentResult> results, AgentType type, Class<T> dataType) {
        for (AgentResult result : results) {
            if (result.getAgentType() == type && dataType.isInstance(result.getData())) {
                return Optional.of(dataType.cast(result.getData()));
            }
        }
        return Optional.empty();
    }

    static Optional<AgentResult> resultOf(List<AgentResult> results, AgentType type) {
        return results.stream().filter(result -> result.getAgentType() == type).findFirst();
    }
}
