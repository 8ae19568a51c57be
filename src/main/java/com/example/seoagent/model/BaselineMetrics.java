package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Базовые измерения сайта, полученные до запуска агентов. Только для чтения.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineMetrics {
    /**
     * Общая оценка SEO (0-100)
     */
    private int seoScore;

    @Builder.Default
    private TechnicalSeo technicalSeo = new TechnicalSeo();

    @Builder.Default
    private PageSpeed pageSpeed = new PageSpeed();

    @Builder.Default
    private List<KeywordMetric> keywords = new ArrayList<>();

    @Builder.Default
    private List<Competitor> competitors = new ArrayList<>();

    @Builder.Default
    private SerpPresence serpPresence = new SerpPresence();

    @Builder.Default
    private MarketPosition marketPosition = new MarketPosition();

    public List<KeywordMetric> keywordsOrEmpty() {
        return keywords != null ? keywords : List.of();
    }

    public List<Competitor> competitorsOrEmpty() {
        return competitors != null ? competitors : List.of();
    }

    public List<TechnicalIssue> issuesOrEmpty() {
        return technicalSeo != null && technicalSeo.getIssues() != null ? technicalSeo.getIssues() : List.of();
    }

    /**
     * Количество технических проблем с высоким влиянием
     */
    public int criticalIssueCount() {
        return (int) issuesOrEmpty().stream()
                .filter(issue -> "high".equalsIgnoreCase(issue.getImpact()))
                .count();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TechnicalSeo {
        private int score;

        @Builder.Default
        private List<TechnicalIssue> issues = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TechnicalIssue {
        private String title;
        private String description;

        /**
         * Влияние: high, medium, low
         */
        private String impact;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PageSpeed {
        private int mobile;
        private int desktop;

        /**
         * Секунды
         */
        private double firstContentfulPaint;

        /**
         * Секунды
         */
        private double largestContentfulPaint;

        private double cumulativeLayoutShift;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeywordMetric {
        private String keyword;
        private int volume;

        /**
         * Сложность: high, medium, low
         */
        private String difficulty;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Competitor {
        private String name;
        private int score;
        private int ranking;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SerpPresence {
        @Builder.Default
        private List<String> organicResults = new ArrayList<>();

        @Builder.Default
        private SerpFeature mapsResults = new SerpFeature();

        @Builder.Default
        private SerpFeature featuredSnippets = new SerpFeature();

        @Builder.Default
        private SerpFeature knowledgePanel = new SerpFeature();

        @Builder.Default
        private SerpFeature newsResults = new SerpFeature();

        @Builder.Default
        private SerpFeature videoResults = new SerpFeature();

        @Builder.Default
        private SerpFeature imagesResults = new SerpFeature();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SerpFeature {
        private boolean found;

        public static boolean present(SerpFeature feature) {
            return feature != null && feature.isFound();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MarketPosition {
        private int rank;
        private int totalCompetitors;
    }
}
