package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetitorData implements AgentData {
    private int competitorCount;
    private double averageCompetitorScore;
    private int marketRank;
    private int totalCompetitors;

    /**
     * Оценка доли рынка в процентах
     */
    private int estimatedMarketShare;

    /**
     * Strong, Competitive, Needs Improvement или Unknown
     */
    private String competitiveStrength;

    /**
     * Отставание от лидера по SEO-оценке (0, если сайт лидирует)
     */
    private int leaderGap;
}
