package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Конкурентный анализ.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetitiveIntelligence {
    private String marketPosition;

    @Builder.Default
    private List<String> competitiveAdvantages = new ArrayList<>();

    @Builder.Default
    private List<String> competitiveGaps = new ArrayList<>();

    @Builder.Default
    private List<String> opportunityAreas = new ArrayList<>();

    private BenchmarkScores benchmarkScores;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BenchmarkScores {
        private int content;
        private int technical;
        private int authority;
        private int userExperience;
    }
}
