package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Итоговый план действий.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionPlan {
    private String summary;

    /**
     * Текущая оценка 0-100
     */
    private int overallScore;

    /**
     * Достижимая оценка, не выше 95
     */
    private int potentialImprovement;
    private String timeline;

    @Builder.Default
    private List<ActionItem> items = new ArrayList<>();

    /**
     * Не более пяти заголовков
     */
    @Builder.Default
    private List<String> quickWins = new ArrayList<>();

    @Builder.Default
    private List<String> longTermGoals = new ArrayList<>();
}
