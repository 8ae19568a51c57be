package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Вехи и ключевые показатели для отслеживания выполнения плана.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressTracking {
    @Builder.Default
    private List<Milestone> milestones = new ArrayList<>();

    @Builder.Default
    private List<Kpi> kpis = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Milestone {
        private String title;
        private LocalDate dueDate;
        private MilestoneStatus status;

        @Builder.Default
        private List<String> actionItemIds = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Kpi {
        private String metric;
        private int current;
        private int target;
        private String timeframe;
    }
}
