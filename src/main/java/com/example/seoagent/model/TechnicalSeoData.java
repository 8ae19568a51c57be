package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.OptionalInt;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechnicalSeoData implements AgentData {
    /**
     * Взвешенная итоговая техническая оценка
     */
    private int technicalScore;
    private int baselineTechnicalScore;
    private int criticalIssues;
    private String pageSpeedGrade;
    private int coreWebVitalsScore;
    private int securityScore;
    private int accessibilityScore;
    private int schemaMarkupScore;

    @Override
    public OptionalInt planScore() {
        return OptionalInt.of(technicalScore);
    }
}
