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
public class UserExperienceData implements AgentData {
    private int uxScore;

    /**
     * Мобильная оценка скорости
     */
    private int mobileOptimization;
    private int desktopScore;
    private String coreWebVitalsGrade;

    @Override
    public OptionalInt planScore() {
        return OptionalInt.of(uxScore);
    }
}
