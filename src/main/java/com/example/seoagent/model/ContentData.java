package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentData implements AgentData {
    private int contentScore;

    /**
     * Количество ключевых слов в базовых измерениях
     */
    private int keywordCoverage;
    private int offeringsCount;

    /**
     * Ключевые слова бизнеса, для которых нет позиций
     */
    @Builder.Default
    private List<String> uncoveredKeywords = new ArrayList<>();
    private String industry;

    @Override
    public OptionalInt planScore() {
        return OptionalInt.of(contentScore);
    }
}
