package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordData implements AgentData {
    private int keywordCount;
    private double averageVolume;
    private int highDifficultyCount;

    /**
     * Низкая сложность при заметном объёме
     */
    @Builder.Default
    private List<String> opportunityKeywords = new ArrayList<>();
    private int longTailCount;
}
