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
public class SerpData implements AgentData {
    private int organicListings;

    /**
     * Сколько из шести SERP-функций найдено
     */
    private int serpFeatures;
    private boolean localPresence;

    @Builder.Default
    private List<String> missingFeatures = new ArrayList<>();
    private int visibilityScore;
}
