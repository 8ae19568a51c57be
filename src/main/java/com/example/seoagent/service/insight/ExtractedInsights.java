package com.example.seoagent.service.insight;

import lombok.Value;

import java.util.List;

/**
 * Выводы и рекомендации, извлечённые из текста модели, в порядке появления.
 */
@Value
public class ExtractedInsights {
    List<String> findings;
    List<String> recommendations;

    public static ExtractedInsights empty() {
        return new ExtractedInsights(List.of(), List.of());
    }
}
