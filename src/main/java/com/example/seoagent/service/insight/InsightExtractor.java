package com.example.seoagent.service.insight;

/**
 * Превращает свободный текст модели в списки выводов и рекомендаций.
 */
public interface InsightExtractor {

    ExtractedInsights extract(String text, InsightVocabulary vocabulary);
}
