package com.example.seoagent.service.insight;

import java.util.List;
import java.util.Locale;

/**
 * Слова-заголовки, переключающие активный раздел при разборе текста модели.
 */
public final class InsightVocabulary {

    private final List<String> findingWords;
    private final List<String> recommendationWords;

    private InsightVocabulary(List<String> findingWords, List<String> recommendationWords) {
        this.findingWords = normalize(findingWords);
        this.recommendationWords = normalize(recommendationWords);
    }

    public static InsightVocabulary of(List<String> findingWords, List<String> recommendationWords) {
        return new InsightVocabulary(findingWords, recommendationWords);
    }

    public List<String> getFindingWords() {
        return findingWords;
    }

    public List<String> getRecommendationWords() {
        return recommendationWords;
    }

    boolean isFindingHeader(String lowerCaseLine) {
        return containsAny(lowerCaseLine, findingWords);
    }

    boolean isRecommendationHeader(String lowerCaseLine) {
        return containsAny(lowerCaseLine, recommendationWords);
    }

    private static boolean containsAny(String line, List<String> words) {
        for (String word : words) {
            if (line.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(List<String> words) {
        return words.stream()
                .map(word -> word.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public String toString() {
        return "InsightVocabulary{findings=" + findingWords + ", recommendations=" + recommendationWords + "}";
    }
}
