package com.example.seoagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Контент-стратегия: пробелы, кластеры тем и календарь публикаций.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentStrategy {
    @Builder.Default
    private List<String> contentGaps = new ArrayList<>();

    @Builder.Default
    private List<TopicCluster> topicClusters = new ArrayList<>();

    @Builder.Default
    private List<CalendarEntry> contentCalendar = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopicCluster {
        private String topic;

        @Builder.Default
        private List<String> keywords = new ArrayList<>();
        private Level priority;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CalendarEntry {
        private String week;
        private String contentType;
        private String topic;
        private String targetKeyword;
    }
}
