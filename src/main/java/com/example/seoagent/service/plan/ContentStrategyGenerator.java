package com.example.seoagent.service.plan;

import com.example.seoagent.metrics.AnalysisMetrics;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.ContentStrategy;
import com.example.seoagent.model.ContentStrategy.CalendarEntry;
import com.example.seoagent.model.ContentStrategy.TopicCluster;
import com.example.seoagent.model.Level;
import com.example.seoagent.model.ValueEnum;
import com.example.seoagent.service.llm.TextGenerationException;
import com.example.seoagent.service.llm.TextGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Контент-стратегия от модели. Пустые разделы ответа берутся из детерминированной стратегии.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentStrategyGenerator {

    static final String SECTION = "content_strategy";
    static final int MAX_TOKENS = 1200;

    private final TextGenerator textGenerator;
    private final PlanPromptBuilder promptBuilder;
    private final JsonResponseReader jsonReader;
    private final FallbackPlanContent fallback;
    private final AnalysisMetrics analysisMetrics;

    public ContentStrategy generate(BusinessContext context, BaselineMetrics baseline, List<AgentResult> results) {
        AgentResult contentResult = PlanScoring.resultOf(results, AgentType.CONTENT_ANALYSIS).orElse(null);
        ContentStrategy defaults = fallback.contentStrategy(context);

        try {
            String response = textGenerator.generateText(SECTION,
                    promptBuilder.contentStrategyPrompt(context, baseline, contentResult), MAX_TOKENS);
            JsonNode node = jsonReader.readObject(response);

            List<String> gaps = JsonResponseReader.stringList(node, "contentGaps");
            List<TopicCluster> clusters = clusters(node.get("topicClusters"));
            List<CalendarEntry> calendar = calendar(node.get("contentCalendar"));
            if ((gaps == null || gaps.isEmpty()) && clusters.isEmpty() && calendar.isEmpty()) {
                throw new SynthesisParseException("Content strategy response has no usable sections");
            }

            return ContentStrategy.builder()
                    .contentGaps(gaps == null || gaps.isEmpty() ? defaults.getContentGaps() : gaps)
                    .topicClusters(clusters.isEmpty() ? defaults.getTopicClusters() : clusters)
                    .contentCalendar(calendar.isEmpty() ? defaults.getContentCalendar() : calendar)
                    .build();
        } catch (TextGenerationException | SynthesisParseException e) {
            log.warn("Content strategy generation failed, using fallback: {}", e.getMessage());
            analysisMetrics.recordSynthesisFallback(SECTION);
            return defaults;
        }
    }

    private static List<TopicCluster> clusters(JsonNode array) {
        List<TopicCluster> clusters = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return clusters;
        }
        for (JsonNode node : array) {
            String topic = node.isObject() ? JsonResponseReader.text(node, "topic") : null;
            if (topic == null) {
                continue;
            }
            List<String> keywords = JsonResponseReader.stringList(node, "keywords");
            clusters.add(TopicCluster.builder()
                    .topic(topic)
                    .keywords(keywords != null ? keywords : new ArrayList<>())
                    .priority(ValueEnum.fromValue(Level.class, JsonResponseReader.text(node, "priority"))
                            .orElse(Level.MEDIUM))
                    .build());
        }
        return clusters;
    }

    private static List<CalendarEntry> calendar(JsonNode array) {
        List<CalendarEntry> entries = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return entries;
        }
        for (JsonNode node : array) {
            if (!node.isObject()) {
                continue;
            }
            String week = JsonResponseReader.text(node, "week");
            entries.add(new CalendarEntry(
                    week != null ? week : "Week " + (entries.size() + 1),
                    JsonResponseReader.text(node, "contentType"),
                    JsonResponseReader.text(node, "topic"),
                    JsonResponseReader.text(node, "targetKeyword")));
        }
        return entries;
    }
}
