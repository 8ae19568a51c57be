package com.example.seoagent.service.plan;

import com.example.seoagent.metrics.AnalysisMetrics;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.CompetitiveIntelligence;
import com.example.seoagent.model.CompetitiveIntelligence.BenchmarkScores;
import com.example.seoagent.service.llm.TextGenerationException;
import com.example.seoagent.service.llm.TextGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Конкурентный анализ: позиционирование от модели, бенчмарки всегда детерминированные.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompetitiveIntelligenceGenerator {

    static final String SECTION = "competitive_intelligence";
    static final int MAX_TOKENS = 800;
    static final String DEFAULT_MARKET_POSITION = "Middle tier competitor";

    private final TextGenerator textGenerator;
    private final PlanPromptBuilder promptBuilder;
    private final JsonResponseReader jsonReader;
    private final FallbackPlanContent fallback;
    private final AnalysisMetrics analysisMetrics;

    public CompetitiveIntelligence generate(BusinessContext context, BaselineMetrics baseline,
                                            List<AgentResult> results) {
        BenchmarkScores benchmarkScores = PlanScoring.benchmarkScores(baseline, results);
        AgentResult competitorResult = PlanScoring.resultOf(results, AgentType.COMPETITOR_INTELLIGENCE).orElse(null);

        try {
            String response = textGenerator.generateText(SECTION,
                    promptBuilder.competitiveIntelligencePrompt(context, baseline, competitorResult), MAX_TOKENS);
            JsonNode node = jsonReader.readObject(response);

            String marketPosition = JsonResponseReader.text(node, "marketPosition");
            return CompetitiveIntelligence.builder()
                    .marketPosition(marketPosition != null ? marketPosition : DEFAULT_MARKET_POSITION)
                    .competitiveAdvantages(listOrDefault(node, "competitiveAdvantages", FallbackPlanContent.DEFAULT_ADVANTAGES))
                    .competitiveGaps(listOrDefault(node, "competitiveGaps", FallbackPlanContent.DEFAULT_GAPS))
                    .opportunityAreas(listOrDefault(node, "opportunityAreas", FallbackPlanContent.DEFAULT_OPPORTUNITIES))
                    .benchmarkScores(benchmarkScores)
                    .build();
        } catch (TextGenerationException | SynthesisParseException e) {
            log.warn("Competitive intelligence generation failed, using fallback: {}", e.getMessage());
            analysisMetrics.recordSynthesisFallback(SECTION);
            return fallback.competitiveIntelligence(context, benchmarkScores);
        }
    }

    private static List<String> listOrDefault(JsonNode node, String field, List<String> defaults) {
        List<String> values = JsonResponseReader.stringList(node, field);
        return values == null || values.isEmpty() ? new ArrayList<>(defaults) : values;
    }
}
