package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentData;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.service.insight.ExtractedInsights;
import com.example.seoagent.service.insight.InsightVocabulary;
import com.example.seoagent.service.llm.TextGenerationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Общий конвейер агента: четыре детерминированных этапа над базовыми измерениями,
 * затем один вызов модели, ответ которого разбирается {@link com.example.seoagent.service.insight.InsightExtractor}.
 *
 * @param <D> структурированные данные агента
 */
@Slf4j
public abstract sealed class AbstractAnalysisAgent<D extends AgentData> implements AnalysisAgent
        permits TechnicalSeoAgent, ContentAnalysisAgent, CompetitorIntelligenceAgent,
                KeywordResearchAgent, SerpAnalysisAgent, UserExperienceAgent {

    static final int START_PROGRESS = 10;
    static final int[] STAGE_PROGRESS = {30, 45, 60, 75};
    static final int AI_PROGRESS = 90;
    static final int AI_MAX_TOKENS = 1500;

    protected final BusinessContext context;
    protected final BaselineMetrics baseline;
    private final AgentType type;
    private final AgentDependencies dependencies;

    protected AbstractAnalysisAgent(AgentType type, BusinessContext context, BaselineMetrics baseline,
                                    AgentDependencies dependencies) {
        this.type = type;
        this.context = context != null ? context : new BusinessContext();
        this.baseline = baseline != null ? baseline : new BaselineMetrics();
        this.dependencies = dependencies;
    }

    @Override
    public AgentType type() {
        return type;
    }

    @Override
    public AgentResult analyze(AgentProgressListener listener) {
        AgentResult result = new AgentResult(type);
        result.start(now());
        report(listener, result, START_PROGRESS, "Starting " + type.getValue() + " analysis");
        log.info("Agent {} started", type.getValue());

        try {
            D data = computeData();
            AgentInsights insights = new AgentInsights();

            List<Stage<D>> stages = stages();
            if (stages.size() != STAGE_PROGRESS.length) {
                throw new IllegalStateException("Agent " + type.getValue() + " must declare "
                        + STAGE_PROGRESS.length + " stages, got " + stages.size());
            }
            for (int i = 0; i < stages.size(); i++) {
                Stage<D> stage = stages.get(i);
                stage.action.apply(data, insights);
                report(listener, result, STAGE_PROGRESS[i], stage.name);
            }

            report(listener, result, AI_PROGRESS, "Generating AI insights");
            insights.addAll(generateInsights(data));

            result.complete(insights.getFindings(), insights.getRecommendations(), data, now());
            log.info("Agent {} completed: {} findings, {} recommendations",
                    type.getValue(), result.getFindings().size(), result.getRecommendations().size());
        } catch (Exception e) {
            log.error("Agent {} failed: {}", type.getValue(), e.getMessage(), e);
            result.fail(e.getMessage(), now());
        }

        if (listener != null) {
            listener.onProgress(result.snapshot(), result.getStatus().getValue());
        }
        return result;
    }

    /**
     * Структурированные данные агента. Чистая функция входных данных.
     */
    protected abstract D computeData();

    /**
     * Ровно четыре детерминированных этапа в порядке выполнения.
     */
    protected abstract List<Stage<D>> stages();

    protected abstract String buildPrompt(D data);

    protected abstract InsightVocabulary vocabulary();

    /**
     * Замена выводов модели при ошибке вызова. Пустой результат означает, что агент завершится с ошибкой.
     */
    protected Optional<ExtractedInsights> fallbackInsights(D data) {
        return Optional.empty();
    }

    private ExtractedInsights generateInsights(D data) {
        try {
            String text = dependencies.getTextGenerator().generateText(type.getValue(), buildPrompt(data), AI_MAX_TOKENS);
            return dependencies.getInsightExtractor().extract(text, vocabulary());
        } catch (TextGenerationException e) {
            Optional<ExtractedInsights> fallback = fallbackInsights(data);
            if (fallback.isEmpty()) {
                throw new TextGenerationException("AI analysis failed for " + type.getValue() + ": "
                        + e.getMessage(), e);
            }
            log.warn("AI analysis failed for {}, using fallback insights: {}", type.getValue(), e.getMessage());
            return fallback.get();
        }
    }

    private void report(AgentProgressListener listener, AgentResult result, int progress, String step) {
        if (result.advance(progress) && listener != null) {
            listener.onProgress(result.snapshot(), step);
        }
        log.debug("Agent {}: {}% - {}", type.getValue(), progress, step);
    }

    private Instant now() {
        return dependencies.getClock().instant();
    }

    /**
     * Общая шапка промпта: домен и описание бизнеса.
     */
    protected StringBuilder promptHeader(String task) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(task).append(" for: ").append(orDash(context.getDomain())).append("\n\n");
        prompt.append("Business Context:\n");
        prompt.append("- Type: ").append(orDash(context.getBusinessType())).append("\n");
        prompt.append("- Industry: ").append(orDash(context.getIndustry())).append("\n");
        prompt.append("- Location: ").append(orDash(context.getLocation())).append("\n");
        return prompt;
    }

    /**
     * Общее окончание промпта: формат ответа, который понимает разбор по разделам.
     */
    protected void appendAnswerFormat(StringBuilder prompt, String findingsHeading, String recommendationsHeading) {
        prompt.append("\nProvide:\n");
        prompt.append("1. 5 ").append(findingsHeading).append("\n");
        prompt.append("2. 5 ").append(recommendationsHeading).append("\n\n");
        prompt.append("""
                Answer format:
                - Put each section under its own heading line.
                - List every item on a separate line starting with "- ".
                """);
    }

    protected static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }

    protected static String joinOrDash(List<String> values) {
        return values == null || values.isEmpty() ? "-" : String.join(", ", values);
    }

    protected static String decimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /**
     * Детерминированный этап конвейера.
     */
    protected static final class Stage<D> {
        private final String name;
        private final StageAction<D> action;

        private Stage(String name, StageAction<D> action) {
            this.name = name;
            this.action = action;
        }

        public String getName() {
            return name;
        }
    }

    @FunctionalInterface
    protected interface StageAction<D> {
        void apply(D data, AgentInsights insights);
    }

    protected static <D> Stage<D> stage(String name, StageAction<D> action) {
        return new Stage<>(name, action);
    }
}
