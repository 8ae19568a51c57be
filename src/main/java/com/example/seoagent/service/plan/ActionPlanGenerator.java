package com.example.seoagent.service.plan;

import com.example.seoagent.metrics.AnalysisMetrics;
import com.example.seoagent.model.ActionItem;
import com.example.seoagent.model.ActionPlan;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AnalysisStatus;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.CompetitiveIntelligence;
import com.example.seoagent.model.ContentStrategy;
import com.example.seoagent.model.ProgressTracking;
import com.example.seoagent.service.llm.TextGenerationException;
import com.example.seoagent.service.llm.TextGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Сводит результаты агентов в план действий, конкурентный анализ,
 * контент-стратегию и план отслеживания прогресса.
 */
@Slf4j
@Service
public class ActionPlanGenerator {

    static final String ACTION_ITEMS_SECTION = "action_items";
    static final String SUMMARY_SECTION = "summary";
    static final int ACTION_ITEMS_MAX_TOKENS = 3000;
    static final int SUMMARY_MAX_TOKENS = 200;

    private final TextGenerator textGenerator;
    private final PlanPromptBuilder promptBuilder;
    private final ActionItemParser actionItemParser;
    private final FallbackPlanContent fallback;
    private final CompetitiveIntelligenceGenerator competitiveIntelligenceGenerator;
    private final ContentStrategyGenerator contentStrategyGenerator;
    private final ProgressTrackingBuilder progressTrackingBuilder;
    private final AnalysisMetrics analysisMetrics;
    private final Executor agentExecutor;

    public ActionPlanGenerator(TextGenerator textGenerator,
                               PlanPromptBuilder promptBuilder,
                               ActionItemParser actionItemParser,
                               FallbackPlanContent fallback,
                               CompetitiveIntelligenceGenerator competitiveIntelligenceGenerator,
                               ContentStrategyGenerator contentStrategyGenerator,
                               ProgressTrackingBuilder progressTrackingBuilder,
                               AnalysisMetrics analysisMetrics,
                               @Qualifier("agentExecutor") Executor agentExecutor) {
        this.textGenerator = textGenerator;
        this.promptBuilder = promptBuilder;
        this.actionItemParser = actionItemParser;
        this.fallback = fallback;
        this.competitiveIntelligenceGenerator = competitiveIntelligenceGenerator;
        this.contentStrategyGenerator = contentStrategyGenerator;
        this.progressTrackingBuilder = progressTrackingBuilder;
        this.analysisMetrics = analysisMetrics;
        this.agentExecutor = agentExecutor;
    }

    /**
     * Строит все разделы. План, конкурентный анализ и контент-стратегия
     * генерируются параллельно, отслеживание прогресса строится по готовому плану.
     */
    public PlanSynthesis synthesize(BusinessContext context, BaselineMetrics baseline, List<AgentResult> results) {
        log.info("Synthesizing action plan for {} from {} agent results", context.getDomain(), results.size());

        CompletableFuture<ActionPlan> planFuture = CompletableFuture.supplyAsync(
                () -> actionPlan(context, baseline, results), agentExecutor);
        CompletableFuture<CompetitiveIntelligence> intelligenceFuture = CompletableFuture.supplyAsync(
                () -> competitiveIntelligence(context, baseline, results), agentExecutor);
        CompletableFuture<ContentStrategy> strategyFuture = CompletableFuture.supplyAsync(
                () -> contentStrategy(context, baseline, results), agentExecutor);

        CompletableFuture.allOf(planFuture, intelligenceFuture, strategyFuture).join();

        ActionPlan plan = planFuture.join();
        ProgressTracking tracking = progressTracking(plan.getItems(), baseline);

        log.info("Action plan ready for {}: {} items, score {} -> {}",
                context.getDomain(), plan.getItems().size(), plan.getOverallScore(), plan.getPotentialImprovement());
        return new PlanSynthesis(plan, intelligenceFuture.join(), strategyFuture.join(), tracking);
    }

    public ActionPlan actionPlan(BusinessContext context, BaselineMetrics baseline, List<AgentResult> results) {
        List<ActionItem> items = actionItems(context, baseline, results);
        int overallScore = PlanScoring.overallScore(baseline, results);
        int potentialImprovement = PlanScoring.potentialImprovement(overallScore, baseline, results);

        return ActionPlan.builder()
                .summary(summary(context, items, overallScore, potentialImprovement))
                .overallScore(overallScore)
                .potentialImprovement(potentialImprovement)
                .timeline(PlanScoring.timeline(items))
                .items(items)
                .quickWins(PlanScoring.quickWins(items))
                .longTermGoals(PlanScoring.longTermGoals(items))
                .build();
    }

    /**
     * Пункты плана от модели по выводам успешных агентов.
     * При ошибке генерации или разбора возвращает пять заготовленных пунктов.
     */
    public List<ActionItem> actionItems(BusinessContext context, BaselineMetrics baseline, List<AgentResult> results) {
        List<String> findings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        for (AgentResult result : results) {
            if (result.getStatus() == AnalysisStatus.COMPLETED) {
                findings.addAll(result.getFindings());
                recommendations.addAll(result.getRecommendations());
            }
        }

        try {
            String response = textGenerator.generateText(ACTION_ITEMS_SECTION,
                    promptBuilder.actionItemsPrompt(context, baseline, findings, recommendations),
                    ACTION_ITEMS_MAX_TOKENS);
            return actionItemParser.parse(response);
        } catch (TextGenerationException | SynthesisParseException e) {
            log.warn("Action item generation failed, using fallback plan: {}", e.getMessage());
            analysisMetrics.recordSynthesisFallback(ACTION_ITEMS_SECTION);
            return fallback.actionItems();
        }
    }

    public String summary(BusinessContext context, List<ActionItem> items, int overallScore, int potentialImprovement) {
        try {
            String summary = textGenerator.generateText(SUMMARY_SECTION,
                    promptBuilder.summaryPrompt(context, items, overallScore, potentialImprovement),
                    SUMMARY_MAX_TOKENS);
            return summary.trim();
        } catch (TextGenerationException e) {
            log.warn("Summary generation failed, using fallback: {}", e.getMessage());
            analysisMetrics.recordSynthesisFallback(SUMMARY_SECTION);
            return fallback.summary(overallScore, potentialImprovement, items.size());
        }
    }

    public CompetitiveIntelligence competitiveIntelligence(BusinessContext context, BaselineMetrics baseline,
                                                           List<AgentResult> results) {
        return competitiveIntelligenceGenerator.generate(context, baseline, results);
    }

    public ContentStrategy contentStrategy(BusinessContext context, BaselineMetrics baseline,
                                           List<AgentResult> results) {
        return contentStrategyGenerator.generate(context, baseline, results);
    }

    public ProgressTracking progressTracking(List<ActionItem> items, BaselineMetrics baseline) {
        return progressTrackingBuilder.build(items, baseline);
    }

    public int overallScore(BaselineMetrics baseline, List<AgentResult> results) {
        return PlanScoring.overallScore(baseline, results);
    }

    public int potentialImprovement(int overallScore, BaselineMetrics baseline, List<AgentResult> results) {
        return PlanScoring.potentialImprovement(overallScore, baseline, results);
    }
}
