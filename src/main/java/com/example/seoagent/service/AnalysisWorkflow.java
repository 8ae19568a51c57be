package com.example.seoagent.service;

import com.example.seoagent.metrics.AnalysisMetrics;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.ComprehensiveAnalysis;
import com.example.seoagent.service.coordinator.MultiAgentCoordinator;
import com.example.seoagent.service.plan.ActionPlanGenerator;
import com.example.seoagent.service.plan.PlanSynthesis;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Основной workflow анализа: агенты, затем синтез плана.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisWorkflow {
    private final MultiAgentCoordinator coordinator;
    private final ActionPlanGenerator actionPlanGenerator;
    private final AnalysisMetrics analysisMetrics;
    private final Clock clock;

    public void run(ComprehensiveAnalysis analysis, BusinessContext context, BaselineMetrics baseline) {
        Timer.Sample totalSample = analysisMetrics.startTimer();
        analysisMetrics.incrementActiveRuns();

        try {
            // 1. Агенты
            Timer.Sample agentsSample = analysisMetrics.startTimer();
            List<AgentResult> results = coordinator.runAll(context, baseline, (snapshot, step) -> {
                analysis.updateAgent(snapshot);
                log.debug("Run {}: agent {} at {}% ({})",
                        analysis.getId(), snapshot.getAgentType().getValue(), snapshot.getProgress(), step);
            });
            results.forEach(analysis::updateAgent);
            results.forEach(analysisMetrics::recordAgent);
            analysisMetrics.recordStepDuration(agentsSample, "agents");

            // 2. Синтез плана
            Timer.Sample synthesisSample = analysisMetrics.startTimer();
            PlanSynthesis synthesis = actionPlanGenerator.synthesize(context, baseline, results);
            analysisMetrics.recordStepDuration(synthesisSample, "synthesis");

            analysis.complete(synthesis.getActionPlan(), synthesis.getCompetitiveIntelligence(),
                    synthesis.getContentStrategy(), synthesis.getProgressTracking(), clock.instant());

            analysisMetrics.recordCompleted();
            log.info("Run {} finished with status {}", analysis.getId(), analysis.getStatus().getValue());
        } catch (RuntimeException e) {
            analysisMetrics.recordFailed();
            throw e;
        } finally {
            analysisMetrics.decrementActiveRuns();
            analysisMetrics.recordTotalDuration(totalSample);
        }
    }
}
