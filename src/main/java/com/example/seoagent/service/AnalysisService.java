package com.example.seoagent.service;

import com.example.seoagent.dto.AnalysisRequest;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.ComprehensiveAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Управляет жизненным циклом прогонов анализа.
 */
@Slf4j
@Service
public class AnalysisService {

    private final AnalysisRunStore runStore;
    private final AnalysisWorkflow workflow;
    private final TaskExecutor analysisExecutor;
    private final Clock clock;

    public AnalysisService(AnalysisRunStore runStore,
                           AnalysisWorkflow workflow,
                           @Qualifier("analysisExecutor") TaskExecutor analysisExecutor,
                           Clock clock) {
        this.runStore = runStore;
        this.workflow = workflow;
        this.analysisExecutor = analysisExecutor;
        this.clock = clock;
    }

    /**
     * Регистрирует прогон и запускает его асинхронно.
     *
     * @param request контекст бизнеса и базовые метрики
     * @return ID прогона
     */
    public String startAnalysis(AnalysisRequest request) {
        String runId = request.getRunId() != null && !request.getRunId().isBlank()
                ? request.getRunId()
                : UUID.randomUUID().toString();

        BusinessContext context = request.getBusinessContext();
        ComprehensiveAnalysis analysis = runStore.create(runId, context.getDomain(), request.getBaseline());
        log.info("Analysis {} registered for {}", runId, context.getDomain());

        analysisExecutor.execute(() -> runAnalysis(analysis, context, request.getBaseline()));
        return runId;
    }

    public Optional<ComprehensiveAnalysis> getAnalysis(String runId) {
        return runStore.get(runId);
    }

    void runAnalysis(ComprehensiveAnalysis analysis, BusinessContext context, BaselineMetrics baseline) {
        analysis.markStarted();
        try {
            workflow.run(analysis, context, baseline);
        } catch (Exception e) {
            log.error("Analysis {} failed: {}", analysis.getId(), e.getMessage(), e);
            analysis.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), clock.instant());
        }
    }
}
