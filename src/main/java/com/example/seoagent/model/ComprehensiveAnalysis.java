package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Корневой объект прогона анализа, который отдаётся опрашивающим клиентам.
 * Статус и прогресс вычисляются из результатов агентов.
 */
@Getter
public class ComprehensiveAnalysis {
    /**
     * Прогресс до прикрепления плана не поднимается выше этого значения
     */
    public static final int MAX_PROGRESS_BEFORE_SYNTHESIS = 95;

    private final String id;
    private final String domain;
    private final Instant createdAt;
    private final BaselineMetrics basicAnalysis;

    @Getter(AccessLevel.NONE)
    private final Map<AgentType, AgentResult> agentResults = new ConcurrentHashMap<>();

    private volatile Instant completedAt;
    private volatile ActionPlan actionPlan;
    private volatile CompetitiveIntelligence competitiveIntelligence;
    private volatile ContentStrategy contentStrategy;
    private volatile ProgressTracking progressTracking;

    /**
     * Причина сбоя всего прогона, если он не дошёл до синтеза
     */
    private volatile String error;

    @Getter(AccessLevel.NONE)
    private volatile boolean started;

    @Getter(AccessLevel.NONE)
    private volatile AnalysisStatus finalStatus;

    public ComprehensiveAnalysis(String id, String domain, BaselineMetrics basicAnalysis, Instant createdAt) {
        this.id = id;
        this.domain = domain;
        this.basicAnalysis = basicAnalysis;
        this.createdAt = createdAt;
        for (AgentType type : AgentType.values()) {
            agentResults.put(type, new AgentResult(type));
        }
    }

    public void markStarted() {
        started = true;
    }

    /**
     * Сохраняет свежий снимок результата агента. Завершённый результат больше не заменяется.
     */
    public void updateAgent(AgentResult result) {
        agentResults.compute(result.getAgentType(),
                (type, existing) -> existing != null && existing.isTerminal() ? existing : result);
    }

    /**
     * Прикрепляет результаты синтеза и фиксирует итоговый статус.
     */
    public synchronized void complete(ActionPlan actionPlan,
                                      CompetitiveIntelligence competitiveIntelligence,
                                      ContentStrategy contentStrategy,
                                      ProgressTracking progressTracking,
                                      Instant now) {
        if (finalStatus != null) {
            return;
        }
        this.actionPlan = actionPlan;
        this.competitiveIntelligence = competitiveIntelligence;
        this.contentStrategy = contentStrategy;
        this.progressTracking = progressTracking;
        this.completedAt = now;
        this.finalStatus = AgentResults.combinedStatus(agentResults.values());
    }

    public synchronized void fail(String error, Instant now) {
        if (finalStatus != null) {
            return;
        }
        this.error = error;
        this.completedAt = now;
        this.finalStatus = AnalysisStatus.FAILED;
    }

    public AnalysisStatus getStatus() {
        AnalysisStatus status = finalStatus;
        if (status != null) {
            return status;
        }
        return started ? AnalysisStatus.RUNNING : AnalysisStatus.PENDING;
    }

    public int getProgress() {
        int progress = AgentResults.averageProgress(agentResults.values());
        return finalStatus != null ? progress : Math.min(progress, MAX_PROGRESS_BEFORE_SYNTHESIS);
    }

    /**
     * Результаты агентов в порядке типов.
     */
    public List<AgentResult> getAgentResults() {
        List<AgentResult> ordered = new ArrayList<>(agentResults.values());
        ordered.sort(Comparator.comparing(AgentResult::getAgentType));
        return ordered;
    }

    public AgentResult getAgentResult(AgentType type) {
        return agentResults.get(type);
    }

    @JsonIgnore
    public boolean isFinished() {
        return finalStatus != null;
    }
}
