package com.example.seoagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Результат одного агента. Статус меняется только вперёд: pending, running, затем completed или failed.
 * Прогресс не убывает, пока агент работает, и сбрасывается в 0 при ошибке.
 */
@Getter
public class AgentResult {
    /**
     * Максимальное количество выводов и рекомендаций
     */
    public static final int MAX_INSIGHTS = 12;

    private final AgentType agentType;
    private volatile AnalysisStatus status;
    private volatile int progress;
    private volatile List<String> findings;
    private volatile List<String> recommendations;
    private volatile AgentData data;
    private volatile String error;
    private volatile Instant startTime;
    private volatile Instant endTime;

    public AgentResult(AgentType agentType) {
        this.agentType = agentType;
        this.status = AnalysisStatus.PENDING;
        this.findings = List.of();
        this.recommendations = List.of();
    }

    private AgentResult(AgentResult source) {
        this.agentType = source.agentType;
        this.status = source.status;
        this.progress = source.progress;
        this.findings = source.findings;
        this.recommendations = source.recommendations;
        this.data = source.data;
        this.error = source.error;
        this.startTime = source.startTime;
        this.endTime = source.endTime;
    }

    /**
     * Переводит результат из pending в running.
     */
    public synchronized boolean start(Instant now) {
        if (status != AnalysisStatus.PENDING) {
            return false;
        }
        status = AnalysisStatus.RUNNING;
        startTime = now;
        return true;
    }

    /**
     * Поднимает прогресс работающего агента. Меньшие значения игнорируются.
     */
    public synchronized boolean advance(int value) {
        int bounded = Math.max(0, Math.min(value, 100));
        if (status != AnalysisStatus.RUNNING || bounded <= progress) {
            return false;
        }
        progress = bounded;
        return true;
    }

    public synchronized boolean complete(List<String> findings, List<String> recommendations,
                                         AgentData data, Instant now) {
        if (status != AnalysisStatus.RUNNING) {
            return false;
        }
        this.findings = cap(findings);
        this.recommendations = cap(recommendations);
        this.data = data;
        this.progress = 100;
        this.endTime = now;
        this.status = AnalysisStatus.COMPLETED;
        return true;
    }

    public synchronized boolean fail(String error, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        if (startTime == null) {
            startTime = now;
        }
        this.error = error != null ? error : "Unknown error";
        this.progress = 0;
        this.endTime = now;
        this.status = AnalysisStatus.FAILED;
        return true;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Согласованная копия для опрашивающих клиентов.
     */
    public synchronized AgentResult snapshot() {
        return new AgentResult(this);
    }

    private static List<String> cap(List<String> items) {
        if (items == null) {
            return List.of();
        }
        return List.copyOf(items.subList(0, Math.min(items.size(), MAX_INSIGHTS)));
    }
}
