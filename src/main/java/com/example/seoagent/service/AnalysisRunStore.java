package com.example.seoagent.service;

import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.ComprehensiveAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Хранилище прогонов анализа.
 */
@Service
@RequiredArgsConstructor
public class AnalysisRunStore {
    private final Map<String, ComprehensiveAnalysis> runs = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Регистрирует новый прогон в статусе pending.
     *
     * @throws IllegalStateException если прогон с таким ID уже есть
     */
    public ComprehensiveAnalysis create(String runId, String domain, BaselineMetrics baseline) {
        ComprehensiveAnalysis analysis = new ComprehensiveAnalysis(runId, domain, baseline, clock.instant());
        if (runs.putIfAbsent(runId, analysis) != null) {
            throw new IllegalStateException("Analysis already exists: " + runId);
        }
        return analysis;
    }

    public Optional<ComprehensiveAnalysis> get(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }
}
