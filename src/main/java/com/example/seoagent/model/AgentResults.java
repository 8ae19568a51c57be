package com.example.seoagent.model;

import java.util.Collection;

/**
 * Сводные показатели по набору результатов агентов.
 */
public final class AgentResults {

    private AgentResults() {
    }

    /**
     * Среднее арифметическое прогресса с округлением; 0 для пустого набора.
     */
    public static int averageProgress(Collection<AgentResult> results) {
        if (results == null || results.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (AgentResult result : results) {
            total += result.getProgress();
        }
        return (int) Math.round(total / results.size());
    }

    /**
     * Любой failed даёт failed, затем любой незавершённый даёт running, иначе completed.
     */
    public static AnalysisStatus combinedStatus(Collection<AgentResult> results) {
        if (results == null || results.isEmpty()) {
            return AnalysisStatus.PENDING;
        }
        boolean unfinished = false;
        for (AgentResult result : results) {
            if (result.getStatus() == AnalysisStatus.FAILED) {
                return AnalysisStatus.FAILED;
            }
            if (!result.isTerminal()) {
                unfinished = true;
            }
        }
        return unfinished ? AnalysisStatus.RUNNING : AnalysisStatus.COMPLETED;
    }
}
