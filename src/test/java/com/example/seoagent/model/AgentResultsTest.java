package com.example.seoagent.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AgentResultsTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void shouldReturnDefaultsForEmptyInput() {
        assertEquals(0, AgentResults.averageProgress(List.of()));
        assertEquals(AnalysisStatus.PENDING, AgentResults.combinedStatus(List.of()));
    }

    @Test
    void shouldRoundAverageProgress() {
        // 100 + 0 + 0 -> 33
        List<AgentResult> results = List.of(
                completed(AgentType.TECHNICAL_SEO),
                new AgentResult(AgentType.CONTENT_ANALYSIS),
                new AgentResult(AgentType.SERP_ANALYSIS));

        assertEquals(33, AgentResults.averageProgress(results));
        assertEquals(AnalysisStatus.RUNNING, AgentResults.combinedStatus(results));
    }

    @Test
    void shouldPreferFailedOverRunning() {
        AgentResult failed = new AgentResult(AgentType.CONTENT_ANALYSIS);
        failed.fail("error", NOW);

        List<AgentResult> results = List.of(failed, new AgentResult(AgentType.SERP_ANALYSIS));

        assertEquals(AnalysisStatus.FAILED, AgentResults.combinedStatus(results));
    }

    @Test
    void shouldBeCompletedWhenAllCompleted() {
        List<AgentResult> results = List.of(completed(AgentType.TECHNICAL_SEO), completed(AgentType.USER_EXPERIENCE));

        assertEquals(AnalysisStatus.COMPLETED, AgentResults.combinedStatus(results));
        assertEquals(100, AgentResults.averageProgress(results));
    }

    private static AgentResult completed(AgentType type) {
        AgentResult result = new AgentResult(type);
        result.start(NOW);
        result.complete(List.of(), List.of(), null, NOW);
        return result;
    }
}
