package com.example.seoagent.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComprehensiveAnalysisTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void shouldInitialiseOnePendingResultPerAgent() {
        ComprehensiveAnalysis analysis = new ComprehensiveAnalysis("run-1", "example.com", null, NOW);

        assertEquals(AgentType.values().length, analysis.getAgentResults().size());
        assertTrue(analysis.getAgentResults().stream().allMatch(r -> r.getStatus() == AnalysisStatus.PENDING));
        assertEquals(AnalysisStatus.PENDING, analysis.getStatus());
        assertEquals(0, analysis.getProgress());
    }

    @Test
    void shouldStayRunningUntilSynthesisIsAttached() {
        // Given
        ComprehensiveAnalysis analysis = new ComprehensiveAnalysis("run-1", "example.com", null, NOW);
        analysis.markStarted();

        // When
        for (AgentType type : AgentType.values()) {
            analysis.updateAgent(completed(type));
        }

        // Then
        assertEquals(AnalysisStatus.RUNNING, analysis.getStatus());
        assertEquals(ComprehensiveAnalysis.MAX_PROGRESS_BEFORE_SYNTHESIS, analysis.getProgress());
        assertNull(analysis.getActionPlan());

        analysis.complete(new ActionPlan(), null, null, null, NOW);
        assertEquals(AnalysisStatus.COMPLETED, analysis.getStatus());
        assertEquals(100, analysis.getProgress());
    }

    @Test
    void shouldReportFailedWhenAnyAgentFailed() {
        ComprehensiveAnalysis analysis = new ComprehensiveAnalysis("run-1", "example.com", null, NOW);
        analysis.markStarted();
        for (AgentType type : AgentType.values()) {
            AgentResult result = type == AgentType.CONTENT_ANALYSIS ? failed(type) : completed(type);
            analysis.updateAgent(result);
        }

        analysis.complete(new ActionPlan(), null, null, null, NOW);

        assertEquals(AnalysisStatus.FAILED, analysis.getStatus());
    }

    @Test
    void shouldKeepTerminalAgentResult() {
        ComprehensiveAnalysis analysis = new ComprehensiveAnalysis("run-1", "example.com", null, NOW);
        analysis.updateAgent(completed(AgentType.SERP_ANALYSIS));

        AgentResult stale = new AgentResult(AgentType.SERP_ANALYSIS);
        stale.start(NOW);
        stale.advance(45);
        analysis.updateAgent(stale);

        assertEquals(AnalysisStatus.COMPLETED, analysis.getAgentResult(AgentType.SERP_ANALYSIS).getStatus());
    }

    @Test
    void shouldRecordRunFailure() {
        ComprehensiveAnalysis analysis = new ComprehensiveAnalysis("run-1", "example.com", null, NOW);
        analysis.markStarted();

        analysis.fail("boom", NOW);

        assertEquals(AnalysisStatus.FAILED, analysis.getStatus());
        assertEquals("boom", analysis.getError());
        assertTrue(analysis.isFinished());
    }

    private static AgentResult completed(AgentType type) {
        AgentResult result = new AgentResult(type);
        result.start(NOW);
        result.complete(List.of(), List.of(), null, NOW);
        return result;
    }

    private static AgentResult failed(AgentType type) {
        AgentResult result = new AgentResult(type);
        result.start(NOW);
        result.fail("AI analysis failed", NOW);
        return result;
    }
}
