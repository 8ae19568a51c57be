package com.example.seoagent.service.coordinator;

import com.example.seoagent.config.AppConfig;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.AnalysisStatus;
import com.example.seoagent.service.agent.AgentFactory;
import com.example.seoagent.service.insight.SectionInsightExtractor;
import com.example.seoagent.support.FakeTextGenerator;
import com.example.seoagent.support.TestData;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MultiAgentCoordinatorTest {

    private static final Instant NOW = TestData.NOW;

    private static final String AI_RESPONSE = """
            Findings
            - Mobile pages render slowly
            Recommendations
            - Lazy-load below-the-fold images
            """;

    private MultiAgentCoordinator coordinator(FakeTextGenerator generator, AppConfig appConfig,
                                              Executor executor) {
        AgentFactory factory = new AgentFactory(generator, new SectionInsightExtractor(), TestData.CLOCK);
        return new MultiAgentCoordinator(factory, executor, appConfig, TestData.CLOCK);
    }

    @Test
    void shouldReturnOneResultPerAgentInTypeOrder() {
        // Given
        MultiAgentCoordinator coordinator = coordinator(
                FakeTextGenerator.replying(AI_RESPONSE), new AppConfig(), Runnable::run);

        // When
        List<AgentResult> results = coordinator.runAll(TestData.bakery(), TestData.baseline());

        // Then
        assertEquals(Arrays.asList(AgentType.values()), results.stream().map(AgentResult::getAgentType).toList());
        assertTrue(results.stream().allMatch(r -> r.getStatus() == AnalysisStatus.COMPLETED));
        assertEquals(100, coordinator.aggregateProgress(results));
        assertEquals(AnalysisStatus.COMPLETED, coordinator.aggregateStatus(results));
    }

    @Test
    void shouldIsolateAgentFailures() {
        // Given
        MultiAgentCoordinator coordinator = coordinator(
                FakeTextGenerator.failing(), new AppConfig(), Runnable::run);

        // When
        List<AgentResult> results = coordinator.runAll(TestData.bakery(), TestData.baseline());

        // Then
        assertEquals(6, results.size());
        assertEquals(AnalysisStatus.FAILED, results.get(AgentType.CONTENT_ANALYSIS.ordinal()).getStatus());
        assertEquals(AnalysisStatus.FAILED, results.get(AgentType.COMPETITOR_INTELLIGENCE.ordinal()).getStatus());
        assertEquals(AnalysisStatus.COMPLETED, results.get(AgentType.TECHNICAL_SEO.ordinal()).getStatus());
        assertEquals(AnalysisStatus.FAILED, coordinator.aggregateStatus(results));
        // 4 * 100 + 2 * 0
        assertEquals(67, coordinator.aggregateProgress(results));
    }

    @Test
    void shouldAggregateProgressOfMixedResults() {
        MultiAgentCoordinator coordinator = coordinator(
                FakeTextGenerator.failing(), new AppConfig(), Runnable::run);

        List<AgentResult> results = new ArrayList<>();
        results.add(completed(AgentType.TECHNICAL_SEO));
        results.add(new AgentResult(AgentType.CONTENT_ANALYSIS));
        results.add(new AgentResult(AgentType.SERP_ANALYSIS));

        assertEquals(33, coordinator.aggregateProgress(results));
        assertEquals(AnalysisStatus.RUNNING, coordinator.aggregateStatus(results));
        assertEquals(0, coordinator.aggregateProgress(List.of()));
        assertEquals(AnalysisStatus.PENDING, coordinator.aggregateStatus(List.of()));
    }

    @Test
    void shouldReportFailedWhenOneOfSixFailed() {
        MultiAgentCoordinator coordinator = coordinator(
                FakeTextGenerator.failing(), new AppConfig(), Runnable::run);

        List<AgentResult> results = new ArrayList<>();
        for (AgentType type : AgentType.values()) {
            results.add(type == AgentType.SERP_ANALYSIS ? failed(type) : completed(type));
        }

        assertEquals(AnalysisStatus.FAILED, coordinator.aggregateStatus(results));
    }

    @Test
    void shouldTurnTimedOutAgentIntoFailedResult() {
        // Given
        AppConfig appConfig = new AppConfig();
        appConfig.getAgents().setTimeoutSeconds(1);
        FakeTextGenerator generator = new FakeTextGenerator(prompt -> {
            if (prompt.startsWith("SERP positioning analysis")) {
                sleep(3000);
            }
            return AI_RESPONSE;
        });
        ExecutorService executor = Executors.newFixedThreadPool(6);
        Map<AgentType, AgentResult> lastSeen = new ConcurrentHashMap<>();

        try {
            // When
            List<AgentResult> results = coordinator(generator, appConfig, executor)
                    .runAll(TestData.bakery(), TestData.baseline(),
                            (snapshot, step) -> lastSeen.merge(snapshot.getAgentType(), snapshot,
                                    (old, fresh) -> old.isTerminal() ? old : fresh));

            // Then
            AgentResult serp = results.get(AgentType.SERP_ANALYSIS.ordinal());
            assertEquals(AnalysisStatus.FAILED, serp.getStatus());
            assertEquals("Agent timed out after 1 seconds", serp.getError());
            assertEquals(AnalysisStatus.FAILED, lastSeen.get(AgentType.SERP_ANALYSIS).getStatus());
            assertEquals(AnalysisStatus.COMPLETED, results.get(AgentType.TECHNICAL_SEO.ordinal()).getStatus());
        } finally {
            executor.shutdownNow();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
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
