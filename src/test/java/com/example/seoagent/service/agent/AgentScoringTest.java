package com.example.seoagent.service.agent;

import com.example.seoagent.model.BaselineMetrics.Competitor;
import com.example.seoagent.model.BaselineMetrics.KeywordMetric;
import com.example.seoagent.model.BaselineMetrics.PageSpeed;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentScoringTest {

    @Test
    void contentScoreShouldCapEachBonus() {
        assertEquals(60, ContentAnalysisAgent.contentScore(0, 0));
        assertEquals(95, ContentAnalysisAgent.contentScore(10, 10));
        assertEquals(71, ContentAnalysisAgent.contentScore(1, 2));
    }

    @Test
    void marketShareShouldFollowRank() {
        assertEquals(40, CompetitorIntelligenceAgent.estimatedMarketShare(1));
        assertEquals(20, CompetitorIntelligenceAgent.estimatedMarketShare(2));
        assertEquals(1, CompetitorIntelligenceAgent.estimatedMarketShare(100));
        assertEquals(0, CompetitorIntelligenceAgent.estimatedMarketShare(0));
    }

    @Test
    void competitiveStrengthShouldCompareToAverage() {
        List<Competitor> competitors = List.of(new Competitor("a", 60, 1), new Competitor("b", 70, 2));

        assertEquals(CompetitorIntelligenceAgent.STRONG, CompetitorIntelligenceAgent.competitiveStrength(80, competitors));
        assertEquals(CompetitorIntelligenceAgent.COMPETITIVE, CompetitorIntelligenceAgent.competitiveStrength(62, competitors));
        assertEquals(CompetitorIntelligenceAgent.NEEDS_IMPROVEMENT, CompetitorIntelligenceAgent.competitiveStrength(50, competitors));
        assertEquals(CompetitorIntelligenceAgent.UNKNOWN, CompetitorIntelligenceAgent.competitiveStrength(50, List.of()));
    }

    @Test
    void uxScoreShouldPenaliseSlowVitals() {
        assertEquals(80, UserExperienceAgent.uxScore(new PageSpeed(80, 90, 1.0, 2.0, 0.05)));
        assertEquals(60, UserExperienceAgent.uxScore(new PageSpeed(80, 90, 1.0, 3.0, 0.2)));
        assertEquals(0, UserExperienceAgent.uxScore(new PageSpeed(15, 90, 1.0, 3.0, 0.2)));
    }

    @Test
    void coreWebVitalsGradeShouldCountGoodMetrics() {
        assertEquals("A", UserExperienceAgent.coreWebVitalsGrade(new PageSpeed(80, 90, 1.0, 2.0, 0.05)));
        assertEquals("C", UserExperienceAgent.coreWebVitalsGrade(new PageSpeed(80, 90, 2.0, 3.0, 0.05)));
        assertEquals("D", UserExperienceAgent.coreWebVitalsGrade(new PageSpeed(80, 90, 2.0, 3.0, 0.3)));
    }

    @Test
    void pageSpeedGradeShouldUseTenPointBands() {
        assertEquals("A", TechnicalSeoAgent.pageSpeedGrade(95));
        assertEquals("C", TechnicalSeoAgent.pageSpeedGrade(70));
        assertEquals("F", TechnicalSeoAgent.pageSpeedGrade(10));
    }

    @Test
    void visibilityScoreShouldBeCapped() {
        assertEquals(100, SerpAnalysisAgent.visibilityScore(8, 6, true));
        assertEquals(28, SerpAnalysisAgent.visibilityScore(2, 1, false));
    }

    @Test
    void longTailNeedsThreeWords() {
        assertTrue(KeywordResearchAgent.isLongTail(new KeywordMetric("gluten free bakery", 100, "low")));
        assertFalse(KeywordResearchAgent.isLongTail(new KeywordMetric("bakery", 100, "low")));
    }
}
