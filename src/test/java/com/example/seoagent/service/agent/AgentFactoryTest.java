package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentType;
import com.example.seoagent.service.insight.SectionInsightExtractor;
import com.example.seoagent.support.FakeTextGenerator;
import com.example.seoagent.support.TestData;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AgentFactoryTest {

    private final AgentFactory factory = new AgentFactory(
            FakeTextGenerator.failing(), new SectionInsightExtractor(), TestData.CLOCK);

    @Test
    void shouldCreateAgentForEveryType() {
        for (AgentType type : AgentType.values()) {
            AnalysisAgent agent = factory.create(type, TestData.bakery(), TestData.baseline());
            assertEquals(type, agent.type());
        }
    }

    @Test
    void shouldMapTypeToVariant() {
        assertInstanceOf(TechnicalSeoAgent.class,
                factory.create(AgentType.TECHNICAL_SEO, TestData.bakery(), TestData.baseline()));
        assertInstanceOf(UserExperienceAgent.class,
                factory.create(AgentType.USER_EXPERIENCE, TestData.bakery(), TestData.baseline()));
    }

    @Test
    void shouldRejectNullType() {
        assertThrows(IllegalArgumentException.class,
                () -> factory.create(null, TestData.bakery(), TestData.baseline()));
    }
}
