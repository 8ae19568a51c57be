package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.service.insight.InsightExtractor;
import com.example.seoagent.service.llm.TextGenerator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Создаёт агента по типу через таблицу конструкторов.
 */
@Component
public class AgentFactory {

    @FunctionalInterface
    interface AgentConstructor {
        AnalysisAgent create(BusinessContext context, BaselineMetrics baseline, AgentDependencies dependencies);
    }

    private static final Map<AgentType, AgentConstructor> CONSTRUCTORS = new EnumMap<>(AgentType.class);

    static {
        CONSTRUCTORS.put(AgentType.TECHNICAL_SEO, TechnicalSeoAgent::new);
        CONSTRUCTORS.put(AgentType.CONTENT_ANALYSIS, ContentAnalysisAgent::new);
        CONSTRUCTORS.put(AgentType.COMPETITOR_INTELLIGENCE, CompetitorIntelligenceAgent::new);
        CONSTRUCTORS.put(AgentType.KEYWORD_RESEARCH, KeywordResearchAgent::new);
        CONSTRUCTORS.put(AgentType.SERP_ANALYSIS, SerpAnalysisAgent::new);
        CONSTRUCTORS.put(AgentType.USER_EXPERIENCE, UserExperienceAgent::new);
    }

    private final AgentDependencies dependencies;

    public AgentFactory(TextGenerator textGenerator, InsightExtractor insightExtractor, Clock clock) {
        this.dependencies = new AgentDependencies(textGenerator, insightExtractor, clock);
    }

    public AnalysisAgent create(AgentType type, BusinessContext context, BaselineMetrics baseline) {
        if (type == null) {
            throw new IllegalArgumentException("Agent type is required");
        }
        AgentConstructor constructor = CONSTRUCTORS.get(type);
        if (constructor == null) {
            throw new IllegalArgumentException("Unknown agent type: " + type);
        }
        return constructor.create(context, baseline, dependencies);
    }
}
