package com.example.seoagent.service.agent;

import com.example.seoagent.service.insight.InsightExtractor;
import com.example.seoagent.service.llm.TextGenerator;
import lombok.Value;

import java.time.Clock;

/**
 * Общие зависимости, которые фабрика передаёт каждому агенту.
 */
@Value
public class AgentDependencies {
    TextGenerator textGenerator;
    InsightExtractor insightExtractor;
    Clock clock;
}
