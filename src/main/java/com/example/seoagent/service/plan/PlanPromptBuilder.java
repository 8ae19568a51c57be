package com.example.seoagent.service.plan;

import com.example.seoagent.model.ActionItem;
import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BaselineMetrics.Competitor;
import com.example.seoagent.model.BaselineMetrics.KeywordMetric;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.Priority;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Строит промпты для разделов плана.
 */
@Component
public class PlanPromptBuilder {

    public String actionItemsPrompt(BusinessContext context, BaselineMetrics baseline,
                                    List<String> findings, List<String> recommendations) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Create a comprehensive SEO action plan for: ").append(context.getDomain()).append("\n\n");
        prompt.append("Business Context:\n");
        prompt.append("- Type: ").append(context.getBusinessType()).append("\n");
        prompt.append("- Industry: ").append(context.getIndustry()).append("\n");
        prompt.append("- Location: ").append(context.getLocation()).append("\n");
        prompt.append("- Current SEO Score: ").append(baseline.getSeoScore()).append("/100\n\n");

        prompt.append("Analysis Findings:\n");
        appendNumbered(prompt, findings);
        prompt.append("\nRecommendations:\n");
        appendNumbered(prompt, recommendations);

        prompt.append("""

                Create 8-12 prioritized action items with detailed step-by-step implementation directions.
                Each step must be actionable: exact URLs to visit, buttons to click, code snippets to add.

                For each action item, provide:
                - id (action_1, action_2, ...)
                - title
                - description
                - priority (critical/high/medium/low)
                - impact (high/medium/low)
                - effort (high/medium/low)
                - category (technical/content/keywords/competitors/user_experience/local_seo)
                - timeframe (immediate/this_week/this_month/next_quarter)
                - steps (8-15 detailed instructions)
                - tools
                - expectedImprovement
                - dependencies (ids of other action items, if any)

                Format as a JSON array of objects with exactly these field names.
                Return ONLY valid JSON with no additional text.
                """);
        return prompt.toString();
    }

    public String summaryPrompt(BusinessContext context, List<ActionItem> items, int overallScore,
                                int potentialImprovement) {
        long critical = items.stream().filter(item -> item.getPriority() == Priority.CRITICAL).count();
        long high = items.stream().filter(item -> item.getPriority() == Priority.HIGH).count();

        StringBuilder prompt = new StringBuilder();
        prompt.append("Generate a concise executive summary for an SEO action plan:\n\n");
        prompt.append("Domain: ").append(context.getDomain()).append("\n");
        prompt.append("Business: ").append(context.getBusinessType()).append(" in ").append(context.getIndustry()).append("\n");
        prompt.append("Current SEO Score: ").append(overallScore).append("/100\n");
        prompt.append("Potential Score: ").append(potentialImprovement).append("/100\n\n");
        prompt.append("Action Items:\n");
        prompt.append("- ").append(critical).append(" critical priority items\n");
        prompt.append("- ").append(high).append(" high priority items\n");
        prompt.append("- ").append(items.size()).append(" total action items\n\n");
        prompt.append("Write a 2-3 sentence summary focusing on the biggest opportunities and expected outcomes.\n");
        return prompt.toString();
    }

    public String competitiveIntelligencePrompt(BusinessContext context, BaselineMetrics baseline,
                                                AgentResult competitorResult) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze competitive positioning for: ").append(context.getDomain()).append("\n\n");
        prompt.append("Business: ").append(context.getBusinessType()).append(" in ").append(context.getIndustry()).append("\n");
        prompt.append("Current SEO Score: ").append(baseline.getSeoScore()).append("/100\n");
        if (baseline.getMarketPosition() != null) {
            prompt.append("Market Position: Rank ").append(baseline.getMarketPosition().getRank())
                  .append(" of ").append(baseline.getMarketPosition().getTotalCompetitors()).append("\n");
        }
        prompt.append("\nCompetitors:\n");
        for (Competitor competitor : baseline.competitorsOrEmpty()) {
            prompt.append("- ").append(competitor.getName()).append(" (Score: ").append(competitor.getScore()).append(")\n");
        }
        prompt.append("\nAgent Findings: ").append(findingsOf(competitorResult)).append("\n\n");
        prompt.append("""
                Provide competitive analysis in this format:
                {
                  "marketPosition": "Brief description of current market position",
                  "competitiveAdvantages": ["advantage 1", "advantage 2", "advantage 3"],
                  "competitiveGaps": ["gap 1", "gap 2", "gap 3"],
                  "opportunityAreas": ["opportunity 1", "opportunity 2", "opportunity 3"]
                }

                Return only valid JSON.
                """);
        return prompt.toString();
    }

    public String contentStrategyPrompt(BusinessContext context, BaselineMetrics baseline,
                                        AgentResult contentResult) {
        String keywords = baseline.keywordsOrEmpty().stream()
                .map(KeywordMetric::getKeyword)
                .collect(Collectors.joining(", "));

        StringBuilder prompt = new StringBuilder();
        prompt.append("Create a content strategy for: ").append(context.getDomain()).append("\n\n");
        prompt.append("Business: ").append(context.getBusinessType()).append(" in ").append(context.getIndustry()).append("\n");
        prompt.append("Location: ").append(context.getLocation()).append("\n");
        prompt.append("Services: ").append(context.getServices() != null ? String.join(", ", context.getServices()) : "").append("\n");
        prompt.append("Current Keywords: ").append(keywords).append("\n\n");
        prompt.append("Content Agent Findings: ").append(findingsOf(contentResult)).append("\n\n");
        prompt.append("""
                Generate content strategy with:
                1. 5 content gaps to address
                2. 3 topic clusters with keywords
                3. 4-week content calendar

                Format as JSON:
                {
                  "contentGaps": ["gap 1", "gap 2"],
                  "topicClusters": [
                    {"topic": "cluster name", "keywords": ["kw1", "kw2"], "priority": "high"}
                  ],
                  "contentCalendar": [
                    {"week": "Week 1", "contentType": "Blog Post", "topic": "topic", "targetKeyword": "keyword"}
                  ]
                }

                Return only valid JSON.
                """);
        return prompt.toString();
    }

    private static void appendNumbered(StringBuilder prompt, List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            prompt.append(i + 1).append(". ").append(lines.get(i)).append("\n");
        }
    }

    private static String findingsOf(AgentResult result) {
        if (result == null || result.getFindings().isEmpty()) {
            return "None available";
        }
        return String.join("; ", result.getFindings());
    }
}
