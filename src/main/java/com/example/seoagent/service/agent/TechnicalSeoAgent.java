package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BaselineMetrics.PageSpeed;
import com.example.seoagent.model.BaselineMetrics.TechnicalIssue;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.TechnicalSeoData;
import com.example.seoagent.service.insight.ExtractedInsights;
import com.example.seoagent.service.insight.InsightVocabulary;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Технический SEO: проблемы сканирования, Core Web Vitals, безопасность, доступность и разметка.
 */
public final class TechnicalSeoAgent extends AbstractAnalysisAgent<TechnicalSeoData> {

    private static final InsightVocabulary VOCABULARY =
            InsightVocabulary.of(List.of("finding"), List.of("recommendation"));

    private static final double BASELINE_WEIGHT = 0.35;
    private static final double CORE_WEB_VITALS_WEIGHT = 0.25;
    private static final double SECURITY_WEIGHT = 0.15;
    private static final double ACCESSIBILITY_WEIGHT = 0.10;
    private static final double SCHEMA_WEIGHT = 0.15;

    public TechnicalSeoAgent(BusinessContext context, BaselineMetrics baseline, AgentDependencies dependencies) {
        super(AgentType.TECHNICAL_SEO, context, baseline, dependencies);
    }

    @Override
    protected TechnicalSeoData computeData() {
        List<TechnicalIssue> issues = baseline.issuesOrEmpty();
        PageSpeed pageSpeed = pageSpeed();
        int baselineScore = baseline.getTechnicalSeo() != null ? baseline.getTechnicalSeo().getScore() : 0;

        int coreWebVitals = (int) Math.round((
                tiered(pageSpeed.getLargestContentfulPaint(), 2.5, 4.0)
                + tiered(pageSpeed.getCumulativeLayoutShift(), 0.1, 0.25)
                + tiered(pageSpeed.getFirstContentfulPaint(), 1.8, 3.0)) / 3.0);
        int security = mentions(issues, "ssl", "https", "security") ? 50 : 85;
        int accessibility = mentions(issues, "alt text", "alt attribute", "accessib", "contrast") ? 60 : 80;
        int schema = mentions(issues, "schema", "structured data") ? 30 : 70;
        if (BaselineMetrics.SerpFeature.present(baseline.getSerpPresence() != null
                ? baseline.getSerpPresence().getKnowledgePanel() : null)) {
            schema = Math.min(schema + 20, 100);
        }

        int technicalScore = (int) Math.round(baselineScore * BASELINE_WEIGHT
                + coreWebVitals * CORE_WEB_VITALS_WEIGHT
                + security * SECURITY_WEIGHT
                + accessibility * ACCESSIBILITY_WEIGHT
                + schema * SCHEMA_WEIGHT);

        return TechnicalSeoData.builder()
                .technicalScore(technicalScore)
                .baselineTechnicalScore(baselineScore)
                .criticalIssues(baseline.criticalIssueCount())
                .pageSpeedGrade(pageSpeedGrade(pageSpeed.getMobile()))
                .coreWebVitalsScore(coreWebVitals)
                .securityScore(security)
                .accessibilityScore(accessibility)
                .schemaMarkupScore(schema)
                .build();
    }

    @Override
    protected List<Stage<TechnicalSeoData>> stages() {
        return List.of(
                stage("Triaging technical issues", this::triageIssues),
                stage("Evaluating Core Web Vitals", this::evaluateCoreWebVitals),
                stage("Checking security and accessibility", this::checkSecurityAndAccessibility),
                stage("Assessing schema markup", this::assessSchemaMarkup)
        );
    }

    private void triageIssues(TechnicalSeoData data, AgentInsights insights) {
        List<TechnicalIssue> issues = baseline.issuesOrEmpty();
        if (issues.isEmpty()) {
            insights.finding("No technical issues reported by the baseline crawl");
            return;
        }
        insights.finding(data.getCriticalIssues() + " critical technical issues out of " + issues.size() + " detected");
        issues.stream()
                .filter(issue -> "high".equalsIgnoreCase(issue.getImpact()))
                .limit(3)
                .forEach(issue -> {
                    insights.finding("Critical issue: " + issue.getTitle());
                    insights.recommendation("Resolve \"" + issue.getTitle() + "\" before other technical work");
                });
    }

    private void evaluateCoreWebVitals(TechnicalSeoData data, AgentInsights insights) {
        PageSpeed pageSpeed = pageSpeed();
        insights.finding("Core Web Vitals score " + data.getCoreWebVitalsScore() + "/100 (LCP "
                + decimal(pageSpeed.getLargestContentfulPaint()) + "s, CLS "
                + pageSpeed.getCumulativeLayoutShift() + ", FCP "
                + decimal(pageSpeed.getFirstContentfulPaint()) + "s)");
        if (pageSpeed.getLargestContentfulPaint() > 2.5) {
            insights.recommendation("Reduce Largest Contentful Paint below 2.5s by optimizing hero images and server response time");
        }
        if (pageSpeed.getCumulativeLayoutShift() > 0.1) {
            insights.recommendation("Reserve space for images and embeds to bring Cumulative Layout Shift under 0.1");
        }
        if (pageSpeed.getFirstContentfulPaint() > 1.8) {
            insights.recommendation("Inline critical CSS and defer render-blocking scripts to improve First Contentful Paint");
        }
    }

    private void checkSecurityAndAccessibility(TechnicalSeoData data, AgentInsights insights) {
        if (data.getSecurityScore() < 85) {
            insights.finding("Security issues detected (HTTPS or SSL configuration)");
            insights.recommendation("Serve every page over HTTPS and keep the SSL certificate valid");
        }
        if (data.getAccessibilityScore() < 80) {
            insights.finding("Accessibility issues detected (alt text or contrast)");
            insights.recommendation("Add descriptive alt text to images and fix low-contrast text");
        }
    }

    private void assessSchemaMarkup(TechnicalSeoData data, AgentInsights insights) {
        insights.finding("Schema markup coverage score " + data.getSchemaMarkupScore() + "/100");
        insights.finding("Mobile page speed grade " + data.getPageSpeedGrade());
        if (data.getSchemaMarkupScore() < 70) {
            insights.recommendation("Add LocalBusiness and Organization structured data using schema.org markup");
        }
    }

    @Override
    protected String buildPrompt(TechnicalSeoData data) {
        PageSpeed pageSpeed = pageSpeed();
        StringBuilder prompt = promptHeader("Analyze the technical SEO");

        prompt.append("\nCurrent Technical Issues:\n");
        for (TechnicalIssue issue : baseline.issuesOrEmpty()) {
            prompt.append("- ").append(issue.getTitle()).append(": ").append(orDash(issue.getDescription()))
                  .append(" (impact: ").append(orDash(issue.getImpact())).append(")\n");
        }

        prompt.append("\nPage Speed Data:\n");
        prompt.append("- Mobile Score: ").append(pageSpeed.getMobile()).append("/100\n");
        prompt.append("- Desktop Score: ").append(pageSpeed.getDesktop()).append("/100\n");
        prompt.append("- Largest Contentful Paint: ").append(decimal(pageSpeed.getLargestContentfulPaint())).append("s\n");
        prompt.append("- Cumulative Layout Shift: ").append(pageSpeed.getCumulativeLayoutShift()).append("\n");

        prompt.append("\nComputed Scores:\n");
        prompt.append("- Technical score: ").append(data.getTechnicalScore()).append("/100\n");
        prompt.append("- Core Web Vitals: ").append(data.getCoreWebVitalsScore()).append("/100\n");
        prompt.append("- Schema markup: ").append(data.getSchemaMarkupScore()).append("/100\n");

        appendAnswerFormat(prompt, "key technical SEO findings",
                "specific recommendations to improve technical performance, in priority order");
        return prompt.toString();
    }

    @Override
    protected InsightVocabulary vocabulary() {
        return VOCABULARY;
    }

    @Override
    protected Optional<ExtractedInsights> fallbackInsights(TechnicalSeoData data) {
        return Optional.of(new ExtractedInsights(
                List.of("Technical score " + data.getTechnicalScore() + "/100 estimated from baseline metrics"),
                List.of("Review the Coverage and Core Web Vitals reports in Google Search Console",
                        "Submit an up-to-date XML sitemap")));
    }

    static int tiered(double value, double good, double needsImprovement) {
        if (value <= good) {
            return 100;
        }
        return value <= needsImprovement ? 60 : 20;
    }

    static String pageSpeedGrade(int score) {
        if (score >= 90) {
            return "A";
        }
        if (score >= 80) {
            return "B";
        }
        if (score >= 70) {
            return "C";
        }
        return score >= 60 ? "D" : "F";
    }

    private static boolean mentions(List<TechnicalIssue> issues, String... keywords) {
        for (TechnicalIssue issue : issues) {
            String text = ((issue.getTitle() != null ? issue.getTitle() : "") + " "
                    + (issue.getDescription() != null ? issue.getDescription() : "")).toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (text.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    private PageSpeed pageSpeed() {
        return baseline.getPageSpeed() != null ? baseline.getPageSpeed() : new PageSpeed();
    }
}
