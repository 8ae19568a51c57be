package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentType;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.BaselineMetrics.PageSpeed;
import com.example.seoagent.model.BusinessContext;
import com.example.seoagent.model.UserExperienceData;
import com.example.seoagent.service.insight.ExtractedInsights;
import com.example.seoagent.service.insight.InsightVocabulary;

import java.util.List;
import java.util.Optional;

/**
 * Пользовательский опыт: мобильная скорость, оценка Core Web Vitals и разрыв между устройствами.
 */
public final class UserExperienceAgent extends AbstractAnalysisAgent<UserExperienceData> {

    private static final InsightVocabulary VOCABULARY =
            InsightVocabulary.of(List.of("finding", "experience"), List.of("recommendation", "improvement"));

    static final int DEVICE_GAP_THRESHOLD = 20;

    public UserExperienceAgent(BusinessContext context, BaselineMetrics baseline, AgentDependencies dependencies) {
        super(AgentType.USER_EXPERIENCE, context, baseline, dependencies);
    }

    @Override
    protected UserExperienceData computeData() {
        PageSpeed pageSpeed = pageSpeed();
        return UserExperienceData.builder()
                .uxScore(uxScore(pageSpeed))
                .mobileOptimization(pageSpeed.getMobile())
                .desktopScore(pageSpeed.getDesktop())
                .coreWebVitalsGrade(coreWebVitalsGrade(pageSpeed))
                .build();
    }

    static int uxScore(PageSpeed pageSpeed) {
        int score = pageSpeed.getMobile();
        if (pageSpeed.getLargestContentfulPaint() > 2.5) {
            score -= 10;
        }
        if (pageSpeed.getCumulativeLayoutShift() > 0.1) {
            score -= 10;
        }
        return Math.max(score, 0);
    }

    static String coreWebVitalsGrade(PageSpeed pageSpeed) {
        int good = 0;
        if (pageSpeed.getLargestContentfulPaint() <= 2.5) {
            good++;
        }
        if (pageSpeed.getCumulativeLayoutShift() <= 0.1) {
            good++;
        }
        if (pageSpeed.getFirstContentfulPaint() <= 1.8) {
            good++;
        }
        switch (good) {
            case 3:
                return "A";
            case 2:
                return "B";
            case 1:
                return "C";
            default:
                return "D";
        }
    }

    @Override
    protected List<Stage<UserExperienceData>> stages() {
        return List.of(
                stage("Assessing mobile readiness", this::assessMobile),
                stage("Grading Core Web Vitals", this::gradeCoreWebVitals),
                stage("Scoring user experience", this::scoreExperience),
                stage("Comparing devices", this::compareDevices)
        );
    }

    private void assessMobile(UserExperienceData data, AgentInsights insights) {
        insights.finding("Mobile performance score " + data.getMobileOptimization() + "/100");
        if (data.getMobileOptimization() < 70) {
            insights.recommendation("Compress images and defer non-critical scripts to speed up mobile pages");
        }
    }

    private void gradeCoreWebVitals(UserExperienceData data, AgentInsights insights) {
        insights.finding("Core Web Vitals grade " + data.getCoreWebVitalsGrade());
    }

    private void scoreExperience(UserExperienceData data, AgentInsights insights) {
        insights.finding("User experience score " + data.getUxScore() + "/100");
    }

    private void compareDevices(UserExperienceData data, AgentInsights insights) {
        int gap = data.getDesktopScore() - data.getMobileOptimization();
        if (gap >= DEVICE_GAP_THRESHOLD) {
            insights.finding("Mobile trails desktop by " + gap + " points");
            insights.recommendation("Audit mobile layout and resource loading separately from desktop");
        }
    }

    @Override
    protected String buildPrompt(UserExperienceData data) {
        PageSpeed pageSpeed = pageSpeed();
        StringBuilder prompt = promptHeader("User experience analysis");

        prompt.append("\nPerformance Metrics:\n");
        prompt.append("- Mobile Score: ").append(pageSpeed.getMobile()).append("/100\n");
        prompt.append("- Desktop Score: ").append(pageSpeed.getDesktop()).append("/100\n");
        prompt.append("- First Contentful Paint: ").append(decimal(pageSpeed.getFirstContentfulPaint())).append("s\n");
        prompt.append("- Largest Contentful Paint: ").append(decimal(pageSpeed.getLargestContentfulPaint())).append("s\n");
        prompt.append("- Cumulative Layout Shift: ").append(pageSpeed.getCumulativeLayoutShift()).append("\n");
        prompt.append("Core Web Vitals grade: ").append(data.getCoreWebVitalsGrade()).append("\n");

        appendAnswerFormat(prompt, "user experience findings", "UX improvement recommendations");
        return prompt.toString();
    }

    @Override
    protected InsightVocabulary vocabulary() {
        return VOCABULARY;
    }

    @Override
    protected Optional<ExtractedInsights> fallbackInsights(UserExperienceData data) {
        return Optional.of(new ExtractedInsights(
                List.of(),
                List.of("Monitor Core Web Vitals in Google Search Console",
                        "Test key pages on real mobile devices")));
    }

    private PageSpeed pageSpeed() {
        return baseline.getPageSpeed() != null ? baseline.getPageSpeed() : new PageSpeed();
    }
}
