package com.example.seoagent.service.plan;

import com.example.seoagent.model.ActionCategory;
import com.example.seoagent.model.ActionItem;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.MilestoneStatus;
import com.example.seoagent.model.ProgressTracking;
import com.example.seoagent.model.ProgressTracking.Kpi;
import com.example.seoagent.model.ProgressTracking.Milestone;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Вехи через 7/21/30/90 дней от даты прогона и пять KPI с ограниченными целями.
 */
@Component
@RequiredArgsConstructor
public class ProgressTrackingBuilder {

    private final Clock clock;

    public ProgressTracking build(List<ActionItem> items, BaselineMetrics baseline) {
        return ProgressTracking.builder()
                .milestones(milestones(items))
                .kpis(kpis(baseline != null ? baseline : new BaselineMetrics()))
                .build();
    }

    List<Milestone> milestones(List<ActionItem> items) {
        LocalDate today = LocalDate.now(clock);
        List<Milestone> milestones = new ArrayList<>();
        milestones.add(milestone("Quick Wins Implementation", today.plusDays(7),
                ids(items, item -> item.getTimeframe() != null && item.getTimeframe().isNearTerm(), 3)));
        milestones.add(milestone("Technical SEO Improvements", today.plusDays(21),
                ids(items, item -> item.getCategory() == ActionCategory.TECHNICAL, Integer.MAX_VALUE)));
        milestones.add(milestone("Content Strategy Launch", today.plusDays(30),
                ids(items, item -> item.getCategory() == ActionCategory.CONTENT, Integer.MAX_VALUE)));
        milestones.add(milestone("Comprehensive SEO Optimization", today.plusDays(90),
                ids(items, item -> true, Integer.MAX_VALUE)));
        return milestones;
    }

    List<Kpi> kpis(BaselineMetrics baseline) {
        int currentScore = PlanScoring.baseScore(baseline);
        int mobile = baseline.getPageSpeed() != null && baseline.getPageSpeed().getMobile() > 0
                ? baseline.getPageSpeed().getMobile() : 70;
        int keywordCount = baseline.keywordsOrEmpty().isEmpty() ? 5 : baseline.keywordsOrEmpty().size();
        int technical = baseline.getTechnicalSeo() != null && baseline.getTechnicalSeo().getScore() > 0
                ? baseline.getTechnicalSeo().getScore() : 75;

        List<Kpi> kpis = new ArrayList<>();
        kpis.add(new Kpi("Overall SEO Score", currentScore, Math.min(currentScore + 25, 90), "3 months"));
        kpis.add(new Kpi("Mobile Speed Score", mobile, Math.min(mobile + 15, 95), "1 month"));
        kpis.add(new Kpi("Keyword Rankings (Top 10)", 0, Math.min(keywordCount * 2, 15), "3 months"));
        kpis.add(new Kpi("Organic Traffic Increase (%)", 0, 50, "6 months"));
        kpis.add(new Kpi("Technical SEO Score", technical, 95, "2 months"));
        return kpis;
    }

    private static Milestone milestone(String title, LocalDate dueDate, List<String> actionItemIds) {
        return Milestone.builder()
                .title(title)
                .dueDate(dueDate)
                .status(MilestoneStatus.NOT_STARTED)
                .actionItemIds(actionItemIds)
                .build();
    }

    private static List<String> ids(List<ActionItem> items, Predicate<ActionItem> filter, int limit) {
        return items.stream()
                .filter(filter)
                .map(ActionItem::getId)
                .limit(limit)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
