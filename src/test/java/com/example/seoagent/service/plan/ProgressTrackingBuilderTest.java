package com.example.seoagent.service.plan;

import com.example.seoagent.model.ActionCategory;
import com.example.seoagent.model.ActionItem;
import com.example.seoagent.model.BaselineMetrics;
import com.example.seoagent.model.MilestoneStatus;
import com.example.seoagent.model.ProgressTracking;
import com.example.seoagent.model.ProgressTracking.Kpi;
import com.example.seoagent.model.ProgressTracking.Milestone;
import com.example.seoagent.model.Timeframe;
import com.example.seoagent.support.TestData;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressTrackingBuilderTest {

    private final ProgressTrackingBuilder builder = new ProgressTrackingBuilder(TestData.CLOCK);

    @Test
    void shouldScheduleMilestonesFromToday() {
        // Given
        List<ActionItem> items = List.of(
                item("action_1", Timeframe.IMMEDIATE, ActionCategory.TECHNICAL),
                item("action_2", Timeframe.THIS_WEEK, ActionCategory.CONTENT),
                item("action_3", Timeframe.IMMEDIATE, ActionCategory.LOCAL_SEO),
                item("action_4", Timeframe.THIS_WEEK, ActionCategory.TECHNICAL),
                item("action_5", Timeframe.NEXT_QUARTER, ActionCategory.CONTENT));

        // When
        ProgressTracking tracking = builder.build(items, TestData.baseline());

        // Then
        List<Milestone> milestones = tracking.getMilestones();
        LocalDate today = LocalDate.of(2024, 3, 1);
        assertEquals(4, milestones.size());
        assertEquals(today.plusDays(7), milestones.get(0).getDueDate());
        assertEquals(today.plusDays(21), milestones.get(1).getDueDate());
        assertEquals(today.plusDays(30), milestones.get(2).getDueDate());
        assertEquals(today.plusDays(90), milestones.get(3).getDueDate());
        assertEquals(List.of("action_1", "action_2", "action_3"), milestones.get(0).getActionItemIds());
        assertEquals(List.of("action_1", "action_4"), milestones.get(1).getActionItemIds());
        assertEquals(List.of("action_2", "action_5"), milestones.get(2).getActionItemIds());
        assertEquals(5, milestones.get(3).getActionItemIds().size());
        assertTrue(milestones.stream().allMatch(m -> m.getStatus() == MilestoneStatus.NOT_STARTED));
    }

    @Test
    void shouldBoundKpiTargets() {
        List<Kpi> kpis = builder.build(List.of(), TestData.baseline()).getKpis();

        assertEquals(5, kpis.size());
        assertEquals(62, kpis.get(0).getCurrent());
        assertEquals(87, kpis.get(0).getTarget());
        assertEquals(55, kpis.get(1).getCurrent());
        assertEquals(70, kpis.get(1).getTarget());
        assertEquals(6, kpis.get(2).getTarget());
        assertEquals(50, kpis.get(3).getTarget());
        assertEquals(70, kpis.get(4).getCurrent());
        assertEquals(95, kpis.get(4).getTarget());
    }

    @Test
    void shouldUseDefaultsForMissingBaselineValues() {
        BaselineMetrics empty = BaselineMetrics.builder().seoScore(80).build();

        List<Kpi> kpis = builder.build(List.of(), empty).getKpis();

        assertEquals(90, kpis.get(0).getTarget());
        assertEquals(70, kpis.get(1).getCurrent());
        assertEquals(85, kpis.get(1).getTarget());
        assertEquals(10, kpis.get(2).getTarget());
        assertEquals(75, kpis.get(4).getCurrent());
    }

    private static ActionItem item(String id, Timeframe timeframe, ActionCategory category) {
        return ActionItem.builder().id(id).title(id).timeframe(timeframe).category(category).build();
    }
}
